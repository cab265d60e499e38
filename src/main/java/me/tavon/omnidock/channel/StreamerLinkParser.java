package me.tavon.omnidock.channel;

import com.google.common.base.Splitter;
import me.tavon.omnidock.OmniDock;

import java.io.UnsupportedEncodingException;
import java.net.URLDecoder;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Turns a shared bookmark link such as
 * {@code omnichat://add-streamer?nickname=Destiny&kick=destiny&color=%23ff0000} into a new
 * {@link BookmarkedStreamer}.
 */
public final class StreamerLinkParser {

    public static final String SCHEME = "omnichat";

    private static final Pattern HEX_COLOR = Pattern.compile("^#[0-9A-Fa-f]{6}$");
    private static final Pattern TRAILING_JUNK = Pattern.compile("[)\\]\\s]+$");

    private StreamerLinkParser() {
    }

    public static boolean isLink(String url) {
        return url != null && url.trim().toLowerCase(Locale.ROOT).startsWith(SCHEME + ":");
    }

    /**
     * @throws IllegalArgumentException if the link is not an add-streamer link or names no platform
     */
    public static BookmarkedStreamer parse(String url) {
        if (!isLink(url)) {
            throw new IllegalArgumentException("Not an " + SCHEME + " link: " + url);
        }

        String rest = url.trim().substring(SCHEME.length() + 1);

        if (rest.startsWith("//")) {
            rest = rest.substring(2);
        }

        int query = rest.indexOf('?');
        String operation = (query < 0 ? rest : rest.substring(0, query)).replaceAll("^/+|/+$", "").trim();
        operation = operation.isEmpty() ? "open" : operation.toLowerCase(Locale.ROOT);

        if (!operation.equals("add-streamer") && !operation.equals("bookmark")) {
            throw new IllegalArgumentException("Unknown operation: " + operation);
        }

        return fromParams(parseParams(query < 0 ? "" : rest.substring(query + 1)));
    }

    static Map<String, String> parseParams(String query) {
        Map<String, String> params = new HashMap<>();

        for (String pair : Splitter.on('&').omitEmptyStrings().split(query)) {
            List<String> parts = Splitter.on('=').limit(2).splitToList(pair);

            if (parts.get(0).isEmpty()) {
                continue;
            }

            String value = parts.size() > 1 ? decode(parts.get(1)) : "";
            params.put(decode(parts.get(0)), TRAILING_JUNK.matcher(value).replaceAll(""));
        }

        return params;
    }

    static BookmarkedStreamer fromParams(Map<String, String> params) {
        String nickname = first(params, "nickname", "nick");
        Map<Platform, String> ids = new EnumMap<>(Platform.class);
        Map<Platform, String> colors = new EnumMap<>(Platform.class);

        putIfPresent(ids, Platform.YOUTUBE, first(params, "youtube", "youtubeChannelId"));
        putIfPresent(ids, Platform.KICK, first(params, "kick", "kickSlug").toLowerCase(Locale.ROOT));
        putIfPresent(ids, Platform.TWITCH, first(params, "twitch", "twitchLogin").toLowerCase(Locale.ROOT));

        if (ids.isEmpty()) {
            throw new IllegalArgumentException("At least one platform (youtube, kick or twitch) is required");
        }

        putIfColor(colors, Platform.YOUTUBE, first(params, "youtubeColor"));
        putIfColor(colors, Platform.KICK, first(params, "kickColor"));
        putIfColor(colors, Platform.TWITCH, first(params, "twitchColor"));

        String master = first(params, "color");

        return new BookmarkedStreamer(UUID.randomUUID().toString(), nickname.isEmpty() ? "Unnamed" : nickname,
                ids, colors, HEX_COLOR.matcher(master).matches() ? master : null,
                flag(params.get("openWhenLive"), true), flag(params.get("hideLabel"), false));
    }

    private static String first(Map<String, String> params, String... names) {
        for (String name : names) {
            String value = params.get(name);

            if (value != null && !value.trim().isEmpty()) {
                return value.trim();
            }
        }

        return "";
    }

    private static void putIfPresent(Map<Platform, String> ids, Platform platform, String id) {
        if (!id.isEmpty()) {
            ids.put(platform, id);
        }
    }

    private static void putIfColor(Map<Platform, String> colors, Platform platform, String color) {
        if (HEX_COLOR.matcher(color).matches()) {
            colors.put(platform, color);
        }
    }

    private static boolean flag(String value, boolean absent) {
        if (value == null) {
            return absent;
        }

        return value.equals("1") || value.equals("true");
    }

    private static String decode(String s) {
        try {
            return URLDecoder.decode(s, "UTF-8");
        } catch (UnsupportedEncodingException | IllegalArgumentException e) {
            OmniDock.LOGGER.fine("Keeping undecodable link value " + s + ": " + e.getMessage());
            return s;
        }
    }
}
