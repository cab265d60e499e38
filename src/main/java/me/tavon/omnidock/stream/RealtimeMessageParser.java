package me.tavon.omnidock.stream;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import me.tavon.omnidock.OmniDock;
import me.tavon.omnidock.channel.BannedEmbed;
import me.tavon.omnidock.channel.CanonicalKey;
import me.tavon.omnidock.channel.EmbedRecord;
import me.tavon.omnidock.registry.SourceEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns realtime feed frames into registry events. Frames are JSON objects {@code {type, data}}.
 */
public class RealtimeMessageParser {

    public static final String EMBEDS_TYPE = "dggApi:embeds";
    public static final String BANNED_TYPE = "dggApi:bannedEmbeds";

    private final Set<String> unknownTypes = ConcurrentHashMap.newKeySet();

    /**
     * @return the event the frame carries, or null when the frame is unparseable or of a type the
     * registry has no use for
     */
    public SourceEvent parse(String frame) {
        JsonObject object;

        try {
            JsonElement element = new JsonParser().parse(frame);

            if (!element.isJsonObject()) {
                OmniDock.LOGGER.warning("Dropping realtime frame that is not an object");
                return null;
            }

            object = element.getAsJsonObject();
        } catch (JsonParseException e) {
            OmniDock.LOGGER.warning("Dropping unparseable realtime frame: " + e.getMessage());
            return null;
        }

        String type = stringOrNull(object, "type");

        if (EMBEDS_TYPE.equals(type)) {
            JsonElement data = object.get("data");

            if (data == null || data.isJsonNull()) {
                return SourceEvent.realtimeBatch(new ArrayList<EmbedRecord>());
            }

            if (!data.isJsonArray()) {
                OmniDock.LOGGER.warning("Dropping " + EMBEDS_TYPE + " frame whose data is not an array");
                return null;
            }

            return SourceEvent.realtimeBatch(parseEmbeds(data.getAsJsonArray()));
        }

        if (BANNED_TYPE.equals(type)) {
            JsonElement data = object.get("data");

            if (data == null || data.isJsonNull()) {
                return SourceEvent.bannedList(new ArrayList<BannedEmbed>());
            }

            if (!data.isJsonArray()) {
                OmniDock.LOGGER.warning("Dropping " + BANNED_TYPE + " frame whose data is not an array");
                return null;
            }

            return SourceEvent.bannedList(parseBanned(data.getAsJsonArray()));
        }

        if (type != null && unknownTypes.add(type)) {
            OmniDock.LOGGER.info("Ignoring realtime frames of type " + type);
        }

        return null;
    }

    static List<EmbedRecord> parseEmbeds(JsonArray array) {
        List<EmbedRecord> records = new ArrayList<>();
        int skipped = 0;

        for (JsonElement element : array) {
            EmbedRecord record = parseEmbed(element);

            if (record == null) {
                skipped++;
                continue;
            }

            records.add(record);
        }

        if (skipped > 0) {
            OmniDock.LOGGER.warning("Skipped " + skipped + " malformed embed(s) out of " + array.size());
        }

        return records;
    }

    /**
     * @return the record, or null when the entry lacks a platform or an id
     */
    static EmbedRecord parseEmbed(JsonElement element) {
        if (element == null || !element.isJsonObject()) {
            return null;
        }

        JsonObject entry = element.getAsJsonObject();
        String platform = stringOrNull(entry, "platform");
        String id = stringOrNull(entry, "id");

        if (platform == null || platform.trim().isEmpty() || id == null || id.isEmpty()) {
            return null;
        }

        CanonicalKey key = CanonicalKey.of(platform, id);
        String title = null;
        String previewUrl = null;
        Long viewers = null;

        JsonObject mediaItem = objectOrNull(entry, "mediaItem");
        JsonObject metadata = mediaItem == null ? null : objectOrNull(mediaItem, "metadata");

        if (metadata != null) {
            title = stringOrNull(metadata, "title");

            if (title == null || title.trim().isEmpty()) {
                title = stringOrNull(metadata, "displayName");
            }

            previewUrl = stringOrNull(metadata, "previewUrl");
            viewers = longOrNull(metadata, "viewers");
        }

        Long count = longOrNull(entry, "count");

        return new EmbedRecord(key, id, title, viewers, count == null ? null : count.intValue(), previewUrl,
                false, null);
    }

    static List<BannedEmbed> parseBanned(JsonArray array) {
        List<BannedEmbed> banned = new ArrayList<>();

        for (JsonElement element : array) {
            if (!element.isJsonObject()) {
                continue;
            }

            JsonObject entry = element.getAsJsonObject();
            String platform = stringOrNull(entry, "platform");
            String name = stringOrNull(entry, "name");

            if (platform == null || platform.trim().isEmpty() || name == null || name.isEmpty()) {
                continue;
            }

            banned.add(new BannedEmbed(CanonicalKey.of(platform, name), stringOrNull(entry, "reason")));
        }

        return banned;
    }

    private static JsonObject objectOrNull(JsonObject object, String member) {
        JsonElement element = object.get(member);
        return element != null && element.isJsonObject() ? element.getAsJsonObject() : null;
    }

    private static String stringOrNull(JsonObject object, String member) {
        JsonElement element = object.get(member);

        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            return null;
        }

        return element.getAsString();
    }

    private static Long longOrNull(JsonObject object, String member) {
        JsonElement element = object.get(member);

        if (element == null || !element.isJsonPrimitive()) {
            return null;
        }

        JsonPrimitive primitive = element.getAsJsonPrimitive();

        if (!primitive.isNumber()) {
            return null;
        }

        return primitive.getAsLong();
    }
}
