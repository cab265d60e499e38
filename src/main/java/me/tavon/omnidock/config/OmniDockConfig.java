package me.tavon.omnidock.config;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import me.tavon.omnidock.OmniDock;
import me.tavon.omnidock.channel.Platform;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * Application settings. Defaults come from the bundled {@code default-config.json}; a
 * {@code config.json} next to the application overrides any of its top-level keys.
 */
public class OmniDockConfig {

    public static final String DEFAULT_RESOURCE = "/default-config.json";
    public static final String CONFIG_FILE = "config.json";

    private String dataPath;
    private String realtimeUrl;
    private String realtimeOrigin;
    private String primaryChatUrl;
    private String primaryChatName;
    private String youtubeApiKey;
    private List<String> preferredPlatforms;
    private Map<String, Integer> pollIntervalSeconds;
    private int youtubePollMultiplier;
    private Reconnect realtimeReconnect;
    private int youtubeChatPollSeconds;

    public static OmniDockConfig load(File file) throws IOException {
        JsonObject merged = readDefaults();

        if (file != null && file.isFile()) {
            try (Reader reader = new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8)) {
                JsonElement element = new JsonParser().parse(reader);

                if (!element.isJsonObject()) {
                    throw new IOException(file + " is not a JSON object");
                }

                for (Map.Entry<String, JsonElement> entry : element.getAsJsonObject().entrySet()) {
                    merged.add(entry.getKey(), entry.getValue());
                }
            } catch (JsonParseException e) {
                throw new IOException("Could not parse " + file, e);
            }

            OmniDock.LOGGER.info("Loaded configuration from " + file);
        }

        return OmniDock.GSON.fromJson(merged, OmniDockConfig.class);
    }

    public static OmniDockConfig defaults() throws IOException {
        return load(null);
    }

    private static JsonObject readDefaults() throws IOException {
        InputStream stream = OmniDockConfig.class.getResourceAsStream(DEFAULT_RESOURCE);

        if (stream == null) {
            throw new IOException("Missing bundled " + DEFAULT_RESOURCE);
        }

        try (Reader reader = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            return new JsonParser().parse(reader).getAsJsonObject();
        } catch (JsonParseException | IllegalStateException e) {
            throw new IOException("Could not parse bundled " + DEFAULT_RESOURCE, e);
        }
    }

    public File getDataFolder() {
        return new File(dataPath == null || dataPath.trim().isEmpty() ? "data/" : dataPath);
    }

    public String getRealtimeUrl() {
        return realtimeUrl;
    }

    public String getRealtimeOrigin() {
        return realtimeOrigin;
    }

    public String getPrimaryChatUrl() {
        return primaryChatUrl;
    }

    public String getPrimaryChatName() {
        return primaryChatName == null ? "chat" : primaryChatName;
    }

    public String getYoutubeApiKey() {
        return youtubeApiKey;
    }

    public List<String> getPreferredPlatforms() {
        return preferredPlatforms == null ? Collections.<String>emptyList()
                : Collections.unmodifiableList(preferredPlatforms);
    }

    /**
     * Delay between two polls of one streamer on the platform. A multiplier below one counts as one.
     */
    public long getPollInterval(Platform platform) {
        long millis = platform.getDefaultPollInterval();
        Integer seconds = pollIntervalSeconds == null ? null : pollIntervalSeconds.get(platform.getKeyPrefix());

        if (seconds != null && seconds > 0) {
            millis = TimeUnit.SECONDS.toMillis(seconds);
        }

        if (platform == Platform.YOUTUBE) {
            millis *= Math.max(1, youtubePollMultiplier);
        }

        return millis;
    }

    public Reconnect getRealtimeReconnect() {
        return realtimeReconnect == null ? new Reconnect() : realtimeReconnect;
    }

    public long getYoutubeChatPollInterval() {
        return TimeUnit.SECONDS.toMillis(Math.max(1, youtubeChatPollSeconds));
    }

    public static class Reconnect {

        private long baseMillis = 1000L;
        private long maxMillis = 30000L;
        private int maxAttempts = 10;

        public long getBaseMillis() {
            return Math.max(1L, baseMillis);
        }

        public long getMaxMillis() {
            return Math.max(getBaseMillis(), maxMillis);
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        /**
         * Delay before reconnect attempt {@code attempt}, counted from one.
         */
        public long delayFor(int attempt) {
            int shift = Math.min(Math.max(0, attempt - 1), 30);
            return Math.min(getBaseMillis() << shift, getMaxMillis());
        }
    }
}
