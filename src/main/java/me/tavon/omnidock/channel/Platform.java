package me.tavon.omnidock.channel;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

public enum Platform {

    KICK("Kick", false, false, TimeUnit.SECONDS.toMillis(60)),
    TWITCH("Twitch", false, false, TimeUnit.SECONDS.toMillis(60)),
    YOUTUBE("YouTube", true, true, TimeUnit.SECONDS.toMillis(120));

    private String displayName;
    private boolean caseSensitiveIds;
    private boolean ephemeralStreamIds;
    private long defaultPollInterval;

    Platform(String displayName, boolean caseSensitiveIds, boolean ephemeralStreamIds,
             long defaultPollInterval) {
        this.displayName = displayName;
        this.caseSensitiveIds = caseSensitiveIds;
        this.ephemeralStreamIds = ephemeralStreamIds;
        this.defaultPollInterval = defaultPollInterval;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getKeyPrefix() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Whether embed ids on this platform keep their original case in a canonical key.
     */
    public boolean hasCaseSensitiveIds() {
        return caseSensitiveIds;
    }

    /**
     * Whether a bookmarked identifier on this platform (a channel) differs from the id of its live
     * embed (a video resolved when polled).
     */
    public boolean hasEphemeralStreamIds() {
        return ephemeralStreamIds;
    }

    public long getDefaultPollInterval() {
        return defaultPollInterval;
    }

    public static Platform fromKeyPrefix(String prefix) {
        if (prefix == null) {
            return null;
        }

        for (Platform platform : values()) {
            if (platform.getKeyPrefix().equalsIgnoreCase(prefix.trim())) {
                return platform;
            }
        }

        return null;
    }
}
