package me.tavon.omnidock.channel;

import java.util.Objects;

public final class BannedEmbed {

    private final CanonicalKey key;
    private final String reason;

    public BannedEmbed(CanonicalKey key, String reason) {
        Objects.requireNonNull(key, "key cannot be null");
        this.key = key;
        this.reason = reason;
    }

    public CanonicalKey getKey() {
        return key;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "BannedEmbed{key=" + key + ", reason='" + reason + "'}";
    }
}
