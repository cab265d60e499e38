package me.tavon.omnidock.channel;

import java.util.Locale;
import java.util.Objects;

/**
 * Identity of a watchable embed, written {@code platform:id}.
 * <p>
 * The platform is always lower-cased. The id is lower-cased too, except on platforms whose ids are
 * case-sensitive (YouTube video ids), where it is kept exactly as given. Unknown platforms reported by
 * the realtime feed are accepted and follow the lower-case rule.
 */
public final class CanonicalKey implements Comparable<CanonicalKey> {

    public static final CanonicalKey PRIMARY_CHAT = new CanonicalKey("primary", "chat");

    private final String platform;
    private final String id;

    private CanonicalKey(String platform, String id) {
        this.platform = platform;
        this.id = id;
    }

    public static CanonicalKey of(String platform, String id) {
        if (platform == null || platform.trim().isEmpty()) {
            throw new IllegalArgumentException("platform cannot be empty");
        }

        if (id == null || id.isEmpty()) {
            throw new IllegalArgumentException("id cannot be empty");
        }

        String normalizedPlatform = platform.trim().toLowerCase(Locale.ROOT);
        Platform known = Platform.fromKeyPrefix(normalizedPlatform);

        if (known != null && known.hasCaseSensitiveIds()) {
            return new CanonicalKey(normalizedPlatform, id);
        }

        return new CanonicalKey(normalizedPlatform, id.toLowerCase(Locale.ROOT));
    }

    public static CanonicalKey of(Platform platform, String id) {
        Objects.requireNonNull(platform, "platform cannot be null");
        return of(platform.getKeyPrefix(), id);
    }

    /**
     * Parses a key previously produced by {@link #toString()}. The id may itself contain colons.
     */
    public static CanonicalKey parse(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }

        int separator = key.indexOf(':');

        if (separator <= 0 || separator == key.length() - 1) {
            throw new IllegalArgumentException("malformed key " + key);
        }

        return of(key.substring(0, separator), key.substring(separator + 1));
    }

    public String getPlatformName() {
        return platform;
    }

    public Platform getPlatform() {
        return Platform.fromKeyPrefix(platform);
    }

    public String getId() {
        return id;
    }

    /**
     * The all-lower form older versions stored for every platform.
     */
    public CanonicalKey legacyForm() {
        String lowered = id.toLowerCase(Locale.ROOT);

        if (lowered.equals(id)) {
            return this;
        }

        return new CanonicalKey(platform, lowered);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        CanonicalKey that = (CanonicalKey) o;
        return platform.equals(that.platform) && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(platform, id);
    }

    @Override
    public int compareTo(CanonicalKey o) {
        return toString().compareTo(o.toString());
    }

    @Override
    public String toString() {
        return platform + ":" + id;
    }
}
