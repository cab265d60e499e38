package me.tavon.omnidock.channel;

import java.util.Objects;

/**
 * One watchable embed as the catalog knows it. Records are replaced wholesale; the {@code with*}
 * methods return copies.
 */
public final class EmbedRecord {

    private final CanonicalKey key;
    private final String rawId;
    private final String title;
    private final Long viewers;
    private final Integer embedCount;
    private final String thumbnailUrl;
    private final boolean banned;
    private final String banReason;

    public EmbedRecord(CanonicalKey key, String rawId, String title, Long viewers, Integer embedCount,
                       String thumbnailUrl, boolean banned, String banReason) {
        Objects.requireNonNull(key, "key cannot be null");
        this.key = key;
        this.rawId = rawId == null ? key.getId() : rawId;
        this.title = title;
        this.viewers = viewers;
        this.embedCount = embedCount;
        this.thumbnailUrl = thumbnailUrl;
        this.banned = banned;
        this.banReason = banned ? banReason : null;
    }

    public static EmbedRecord of(CanonicalKey key, String title) {
        return new EmbedRecord(key, key.getId(), title, null, null, null, false, null);
    }

    public static EmbedRecord of(CanonicalKey key, String title, Long viewers) {
        return new EmbedRecord(key, key.getId(), title, viewers, null, null, false, null);
    }

    public CanonicalKey getKey() {
        return key;
    }

    public String getPlatformName() {
        return key.getPlatformName();
    }

    public String getRawId() {
        return rawId;
    }

    public String getTitle() {
        return title;
    }

    /**
     * Title if present, otherwise {@code platform/rawId}.
     */
    public String getDisplayTitle() {
        if (title != null && !title.trim().isEmpty()) {
            return title;
        }

        return key.getPlatformName() + "/" + rawId;
    }

    public Long getViewers() {
        return viewers;
    }

    public long getViewersOrZero() {
        return viewers == null ? 0L : viewers;
    }

    public Integer getEmbedCount() {
        return embedCount;
    }

    public String getThumbnailUrl() {
        return thumbnailUrl;
    }

    public boolean isBanned() {
        return banned;
    }

    public String getBanReason() {
        return banReason;
    }

    public EmbedRecord withKey(CanonicalKey newKey) {
        return new EmbedRecord(newKey, rawId, title, viewers, embedCount, thumbnailUrl, banned, banReason);
    }

    public EmbedRecord withViewers(Long newViewers) {
        return new EmbedRecord(key, rawId, title, newViewers, embedCount, thumbnailUrl, banned, banReason);
    }

    public EmbedRecord withEmbedCount(Integer newEmbedCount) {
        return new EmbedRecord(key, rawId, title, viewers, newEmbedCount, thumbnailUrl, banned, banReason);
    }

    public EmbedRecord withBan(boolean newBanned, String reason) {
        if (newBanned == banned && Objects.equals(reason, banReason)) {
            return this;
        }

        return new EmbedRecord(key, rawId, title, viewers, embedCount, thumbnailUrl, newBanned, reason);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        EmbedRecord that = (EmbedRecord) o;
        return banned == that.banned
                && key.equals(that.key)
                && Objects.equals(rawId, that.rawId)
                && Objects.equals(title, that.title)
                && Objects.equals(viewers, that.viewers)
                && Objects.equals(embedCount, that.embedCount)
                && Objects.equals(thumbnailUrl, that.thumbnailUrl)
                && Objects.equals(banReason, that.banReason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, rawId, title, viewers, embedCount, thumbnailUrl, banned, banReason);
    }

    @Override
    public String toString() {
        return "EmbedRecord{" +
                "key=" + key +
                ", title='" + title + '\'' +
                ", viewers=" + viewers +
                ", embedCount=" + embedCount +
                ", banned=" + banned +
                '}';
    }
}
