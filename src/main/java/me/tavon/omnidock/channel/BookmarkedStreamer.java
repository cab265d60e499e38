package me.tavon.omnidock.channel;

import java.util.*;

public class BookmarkedStreamer {

    private final String id;
    private final String nickname;
    private final Map<Platform, String> platformIds;
    private final Map<Platform, String> platformColors;
    private final String masterColor;
    private final boolean autoOpenWhenLive;
    private final boolean hideLabel;

    public BookmarkedStreamer(String id, String nickname, Map<Platform, String> platformIds,
                              Map<Platform, String> platformColors, String masterColor,
                              boolean autoOpenWhenLive, boolean hideLabel) {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(nickname, "nickname cannot be null");
        this.id = id;
        this.nickname = nickname;
        this.platformIds = copy(platformIds);
        this.platformColors = copy(platformColors);
        this.masterColor = masterColor;
        this.autoOpenWhenLive = autoOpenWhenLive;
        this.hideLabel = hideLabel;
    }

    private static Map<Platform, String> copy(Map<Platform, String> map) {
        Map<Platform, String> copy = new EnumMap<>(Platform.class);

        if (map != null) {
            copy.putAll(map);
        }

        return copy;
    }

    public static BookmarkedStreamer create(String nickname, Map<Platform, String> platformIds) {
        return new BookmarkedStreamer(UUID.randomUUID().toString(), nickname, platformIds,
                null, null, false, false);
    }

    public String getId() {
        return id;
    }

    public String getNickname() {
        return nickname;
    }

    public Map<Platform, String> getPlatformIds() {
        return platformIds == null ? Collections.emptyMap() : Collections.unmodifiableMap(platformIds);
    }

    public String getPlatformId(Platform platform) {
        return platformIds == null ? null : platformIds.get(platform);
    }

    public String getPlatformColor(Platform platform) {
        return platformColors == null || platform == null ? null : platformColors.get(platform);
    }

    public Map<Platform, String> getPlatformColors() {
        return platformColors == null ? Collections.emptyMap() : Collections.unmodifiableMap(platformColors);
    }

    public String getMasterColor() {
        return masterColor;
    }

    public boolean isAutoOpenWhenLive() {
        return autoOpenWhenLive;
    }

    public boolean isHideLabel() {
        return hideLabel;
    }

    /**
     * Keys this streamer owns regardless of polling, one per platform whose bookmarked id is also
     * the embed id.
     */
    public Set<CanonicalKey> getDirectKeys() {
        Set<CanonicalKey> keys = new LinkedHashSet<>();

        for (Map.Entry<Platform, String> entry : getPlatformIds().entrySet()) {
            if (entry.getValue() == null || entry.getValue().trim().isEmpty()) {
                continue;
            }

            if (!entry.getKey().hasEphemeralStreamIds()) {
                keys.add(CanonicalKey.of(entry.getKey(), entry.getValue().trim()));
            }
        }

        return keys;
    }

    public BookmarkedStreamer withAutoOpenWhenLive(boolean autoOpen) {
        return new BookmarkedStreamer(id, nickname, platformIds, platformColors, masterColor, autoOpen, hideLabel);
    }

    public BookmarkedStreamer withColors(Map<Platform, String> colors, String master) {
        return new BookmarkedStreamer(id, nickname, platformIds, colors, master, autoOpenWhenLive, hideLabel);
    }

    public BookmarkedStreamer withHideLabel(boolean hide) {
        return new BookmarkedStreamer(id, nickname, platformIds, platformColors, masterColor, autoOpenWhenLive, hide);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        BookmarkedStreamer that = (BookmarkedStreamer) o;
        return autoOpenWhenLive == that.autoOpenWhenLive
                && hideLabel == that.hideLabel
                && id.equals(that.id)
                && nickname.equals(that.nickname)
                && getPlatformIds().equals(that.getPlatformIds())
                && getPlatformColors().equals(that.getPlatformColors())
                && Objects.equals(masterColor, that.masterColor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, nickname, getPlatformIds(), getPlatformColors(), masterColor, autoOpenWhenLive, hideLabel);
    }

    @Override
    public String toString() {
        return "BookmarkedStreamer{" +
                "id='" + id + '\'' +
                ", nickname='" + nickname + '\'' +
                ", platformIds=" + platformIds +
                ", autoOpenWhenLive=" + autoOpenWhenLive +
                '}';
    }
}
