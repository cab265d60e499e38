package me.tavon.omnidock.registry;

import me.tavon.omnidock.channel.Platform;

import java.util.Objects;

/**
 * Where a poll-originated record came from: one bookmarked streamer on one platform. A fresh result
 * for a slot replaces only that slot's previous record.
 */
public final class PollSlot {

    private final Platform platform;
    private final String streamerId;

    public PollSlot(Platform platform, String streamerId) {
        Objects.requireNonNull(platform, "platform cannot be null");
        Objects.requireNonNull(streamerId, "streamerId cannot be null");
        this.platform = platform;
        this.streamerId = streamerId;
    }

    public Platform getPlatform() {
        return platform;
    }

    public String getStreamerId() {
        return streamerId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }

        if (o == null || getClass() != o.getClass()) {
            return false;
        }

        PollSlot pollSlot = (PollSlot) o;
        return platform == pollSlot.platform && streamerId.equals(pollSlot.streamerId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(platform, streamerId);
    }

    @Override
    public String toString() {
        return platform.getKeyPrefix() + "/" + streamerId;
    }
}
