package me.tavon.omnidock.registry;

import com.google.common.collect.ImmutableList;
import me.tavon.omnidock.channel.BookmarkedStreamer;
import me.tavon.omnidock.channel.CanonicalKey;

import java.util.List;

public final class DockGroup {

    private final String label;
    private final ImmutableList<CanonicalKey> keys;
    private final ImmutableList<BookmarkedStreamer> streamers;
    private final long viewers;

    DockGroup(String label, List<CanonicalKey> keys, List<BookmarkedStreamer> streamers, long viewers) {
        this.label = label;
        this.keys = ImmutableList.copyOf(keys);
        this.streamers = ImmutableList.copyOf(streamers);
        this.viewers = viewers;
    }

    public String getLabel() {
        return label;
    }

    public ImmutableList<CanonicalKey> getKeys() {
        return keys;
    }

    public ImmutableList<BookmarkedStreamer> getStreamers() {
        return streamers;
    }

    /**
     * True when at least one bookmarked streamer claims these keys.
     */
    public boolean isGrouped() {
        return !streamers.isEmpty();
    }

    public long getViewers() {
        return viewers;
    }

    public boolean isActive(RegistryState state) {
        for (CanonicalKey key : keys) {
            if (state.getSelectedVideo().contains(key) || state.getSelectedChat().contains(key)) {
                return true;
            }
        }

        return false;
    }

    @Override
    public String toString() {
        return "DockGroup{label='" + label + "', keys=" + keys + ", viewers=" + viewers + '}';
    }
}
