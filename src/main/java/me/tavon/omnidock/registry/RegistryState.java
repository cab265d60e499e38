package me.tavon.omnidock.registry;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import me.tavon.omnidock.channel.BannedEmbed;
import me.tavon.omnidock.channel.BookmarkedStreamer;
import me.tavon.omnidock.channel.CanonicalKey;
import me.tavon.omnidock.channel.EmbedRecord;

import java.util.*;

/**
 * Immutable snapshot of everything the registry owns. Each committed change produces a new instance,
 * so a reader holding one never sees a half-applied merge.
 */
public final class RegistryState {

    private final long cycle;
    private final ImmutableMap<CanonicalKey, EmbedRecord> catalog;
    private final ImmutableMap<CanonicalKey, EmbedRecord> retainedGhosts;
    private final ImmutableSet<CanonicalKey> selectedVideo;
    private final ImmutableSet<CanonicalKey> selectedChat;
    private final ImmutableMap<CanonicalKey, EmbedRecord> pinned;
    private final ImmutableList<EmbedRecord> realtimeBatch;
    private final ImmutableMap<CanonicalKey, BannedEmbed> banned;
    private final ImmutableMap<PollSlot, EmbedRecord> pollRecords;
    private final ImmutableList<BookmarkedStreamer> streamers;

    RegistryState(long cycle,
                  Map<CanonicalKey, EmbedRecord> catalog,
                  Map<CanonicalKey, EmbedRecord> retainedGhosts,
                  Collection<CanonicalKey> selectedVideo,
                  Collection<CanonicalKey> selectedChat,
                  Map<CanonicalKey, EmbedRecord> pinned,
                  List<EmbedRecord> realtimeBatch,
                  Map<CanonicalKey, BannedEmbed> banned,
                  Map<PollSlot, EmbedRecord> pollRecords,
                  List<BookmarkedStreamer> streamers) {
        this.cycle = cycle;
        this.catalog = ImmutableMap.copyOf(catalog);
        this.retainedGhosts = ImmutableMap.copyOf(retainedGhosts);
        this.selectedVideo = ImmutableSet.copyOf(selectedVideo);
        this.selectedChat = ImmutableSet.copyOf(selectedChat);
        this.pinned = ImmutableMap.copyOf(pinned);
        this.realtimeBatch = ImmutableList.copyOf(realtimeBatch);
        this.banned = ImmutableMap.copyOf(banned);
        this.pollRecords = ImmutableMap.copyOf(pollRecords);
        this.streamers = ImmutableList.copyOf(streamers);
    }

    static RegistryState empty() {
        return new RegistryState(0, ImmutableMap.of(), ImmutableMap.of(), ImmutableSet.of(), ImmutableSet.of(),
                ImmutableMap.of(), ImmutableList.of(), ImmutableMap.of(), ImmutableMap.of(), ImmutableList.of());
    }

    public long getCycle() {
        return cycle;
    }

    public ImmutableMap<CanonicalKey, EmbedRecord> getCatalog() {
        return catalog;
    }

    public ImmutableMap<CanonicalKey, EmbedRecord> getRetainedGhosts() {
        return retainedGhosts;
    }

    public ImmutableSet<CanonicalKey> getSelectedVideo() {
        return selectedVideo;
    }

    public ImmutableSet<CanonicalKey> getSelectedChat() {
        return selectedChat;
    }

    public ImmutableSet<CanonicalKey> getPinnedManual() {
        return pinned.keySet();
    }

    public ImmutableMap<CanonicalKey, EmbedRecord> getPinnedRecords() {
        return pinned;
    }

    public ImmutableList<EmbedRecord> getRealtimeBatch() {
        return realtimeBatch;
    }

    public ImmutableMap<CanonicalKey, BannedEmbed> getBanned() {
        return banned;
    }

    public ImmutableMap<PollSlot, EmbedRecord> getPollRecords() {
        return pollRecords;
    }

    public ImmutableList<BookmarkedStreamer> getStreamers() {
        return streamers;
    }

    /**
     * The catalog followed by the retained ghosts; what presentation may show.
     */
    public Map<CanonicalKey, EmbedRecord> getAvailable() {
        Map<CanonicalKey, EmbedRecord> available = new LinkedHashMap<>(catalog);

        for (Map.Entry<CanonicalKey, EmbedRecord> entry : retainedGhosts.entrySet()) {
            available.putIfAbsent(entry.getKey(), entry.getValue());
        }

        return Collections.unmodifiableMap(available);
    }

    public EmbedRecord resolve(CanonicalKey key) {
        EmbedRecord record = catalog.get(key);
        return record != null ? record : retainedGhosts.get(key);
    }

    public boolean isResolvable(CanonicalKey key) {
        return catalog.containsKey(key) || retainedGhosts.containsKey(key);
    }

    public boolean isGhost(CanonicalKey key) {
        return !catalog.containsKey(key) && retainedGhosts.containsKey(key);
    }

    public Set<CanonicalKey> getReferencedKeys() {
        Set<CanonicalKey> keys = new LinkedHashSet<>(selectedVideo);
        keys.addAll(selectedChat);
        return keys;
    }

    /**
     * Visible keys belonging to the streamer, either through a bookmarked id that is itself the embed
     * id or through a record one of the streamer's polls produced.
     */
    public List<CanonicalKey> resolveStreamerKeys(BookmarkedStreamer streamer) {
        Set<CanonicalKey> keys = new TreeSet<>();

        for (CanonicalKey key : streamer.getDirectKeys()) {
            if (isResolvable(key)) {
                keys.add(key);
            }
        }

        for (Map.Entry<PollSlot, EmbedRecord> entry : pollRecords.entrySet()) {
            if (!entry.getKey().getStreamerId().equals(streamer.getId())) {
                continue;
            }

            CanonicalKey key = entry.getValue().getKey();

            if (isResolvable(key)) {
                keys.add(key);
            }
        }

        return new ArrayList<>(keys);
    }

    /**
     * First streamer, in bookmark order, that claims the key.
     */
    public BookmarkedStreamer findStreamer(CanonicalKey key) {
        for (BookmarkedStreamer streamer : streamers) {
            if (streamer.getDirectKeys().contains(key)) {
                return streamer;
            }

            for (Map.Entry<PollSlot, EmbedRecord> entry : pollRecords.entrySet()) {
                if (entry.getKey().getStreamerId().equals(streamer.getId())
                        && entry.getValue().getKey().equals(key)) {
                    return streamer;
                }
            }
        }

        return null;
    }

    @Override
    public String toString() {
        return "RegistryState{" +
                "cycle=" + cycle +
                ", catalog=" + catalog.keySet() +
                ", retainedGhosts=" + retainedGhosts.keySet() +
                ", selectedVideo=" + selectedVideo +
                ", selectedChat=" + selectedChat +
                ", pinned=" + pinned.keySet() +
                '}';
    }
}
