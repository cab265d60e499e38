package me.tavon.omnidock.registry;

import com.google.common.collect.ImmutableList;
import me.tavon.omnidock.OmniDock;
import me.tavon.omnidock.channel.*;
import me.tavon.omnidock.driver.LivenessResult;
import me.tavon.omnidock.store.PreferenceStore;
import me.tavon.omnidock.store.SelectionSnapshot;

import java.io.IOException;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owner of the merged embed catalog and of the selection sets.
 * <p>
 * Sources only hand in {@link SourceEvent}s. Every change, whether a merge cycle or a user
 * operation, runs under one lock and publishes a new immutable {@link RegistryState}; readers use
 * {@link #state()} and never see a partial update.
 * <p>
 * Identity precedence when a key is reported by more than one source is pinned, then polled, then
 * realtime. A viewer count from the realtime feed always wins over the others.
 */
public class LiveEmbedRegistry {

    private final Object lock = new Object();
    private final PreferenceStore store;
    private final List<String> preferredPlatforms;
    private final List<RegistryListener> listeners = new CopyOnWriteArrayList<>();

    private volatile RegistryState state = RegistryState.empty();

    public LiveEmbedRegistry(PreferenceStore store, List<String> preferredPlatforms) {
        Objects.requireNonNull(store, "store cannot be null");
        this.store = store;
        this.preferredPlatforms = preferredPlatforms == null
                ? ImmutableList.<String>of() : ImmutableList.copyOf(preferredPlatforms);
    }

    /**
     * Reads streamers, pins and selections from the store. Selected keys that no pin covers become
     * ghosts of their persisted records until a source reports them.
     */
    public void activate() {
        List<BookmarkedStreamer> streamers = Collections.emptyList();
        List<EmbedRecord> pinnedRecords = Collections.emptyList();
        SelectionSnapshot selection = SelectionSnapshot.empty();

        try {
            streamers = nonNull(store.loadStreamers());
            pinnedRecords = nonNull(store.loadPinned());

            SelectionSnapshot stored = store.loadSelection();

            if (stored != null) {
                selection = stored;
            }
        } catch (IOException e) {
            OmniDock.LOGGER.warning("Could not load stored registry data: " + e.getMessage());
        }

        synchronized (lock) {
            RegistryState previous = state;
            Map<CanonicalKey, EmbedRecord> pinned = new LinkedHashMap<>();

            for (EmbedRecord record : pinnedRecords) {
                pinned.put(record.getKey(), record);
            }

            Map<CanonicalKey, EmbedRecord> known = new HashMap<>();

            for (EmbedRecord record : selection.getKnown()) {
                known.put(record.getKey(), record);
            }

            Map<CanonicalKey, EmbedRecord> ghosts = new LinkedHashMap<>();
            Set<CanonicalKey> video = restoreSelection(selection.getVideo(), pinned, known, ghosts);
            Set<CanonicalKey> chat = restoreSelection(selection.getChat(), pinned, known, ghosts);

            RegistryState next = new RegistryState(previous.getCycle(), pinned, ghosts, video, chat, pinned,
                    ImmutableList.<EmbedRecord>of(), previous.getBanned(), previous.getPollRecords(), streamers);
            commit(previous, next);

            OmniDock.LOGGER.info("Loaded " + streamers.size() + " streamer(s), " + pinned.size()
                    + " pin(s) and " + next.getReferencedKeys().size() + " selected embed(s)");
        }
    }

    public RegistryState state() {
        return state;
    }

    public List<String> getPreferredPlatforms() {
        return preferredPlatforms;
    }

    public void addListener(RegistryListener listener) {
        listeners.add(listener);
    }

    public void removeListener(RegistryListener listener) {
        listeners.remove(listener);
    }

    /**
     * Applies one source event and runs a merge cycle over the latest input of every source.
     */
    public void submit(SourceEvent event) {
        Objects.requireNonNull(event, "event cannot be null");

        synchronized (lock) {
            RegistryState previous = state;
            MergeInputs inputs = new MergeInputs(previous);

            if (!event.accept(inputs)) {
                return;
            }

            commit(previous, merge(previous, inputs, previous.getStreamers()));
        }
    }

    public void pin(EmbedRecord record) {
        submit(SourceEvent.pin(record));
    }

    public void unpin(CanonicalKey key) {
        submit(SourceEvent.unpin(key));
    }

    /**
     * Replaces the bookmarked streamer list. Poll records of streamers or platforms that are no longer
     * bookmarked are dropped.
     */
    public void setStreamers(List<BookmarkedStreamer> streamers) {
        synchronized (lock) {
            RegistryState previous = state;
            MergeInputs inputs = new MergeInputs(previous);
            Iterator<Map.Entry<PollSlot, EmbedRecord>> iterator = inputs.pollRecords.entrySet().iterator();

            while (iterator.hasNext()) {
                PollSlot slot = iterator.next().getKey();

                if (!isStillBookmarked(streamers, slot, null)) {
                    iterator.remove();
                }
            }

            commit(previous, merge(previous, inputs, streamers));
        }
    }

    /**
     * Appends a streamer to the end of the bookmark list.
     */
    public void addStreamer(BookmarkedStreamer streamer) {
        Objects.requireNonNull(streamer, "streamer cannot be null");

        synchronized (lock) {
            List<BookmarkedStreamer> next = new ArrayList<>(state.getStreamers());
            next.add(streamer);
            setStreamers(next);
        }
    }

    public List<BookmarkedStreamer> streamers() {
        return state.getStreamers();
    }

    public List<DockGroup> dockGroups() {
        return DockGrouper.group(state);
    }

    public boolean setVideoSelected(CanonicalKey key, boolean selected) {
        return setSelected(key, selected, true);
    }

    public boolean setChatSelected(CanonicalKey key, boolean selected) {
        return setSelected(key, selected, false);
    }

    /**
     * Turns the whole group off when any of its keys is selected for video or chat, otherwise turns
     * on video for the group's preferred key.
     */
    public void toggleGroup(DockGroup group) {
        Objects.requireNonNull(group, "group cannot be null");

        synchronized (lock) {
            RegistryState previous = state;
            Set<CanonicalKey> video = new LinkedHashSet<>(previous.getSelectedVideo());
            Set<CanonicalKey> chat = new LinkedHashSet<>(previous.getSelectedChat());

            if (group.isActive(previous)) {
                video.removeAll(group.getKeys());
                chat.removeAll(group.getKeys());
            } else {
                CanonicalKey key = DockGrouper.preferredKey(group.getKeys(), preferredPlatforms);

                if (!previous.isResolvable(key)) {
                    OmniDock.LOGGER.fine("Ignoring toggle of unresolvable " + key);
                    return;
                }

                video.add(key);
            }

            commit(previous, withSelection(previous, video, chat));
        }
    }

    private boolean setSelected(CanonicalKey key, boolean selected, boolean videoSet) {
        Objects.requireNonNull(key, "key cannot be null");

        synchronized (lock) {
            RegistryState previous = state;

            if (selected && !previous.isResolvable(key)) {
                OmniDock.LOGGER.fine("Refusing to select unresolvable " + key);
                return false;
            }

            Set<CanonicalKey> video = new LinkedHashSet<>(previous.getSelectedVideo());
            Set<CanonicalKey> chat = new LinkedHashSet<>(previous.getSelectedChat());
            Set<CanonicalKey> target = videoSet ? video : chat;
            boolean changed = selected ? target.add(key) : target.remove(key);

            if (changed) {
                commit(previous, withSelection(previous, video, chat));
            }

            return changed;
        }
    }

    private RegistryState withSelection(RegistryState previous, Set<CanonicalKey> video, Set<CanonicalKey> chat) {
        Map<CanonicalKey, EmbedRecord> ghosts = new LinkedHashMap<>();

        for (Map.Entry<CanonicalKey, EmbedRecord> entry : previous.getRetainedGhosts().entrySet()) {
            if (video.contains(entry.getKey()) || chat.contains(entry.getKey())) {
                ghosts.put(entry.getKey(), entry.getValue());
            }
        }

        return new RegistryState(previous.getCycle(), previous.getCatalog(), ghosts, video, chat,
                previous.getPinnedRecords(), previous.getRealtimeBatch(), previous.getBanned(),
                previous.getPollRecords(), previous.getStreamers());
    }

    private RegistryState merge(RegistryState previous, MergeInputs inputs, List<BookmarkedStreamer> streamers) {
        List<CanonicalKey> realtimeKeys = new ArrayList<>();

        for (EmbedRecord record : inputs.realtime) {
            realtimeKeys.add(record.getKey());
        }

        LegacyKeyMigration migration = LegacyKeyMigration.of(realtimeKeys);

        Map<CanonicalKey, EmbedRecord> realtimeByKey = new LinkedHashMap<>();

        for (EmbedRecord record : inputs.realtime) {
            realtimeByKey.putIfAbsent(record.getKey(), record);
        }

        Map<CanonicalKey, EmbedRecord> pinned = new LinkedHashMap<>();

        for (EmbedRecord record : inputs.pinned.values()) {
            CanonicalKey key = migration.migrate(record.getKey());
            pinned.put(key, key.equals(record.getKey()) ? record : record.withKey(key));
        }

        Map<CanonicalKey, EmbedRecord> catalog = new LinkedHashMap<>(realtimeByKey);

        for (EmbedRecord record : inputs.pollRecords.values()) {
            CanonicalKey key = migration.migrate(record.getKey());
            EmbedRecord polled = key.equals(record.getKey()) ? record : record.withKey(key);
            catalog.put(key, overlay(polled, catalog.get(key), realtimeByKey.get(key)));
        }

        for (EmbedRecord record : pinned.values()) {
            catalog.put(record.getKey(), overlay(record, catalog.get(record.getKey()),
                    realtimeByKey.get(record.getKey())));
        }

        annotateBans(catalog, inputs.banned);

        Map<CanonicalKey, EmbedRecord> ghosts = new LinkedHashMap<>();

        for (CanonicalKey key : previous.getReferencedKeys()) {
            if (catalog.containsKey(migration.migrate(key))) {
                continue;
            }

            EmbedRecord last = previous.resolve(key);

            if (last != null) {
                ghosts.put(key, last);
            }
        }

        Set<CanonicalKey> video = migrateSelection(previous.getSelectedVideo(), migration, catalog, ghosts);
        Set<CanonicalKey> chat = migrateSelection(previous.getSelectedChat(), migration, catalog, ghosts);

        RegistryState merged = new RegistryState(previous.getCycle() + 1, catalog, ghosts, video, chat, pinned,
                inputs.realtime, inputs.banned, inputs.pollRecords, streamers);

        Set<CanonicalKey> opened = autoOpen(previous, merged, video);

        if (!opened.isEmpty()) {
            video.addAll(opened);
            merged = new RegistryState(merged.getCycle(), catalog, ghosts, video, chat, pinned,
                    inputs.realtime, inputs.banned, inputs.pollRecords, streamers);
        }

        OmniDock.LOGGER.fine("Merge cycle " + merged.getCycle() + ": " + catalog.size() + " embed(s), "
                + ghosts.size() + " retained, " + video.size() + " video, " + chat.size() + " chat");

        return merged;
    }

    private static EmbedRecord overlay(EmbedRecord winner, EmbedRecord lower, EmbedRecord realtime) {
        EmbedRecord result = winner;

        if (realtime != null && realtime.getViewers() != null) {
            result = result.withViewers(realtime.getViewers());
        } else if (result.getViewers() == null && lower != null && lower.getViewers() != null) {
            result = result.withViewers(lower.getViewers());
        }

        if (realtime != null && realtime.getEmbedCount() != null) {
            result = result.withEmbedCount(realtime.getEmbedCount());
        }

        return result;
    }

    private static void annotateBans(Map<CanonicalKey, EmbedRecord> catalog, Map<CanonicalKey, BannedEmbed> banned) {
        Map<CanonicalKey, BannedEmbed> byLegacy = new HashMap<>();

        for (BannedEmbed ban : banned.values()) {
            byLegacy.putIfAbsent(ban.getKey().legacyForm(), ban);
        }

        for (Map.Entry<CanonicalKey, EmbedRecord> entry : catalog.entrySet()) {
            BannedEmbed ban = banned.get(entry.getKey());

            if (ban == null) {
                ban = byLegacy.get(entry.getKey().legacyForm());
            }

            entry.setValue(entry.getValue().withBan(ban != null, ban == null ? null : ban.getReason()));
        }
    }

    private static Set<CanonicalKey> migrateSelection(Set<CanonicalKey> selection, LegacyKeyMigration migration,
                                                      Map<CanonicalKey, EmbedRecord> catalog,
                                                      Map<CanonicalKey, EmbedRecord> ghosts) {
        Set<CanonicalKey> migrated = new LinkedHashSet<>();

        for (CanonicalKey key : selection) {
            CanonicalKey canonical = migration.migrate(key);

            if (catalog.containsKey(canonical) || ghosts.containsKey(canonical)) {
                migrated.add(canonical);
            } else {
                OmniDock.LOGGER.fine("Dropping selection of " + key + ", no record left to resolve it");
            }
        }

        return migrated;
    }

    /**
     * Keys to add to the video selection for auto-open streamers that had no visible key in the
     * previous state and have nothing selected for video yet.
     */
    private Set<CanonicalKey> autoOpen(RegistryState previous, RegistryState merged, Set<CanonicalKey> video) {
        Set<CanonicalKey> opened = new LinkedHashSet<>();

        for (BookmarkedStreamer streamer : merged.getStreamers()) {
            if (!streamer.isAutoOpenWhenLive()) {
                continue;
            }

            List<CanonicalKey> keys = merged.resolveStreamerKeys(streamer);

            if (keys.isEmpty() || !previous.resolveStreamerKeys(streamer).isEmpty()) {
                continue;
            }

            if (!Collections.disjoint(keys, video) || !Collections.disjoint(keys, opened)) {
                continue;
            }

            CanonicalKey key = DockGrouper.preferredKey(keys, preferredPlatforms);
            opened.add(key);
            OmniDock.LOGGER.info("Auto-opening " + key + " for " + streamer.getNickname());
        }

        return opened;
    }

    private void commit(RegistryState previous, RegistryState next) {
        state = next;

        if (!previous.getSelectedVideo().equals(next.getSelectedVideo())
                || !previous.getSelectedChat().equals(next.getSelectedChat())) {
            persistSelection(next);
        }

        if (!previous.getPinnedRecords().equals(next.getPinnedRecords())) {
            try {
                store.savePinned(new ArrayList<>(next.getPinnedRecords().values()));
            } catch (IOException e) {
                OmniDock.LOGGER.warning("Could not save pinned embeds: " + e.getMessage());
            }
        }

        if (!previous.getStreamers().equals(next.getStreamers())) {
            try {
                store.saveStreamers(next.getStreamers());
            } catch (IOException e) {
                OmniDock.LOGGER.warning("Could not save streamers: " + e.getMessage());
            }
        }

        for (RegistryListener listener : listeners) {
            try {
                listener.onRegistryChanged(previous, next);
            } catch (RuntimeException e) {
                OmniDock.LOGGER.warning("Registry listener failed: " + e.getMessage());
            }
        }
    }

    private void persistSelection(RegistryState next) {
        List<EmbedRecord> known = new ArrayList<>();

        for (CanonicalKey key : next.getReferencedKeys()) {
            EmbedRecord record = next.resolve(key);

            if (record != null) {
                known.add(record);
            }
        }

        try {
            store.saveSelection(new SelectionSnapshot(next.getSelectedVideo(), next.getSelectedChat(), known));
        } catch (IOException e) {
            OmniDock.LOGGER.warning("Could not save selection: " + e.getMessage());
        }
    }

    private static Set<CanonicalKey> restoreSelection(List<CanonicalKey> keys, Map<CanonicalKey, EmbedRecord> pinned,
                                                      Map<CanonicalKey, EmbedRecord> known,
                                                      Map<CanonicalKey, EmbedRecord> ghosts) {
        Set<CanonicalKey> restored = new LinkedHashSet<>();

        for (CanonicalKey key : keys) {
            if (key == null) {
                continue;
            }

            if (pinned.containsKey(key)) {
                restored.add(key);
                continue;
            }

            EmbedRecord record = known.get(key);

            if (record == null) {
                OmniDock.LOGGER.fine("Dropping stored selection of " + key + ", no record was stored with it");
                continue;
            }

            ghosts.put(key, record);
            restored.add(key);
        }

        return restored;
    }

    /**
     * Whether the slot still belongs to a bookmarked streamer. When an identifier is given it must also
     * still be the streamer's id on the slot's platform.
     */
    private static boolean isStillBookmarked(List<BookmarkedStreamer> streamers, PollSlot slot, String identifier) {
        for (BookmarkedStreamer streamer : streamers) {
            if (streamer.getId().equals(slot.getStreamerId())) {
                String id = streamer.getPlatformId(slot.getPlatform());

                if (id == null || id.trim().isEmpty()) {
                    return false;
                }

                return identifier == null || identifier.trim().equals(id.trim());
            }
        }

        return false;
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list == null ? Collections.<T>emptyList() : list;
    }

    /**
     * Working copy of every source's latest input, updated by exactly one event per cycle.
     */
    private static final class MergeInputs implements SourceEvent.Handler<Boolean> {

        private List<EmbedRecord> realtime;
        private Map<CanonicalKey, BannedEmbed> banned;
        private final Map<PollSlot, EmbedRecord> pollRecords;
        private final Map<CanonicalKey, EmbedRecord> pinned;
        private final List<BookmarkedStreamer> streamers;

        MergeInputs(RegistryState state) {
            this.streamers = state.getStreamers();
            this.realtime = state.getRealtimeBatch();
            this.banned = state.getBanned();
            this.pollRecords = new LinkedHashMap<>(state.getPollRecords());
            this.pinned = new LinkedHashMap<>(state.getPinnedRecords());
        }

        @Override
        public Boolean onRealtimeBatch(SourceEvent.RealtimeBatch batch) {
            realtime = batch.getRecords();
            return true;
        }

        @Override
        public Boolean onBannedList(SourceEvent.BannedList bannedList) {
            Map<CanonicalKey, BannedEmbed> next = new LinkedHashMap<>();

            for (BannedEmbed ban : bannedList.getBanned()) {
                next.put(ban.getKey(), ban);
            }

            banned = next;
            return true;
        }

        @Override
        public Boolean onPoll(SourceEvent.Poll poll) {
            LivenessResult result = poll.getResult();

            if (!isStillBookmarked(streamers, poll.getSlot(), poll.getIdentifier())) {
                OmniDock.LOGGER.fine("Ignoring poll of " + poll.getSlot() + " for " + poll.getIdentifier()
                        + ", no longer bookmarked");
                return false;
            }

            if (result.isFailed()) {
                OmniDock.LOGGER.warning("Poll of " + poll.getSlot() + " failed, keeping previous result: "
                        + result.getError());
                return false;
            }

            EmbedRecord previous = pollRecords.get(poll.getSlot());

            if (result.isLive()) {
                if (previous == null) {
                    OmniDock.LOGGER.info(poll.getSlot() + " is now live as " + result.getRecord().getKey());
                }

                pollRecords.put(poll.getSlot(), result.getRecord());
            } else if (previous != null) {
                OmniDock.LOGGER.info(poll.getSlot() + " is no longer live");
                pollRecords.remove(poll.getSlot());
            }

            return true;
        }

        @Override
        public Boolean onPinned(SourceEvent.Pinned pinned) {
            if (pinned.getOp() == SourceEvent.Pinned.Op.ADD) {
                this.pinned.put(pinned.getKey(), pinned.getRecord());
                return true;
            }

            return this.pinned.remove(pinned.getKey()) != null;
        }
    }
}
