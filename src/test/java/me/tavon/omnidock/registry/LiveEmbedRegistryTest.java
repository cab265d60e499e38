package me.tavon.omnidock.registry;

import me.tavon.omnidock.channel.*;
import me.tavon.omnidock.driver.LivenessResult;
import me.tavon.omnidock.store.InMemoryPreferenceStore;
import me.tavon.omnidock.store.SelectionSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class LiveEmbedRegistryTest {

    private static final CanonicalKey KICK_DESTINY = CanonicalKey.of("kick", "destiny");
    private static final CanonicalKey TWITCH_DESTINY = CanonicalKey.of("twitch", "destiny");

    private InMemoryPreferenceStore store;
    private LiveEmbedRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemoryPreferenceStore();
        registry = new LiveEmbedRegistry(store, Arrays.asList("kick", "twitch", "youtube"));
        registry.activate();
    }

    @Test
    void chatSelectedEmbedSurvivesAsGhostUntilDeselected() {
        registry.submit(SourceEvent.realtimeBatch(Collections.singletonList(
                EmbedRecord.of(KICK_DESTINY, "Destiny", 1200L))));
        assertTrue(registry.setChatSelected(KICK_DESTINY, true));

        registry.submit(SourceEvent.realtimeBatch(Collections.<EmbedRecord>emptyList()));

        RegistryState state = registry.state();
        assertFalse(state.getCatalog().containsKey(KICK_DESTINY));
        assertTrue(state.isGhost(KICK_DESTINY));
        assertEquals("Destiny", state.resolve(KICK_DESTINY).getTitle());
        assertTrue(state.getSelectedChat().contains(KICK_DESTINY));

        assertTrue(registry.setChatSelected(KICK_DESTINY, false));

        assertTrue(registry.state().getRetainedGhosts().isEmpty());
        assertFalse(registry.state().isResolvable(KICK_DESTINY));
    }

    @Test
    void unselectedEmbedIsDroppedWhenNoSourceReportsIt() {
        registry.submit(SourceEvent.realtimeBatch(Collections.singletonList(EmbedRecord.of(KICK_DESTINY, "Destiny"))));
        registry.submit(SourceEvent.realtimeBatch(Collections.<EmbedRecord>emptyList()));

        assertFalse(registry.state().isResolvable(KICK_DESTINY));
        assertTrue(registry.state().getRetainedGhosts().isEmpty());
    }

    @Test
    void legacySelectionMigratesToReportedCase() {
        CanonicalKey legacy = CanonicalKey.of("youtube", "abcdefghijk");
        CanonicalKey canonical = CanonicalKey.of("youtube", "AbCdEfGhIjK");
        store.selection = new SelectionSnapshot(Collections.singletonList(legacy),
                Collections.singletonList(legacy), Collections.singletonList(EmbedRecord.of(legacy, "Old title")));
        registry = new LiveEmbedRegistry(store, Arrays.asList("kick", "twitch", "youtube"));
        registry.activate();

        assertTrue(registry.state().isGhost(legacy));

        registry.submit(SourceEvent.realtimeBatch(Collections.singletonList(EmbedRecord.of(canonical, "Live"))));

        RegistryState state = registry.state();
        assertEquals(Collections.singleton(canonical), state.getSelectedVideo());
        assertEquals(Collections.singleton(canonical), state.getSelectedChat());
        assertTrue(state.getRetainedGhosts().isEmpty());
        assertEquals(Collections.singletonList(canonical), store.selection.getVideo());
    }

    @Test
    void pinnedIdentityWinsAndRealtimeViewersOverlay() {
        BookmarkedStreamer streamer = streamer("Destiny", false);
        registry.setStreamers(Collections.singletonList(streamer));

        registry.submit(SourceEvent.poll(Platform.KICK, streamer.getId(),
                LivenessResult.live(EmbedRecord.of(KICK_DESTINY, "Polled title", 10L))));
        assertEquals("Polled title", registry.state().resolve(KICK_DESTINY).getTitle());
        assertEquals(Long.valueOf(10L), registry.state().resolve(KICK_DESTINY).getViewers());

        registry.submit(SourceEvent.realtimeBatch(Collections.singletonList(
                new EmbedRecord(KICK_DESTINY, "Destiny", "Realtime title", 500L, 3, null, false, null))));

        EmbedRecord merged = registry.state().resolve(KICK_DESTINY);
        assertEquals("Polled title", merged.getTitle());
        assertEquals(Long.valueOf(500L), merged.getViewers());
        assertEquals(Integer.valueOf(3), merged.getEmbedCount());

        registry.pin(EmbedRecord.of(KICK_DESTINY, "Pinned title"));

        merged = registry.state().resolve(KICK_DESTINY);
        assertEquals("Pinned title", merged.getTitle());
        assertEquals(Long.valueOf(500L), merged.getViewers());
        assertEquals(1, store.pinned.size());
    }

    @Test
    void lowerSourceViewersFillInWhenRealtimeHasNone() {
        BookmarkedStreamer streamer = streamer("Destiny", false);
        registry.setStreamers(Collections.singletonList(streamer));
        registry.submit(SourceEvent.poll(Platform.KICK, streamer.getId(),
                LivenessResult.live(EmbedRecord.of(KICK_DESTINY, "Polled", 42L))));

        registry.pin(EmbedRecord.of(KICK_DESTINY, "Pinned"));

        assertEquals(Long.valueOf(42L), registry.state().resolve(KICK_DESTINY).getViewers());
    }

    @Test
    void failedPollKeepsPreviousResult() {
        BookmarkedStreamer streamer = streamer("Destiny", false);
        registry.setStreamers(Collections.singletonList(streamer));
        registry.submit(SourceEvent.poll(Platform.KICK, streamer.getId(),
                LivenessResult.live(EmbedRecord.of(KICK_DESTINY, "Live"))));
        RegistryState before = registry.state();

        registry.submit(SourceEvent.poll(Platform.KICK, streamer.getId(), LivenessResult.failed("timeout")));

        assertSame(before, registry.state());
        assertTrue(registry.state().isResolvable(KICK_DESTINY));

        registry.submit(SourceEvent.poll(Platform.KICK, streamer.getId(), LivenessResult.offline()));

        assertFalse(registry.state().isResolvable(KICK_DESTINY));
        assertTrue(registry.state().getPollRecords().isEmpty());
    }

    @Test
    void pollResultReplacesOnlyItsOwnSlot() {
        BookmarkedStreamer first = streamer("First", false);
        BookmarkedStreamer second = BookmarkedStreamer.create("Second",
                Collections.singletonMap(Platform.TWITCH, "second"));
        registry.setStreamers(Arrays.asList(first, second));
        CanonicalKey secondKey = CanonicalKey.of(Platform.TWITCH, "second");

        registry.submit(SourceEvent.poll(Platform.KICK, first.getId(),
                LivenessResult.live(EmbedRecord.of(KICK_DESTINY, "First"))));
        registry.submit(SourceEvent.poll(Platform.TWITCH, second.getId(),
                LivenessResult.live(EmbedRecord.of(secondKey, "Second"))));
        registry.submit(SourceEvent.poll(Platform.KICK, first.getId(), LivenessResult.offline()));

        assertFalse(registry.state().isResolvable(KICK_DESTINY));
        assertTrue(registry.state().isResolvable(secondKey));
    }

    @Test
    void bannedEmbedsAreAnnotated() {
        registry.submit(SourceEvent.realtimeBatch(Arrays.asList(EmbedRecord.of(KICK_DESTINY, "Destiny"),
                EmbedRecord.of(TWITCH_DESTINY, "Destiny"))));
        registry.submit(SourceEvent.bannedList(Collections.singletonList(
                new BannedEmbed(CanonicalKey.of("KICK", "Destiny"), "rule 1"))));

        RegistryState state = registry.state();
        assertTrue(state.resolve(KICK_DESTINY).isBanned());
        assertEquals("rule 1", state.resolve(KICK_DESTINY).getBanReason());
        assertFalse(state.resolve(TWITCH_DESTINY).isBanned());

        registry.submit(SourceEvent.bannedList(Collections.<BannedEmbed>emptyList()));

        assertFalse(registry.state().resolve(KICK_DESTINY).isBanned());
    }

    @Test
    void autoOpenSelectsPreferredPlatformOnce() {
        Map<Platform, String> ids = new EnumMap<>(Platform.class);
        ids.put(Platform.KICK, "destiny");
        ids.put(Platform.TWITCH, "destiny");
        registry.setStreamers(Collections.singletonList(
                BookmarkedStreamer.create("Destiny", ids).withAutoOpenWhenLive(true)));

        List<EmbedRecord> batch = Arrays.asList(EmbedRecord.of(TWITCH_DESTINY, "Destiny"),
                EmbedRecord.of(KICK_DESTINY, "Destiny"));
        registry.submit(SourceEvent.realtimeBatch(batch));

        assertEquals(Collections.singleton(KICK_DESTINY), registry.state().getSelectedVideo());

        registry.setVideoSelected(KICK_DESTINY, false);
        registry.submit(SourceEvent.realtimeBatch(batch));

        assertTrue(registry.state().getSelectedVideo().isEmpty());
    }

    @Test
    void autoOpenSkipsStreamerAlreadyInVideo() {
        Map<Platform, String> ids = new EnumMap<>(Platform.class);
        ids.put(Platform.KICK, "destiny");
        ids.put(Platform.TWITCH, "destiny");
        registry.setStreamers(Collections.singletonList(
                BookmarkedStreamer.create("Destiny", ids).withAutoOpenWhenLive(true)));
        registry.submit(SourceEvent.realtimeBatch(Collections.singletonList(EmbedRecord.of(TWITCH_DESTINY, "T"))));
        assertEquals(Collections.singleton(TWITCH_DESTINY), registry.state().getSelectedVideo());

        registry.submit(SourceEvent.realtimeBatch(Arrays.asList(EmbedRecord.of(TWITCH_DESTINY, "T"),
                EmbedRecord.of(KICK_DESTINY, "K"))));

        assertEquals(Collections.singleton(TWITCH_DESTINY), registry.state().getSelectedVideo());
    }

    @Test
    void secondPlatformGoingLiveDoesNotReopenClosedStreamer() {
        Map<Platform, String> ids = new EnumMap<>(Platform.class);
        ids.put(Platform.KICK, "destiny");
        ids.put(Platform.TWITCH, "destiny");
        registry.setStreamers(Collections.singletonList(
                BookmarkedStreamer.create("Destiny", ids).withAutoOpenWhenLive(true)));

        registry.submit(SourceEvent.realtimeBatch(Collections.singletonList(EmbedRecord.of(KICK_DESTINY, "K"))));
        assertEquals(Collections.singleton(KICK_DESTINY), registry.state().getSelectedVideo());
        registry.setVideoSelected(KICK_DESTINY, false);

        registry.submit(SourceEvent.realtimeBatch(Arrays.asList(EmbedRecord.of(KICK_DESTINY, "K"),
                EmbedRecord.of(TWITCH_DESTINY, "T"))));

        assertTrue(registry.state().getSelectedVideo().isEmpty());

        registry.submit(SourceEvent.realtimeBatch(Collections.<EmbedRecord>emptyList()));
        registry.submit(SourceEvent.realtimeBatch(Collections.singletonList(EmbedRecord.of(TWITCH_DESTINY, "T"))));

        assertEquals(Collections.singleton(TWITCH_DESTINY), registry.state().getSelectedVideo());
    }

    @Test
    void refusesToSelectUnresolvableKey() {
        assertFalse(registry.setVideoSelected(KICK_DESTINY, true));
        assertFalse(registry.setChatSelected(KICK_DESTINY, true));
        assertTrue(registry.state().getReferencedKeys().isEmpty());
        assertEquals(0, store.selectionWrites);
    }

    @Test
    void toggleGroupOpensPreferredKeyThenClosesAll() {
        Map<Platform, String> ids = new EnumMap<>(Platform.class);
        ids.put(Platform.KICK, "destiny");
        ids.put(Platform.TWITCH, "destiny");
        registry.setStreamers(Collections.singletonList(BookmarkedStreamer.create("Destiny", ids)));
        registry.submit(SourceEvent.realtimeBatch(Arrays.asList(EmbedRecord.of(TWITCH_DESTINY, "T"),
                EmbedRecord.of(KICK_DESTINY, "K"))));
        DockGroup group = registry.dockGroups().get(0);

        registry.toggleGroup(group);

        assertEquals(Collections.singleton(KICK_DESTINY), registry.state().getSelectedVideo());

        registry.setChatSelected(TWITCH_DESTINY, true);
        registry.toggleGroup(group);

        assertTrue(registry.state().getSelectedVideo().isEmpty());
        assertTrue(registry.state().getSelectedChat().isEmpty());
    }

    @Test
    void activateRestoresPinsAndGhosts() {
        CanonicalKey pinnedKey = CanonicalKey.of("twitch", "pinned");
        CanonicalKey remembered = CanonicalKey.of("kick", "remembered");
        CanonicalKey forgotten = CanonicalKey.of("kick", "forgotten");
        store.pinned = new ArrayList<>(Collections.singletonList(EmbedRecord.of(pinnedKey, "Pinned")));
        store.selection = new SelectionSnapshot(Arrays.asList(pinnedKey, forgotten),
                Collections.singletonList(remembered), Collections.singletonList(EmbedRecord.of(remembered, "Known")));

        registry = new LiveEmbedRegistry(store, Collections.<String>emptyList());
        registry.activate();

        RegistryState state = registry.state();
        assertEquals(Collections.singleton(pinnedKey), state.getSelectedVideo());
        assertEquals(Collections.singleton(remembered), state.getSelectedChat());
        assertFalse(state.isGhost(pinnedKey));
        assertTrue(state.isGhost(remembered));
        assertFalse(state.isResolvable(forgotten));
    }

    @Test
    void selectionIsPersistedWithKnownRecords() {
        registry.submit(SourceEvent.realtimeBatch(Collections.singletonList(EmbedRecord.of(KICK_DESTINY, "Destiny"))));

        registry.setVideoSelected(KICK_DESTINY, true);

        assertEquals(1, store.selectionWrites);
        assertEquals(Collections.singletonList(KICK_DESTINY), store.selection.getVideo());
        assertEquals(KICK_DESTINY, store.selection.getKnown().get(0).getKey());
    }

    @Test
    void removingStreamerDropsItsPollRecords() {
        BookmarkedStreamer streamer = streamer("Destiny", false);
        registry.setStreamers(Collections.singletonList(streamer));
        registry.submit(SourceEvent.poll(Platform.KICK, streamer.getId(),
                LivenessResult.live(EmbedRecord.of(KICK_DESTINY, "Live"))));

        registry.setStreamers(Collections.<BookmarkedStreamer>emptyList());

        assertTrue(registry.state().getPollRecords().isEmpty());
        assertFalse(registry.state().isResolvable(KICK_DESTINY));
        assertTrue(store.streamers.isEmpty());
    }

    @Test
    void lateResultForRemovedStreamerIsIgnored() {
        BookmarkedStreamer streamer = streamer("Destiny", false);
        registry.setStreamers(Collections.singletonList(streamer));
        registry.setStreamers(Collections.<BookmarkedStreamer>emptyList());
        RegistryState before = registry.state();

        registry.submit(SourceEvent.poll(Platform.KICK, streamer.getId(), "destiny",
                LivenessResult.live(EmbedRecord.of(KICK_DESTINY, "Live"))));

        assertSame(before, registry.state());
        assertFalse(registry.state().isResolvable(KICK_DESTINY));
        assertTrue(registry.state().getPollRecords().isEmpty());
    }

    @Test
    void lateResultForReplacedIdentifierIsIgnored() {
        BookmarkedStreamer streamer = streamer("Destiny", false);
        registry.setStreamers(Collections.singletonList(streamer));
        registry.setStreamers(Collections.singletonList(new BookmarkedStreamer(streamer.getId(), "Destiny",
                Collections.singletonMap(Platform.KICK, "other"), null, null, false, false)));

        registry.submit(SourceEvent.poll(Platform.KICK, streamer.getId(), "destiny",
                LivenessResult.live(EmbedRecord.of(KICK_DESTINY, "Live"))));
        assertFalse(registry.state().isResolvable(KICK_DESTINY));

        CanonicalKey other = CanonicalKey.of(Platform.KICK, "other");
        registry.submit(SourceEvent.poll(Platform.KICK, streamer.getId(), "other",
                LivenessResult.live(EmbedRecord.of(other, "Live"))));
        assertTrue(registry.state().isResolvable(other));
    }

    @Test
    void addedStreamerIsAppendedAndPersisted() {
        BookmarkedStreamer first = streamer("First", false);
        registry.setStreamers(Collections.singletonList(first));
        BookmarkedStreamer linked = StreamerLinkParser.parse("omnichat://add-streamer?nickname=Linked&twitch=Linked");

        registry.addStreamer(linked);

        assertEquals(Arrays.asList(first, linked), registry.streamers());
        assertEquals(Arrays.asList(first, linked), store.streamers);
    }

    @Test
    void unpinRemovesPinnedRecord() {
        registry.pin(EmbedRecord.of(KICK_DESTINY, "Pinned"));
        assertTrue(registry.state().getPinnedManual().contains(KICK_DESTINY));

        registry.unpin(KICK_DESTINY);

        assertFalse(registry.state().isResolvable(KICK_DESTINY));
        assertTrue(store.pinned.isEmpty());
    }

    @Test
    void failingListenerDoesNotStopCommit() {
        List<Long> cycles = new ArrayList<>();
        registry.addListener((previous, current) -> {
            throw new IllegalStateException("boom");
        });
        registry.addListener((previous, current) -> cycles.add(current.getCycle()));

        registry.submit(SourceEvent.realtimeBatch(Collections.singletonList(EmbedRecord.of(KICK_DESTINY, "D"))));

        assertTrue(registry.state().isResolvable(KICK_DESTINY));
        assertEquals(1, cycles.size());
    }

    private static BookmarkedStreamer streamer(String nickname, boolean autoOpen) {
        return BookmarkedStreamer.create(nickname, Collections.singletonMap(Platform.KICK, "destiny"))
                .withAutoOpenWhenLive(autoOpen);
    }
}
