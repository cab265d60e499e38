package me.tavon.omnidock.stream.chat;

import me.tavon.omnidock.channel.CanonicalKey;
import me.tavon.omnidock.channel.EmbedRecord;
import me.tavon.omnidock.driver.chat.ChatSourceDriver;
import me.tavon.omnidock.registry.LiveEmbedRegistry;
import me.tavon.omnidock.registry.SourceEvent;
import me.tavon.omnidock.store.InMemoryPreferenceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class CombinedChatTest {

    private static final CanonicalKey KICK = CanonicalKey.of("kick", "destiny");

    private InMemoryPreferenceStore store;
    private LiveEmbedRegistry registry;
    private ChatSourceDriver primaryDriver;
    private ChatSourceDriver kickDriver;
    private CombinedChat chat;

    @BeforeEach
    void setUp() {
        store = new InMemoryPreferenceStore();
        registry = new LiveEmbedRegistry(store, Collections.<String>emptyList());
        registry.activate();
        primaryDriver = mock(ChatSourceDriver.class);
        kickDriver = mock(ChatSourceDriver.class);
        when(kickDriver.getSourceName()).thenReturn("kick");
        chat = new CombinedChat(registry, store, null, primaryDriver,
                new ChatSubscriptionManager(Collections.singletonList(kickDriver)));
    }

    @Test
    void followsChatSelectionWhileActive() {
        registry.submit(SourceEvent.realtimeBatch(Collections.singletonList(EmbedRecord.of(KICK, "Destiny"))));
        chat.activate();

        verify(primaryDriver).subscribe(CanonicalKey.PRIMARY_CHAT);

        registry.setChatSelected(KICK, true);
        verify(kickDriver).subscribe(KICK);

        chat.deactivate();

        verify(kickDriver).unsubscribe(KICK);
        verify(primaryDriver).unsubscribe(CanonicalKey.PRIMARY_CHAT);
        assertFalse(chat.isActive());
    }

    @Test
    void subscribesExistingSelectionOnActivate() {
        registry.submit(SourceEvent.realtimeBatch(Collections.singletonList(EmbedRecord.of(KICK, "Destiny"))));
        registry.setChatSelected(KICK, true);

        chat.activate();

        verify(kickDriver).subscribe(KICK);
    }

    @Test
    void settingsChangesArePersisted() {
        store.chatSettings = ChatSettings.defaults().withSortMode(SortMode.ARRIVAL);
        chat.activate();

        assertEquals(SortMode.ARRIVAL, chat.snapshot(true).getSortMode());

        chat.setCaps(100, 1000);
        chat.addHighlightTerm("Destiny");

        assertEquals(2, store.chatSettingsWrites);
        assertEquals(1000, store.chatSettings.getScrollCap());
        assertEquals(Collections.singletonList("destiny"), store.chatSettings.getHighlightTerms());
    }

    @Test
    void ingestsOnlyWhileActive() {
        chat.accept(ChatEvent.of(KICK, "a", "dropped", null));
        chat.activate();
        chat.accept(ChatEvent.of(KICK, "a", "kept", null));

        ChatSnapshot snapshot = chat.snapshot(true);

        assertEquals(1, snapshot.getLines().size());
        assertEquals("kept", snapshot.getLines().get(0).getMessage().getText());

        chat.deactivate();

        assertThrows(IllegalStateException.class, () -> chat.snapshot(true));
    }
}
