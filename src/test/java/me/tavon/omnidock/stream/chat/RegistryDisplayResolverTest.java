package me.tavon.omnidock.stream.chat;

import me.tavon.omnidock.channel.BookmarkedStreamer;
import me.tavon.omnidock.channel.CanonicalKey;
import me.tavon.omnidock.channel.EmbedRecord;
import me.tavon.omnidock.channel.Platform;
import me.tavon.omnidock.registry.LiveEmbedRegistry;
import me.tavon.omnidock.registry.SourceEvent;
import me.tavon.omnidock.store.InMemoryPreferenceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RegistryDisplayResolverTest {

    private static final CanonicalKey KICK = CanonicalKey.of("kick", "destiny");
    private static final CanonicalKey TWITCH = CanonicalKey.of("twitch", "destiny");

    private LiveEmbedRegistry registry;
    private RegistryDisplayResolver resolver;

    @BeforeEach
    void setUp() {
        registry = new LiveEmbedRegistry(new InMemoryPreferenceStore(), Collections.<String>emptyList());
        resolver = new RegistryDisplayResolver(registry, "dgg");
    }

    @Test
    void primaryChatUsesConfiguredName() {
        DisplayAttributes display = resolver.resolve(CanonicalKey.PRIMARY_CHAT);

        assertEquals("dgg", display.getLabel());
        assertEquals(SourceColors.PRIMARY_COLOR, display.getColor());
        assertFalse(display.isLabelHidden());
    }

    @Test
    void bookmarkedStreamerUsesNicknameAndColors() {
        Map<Platform, String> ids = new EnumMap<>(Platform.class);
        ids.put(Platform.KICK, "destiny");
        ids.put(Platform.TWITCH, "destiny");
        Map<Platform, String> colors = new EnumMap<>(Platform.class);
        colors.put(Platform.KICK, "#00ff00");
        registry.setStreamers(Collections.singletonList(BookmarkedStreamer.create("Steven", ids)
                .withColors(colors, "#ff0000").withHideLabel(true)));
        registry.submit(SourceEvent.realtimeBatch(Arrays.asList(EmbedRecord.of(KICK, "Kick title"),
                EmbedRecord.of(TWITCH, "Twitch title"))));

        DisplayAttributes kick = resolver.resolve(KICK);
        DisplayAttributes twitch = resolver.resolve(TWITCH);

        assertEquals("Steven", kick.getLabel());
        assertEquals("#00ff00", kick.getColor());
        assertTrue(kick.isLabelHidden());
        assertEquals("#ff0000", twitch.getColor());
    }

    @Test
    void unbookmarkedEmbedUsesTitleOrId() {
        CanonicalKey untitled = CanonicalKey.of("twitch", "someone");
        registry.submit(SourceEvent.realtimeBatch(Arrays.asList(EmbedRecord.of(KICK, "Kick title"),
                EmbedRecord.of(untitled, null))));

        assertEquals("Kick title", resolver.resolve(KICK).getLabel());
        assertEquals("someone", resolver.resolve(untitled).getLabel());
        assertEquals(SourceColors.forKey(untitled), resolver.resolve(untitled).getColor());
        assertEquals("gone", resolver.resolve(CanonicalKey.of("kick", "gone")).getLabel());
    }
}
