package me.tavon.omnidock.channel;

import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalKeyTest {

    @Test
    void lowerCasesCaseInsensitivePlatforms() {
        CanonicalKey key = CanonicalKey.of("Kick", "Destiny");

        assertEquals("kick:destiny", key.toString());
        assertEquals(Platform.KICK, key.getPlatform());
        assertSame(key, key.legacyForm());
    }

    @Test
    void keepsYoutubeIdCase() {
        CanonicalKey key = CanonicalKey.of("YOUTUBE", "AbC_123");

        assertEquals("youtube:AbC_123", key.toString());
        assertEquals(CanonicalKey.of("youtube", "abc_123"), key.legacyForm());
        assertNotEquals(key.legacyForm(), key);
    }

    @Test
    void casingDoesNotDependOnDefaultLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));

        try {
            CanonicalKey key = CanonicalKey.of("TWITCH", "LIRIK");

            assertEquals("twitch:lirik", key.toString());
            assertEquals(Platform.TWITCH, key.getPlatform());
            assertEquals(CanonicalKey.of("youtube", "iiiiiiiiiii"), CanonicalKey.of("youtube", "IIIIIIIIIII").legacyForm());
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    void acceptsUnknownPlatforms() {
        CanonicalKey key = CanonicalKey.of("Rumble", "SomeStream");

        assertEquals("rumble:somestream", key.toString());
        assertNull(key.getPlatform());
    }

    @Test
    void parseKeepsColonsInTheId() {
        CanonicalKey key = CanonicalKey.parse("facebook:page:123");

        assertEquals("facebook", key.getPlatformName());
        assertEquals("page:123", key.getId());
        assertEquals(key, CanonicalKey.parse(key.toString()));
    }

    @Test
    void parseRejectsMalformedKeys() {
        assertThrows(IllegalArgumentException.class, () -> CanonicalKey.parse("nocolon"));
        assertThrows(IllegalArgumentException.class, () -> CanonicalKey.parse(":id"));
        assertThrows(IllegalArgumentException.class, () -> CanonicalKey.parse("kick:"));
        assertThrows(IllegalArgumentException.class, () -> CanonicalKey.of(" ", "id"));
    }

    @Test
    void streamerDirectKeysSkipEphemeralPlatforms() {
        Map<Platform, String> ids = new EnumMap<>(Platform.class);
        ids.put(Platform.KICK, " Destiny ");
        ids.put(Platform.TWITCH, "");
        ids.put(Platform.YOUTUBE, "UCabc");

        BookmarkedStreamer streamer = BookmarkedStreamer.create("Destiny", ids);

        assertEquals(1, streamer.getDirectKeys().size());
        assertTrue(streamer.getDirectKeys().contains(CanonicalKey.of(Platform.KICK, "destiny")));
    }
}
