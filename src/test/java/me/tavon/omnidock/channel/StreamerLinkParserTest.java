package me.tavon.omnidock.channel;

import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class StreamerLinkParserTest {

    @Test
    void buildsStreamerFromAddStreamerLink() {
        BookmarkedStreamer streamer = StreamerLinkParser.parse("omnichat://add-streamer?nickname=Steven+B"
                + "&kick=Destiny&twitch=DESTINY&youtube=UCabcDEF&color=%23FF0000&kickColor=%2300ff00"
                + "&twitchColor=red&hideLabel=1");

        assertEquals("Steven B", streamer.getNickname());
        assertEquals("destiny", streamer.getPlatformId(Platform.KICK));
        assertEquals("destiny", streamer.getPlatformId(Platform.TWITCH));
        assertEquals("UCabcDEF", streamer.getPlatformId(Platform.YOUTUBE));
        assertEquals("#FF0000", streamer.getMasterColor());
        assertEquals("#00ff00", streamer.getPlatformColor(Platform.KICK));
        assertNull(streamer.getPlatformColor(Platform.TWITCH));
        assertTrue(streamer.isAutoOpenWhenLive());
        assertTrue(streamer.isHideLabel());
        assertNotNull(streamer.getId());
    }

    @Test
    void openWhenLiveCanBeTurnedOff() {
        assertFalse(StreamerLinkParser.parse("omnichat://add-streamer?kick=destiny&openWhenLive=0")
                .isAutoOpenWhenLive());
        assertFalse(StreamerLinkParser.parse("omnichat:bookmark?kick=destiny&openWhenLive=no")
                .isAutoOpenWhenLive());
    }

    @Test
    void defaultsNicknameAndAcceptsAliases() {
        BookmarkedStreamer streamer = StreamerLinkParser.parse("OMNICHAT://bookmark/?twitchLogin=Lirik");

        assertEquals("Unnamed", streamer.getNickname());
        assertEquals(Collections.singletonMap(Platform.TWITCH, "lirik"), streamer.getPlatformIds());
        assertFalse(streamer.isHideLabel());
        assertNull(streamer.getMasterColor());
    }

    @Test
    void stripsTrailingMarkupFromValues() {
        BookmarkedStreamer streamer = StreamerLinkParser.parse("omnichat://add-streamer?kick=destiny)]");

        assertEquals("destiny", streamer.getPlatformId(Platform.KICK));
    }

    @Test
    void rejectsLinkWithoutPlatform() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> StreamerLinkParser.parse("omnichat://add-streamer?nickname=Nobody&kick=%20"));
        assertTrue(e.getMessage().contains("At least one platform"));
    }

    @Test
    void rejectsOtherOperationsAndSchemes() {
        assertThrows(IllegalArgumentException.class,
                () -> StreamerLinkParser.parse("omnichat://install?url=https://example.com/manifest.json"));
        assertThrows(IllegalArgumentException.class, () -> StreamerLinkParser.parse("omnichat://"));
        assertThrows(IllegalArgumentException.class,
                () -> StreamerLinkParser.parse("https://kick.com/destiny"));
        assertFalse(StreamerLinkParser.isLink(null));
    }
}
