package me.tavon.omnidock.driver;

import me.tavon.omnidock.channel.CanonicalKey;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TwitchDriverTest {

    @Test
    void livePageBecomesRecord() {
        String html = "<html><head><meta property=\"og:title\" content=\"destiny - Twitch\"></head>"
                + "<script>{\"@type\":\"VideoObject\",\"publication\":{\"isLiveBroadcast\":true,\"isLive\":true}}</script>";

        LivenessResult result = TwitchDriver.parseChannelPage("destiny", html);

        assertTrue(result.isLive());
        assertEquals(CanonicalKey.of("twitch", "destiny"), result.getRecord().getKey());
        assertEquals("destiny - Twitch", result.getRecord().getTitle());
    }

    @Test
    void offlinePageIsOffline() {
        LivenessResult result = TwitchDriver.parseChannelPage("destiny",
                "<html><meta property=\"og:title\" content=\"destiny - Twitch\"></html>");

        assertFalse(result.isLive());
        assertFalse(result.isFailed());
    }
}
