package me.tavon.omnidock.driver.chat;

import me.tavon.omnidock.channel.CanonicalKey;
import me.tavon.omnidock.stream.chat.ChatEvent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PrimaryChatDriverTest {

    @Test
    void parsesMessageFrame() {
        List<ChatEvent> events = PrimaryChatDriver.parseFrame(
                "MSG {\"nick\":\"Bob\",\"features\":[],\"timestamp\":1700000000000,\"data\":\"hello chat\"}");

        assertEquals(1, events.size());
        assertEquals(CanonicalKey.PRIMARY_CHAT, events.get(0).getChannelKey());
        assertEquals("Bob", events.get(0).getAuthor());
        assertEquals("hello chat", events.get(0).getText());
        assertEquals(Long.valueOf(1700000000000L), events.get(0).getSourceTimestamp());
        assertFalse(events.get(0).isHistory());
    }

    @Test
    void historyFrameKeepsOnlyMessages() {
        List<ChatEvent> events = PrimaryChatDriver.parseFrame("HISTORY ["
                + "\"MSG {\\\"nick\\\":\\\"a\\\",\\\"data\\\":\\\"one\\\"}\","
                + "\"JOIN {\\\"nick\\\":\\\"b\\\"}\","
                + "\"MSG {\\\"nick\\\":\\\"c\\\",\\\"data\\\":\\\"two\\\"}\"]");

        assertEquals(2, events.size());
        assertEquals("one", events.get(0).getText());
        assertEquals("two", events.get(1).getText());
        assertTrue(events.get(0).isHistory());
    }

    @Test
    void ignoresOtherFrames() {
        assertTrue(PrimaryChatDriver.parseFrame("NAMES {\"users\":[]}").isEmpty());
        assertTrue(PrimaryChatDriver.parseFrame("MSG {\"nick\":\"a\"}").isEmpty());
        assertTrue(PrimaryChatDriver.parseFrame("MSG not json").isEmpty());
    }
}
