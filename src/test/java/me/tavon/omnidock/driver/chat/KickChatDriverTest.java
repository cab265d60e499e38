package me.tavon.omnidock.driver.chat;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import me.tavon.omnidock.channel.CanonicalKey;
import me.tavon.omnidock.stream.chat.ChatEvent;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KickChatDriverTest {

    private static final CanonicalKey KEY = CanonicalKey.of("kick", "destiny");

    @Test
    void readsChatroomIdFromEitherShape() throws Exception {
        assertEquals(668L, KickChatDriver.parseChatroomId("{\"id\":1,\"chatroom\":{\"id\":668}}"));
        assertEquals(42L, KickChatDriver.parseChatroomId("{\"data\":{\"chatroom_id\":42}}"));
        assertThrows(Exception.class, () -> KickChatDriver.parseChatroomId("{\"id\":1}"));
    }

    @Test
    void readsChatroomIdFromChannelName() {
        assertEquals(Long.valueOf(668L), KickChatDriver.chatroomIdFromChannel("chatrooms.668.v2"));
        assertEquals(Long.valueOf(668L), KickChatDriver.chatroomIdFromChannel("chatrooms.668"));
        assertNull(KickChatDriver.chatroomIdFromChannel("channel.668"));
        assertNull(KickChatDriver.chatroomIdFromChannel("chatrooms.abc.v2"));
    }

    @Test
    void parsesChatMessage() {
        ChatEvent event = KickChatDriver.parseChatMessage(KEY, "{\"id\":\"x\",\"content\":\"hello\","
                + "\"created_at\":\"2024-01-01T00:00:01+00:00\",\"sender\":{\"username\":\"Viewer\"}}");

        assertEquals(KEY, event.getChannelKey());
        assertEquals("Viewer", event.getAuthor());
        assertEquals("hello", event.getText());
        assertEquals(Long.valueOf(1704067201000L), event.getSourceTimestamp());
    }

    @Test
    void badTimestampIsIgnored() {
        ChatEvent event = KickChatDriver.parseChatMessage(KEY, "{\"content\":\"hi\",\"created_at\":\"yesterday\"}");

        assertEquals("unknown", event.getAuthor());
        assertNull(event.getSourceTimestamp());
        assertNull(KickChatDriver.parseChatMessage(KEY, "[]"));
    }

    @Test
    void subscribeCommandNamesChatroomChannel() {
        JsonObject command = new JsonParser().parse(KickChatDriver.pusherCommand("pusher:subscribe", 668L))
                .getAsJsonObject();

        assertEquals("pusher:subscribe", command.get("event").getAsString());
        assertEquals("chatrooms.668.v2", command.getAsJsonObject("data").get("channel").getAsString());
    }
}
