package me.tavon.omnidock.driver.chat;

import me.tavon.omnidock.channel.CanonicalKey;
import me.tavon.omnidock.stream.chat.ChatEvent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChatSourceDriverTest {

    private static final CanonicalKey KEY = CanonicalKey.of("test", "channel");

    @Test
    void subscribeAndUnsubscribeAreIdempotent() {
        List<ChatEvent> received = new ArrayList<>();
        RecordingDriver driver = new RecordingDriver(received::add);

        driver.subscribe(KEY);
        driver.subscribe(KEY);
        driver.unsubscribe(KEY);
        driver.unsubscribe(KEY);

        assertEquals(1, driver.subscribed);
        assertEquals(1, driver.unsubscribed);
    }

    @Test
    void failedSubscribeIsRolledBack() {
        RecordingDriver driver = new RecordingDriver(event -> {
        });
        CanonicalKey broken = CanonicalKey.of("test", "broken");

        driver.subscribe(broken);

        assertFalse(driver.isSubscribed(broken));
    }

    @Test
    void deliversOnlySubscribedKeys() {
        List<ChatEvent> received = new ArrayList<>();
        RecordingDriver driver = new RecordingDriver(received::add);
        driver.subscribe(KEY);

        driver.deliver(ChatEvent.of(KEY, "a", "kept", null));
        driver.deliver(ChatEvent.of(CanonicalKey.of("test", "other"), "b", "dropped", null));
        driver.unsubscribe(KEY);
        driver.deliver(ChatEvent.of(KEY, "a", "late", null));

        assertEquals(1, received.size());
        assertEquals("kept", received.get(0).getText());
    }

    private static final class RecordingDriver extends ChatSourceDriver {

        private int subscribed;
        private int unsubscribed;

        RecordingDriver(ChatSink sink) {
            super(sink);
        }

        @Override
        public String getSourceName() {
            return "test";
        }

        @Override
        void onSubscribe(CanonicalKey key) throws Exception {
            if ("broken".equals(key.getId())) {
                throw new Exception("no such channel");
            }

            subscribed++;
        }

        @Override
        void onUnsubscribe(CanonicalKey key) {
            unsubscribed++;
        }

        @Override
        public void shutdown() {
        }
    }
}
