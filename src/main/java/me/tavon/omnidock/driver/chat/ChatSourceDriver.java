package me.tavon.omnidock.driver.chat;

import me.tavon.omnidock.OmniDock;
import me.tavon.omnidock.channel.CanonicalKey;
import me.tavon.omnidock.stream.chat.ChatEvent;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Delivers the chat of subscribed keys to a {@link ChatSink}. Subscribing twice or unsubscribing a key
 * that is not subscribed does nothing, so callers can replay selection changes freely.
 */
public abstract class ChatSourceDriver {

    ChatSink sink;
    private final Set<CanonicalKey> subscriptions = ConcurrentHashMap.newKeySet();

    public ChatSourceDriver(ChatSink sink) {
        this.sink = sink;
    }

    /**
     * The key prefix of the chats this driver serves.
     */
    public abstract String getSourceName();

    public void subscribe(CanonicalKey key) {
        if (!subscriptions.add(key)) {
            return;
        }

        try {
            onSubscribe(key);
            OmniDock.LOGGER.info("Subscribed to chat of " + key);
        } catch (Exception e) {
            subscriptions.remove(key);
            OmniDock.LOGGER.warning("Could not subscribe to chat of " + key + ": " + e.getMessage());
        }
    }

    public void unsubscribe(CanonicalKey key) {
        if (!subscriptions.remove(key)) {
            return;
        }

        try {
            onUnsubscribe(key);
            OmniDock.LOGGER.info("Unsubscribed from chat of " + key);
        } catch (Exception e) {
            OmniDock.LOGGER.warning("Could not unsubscribe from chat of " + key + ": " + e.getMessage());
        }
    }

    public Set<CanonicalKey> getSubscriptions() {
        return Collections.unmodifiableSet(new HashSet<>(subscriptions));
    }

    public boolean isSubscribed(CanonicalKey key) {
        return subscriptions.contains(key);
    }

    public abstract void shutdown();

    void deliver(ChatEvent event) {
        if (!subscriptions.contains(event.getChannelKey())) {
            return;
        }

        try {
            sink.accept(event);
        } catch (RuntimeException e) {
            OmniDock.LOGGER.warning("Could not deliver chat message from " + event.getChannelKey() + ": "
                    + e.getMessage());
        }
    }

    abstract void onSubscribe(CanonicalKey key) throws Exception;

    abstract void onUnsubscribe(CanonicalKey key) throws Exception;
}
