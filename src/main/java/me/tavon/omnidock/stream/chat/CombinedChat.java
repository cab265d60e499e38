package me.tavon.omnidock.stream.chat;

import me.tavon.omnidock.OmniDock;
import me.tavon.omnidock.channel.CanonicalKey;
import me.tavon.omnidock.driver.chat.ChatSink;
import me.tavon.omnidock.driver.chat.ChatSourceDriver;
import me.tavon.omnidock.registry.LiveEmbedRegistry;
import me.tavon.omnidock.store.PreferenceStore;

import java.io.IOException;
import java.util.function.Function;

/**
 * The combined chat view. While active it owns a {@link ChatAggregator} fed by the primary source and
 * by every chat-selected key; deactivating drops all subscriptions and the buffered messages. The
 * registry is left untouched either way.
 */
public class CombinedChat implements ChatSink {

    private final LiveEmbedRegistry registry;
    private final PreferenceStore store;
    private final DisplayResolver displayResolver;
    private final ChatSourceDriver primaryDriver;
    private final ChatSubscriptionManager subscriptions;

    private volatile ChatAggregator aggregator;

    public CombinedChat(LiveEmbedRegistry registry, PreferenceStore store, DisplayResolver displayResolver,
                        ChatSourceDriver primaryDriver, ChatSubscriptionManager subscriptions) {
        this.registry = registry;
        this.store = store;
        this.displayResolver = displayResolver;
        this.primaryDriver = primaryDriver;
        this.subscriptions = subscriptions;
    }

    public synchronized void activate() {
        if (aggregator != null) {
            return;
        }

        ChatSettings settings;

        try {
            settings = store.loadChatSettings();
        } catch (IOException e) {
            OmniDock.LOGGER.warning("Could not load chat settings, using defaults: " + e.getMessage());
            settings = ChatSettings.defaults();
        }

        aggregator = new ChatAggregator(settings, displayResolver);

        if (primaryDriver != null) {
            primaryDriver.subscribe(CanonicalKey.PRIMARY_CHAT);
        }

        registry.addListener(subscriptions);
        subscriptions.sync(registry.state().getSelectedChat());

        OmniDock.LOGGER.info("Combined chat active with " + aggregator.getSettings());
    }

    public synchronized void deactivate() {
        if (aggregator == null) {
            return;
        }

        registry.removeListener(subscriptions);
        subscriptions.unsubscribeAll();

        if (primaryDriver != null) {
            primaryDriver.unsubscribe(CanonicalKey.PRIMARY_CHAT);
        }

        aggregator = null;
        OmniDock.LOGGER.info("Combined chat closed");
    }

    public boolean isActive() {
        return aggregator != null;
    }

    @Override
    public void accept(ChatEvent event) {
        ChatAggregator current = aggregator;

        if (current != null) {
            current.ingest(event);
        }
    }

    public ChatSnapshot snapshot(boolean pinnedToBottom) {
        return requireActive().snapshot(pinnedToBottom);
    }

    public ChatSettings setCaps(int visibleCap, int scrollCap) {
        return update(a -> a.setCaps(visibleCap, scrollCap));
    }

    public ChatSettings setSortMode(SortMode sortMode) {
        return update(a -> a.setSortMode(sortMode));
    }

    public ChatSettings addHighlightTerm(String term) {
        return update(a -> a.addHighlightTerm(term));
    }

    public ChatSettings removeHighlightTerm(String term) {
        return update(a -> a.removeHighlightTerm(term));
    }

    private ChatSettings update(Function<ChatAggregator, ChatSettings> change) {
        ChatSettings settings = change.apply(requireActive());

        try {
            store.saveChatSettings(settings);
        } catch (IOException e) {
            OmniDock.LOGGER.warning("Could not save chat settings: " + e.getMessage());
        }

        return settings;
    }

    private ChatAggregator requireActive() {
        ChatAggregator current = aggregator;

        if (current == null) {
            throw new IllegalStateException("combined chat is not active");
        }

        return current;
    }
}
