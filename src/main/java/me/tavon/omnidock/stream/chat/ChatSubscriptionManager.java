package me.tavon.omnidock.stream.chat;

import me.tavon.omnidock.OmniDock;
import me.tavon.omnidock.channel.CanonicalKey;
import me.tavon.omnidock.driver.chat.ChatSourceDriver;
import me.tavon.omnidock.registry.RegistryListener;
import me.tavon.omnidock.registry.RegistryState;

import java.util.*;

/**
 * Keeps chat driver subscriptions equal to the registry's chat selection. Only the difference between
 * the last applied selection and the new one is sent to the drivers.
 */
public class ChatSubscriptionManager implements RegistryListener {

    private final Map<String, ChatSourceDriver> drivers = new HashMap<>();
    private final Set<CanonicalKey> subscribed = new LinkedHashSet<>();

    public ChatSubscriptionManager(Collection<? extends ChatSourceDriver> drivers) {
        for (ChatSourceDriver driver : drivers) {
            this.drivers.put(driver.getSourceName(), driver);
        }
    }

    @Override
    public void onRegistryChanged(RegistryState previous, RegistryState current) {
        if (!previous.getSelectedChat().equals(current.getSelectedChat())) {
            sync(current.getSelectedChat());
        }
    }

    public synchronized void sync(Set<CanonicalKey> selectedChat) {
        Iterator<CanonicalKey> iterator = subscribed.iterator();

        while (iterator.hasNext()) {
            CanonicalKey key = iterator.next();

            if (!selectedChat.contains(key)) {
                iterator.remove();
                drivers.get(key.getPlatformName()).unsubscribe(key);
            }
        }

        for (CanonicalKey key : selectedChat) {
            if (subscribed.contains(key)) {
                continue;
            }

            ChatSourceDriver driver = drivers.get(key.getPlatformName());

            if (driver == null) {
                OmniDock.LOGGER.fine("No chat driver for " + key + ", skipping");
                continue;
            }

            subscribed.add(key);
            driver.subscribe(key);
        }
    }

    public synchronized void unsubscribeAll() {
        sync(Collections.<CanonicalKey>emptySet());
    }

    public synchronized Set<CanonicalKey> getSubscribed() {
        return new LinkedHashSet<>(subscribed);
    }
}
