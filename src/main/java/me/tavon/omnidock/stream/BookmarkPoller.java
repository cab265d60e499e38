package me.tavon.omnidock.stream;

import me.tavon.omnidock.OmniDock;
import me.tavon.omnidock.channel.BookmarkedStreamer;
import me.tavon.omnidock.channel.Platform;
import me.tavon.omnidock.config.OmniDockConfig;
import me.tavon.omnidock.driver.LivenessDriver;
import me.tavon.omnidock.driver.LivenessResult;
import me.tavon.omnidock.registry.LiveEmbedRegistry;
import me.tavon.omnidock.registry.PollSlot;
import me.tavon.omnidock.registry.RegistryListener;
import me.tavon.omnidock.registry.RegistryState;
import me.tavon.omnidock.registry.SourceEvent;

import java.util.*;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Polls every bookmarked streamer on every platform it has an id for. Each (streamer, platform) pair
 * has its own fixed-delay timer; the scheduler only keeps time and hands each check to a separate
 * worker pool, so a hung check never holds up another pair's timer. A pair whose previous check is
 * still running skips that tick.
 */
public class BookmarkPoller implements RegistryListener {

    private final LiveEmbedRegistry registry;
    private final Map<Platform, LivenessDriver> drivers = new EnumMap<>(Platform.class);
    private final OmniDockConfig config;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService checks;
    private final Map<PollSlot, Scheduled> tasks = new HashMap<>();

    private boolean running;

    public BookmarkPoller(LiveEmbedRegistry registry, Collection<LivenessDriver> drivers, OmniDockConfig config) {
        this(registry, drivers, config, Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, "BookmarkPoller")),
                Executors.newCachedThreadPool(r -> new Thread(r, "BookmarkPoller-check")));
    }

    BookmarkPoller(LiveEmbedRegistry registry, Collection<LivenessDriver> drivers, OmniDockConfig config,
                   ScheduledExecutorService scheduler, ExecutorService checks) {
        this.registry = registry;
        this.config = config;
        this.scheduler = scheduler;
        this.checks = checks;

        for (LivenessDriver driver : drivers) {
            this.drivers.put(driver.getPlatform(), driver);
        }
    }

    public synchronized void start() {
        running = true;
        registry.addListener(this);
        reconcile(registry.streamers());
    }

    public synchronized void shutdown() {
        running = false;
        registry.removeListener(this);

        for (Scheduled scheduled : tasks.values()) {
            scheduled.future.cancel(false);
        }

        tasks.clear();
        scheduler.shutdownNow();
        checks.shutdownNow();
    }

    @Override
    public void onRegistryChanged(RegistryState previous, RegistryState current) {
        if (!previous.getStreamers().equals(current.getStreamers())) {
            reconcile(current.getStreamers());
        }
    }

    /**
     * Cancels tasks of pairs that are gone or whose id changed, schedules new pairs and leaves the rest
     * running.
     */
    public synchronized void reconcile(List<BookmarkedStreamer> streamers) {
        if (!running) {
            return;
        }

        Map<PollSlot, String> wanted = new LinkedHashMap<>();

        for (BookmarkedStreamer streamer : streamers) {
            for (Map.Entry<Platform, String> entry : streamer.getPlatformIds().entrySet()) {
                String id = entry.getValue() == null ? null : entry.getValue().trim();

                if (id == null || id.isEmpty()) {
                    continue;
                }

                if (!drivers.containsKey(entry.getKey())) {
                    OmniDock.LOGGER.fine("No liveness driver for " + entry.getKey() + ", not polling "
                            + streamer.getNickname());
                    continue;
                }

                wanted.put(new PollSlot(entry.getKey(), streamer.getId()), id);
            }
        }

        Iterator<Map.Entry<PollSlot, Scheduled>> iterator = tasks.entrySet().iterator();

        while (iterator.hasNext()) {
            Map.Entry<PollSlot, Scheduled> entry = iterator.next();
            String id = wanted.get(entry.getKey());

            if (id == null || !id.equals(entry.getValue().identifier)) {
                entry.getValue().future.cancel(false);
                iterator.remove();
            }
        }

        for (Map.Entry<PollSlot, String> entry : wanted.entrySet()) {
            if (tasks.containsKey(entry.getKey())) {
                continue;
            }

            PollSlot slot = entry.getKey();
            String identifier = entry.getValue();
            long interval = config.getPollInterval(slot.getPlatform());

            AtomicBoolean inFlight = new AtomicBoolean();
            ScheduledFuture<?> future = scheduler.scheduleWithFixedDelay(
                    () -> dispatch(slot, identifier, inFlight), 0L, interval, TimeUnit.MILLISECONDS);
            tasks.put(slot, new Scheduled(identifier, future));
        }

        OmniDock.LOGGER.fine("Polling " + tasks.size() + " streamer/platform pair(s)");
    }

    synchronized Set<PollSlot> getScheduledSlots() {
        return new HashSet<>(tasks.keySet());
    }

    void dispatch(PollSlot slot, String identifier, AtomicBoolean inFlight) {
        if (!inFlight.compareAndSet(false, true)) {
            OmniDock.LOGGER.fine("Previous check of " + slot + " still running, skipping");
            return;
        }

        try {
            checks.execute(() -> {
                try {
                    pollOnce(slot, identifier);
                } finally {
                    inFlight.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.set(false);
            OmniDock.LOGGER.fine("Not checking " + slot + ", poller is shut down");
        }
    }

    /**
     * Runs one liveness check and submits its outcome. A thrown exception becomes a failed result so
     * the registry keeps the slot's previous record.
     */
    void pollOnce(PollSlot slot, String identifier) {
        LivenessDriver driver = drivers.get(slot.getPlatform());
        LivenessResult result;

        try {
            result = driver.checkLive(identifier);

            if (result == null) {
                result = LivenessResult.failed("no result");
            }
        } catch (Exception e) {
            OmniDock.LOGGER.warning("Could not check if " + identifier + " on " + slot.getPlatform().getDisplayName()
                    + " is live: " + e.getMessage());
            result = LivenessResult.failed(e.getMessage());
        }

        try {
            registry.submit(SourceEvent.poll(slot.getPlatform(), slot.getStreamerId(), identifier, result));
        } catch (RuntimeException e) {
            OmniDock.LOGGER.warning("Could not apply poll of " + slot + ": " + e.getMessage());
        }
    }

    private static final class Scheduled {

        private final String identifier;
        private final ScheduledFuture<?> future;

        Scheduled(String identifier, ScheduledFuture<?> future) {
            this.identifier = identifier;
            this.future = future;
        }
    }
}
