package me.tavon.omnidock.registry;

import com.google.common.base.Joiner;
import me.tavon.omnidock.channel.BookmarkedStreamer;
import me.tavon.omnidock.channel.CanonicalKey;
import me.tavon.omnidock.channel.EmbedRecord;

import java.util.*;

/**
 * Builds the dock: one entry per distinct set of keys resolved to bookmarked streamers, then every
 * unclaimed key on its own.
 */
public final class DockGrouper {

    private static final Joiner LABEL_JOINER = Joiner.on(" / ");

    private DockGrouper() {
    }

    public static List<DockGroup> group(RegistryState state) {
        Map<List<CanonicalKey>, List<BookmarkedStreamer>> byKeySet = new LinkedHashMap<>();
        Set<CanonicalKey> claimed = new HashSet<>();

        for (BookmarkedStreamer streamer : state.getStreamers()) {
            List<CanonicalKey> keys = state.resolveStreamerKeys(streamer);

            if (keys.isEmpty()) {
                continue;
            }

            byKeySet.computeIfAbsent(keys, k -> new ArrayList<>()).add(streamer);
            claimed.addAll(keys);
        }

        List<DockGroup> groups = new ArrayList<>();

        for (Map.Entry<List<CanonicalKey>, List<BookmarkedStreamer>> entry : byKeySet.entrySet()) {
            List<String> nicknames = new ArrayList<>();

            for (BookmarkedStreamer streamer : entry.getValue()) {
                nicknames.add(streamer.getNickname());
            }

            groups.add(new DockGroup(LABEL_JOINER.join(nicknames), entry.getKey(), entry.getValue(),
                    totalViewers(state, entry.getKey())));
        }

        List<DockGroup> standalone = new ArrayList<>();

        for (Map.Entry<CanonicalKey, EmbedRecord> entry : state.getAvailable().entrySet()) {
            if (claimed.contains(entry.getKey())) {
                continue;
            }

            standalone.add(new DockGroup(entry.getValue().getDisplayTitle(),
                    Collections.singletonList(entry.getKey()), Collections.<BookmarkedStreamer>emptyList(),
                    entry.getValue().getViewersOrZero()));
        }

        standalone.sort(Comparator.comparingLong(DockGroup::getViewers).reversed()
                .thenComparing(group -> group.getKeys().get(0)));
        groups.addAll(standalone);

        return groups;
    }

    /**
     * First key whose platform comes earliest in the preferred order; the first key when none match.
     */
    public static CanonicalKey preferredKey(List<CanonicalKey> keys, List<String> preferredPlatforms) {
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("no keys to choose from");
        }

        if (preferredPlatforms != null) {
            for (String platform : preferredPlatforms) {
                for (CanonicalKey key : keys) {
                    if (key.getPlatformName().equalsIgnoreCase(platform.trim())) {
                        return key;
                    }
                }
            }
        }

        return keys.get(0);
    }

    private static long totalViewers(RegistryState state, List<CanonicalKey> keys) {
        long total = 0L;

        for (CanonicalKey key : keys) {
            EmbedRecord record = state.resolve(key);

            if (record != null) {
                total += record.getViewersOrZero();
            }
        }

        return total;
    }
}
