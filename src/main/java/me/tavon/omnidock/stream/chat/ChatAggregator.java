package me.tavon.omnidock.stream.chat;

import me.tavon.omnidock.channel.CanonicalKey;

import java.util.*;
import java.util.function.LongSupplier;

/**
 * Owner of the combined chat buffer. Ingestion only appends; ordering, highlighting and display
 * attributes are worked out when a snapshot is taken, so settings changes apply to buffered messages
 * too.
 */
public class ChatAggregator {

    private static final Comparator<ChatMessage> BY_SEQUENCE =
            Comparator.comparingLong(ChatMessage::getSequence);
    private static final Comparator<ChatMessage> BY_TIMESTAMP =
            Comparator.comparingLong(ChatMessage::getSortTimestamp).thenComparing(BY_SEQUENCE);

    private final Object lock = new Object();
    private final DisplayResolver displayResolver;
    private final LongSupplier clock;
    private final ChatLog log;

    private ChatSettings settings;
    private long nextSequence = 1L;

    public ChatAggregator(ChatSettings settings, DisplayResolver displayResolver) {
        this(settings, displayResolver, System::currentTimeMillis);
    }

    ChatAggregator(ChatSettings settings, DisplayResolver displayResolver, LongSupplier clock) {
        this.settings = settings == null ? ChatSettings.defaults() : normalize(settings);
        this.displayResolver = displayResolver;
        this.clock = clock;
        this.log = new ChatLog(this.settings.getScrollCap());
    }

    public ChatMessage ingest(ChatEvent event) {
        Objects.requireNonNull(event, "event cannot be null");

        synchronized (lock) {
            ChatMessage message = new ChatMessage(nextSequence++, clock.getAsLong(), event);
            log.append(message);
            return message;
        }
    }

    public ChatSnapshot snapshot(boolean pinnedToBottom) {
        ChatSettings current = getSettings();
        return snapshot(current.getSortMode(), current.getVisibleCap(), current.getScrollCap(), pinnedToBottom);
    }

    /**
     * Orders the newest {@code scrollCap} retained messages by {@code mode}. Pinned to the bottom, only
     * the last {@code visibleCap} of them are returned. Caps are clamped like stored settings are.
     */
    public ChatSnapshot snapshot(SortMode mode, int visibleCap, int scrollCap, boolean pinnedToBottom) {
        int clampedScroll = ChatSettings.clampScrollCap(scrollCap);
        int clampedVisible = ChatSettings.clampVisibleCap(visibleCap, clampedScroll);
        List<ChatMessage> window;
        List<String> terms;
        int retained;

        synchronized (lock) {
            window = log.newest(clampedScroll);
            terms = settings.getHighlightTerms();
            retained = log.size();
        }

        List<ChatMessage> ordered = new ArrayList<>(window);
        ordered.sort(mode == SortMode.ARRIVAL ? BY_SEQUENCE : BY_TIMESTAMP);

        if (pinnedToBottom && ordered.size() > clampedVisible) {
            ordered = ordered.subList(ordered.size() - clampedVisible, ordered.size());
        }

        Map<CanonicalKey, DisplayAttributes> displayCache = new HashMap<>();
        List<ChatLine> lines = new ArrayList<>(ordered.size());

        for (ChatMessage message : ordered) {
            DisplayAttributes display = displayCache.get(message.getChannelKey());

            if (display == null && displayResolver != null) {
                display = displayResolver.resolve(message.getChannelKey());
                displayCache.put(message.getChannelKey(), display);
            }

            lines.add(new ChatLine(message, matchHighlights(message.getText(), terms), display));
        }

        return new ChatSnapshot(lines, mode, retained, countPrimaryAuthors(window));
    }

    public ChatSettings getSettings() {
        synchronized (lock) {
            return settings;
        }
    }

    /**
     * Applies new caps, clamped, and trims the stored log to the new scroll cap right away.
     */
    public ChatSettings setCaps(int visibleCap, int scrollCap) {
        synchronized (lock) {
            settings = settings.withCaps(visibleCap, scrollCap);
            settings = settings.withCaps(settings.getVisibleCap(), settings.getScrollCap());
            log.setCapacity(settings.getScrollCap());
            return settings;
        }
    }

    public ChatSettings setSortMode(SortMode sortMode) {
        synchronized (lock) {
            settings = settings.withSortMode(sortMode);
            return settings;
        }
    }

    public ChatSettings addHighlightTerm(String term) {
        synchronized (lock) {
            List<String> terms = new ArrayList<>(settings.getHighlightTerms());
            terms.add(term);
            settings = settings.withHighlightTerms(normalizeTerms(terms));
            return settings;
        }
    }

    public ChatSettings removeHighlightTerm(String term) {
        synchronized (lock) {
            String normalized = term == null ? "" : term.trim().toLowerCase(Locale.ROOT);
            List<String> terms = new ArrayList<>(settings.getHighlightTerms());
            terms.remove(normalized);
            settings = settings.withHighlightTerms(terms);
            return settings;
        }
    }

    public int getRetainedCount() {
        synchronized (lock) {
            return log.size();
        }
    }

    /**
     * Terms found in the text, case-insensitively, in the order the terms are listed.
     */
    static List<String> matchHighlights(String text, List<String> terms) {
        if (terms.isEmpty() || text == null || text.isEmpty()) {
            return Collections.emptyList();
        }

        String lowered = text.toLowerCase(Locale.ROOT);
        List<String> matched = new ArrayList<>();

        for (String term : terms) {
            if (lowered.contains(term)) {
                matched.add(term);
            }
        }

        return matched;
    }

    static List<String> normalizeTerms(Collection<String> terms) {
        Set<String> normalized = new LinkedHashSet<>();

        if (terms != null) {
            for (String term : terms) {
                if (term == null || term.trim().isEmpty()) {
                    continue;
                }

                normalized.add(term.trim().toLowerCase(Locale.ROOT));
            }
        }

        return new ArrayList<>(normalized);
    }

    private static ChatSettings normalize(ChatSettings settings) {
        return settings.withCaps(settings.getVisibleCap(), settings.getScrollCap())
                .withSortMode(settings.getSortMode())
                .withHighlightTerms(normalizeTerms(settings.getHighlightTerms()));
    }

    private static int countPrimaryAuthors(List<ChatMessage> messages) {
        Set<String> authors = new HashSet<>();

        for (ChatMessage message : messages) {
            if (CanonicalKey.PRIMARY_CHAT.equals(message.getChannelKey()) && !message.getAuthor().isEmpty()) {
                authors.add(message.getAuthor().toLowerCase(Locale.ROOT));
            }
        }

        return authors.size();
    }
}
