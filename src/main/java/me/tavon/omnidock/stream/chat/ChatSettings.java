package me.tavon.omnidock.stream.chat;

import java.util.*;

/**
 * User-facing chat display settings. Caps are always read through the clamping getters so the
 * visible cap can never exceed the scroll cap.
 */
public class ChatSettings {

    public static final int MIN_CAP = 50;
    public static final int MAX_SCROLL_CAP = 50000;
    public static final int DEFAULT_VISIBLE_CAP = 70;
    public static final int DEFAULT_SCROLL_CAP = 5000;

    private int visibleCap;
    private int scrollCap;
    private SortMode sortMode;
    private List<String> highlightTerms;

    public ChatSettings(int visibleCap, int scrollCap, SortMode sortMode, Collection<String> highlightTerms) {
        this.visibleCap = visibleCap;
        this.scrollCap = scrollCap;
        this.sortMode = sortMode;
        this.highlightTerms = highlightTerms == null ? new ArrayList<String>() : new ArrayList<>(highlightTerms);
    }

    public static ChatSettings defaults() {
        return new ChatSettings(DEFAULT_VISIBLE_CAP, DEFAULT_SCROLL_CAP, SortMode.TIMESTAMP,
                Collections.<String>emptyList());
    }

    public int getScrollCap() {
        return clampScrollCap(scrollCap);
    }

    public int getVisibleCap() {
        return clampVisibleCap(visibleCap, getScrollCap());
    }

    public SortMode getSortMode() {
        return sortMode == null ? SortMode.TIMESTAMP : sortMode;
    }

    public List<String> getHighlightTerms() {
        return highlightTerms == null ? Collections.<String>emptyList() : Collections.unmodifiableList(highlightTerms);
    }

    public ChatSettings withCaps(int newVisibleCap, int newScrollCap) {
        return new ChatSettings(newVisibleCap, newScrollCap, sortMode, highlightTerms);
    }

    public ChatSettings withSortMode(SortMode newSortMode) {
        return new ChatSettings(visibleCap, scrollCap, newSortMode, highlightTerms);
    }

    public ChatSettings withHighlightTerms(Collection<String> terms) {
        return new ChatSettings(visibleCap, scrollCap, sortMode, terms);
    }

    static int clampScrollCap(int scrollCap) {
        return Math.max(MIN_CAP, Math.min(MAX_SCROLL_CAP, scrollCap));
    }

    static int clampVisibleCap(int visibleCap, int scrollCap) {
        return Math.max(MIN_CAP, Math.min(scrollCap, visibleCap));
    }

    @Override
    public String toString() {
        return "ChatSettings{" +
                "visibleCap=" + getVisibleCap() +
                ", scrollCap=" + getScrollCap() +
                ", sortMode=" + getSortMode() +
                ", highlightTerms=" + getHighlightTerms() +
                '}';
    }
}
