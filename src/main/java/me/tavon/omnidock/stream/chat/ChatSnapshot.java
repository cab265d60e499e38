package me.tavon.omnidock.stream.chat;

import com.google.common.collect.ImmutableList;

import java.util.List;

public final class ChatSnapshot {

    private final ImmutableList<ChatLine> lines;
    private final SortMode sortMode;
    private final int retainedCount;
    private final int primaryAuthorCount;

    ChatSnapshot(List<ChatLine> lines, SortMode sortMode, int retainedCount, int primaryAuthorCount) {
        this.lines = ImmutableList.copyOf(lines);
        this.sortMode = sortMode;
        this.retainedCount = retainedCount;
        this.primaryAuthorCount = primaryAuthorCount;
    }

    /**
     * Displayed lines, oldest first under the snapshot's sort mode.
     */
    public ImmutableList<ChatLine> getLines() {
        return lines;
    }

    public SortMode getSortMode() {
        return sortMode;
    }

    public int getRetainedCount() {
        return retainedCount;
    }

    /**
     * Distinct authors, case-insensitive, of the always-on source within the snapshot window.
     */
    public int getPrimaryAuthorCount() {
        return primaryAuthorCount;
    }
}
