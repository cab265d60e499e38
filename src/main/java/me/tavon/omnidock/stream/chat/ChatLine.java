package me.tavon.omnidock.stream.chat;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * One message as presentation shows it: the message plus what was derived from it at read time.
 */
public final class ChatLine {

    private final ChatMessage message;
    private final ImmutableList<String> matchedTerms;
    private final DisplayAttributes display;

    ChatLine(ChatMessage message, List<String> matchedTerms, DisplayAttributes display) {
        this.message = message;
        this.matchedTerms = ImmutableList.copyOf(matchedTerms);
        this.display = display;
    }

    public ChatMessage getMessage() {
        return message;
    }

    public boolean isHighlighted() {
        return !matchedTerms.isEmpty();
    }

    public ImmutableList<String> getMatchedTerms() {
        return matchedTerms;
    }

    public DisplayAttributes getDisplay() {
        return display;
    }
}
