package me.tavon.omnidock.stream.chat;

import me.tavon.omnidock.channel.CanonicalKey;

import java.util.Objects;

/**
 * A chat line as a source delivers it, before the aggregator assigns it an arrival sequence.
 */
public final class ChatEvent {

    private final CanonicalKey channelKey;
    private final String author;
    private final String text;
    private final Long sourceTimestamp;
    private final boolean history;

    public ChatEvent(CanonicalKey channelKey, String author, String text, Long sourceTimestamp, boolean history) {
        Objects.requireNonNull(channelKey, "channelKey cannot be null");
        this.channelKey = channelKey;
        this.author = author == null ? "" : author;
        this.text = text == null ? "" : text;
        this.sourceTimestamp = sourceTimestamp;
        this.history = history;
    }

    public static ChatEvent of(CanonicalKey channelKey, String author, String text, Long sourceTimestamp) {
        return new ChatEvent(channelKey, author, text, sourceTimestamp, false);
    }

    public CanonicalKey getChannelKey() {
        return channelKey;
    }

    public String getAuthor() {
        return author;
    }

    public String getText() {
        return text;
    }

    public Long getSourceTimestamp() {
        return sourceTimestamp;
    }

    /**
     * Whether the source replayed this line from its backlog on connect.
     */
    public boolean isHistory() {
        return history;
    }

    @Override
    public String toString() {
        return "ChatEvent{" +
                "channelKey=" + channelKey +
                ", author='" + author + '\'' +
                ", text='" + text + '\'' +
                ", sourceTimestamp=" + sourceTimestamp +
                '}';
    }
}
