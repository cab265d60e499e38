package me.tavon.omnidock.stream.chat;

import me.tavon.omnidock.channel.CanonicalKey;

public final class ChatMessage {

    private final long sequence;
    private final long arrivalTime;
    private final CanonicalKey channelKey;
    private final String author;
    private final String text;
    private final Long sourceTimestamp;
    private final boolean history;

    ChatMessage(long sequence, long arrivalTime, ChatEvent event) {
        this.sequence = sequence;
        this.arrivalTime = arrivalTime;
        this.channelKey = event.getChannelKey();
        this.author = event.getAuthor();
        this.text = event.getText();
        this.sourceTimestamp = event.getSourceTimestamp();
        this.history = event.isHistory();
    }

    /**
     * Arrival sequence, strictly increasing in ingestion order.
     */
    public long getSequence() {
        return sequence;
    }

    public long getArrivalTime() {
        return arrivalTime;
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

    public boolean isHistory() {
        return history;
    }

    /**
     * The source timestamp, or the arrival wall time when the source sent none.
     */
    public long getSortTimestamp() {
        return sourceTimestamp != null ? sourceTimestamp : arrivalTime;
    }

    @Override
    public String toString() {
        return "ChatMessage{" +
                "sequence=" + sequence +
                ", channelKey=" + channelKey +
                ", author='" + author + '\'' +
                ", text='" + text + '\'' +
                ", sourceTimestamp=" + sourceTimestamp +
                '}';
    }
}
