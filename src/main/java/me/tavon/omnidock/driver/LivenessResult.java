package me.tavon.omnidock.driver;

import me.tavon.omnidock.channel.EmbedRecord;

public final class LivenessResult {

    private static final LivenessResult OFFLINE = new LivenessResult(false, null, null);

    private final boolean live;
    private final EmbedRecord record;
    private final String error;

    private LivenessResult(boolean live, EmbedRecord record, String error) {
        this.live = live;
        this.record = record;
        this.error = error;
    }

    public static LivenessResult live(EmbedRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("a live result needs a record");
        }

        return new LivenessResult(true, record, null);
    }

    public static LivenessResult offline() {
        return OFFLINE;
    }

    public static LivenessResult failed(String error) {
        return new LivenessResult(false, null, error == null ? "unknown error" : error);
    }

    public boolean isLive() {
        return live;
    }

    public EmbedRecord getRecord() {
        return record;
    }

    public String getError() {
        return error;
    }

    public boolean isFailed() {
        return error != null;
    }

    @Override
    public String toString() {
        return "LivenessResult{live=" + live + ", record=" + record + ", error='" + error + "'}";
    }
}
