package me.tavon.omnidock.registry;

import com.google.common.collect.ImmutableList;
import me.tavon.omnidock.channel.BannedEmbed;
import me.tavon.omnidock.channel.CanonicalKey;
import me.tavon.omnidock.channel.EmbedRecord;
import me.tavon.omnidock.channel.Platform;
import me.tavon.omnidock.driver.LivenessResult;

import java.util.List;
import java.util.Objects;

/**
 * Everything a source adapter can hand to the registry. The set of kinds is closed: the constructor
 * is private, and {@link Handler} has to cover each one.
 */
public abstract class SourceEvent {

    private SourceEvent() {
    }

    public abstract <R> R accept(Handler<R> handler);

    public interface Handler<R> {

        R onRealtimeBatch(RealtimeBatch batch);

        R onBannedList(BannedList bannedList);

        R onPoll(Poll poll);

        R onPinned(Pinned pinned);
    }

    public static RealtimeBatch realtimeBatch(List<EmbedRecord> records) {
        return new RealtimeBatch(records);
    }

    public static BannedList bannedList(List<BannedEmbed> banned) {
        return new BannedList(banned);
    }

    public static Poll poll(Platform platform, String streamerId, LivenessResult result) {
        return new Poll(new PollSlot(platform, streamerId), null, result);
    }

    /**
     * A poll result for the identifier that was checked. The result is dropped if the streamer's id on
     * that platform has changed since.
     */
    public static Poll poll(Platform platform, String streamerId, String identifier, LivenessResult result) {
        return new Poll(new PollSlot(platform, streamerId), identifier, result);
    }

    public static Pinned pin(EmbedRecord record) {
        Objects.requireNonNull(record, "record cannot be null");
        return new Pinned(Pinned.Op.ADD, record.getKey(), record);
    }

    public static Pinned unpin(CanonicalKey key) {
        Objects.requireNonNull(key, "key cannot be null");
        return new Pinned(Pinned.Op.REMOVE, key, null);
    }

    /**
     * Full replacement list of the embeds the realtime feed currently knows about.
     */
    public static final class RealtimeBatch extends SourceEvent {

        private final ImmutableList<EmbedRecord> records;

        private RealtimeBatch(List<EmbedRecord> records) {
            this.records = records == null ? ImmutableList.of() : ImmutableList.copyOf(records);
        }

        public ImmutableList<EmbedRecord> getRecords() {
            return records;
        }

        @Override
        public <R> R accept(Handler<R> handler) {
            return handler.onRealtimeBatch(this);
        }
    }

    public static final class BannedList extends SourceEvent {

        private final ImmutableList<BannedEmbed> banned;

        private BannedList(List<BannedEmbed> banned) {
            this.banned = banned == null ? ImmutableList.of() : ImmutableList.copyOf(banned);
        }

        public ImmutableList<BannedEmbed> getBanned() {
            return banned;
        }

        @Override
        public <R> R accept(Handler<R> handler) {
            return handler.onBannedList(this);
        }
    }

    public static final class Poll extends SourceEvent {

        private final PollSlot slot;
        private final String identifier;
        private final LivenessResult result;

        private Poll(PollSlot slot, String identifier, LivenessResult result) {
            Objects.requireNonNull(result, "result cannot be null");
            this.slot = slot;
            this.identifier = identifier;
            this.result = result;
        }

        public PollSlot getSlot() {
            return slot;
        }

        public String getIdentifier() {
            return identifier;
        }

        public LivenessResult getResult() {
            return result;
        }

        @Override
        public <R> R accept(Handler<R> handler) {
            return handler.onPoll(this);
        }
    }

    public static final class Pinned extends SourceEvent {

        public enum Op {
            ADD,
            REMOVE
        }

        private final Op op;
        private final CanonicalKey key;
        private final EmbedRecord record;

        private Pinned(Op op, CanonicalKey key, EmbedRecord record) {
            this.op = op;
            this.key = key;
            this.record = record;
        }

        public Op getOp() {
            return op;
        }

        public CanonicalKey getKey() {
            return key;
        }

        public EmbedRecord getRecord() {
            return record;
        }

        @Override
        public <R> R accept(Handler<R> handler) {
            return handler.onPinned(this);
        }
    }
}
