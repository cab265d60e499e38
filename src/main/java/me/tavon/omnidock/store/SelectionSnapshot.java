package me.tavon.omnidock.store;

import me.tavon.omnidock.channel.CanonicalKey;
import me.tavon.omnidock.channel.EmbedRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Persisted selection sets, with the last known record of every selected key so selections made in
 * an earlier session stay resolvable until a source reports them again.
 */
public class SelectionSnapshot {

    private List<CanonicalKey> video;
    private List<CanonicalKey> chat;
    private List<EmbedRecord> known;

    public SelectionSnapshot(Collection<CanonicalKey> video, Collection<CanonicalKey> chat,
                             Collection<EmbedRecord> known) {
        this.video = new ArrayList<>(video);
        this.chat = new ArrayList<>(chat);
        this.known = new ArrayList<>(known);
    }

    public static SelectionSnapshot empty() {
        return new SelectionSnapshot(Collections.<CanonicalKey>emptyList(), Collections.<CanonicalKey>emptyList(),
                Collections.<EmbedRecord>emptyList());
    }

    public List<CanonicalKey> getVideo() {
        return video == null ? Collections.<CanonicalKey>emptyList() : Collections.unmodifiableList(video);
    }

    public List<CanonicalKey> getChat() {
        return chat == null ? Collections.<CanonicalKey>emptyList() : Collections.unmodifiableList(chat);
    }

    public List<EmbedRecord> getKnown() {
        return known == null ? Collections.<EmbedRecord>emptyList() : Collections.unmodifiableList(known);
    }
}
