package me.tavon.omnidock.store;

import me.tavon.omnidock.channel.BookmarkedStreamer;
import me.tavon.omnidock.channel.EmbedRecord;
import me.tavon.omnidock.stream.chat.ChatSettings;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps everything in fields and counts writes.
 */
public class InMemoryPreferenceStore implements PreferenceStore {

    public List<BookmarkedStreamer> streamers = new ArrayList<>();
    public List<EmbedRecord> pinned = new ArrayList<>();
    public SelectionSnapshot selection = SelectionSnapshot.empty();
    public ChatSettings chatSettings = ChatSettings.defaults();
    public int selectionWrites;
    public int chatSettingsWrites;

    @Override
    public List<BookmarkedStreamer> loadStreamers() {
        return new ArrayList<>(streamers);
    }

    @Override
    public void saveStreamers(List<BookmarkedStreamer> streamers) {
        this.streamers = new ArrayList<>(streamers);
    }

    @Override
    public List<EmbedRecord> loadPinned() {
        return new ArrayList<>(pinned);
    }

    @Override
    public void savePinned(List<EmbedRecord> pinned) {
        this.pinned = new ArrayList<>(pinned);
    }

    @Override
    public SelectionSnapshot loadSelection() {
        return selection;
    }

    @Override
    public void saveSelection(SelectionSnapshot selection) {
        this.selection = selection;
        selectionWrites++;
    }

    @Override
    public ChatSettings loadChatSettings() {
        return chatSettings;
    }

    @Override
    public void saveChatSettings(ChatSettings settings) {
        this.chatSettings = settings;
        chatSettingsWrites++;
    }
}
