package me.tavon.omnidock.store;

import me.tavon.omnidock.channel.BookmarkedStreamer;
import me.tavon.omnidock.channel.EmbedRecord;
import me.tavon.omnidock.stream.chat.ChatSettings;

import java.io.IOException;
import java.util.List;

/**
 * Key-value persistence for what the user set up. Loaders return empty values, never null, when
 * nothing has been stored yet.
 */
public interface PreferenceStore {

    List<BookmarkedStreamer> loadStreamers() throws IOException;

    void saveStreamers(List<BookmarkedStreamer> streamers) throws IOException;

    List<EmbedRecord> loadPinned() throws IOException;

    void savePinned(List<EmbedRecord> pinned) throws IOException;

    SelectionSnapshot loadSelection() throws IOException;

    void saveSelection(SelectionSnapshot selection) throws IOException;

    ChatSettings loadChatSettings() throws IOException;

    void saveChatSettings(ChatSettings settings) throws IOException;
}
