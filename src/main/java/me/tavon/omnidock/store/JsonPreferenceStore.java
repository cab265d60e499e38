package me.tavon.omnidock.store;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import me.tavon.omnidock.OmniDock;
import me.tavon.omnidock.channel.BookmarkedStreamer;
import me.tavon.omnidock.channel.CanonicalKey;
import me.tavon.omnidock.channel.EmbedRecord;
import me.tavon.omnidock.stream.chat.ChatSettings;

import java.io.*;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * One pretty-printed JSON file per concern under the data folder.
 */
public class JsonPreferenceStore implements PreferenceStore {

    static final String STREAMERS_FILE = "streamers.json";
    static final String PINNED_FILE = "pinned.json";
    static final String SELECTION_FILE = "selection.json";
    static final String CHAT_SETTINGS_FILE = "chat-settings.json";

    private static final Type STREAMER_LIST_TYPE = new TypeToken<List<BookmarkedStreamer>>() {
    }.getType();
    private static final Type RECORD_LIST_TYPE = new TypeToken<List<EmbedRecord>>() {
    }.getType();

    private final File folder;
    private final Gson gson;

    public JsonPreferenceStore(File folder) {
        this.folder = folder;
        this.gson = OmniDock.GSON.newBuilder()
                .registerTypeAdapter(CanonicalKey.class, new CanonicalKeyAdapter().nullSafe())
                .create();
    }

    @Override
    public synchronized List<BookmarkedStreamer> loadStreamers() throws IOException {
        List<BookmarkedStreamer> streamers = read(STREAMERS_FILE, STREAMER_LIST_TYPE);
        return streamers == null ? new ArrayList<BookmarkedStreamer>() : streamers;
    }

    @Override
    public synchronized void saveStreamers(List<BookmarkedStreamer> streamers) throws IOException {
        write(STREAMERS_FILE, streamers, STREAMER_LIST_TYPE);
    }

    @Override
    public synchronized List<EmbedRecord> loadPinned() throws IOException {
        List<EmbedRecord> pinned = read(PINNED_FILE, RECORD_LIST_TYPE);
        return pinned == null ? new ArrayList<EmbedRecord>() : pinned;
    }

    @Override
    public synchronized void savePinned(List<EmbedRecord> pinned) throws IOException {
        write(PINNED_FILE, pinned, RECORD_LIST_TYPE);
    }

    @Override
    public synchronized SelectionSnapshot loadSelection() throws IOException {
        SelectionSnapshot selection = read(SELECTION_FILE, SelectionSnapshot.class);
        return selection == null ? SelectionSnapshot.empty() : selection;
    }

    @Override
    public synchronized void saveSelection(SelectionSnapshot selection) throws IOException {
        write(SELECTION_FILE, selection, SelectionSnapshot.class);
    }

    @Override
    public synchronized ChatSettings loadChatSettings() throws IOException {
        ChatSettings settings = read(CHAT_SETTINGS_FILE, ChatSettings.class);
        return settings == null ? ChatSettings.defaults() : settings;
    }

    @Override
    public synchronized void saveChatSettings(ChatSettings settings) throws IOException {
        write(CHAT_SETTINGS_FILE, settings, ChatSettings.class);
    }

    private <T> T read(String name, Type type) throws IOException {
        File file = new File(folder, name);

        if (!file.exists() || !file.isFile()) {
            return null;
        }

        try (Reader reader = new BufferedReader(new InputStreamReader(new FileInputStream(file),
                StandardCharsets.UTF_8))) {
            return gson.fromJson(reader, type);
        } catch (JsonParseException e) {
            throw new IOException("Could not parse " + file, e);
        }
    }

    private void write(String name, Object value, Type type) throws IOException {
        if (!folder.exists() && !folder.mkdirs()) {
            throw new IOException("Could not create " + folder);
        }

        File file = new File(folder, name);
        File temp = new File(folder, name + ".tmp");

        try (Writer writer = new BufferedWriter(new OutputStreamWriter(new FileOutputStream(temp),
                StandardCharsets.UTF_8))) {
            gson.toJson(value, type, writer);
        }

        Files.move(temp.toPath(), file.toPath(), StandardCopyOption.REPLACE_EXISTING);
    }
}
