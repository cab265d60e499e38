package me.tavon.omnidock;

import com.google.api.client.http.javanet.NetHttpTransport;
import com.google.api.client.json.jackson2.JacksonFactory;
import com.google.api.services.youtube.YouTube;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import me.tavon.omnidock.channel.BookmarkedStreamer;
import me.tavon.omnidock.channel.StreamerLinkParser;
import me.tavon.omnidock.config.OmniDockConfig;
import me.tavon.omnidock.driver.KickDriver;
import me.tavon.omnidock.driver.LivenessDriver;
import me.tavon.omnidock.driver.TwitchDriver;
import me.tavon.omnidock.driver.YoutubeDriver;
import me.tavon.omnidock.driver.chat.ChatSink;
import me.tavon.omnidock.driver.chat.ChatSourceDriver;
import me.tavon.omnidock.driver.chat.KickChatDriver;
import me.tavon.omnidock.driver.chat.PrimaryChatDriver;
import me.tavon.omnidock.driver.chat.TwitchChatDriver;
import me.tavon.omnidock.driver.chat.YoutubeChatDriver;
import me.tavon.omnidock.registry.LiveEmbedRegistry;
import me.tavon.omnidock.store.JsonPreferenceStore;
import me.tavon.omnidock.stream.BookmarkPoller;
import me.tavon.omnidock.stream.RealtimeFeed;
import me.tavon.omnidock.stream.chat.ChatEvent;
import me.tavon.omnidock.stream.chat.ChatSubscriptionManager;
import me.tavon.omnidock.stream.chat.CombinedChat;
import me.tavon.omnidock.stream.chat.RegistryDisplayResolver;
import okhttp3.OkHttpClient;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

public class OmniDock {

    private OkHttpClient httpClient = new OkHttpClient.Builder()
            .readTimeout(0, TimeUnit.MILLISECONDS)
            .pingInterval(30, TimeUnit.SECONDS)
            .build();
    private LiveEmbedRegistry registry;
    private BookmarkPoller bookmarkPoller;
    private RealtimeFeed realtimeFeed;
    private CombinedChat combinedChat;
    private List<ChatSourceDriver> chatDrivers = new ArrayList<>();

    public static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();
    public static final Logger LOGGER = Logger.getLogger(OmniDock.class.getName());

    public static OmniDock INSTANCE;

    private OmniDock(OmniDockConfig config) {
        INSTANCE = this;

        LOGGER.info("----  OmniDock  ----");

        YouTube youtube = new YouTube.Builder(new NetHttpTransport(), new JacksonFactory(), request -> {
        }).setApplicationName("omnidock").build();

        File dataFolder = config.getDataFolder();
        dataFolder.mkdirs();

        JsonPreferenceStore store = new JsonPreferenceStore(dataFolder);
        registry = new LiveEmbedRegistry(store, config.getPreferredPlatforms());
        registry.activate();

        List<LivenessDriver> livenessDrivers = Arrays.<LivenessDriver>asList(
                new KickDriver(httpClient),
                new TwitchDriver(httpClient),
                new YoutubeDriver(youtube, httpClient, config.getYoutubeApiKey()));

        bookmarkPoller = new BookmarkPoller(registry, livenessDrivers, config);
        bookmarkPoller.start();

        realtimeFeed = new RealtimeFeed(httpClient, registry, config);
        realtimeFeed.connect();

        ChatSinkHolder sink = new ChatSinkHolder();
        PrimaryChatDriver primaryDriver = new PrimaryChatDriver(httpClient, config.getPrimaryChatUrl(),
                config.getRealtimeOrigin(), sink);
        List<ChatSourceDriver> platformChatDrivers = Arrays.<ChatSourceDriver>asList(
                new KickChatDriver(httpClient, sink),
                new TwitchChatDriver(httpClient, sink),
                new YoutubeChatDriver(httpClient, sink, config.getYoutubeChatPollInterval()));

        combinedChat = new CombinedChat(registry, store,
                new RegistryDisplayResolver(registry, config.getPrimaryChatName()), primaryDriver,
                new ChatSubscriptionManager(platformChatDrivers));
        sink.target = combinedChat;
        combinedChat.activate();

        chatDrivers.add(primaryDriver);
        chatDrivers.addAll(platformChatDrivers);

        LOGGER.info("Watching " + registry.streamers().size() + " streamer(s)");

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutting down...");

            combinedChat.deactivate();

            for (ChatSourceDriver driver : chatDrivers) {
                driver.shutdown();
            }

            realtimeFeed.shutdown();
            bookmarkPoller.shutdown();
            httpClient.dispatcher().executorService().shutdown();
        }));
    }

    /**
     * Adds the streamer an {@code omnichat://add-streamer} link describes to the bookmarks.
     */
    public boolean importLink(String link) {
        BookmarkedStreamer streamer;

        try {
            streamer = StreamerLinkParser.parse(link);
        } catch (IllegalArgumentException e) {
            LOGGER.warning("Could not import " + link + ": " + e.getMessage());
            return false;
        }

        registry.addStreamer(streamer);
        LOGGER.info("Bookmarked " + streamer.getNickname() + " from link");
        return true;
    }

    public LiveEmbedRegistry getRegistry() {
        return registry;
    }

    public CombinedChat getCombinedChat() {
        return combinedChat;
    }

    public OkHttpClient getHttpClient() {
        return httpClient;
    }

    public static void main(String[] args) throws Exception {
        System.setProperty("java.util.logging.SimpleFormatter.format",
                "%1$tT %4$s: %5$s%6$s%n");
        Logger.getLogger(OkHttpClient.class.getName()).setLevel(Level.FINE);

        String configPath = OmniDockConfig.CONFIG_FILE;
        List<String> links = new ArrayList<>();

        for (String arg : args) {
            if (StreamerLinkParser.isLink(arg)) {
                links.add(arg);
            } else {
                configPath = arg;
            }
        }

        OmniDock omniDock = new OmniDock(OmniDockConfig.load(new File(configPath)));

        for (String link : links) {
            omniDock.importLink(link);
        }
    }

    /**
     * Lets chat drivers be built before the view that receives their messages.
     */
    private static final class ChatSinkHolder implements ChatSink {

        private volatile CombinedChat target;

        @Override
        public void accept(ChatEvent event) {
            CombinedChat current = target;

            if (current != null) {
                current.accept(event);
            }
        }
    }
}
