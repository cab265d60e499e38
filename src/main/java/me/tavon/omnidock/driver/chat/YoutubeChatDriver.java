package me.tavon.omnidock.driver.chat;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import me.tavon.omnidock.OmniDock;
import me.tavon.omnidock.channel.CanonicalKey;
import me.tavon.omnidock.channel.Platform;
import me.tavon.omnidock.driver.KickDriver;
import me.tavon.omnidock.stream.chat.ChatEvent;
import okhttp3.*;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * YouTube live chat by polling. The popout chat page gives the first continuation and the innertube
 * key; every poll returns new actions and the next continuation.
 */
public class YoutubeChatDriver extends ChatSourceDriver {

    private static final Pattern INITIAL_DATA_PATTERN =
            Pattern.compile("(?:window\\[\"ytInitialData\"\\]|var ytInitialData)\\s*=\\s*(\\{.*?\\});\\s*</script>",
                    Pattern.DOTALL);
    private static final Pattern API_KEY_PATTERN = Pattern.compile("\"INNERTUBE_API_KEY\"\\s*:\\s*\"([^\"]+)\"");
    private static final Pattern CLIENT_VERSION_PATTERN =
            Pattern.compile("\"INNERTUBE_CONTEXT_CLIENT_VERSION\"\\s*:\\s*\"([^\"]+)\"");
    private static final String DEFAULT_CLIENT_VERSION = "2.20240101.00.00";
    private static final int SEEN_ID_LIMIT = 2000;

    private OkHttpClient client;
    private final Map<CanonicalKey, Session> sessions = new ConcurrentHashMap<>();
    private final ExecutorService chatDownloadThread = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "YoutubeChatDriver");
        thread.setDaemon(true);
        return thread;
    });
    private final Timer timer = new Timer("YoutubeChatDriver", true);

    public YoutubeChatDriver(OkHttpClient client, ChatSink sink, long pollInterval) {
        super(sink);
        this.client = client;

        timer.schedule(new TimerTask() {
            @Override
            public void run() {
                for (Map.Entry<CanonicalKey, Session> entry : sessions.entrySet()) {
                    chatDownloadThread.submit(() -> {
                        try {
                            requestChatUpdate(entry.getKey(), entry.getValue());
                        } catch (Exception e) {
                            OmniDock.LOGGER.warning("Could not poll YouTube chat of " + entry.getKey() + ": "
                                    + e.getMessage());
                        }
                    });
                }
            }
        }, pollInterval, pollInterval);
    }

    @Override
    public String getSourceName() {
        return Platform.YOUTUBE.getKeyPrefix();
    }

    @Override
    void onSubscribe(CanonicalKey key) {
        chatDownloadThread.submit(() -> {
            try {
                startSession(key);
            } catch (Exception e) {
                OmniDock.LOGGER.warning("Could not open YouTube chat of " + key + ": " + e.getMessage());
            }
        });
    }

    @Override
    void onUnsubscribe(CanonicalKey key) {
        sessions.remove(key);
    }

    @Override
    public void shutdown() {
        timer.cancel();
        sessions.clear();
        chatDownloadThread.shutdownNow();
    }

    private void startSession(CanonicalKey key) throws Exception {
        HttpUrl url = HttpUrl.get("https://www.youtube.com/live_chat").newBuilder()
                .addQueryParameter("is_popout", "1")
                .addQueryParameter("v", key.getId())
                .build();
        Request request = new Request.Builder()
                .url(url)
                .get()
                .addHeader("user-agent", KickDriver.USER_AGENT)
                .addHeader("cache-control", "no-cache")
                .build();

        String page;

        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();

            if (response.code() != 200 || body == null) {
                throw new Exception("Didn't get 200 or empty body");
            }

            page = body.string();
        }

        JsonObject initialData = extractInitialData(page);
        String apiKey = extractFirst(API_KEY_PATTERN, page);

        if (initialData == null || apiKey == null) {
            throw new Exception("chat page has no initial data or api key");
        }

        JsonObject renderer = liveChatRenderer(initialData);

        if (renderer == null) {
            throw new Exception("chat is not available");
        }

        String clientVersion = extractFirst(CLIENT_VERSION_PATTERN, page);
        Session session = new Session(apiKey, clientVersion == null ? DEFAULT_CLIENT_VERSION : clientVersion,
                continuationOf(renderer.getAsJsonArray("continuations")));

        if (!isSubscribed(key)) {
            return;
        }

        sessions.put(key, session);

        if (renderer.has("actions")) {
            for (ChatEvent event : handleActions(key, renderer.getAsJsonArray("actions"), session.seenIds, true)) {
                deliver(event);
            }
        }
    }

    private void requestChatUpdate(CanonicalKey key, Session session) throws Exception {
        if (session.continuation == null) {
            return;
        }

        JsonObject clientContext = new JsonObject();
        clientContext.addProperty("clientName", "WEB");
        clientContext.addProperty("clientVersion", session.clientVersion);
        clientContext.addProperty("hl", "en");
        clientContext.addProperty("gl", "US");

        JsonObject context = new JsonObject();
        context.add("client", clientContext);

        JsonObject payload = new JsonObject();
        payload.add("context", context);
        payload.addProperty("continuation", session.continuation);

        Request request = new Request.Builder()
                .url("https://www.youtube.com/youtubei/v1/live_chat/get_live_chat?key=" + session.apiKey)
                .post(RequestBody.create(MediaType.parse("application/json"), payload.toString()))
                .addHeader("user-agent", KickDriver.USER_AGENT)
                .addHeader("cache-control", "no-cache")
                .build();

        String responseString;

        try (Response response = client.newCall(request).execute()) {
            ResponseBody responseBody = response.body();

            if (response.code() != 200 || responseBody == null) {
                throw new Exception("Didn't get 200 or empty body");
            }

            responseString = responseBody.string();
        }

        JsonObject root = new JsonParser().parse(responseString).getAsJsonObject();
        JsonObject contents = root.getAsJsonObject("continuationContents");

        if (contents == null || !contents.has("liveChatContinuation")) {
            OmniDock.LOGGER.info("YouTube chat of " + key + " has ended");
            session.continuation = null;
            return;
        }

        JsonObject data = contents.getAsJsonObject("liveChatContinuation");
        session.continuation = continuationOf(data.getAsJsonArray("continuations"));

        if (data.has("actions") && sessions.get(key) == session) {
            for (ChatEvent event : handleActions(key, data.getAsJsonArray("actions"), session.seenIds, false)) {
                deliver(event);
            }
        }
    }

    static JsonObject extractInitialData(String page) {
        Matcher matcher = INITIAL_DATA_PATTERN.matcher(page);

        if (!matcher.find()) {
            return null;
        }

        JsonElement element = new JsonParser().parse(matcher.group(1));
        return element.isJsonObject() ? element.getAsJsonObject() : null;
    }

    static String extractFirst(Pattern pattern, String page) {
        Matcher matcher = pattern.matcher(page);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static JsonObject liveChatRenderer(JsonObject initialData) {
        JsonObject contents = initialData.getAsJsonObject("contents");
        return contents == null ? null : contents.getAsJsonObject("liveChatRenderer");
    }

    static String continuationOf(JsonArray continuations) {
        if (continuations == null || continuations.size() == 0) {
            return null;
        }

        JsonObject container = continuations.get(0).getAsJsonObject();

        for (String kind : new String[]{"timedContinuationData", "invalidationContinuationData",
                "reloadContinuationData"}) {
            if (container.has(kind)) {
                return container.getAsJsonObject(kind).get("continuation").getAsString();
            }
        }

        return null;
    }

    /**
     * Text messages among the actions that have not been seen before, in action order.
     */
    static List<ChatEvent> handleActions(CanonicalKey key, JsonArray actions, Set<String> seenIds, boolean history) {
        List<ChatEvent> events = new ArrayList<>();

        for (int i = 0; i < actions.size(); i++) {
            JsonObject jsonObject = actions.get(i).getAsJsonObject();

            if (!jsonObject.has("addChatItemAction")) {
                continue;
            }

            JsonObject item = jsonObject.getAsJsonObject("addChatItemAction").getAsJsonObject("item");

            if (item == null || !item.has("liveChatTextMessageRenderer")) {
                continue;
            }

            JsonObject chatObject = item.getAsJsonObject("liveChatTextMessageRenderer");
            String id = chatObject.has("id") ? chatObject.get("id").getAsString() : null;

            if (id != null && !seenIds.add(id)) {
                continue;
            }

            Long timestamp = chatObject.has("timestampUsec")
                    ? Long.valueOf(chatObject.get("timestampUsec").getAsString()) / 1000L : null;
            String author = authorOf(chatObject);

            StringBuilder text = new StringBuilder();

            if (chatObject.has("message")) {
                JsonArray jsonRuns = chatObject.getAsJsonObject("message").getAsJsonArray("runs");

                for (int x = 0; jsonRuns != null && x < jsonRuns.size(); x++) {
                    JsonObject runObj = jsonRuns.get(x).getAsJsonObject();

                    if (runObj.has("text")) {
                        text.append(runObj.get("text").getAsString());
                    } else if (runObj.has("emoji")) {
                        JsonObject emoji = runObj.getAsJsonObject("emoji");
                        JsonArray shortcuts = emoji.getAsJsonArray("shortcuts");

                        if (shortcuts != null && shortcuts.size() > 0) {
                            text.append(shortcuts.get(0).getAsString());
                        } else if (emoji.has("emojiId")) {
                            text.append(emoji.get("emojiId").getAsString());
                        }
                    }
                }
            }

            events.add(new ChatEvent(key, author, text.toString().replace("\ufeff", ""), timestamp, history));
        }

        if (seenIds.size() > SEEN_ID_LIMIT) {
            seenIds.clear();
        }

        return events;
    }

    private static String authorOf(JsonObject chatObject) {
        JsonObject authorName = chatObject.getAsJsonObject("authorName");

        if (authorName == null) {
            return "";
        }

        if (authorName.has("simpleText")) {
            return authorName.get("simpleText").getAsString();
        }

        JsonArray runs = authorName.getAsJsonArray("runs");
        return runs == null || runs.size() == 0 ? "" : runs.get(0).getAsJsonObject().get("text").getAsString();
    }

    private static final class Session {

        private final String apiKey;
        private final String clientVersion;
        private final Set<String> seenIds = Collections.newSetFromMap(new ConcurrentHashMap<>());
        private volatile String continuation;

        Session(String apiKey, String clientVersion, String continuation) {
            this.apiKey = apiKey;
            this.clientVersion = clientVersion;
            this.continuation = continuation;
        }
    }
}
