package me.tavon.omnidock.driver.chat;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import me.tavon.omnidock.OmniDock;
import me.tavon.omnidock.channel.CanonicalKey;
import me.tavon.omnidock.channel.Platform;
import me.tavon.omnidock.driver.KickDriver;
import me.tavon.omnidock.stream.chat.ChatEvent;
import okhttp3.*;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Kick chat through its Pusher socket. Subscribing looks up the channel's chatroom id first, then joins
 * {@code chatrooms.<id>.v2}.
 */
public class KickChatDriver extends ChatSourceDriver {

    static final String PUSHER_URL = "wss://ws-us2.pusher.com/app/32cbd69e4b950bf97679" +
            "?protocol=7&client=js&version=8.4.0&flash=false";
    static final String CHAT_MESSAGE_EVENT = "App\\Events\\ChatMessageEvent";
    private static final long RECONNECT_DELAY = TimeUnit.SECONDS.toMillis(5);

    private OkHttpClient client;
    private WebSocket webSocket;
    private boolean open;
    private final Map<Long, CanonicalKey> chatrooms = new ConcurrentHashMap<>();
    private final ScheduledExecutorService lookupThread = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "KickChatDriver");
        thread.setDaemon(true);
        return thread;
    });

    public KickChatDriver(OkHttpClient client, ChatSink sink) {
        super(sink);
        this.client = client;
    }

    @Override
    public String getSourceName() {
        return Platform.KICK.getKeyPrefix();
    }

    @Override
    void onSubscribe(CanonicalKey key) {
        lookupThread.submit(() -> {
            long chatroomId;

            try {
                chatroomId = parseChatroomId(KickDriver.getChannelJson(client, key.getId()));
            } catch (Exception e) {
                OmniDock.LOGGER.warning("Could not find Kick chatroom of " + key.getId() + ": " + e.getMessage());
                return;
            }

            join(key, chatroomId);
        });
    }

    private synchronized void join(CanonicalKey key, long chatroomId) {
        if (!isSubscribed(key)) {
            return;
        }

        chatrooms.put(chatroomId, key);

        if (webSocket == null) {
            connect();
        } else if (open) {
            webSocket.send(pusherCommand("pusher:subscribe", chatroomId));
        }
    }

    @Override
    synchronized void onUnsubscribe(CanonicalKey key) {
        Long chatroomId = null;

        for (Map.Entry<Long, CanonicalKey> entry : chatrooms.entrySet()) {
            if (entry.getValue().equals(key)) {
                chatroomId = entry.getKey();
            }
        }

        if (chatroomId == null) {
            return;
        }

        chatrooms.remove(chatroomId);

        if (webSocket == null) {
            return;
        }

        if (chatrooms.isEmpty()) {
            webSocket.close(1000, "no chatrooms left");
            webSocket = null;
            open = false;
            return;
        }

        if (open) {
            webSocket.send(pusherCommand("pusher:unsubscribe", chatroomId));
        }
    }

    @Override
    public synchronized void shutdown() {
        for (CanonicalKey key : getSubscriptions()) {
            unsubscribe(key);
        }

        if (webSocket != null) {
            webSocket.close(1000, "shutdown");
            webSocket = null;
        }

        lookupThread.shutdownNow();
    }

    private void connect() {
        open = false;

        webSocket = client.newWebSocket(new Request.Builder().url(PUSHER_URL).build(), new WebSocketListener() {
            @Override
            public void onMessage(WebSocket socket, String text) {
                handleFrame(socket, text);
            }

            @Override
            public void onFailure(WebSocket socket, Throwable t, Response response) {
                OmniDock.LOGGER.warning("Kick chat connection failed: " + t.getMessage());
                dropped(socket);
            }

            @Override
            public void onClosed(WebSocket socket, int code, String reason) {
                dropped(socket);
            }
        });
    }

    private void handleFrame(WebSocket socket, String text) {
        JsonObject frame;

        try {
            frame = new JsonParser().parse(text).getAsJsonObject();
        } catch (JsonParseException | IllegalStateException e) {
            OmniDock.LOGGER.fine("Ignoring unparseable Kick frame");
            return;
        }

        String event = frame.has("event") ? frame.get("event").getAsString() : "";

        if ("pusher:connection_established".equals(event)) {
            synchronized (this) {
                for (Long chatroomId : chatrooms.keySet()) {
                    socket.send(pusherCommand("pusher:subscribe", chatroomId));
                }

                open = true;
            }
            OmniDock.LOGGER.info("Connected to Kick chat");
        } else if ("pusher:ping".equals(event)) {
            socket.send("{\"event\":\"pusher:pong\",\"data\":{}}");
        } else if (CHAT_MESSAGE_EVENT.equals(event)) {
            Long chatroomId = chatroomIdFromChannel(frame.has("channel") ? frame.get("channel").getAsString() : null);
            CanonicalKey key = chatroomId == null ? null : chatrooms.get(chatroomId);

            if (key == null || !frame.has("data")) {
                return;
            }

            // pusher usually double-encodes the payload
            JsonElement data = frame.get("data");
            ChatEvent chatEvent = parseChatMessage(key, data.isJsonPrimitive() ? data.getAsString() : data.toString());

            if (chatEvent != null) {
                deliver(chatEvent);
            }
        }
    }

    private synchronized void dropped(WebSocket socket) {
        if (socket != webSocket) {
            return;
        }

        webSocket = null;
        open = false;

        if (chatrooms.isEmpty()) {
            return;
        }

        lookupThread.schedule(() -> {
            synchronized (KickChatDriver.this) {
                if (webSocket == null && !chatrooms.isEmpty()) {
                    OmniDock.LOGGER.info("Reconnecting to Kick chat");
                    connect();
                }
            }
        }, RECONNECT_DELAY, TimeUnit.MILLISECONDS);
    }

    static String pusherCommand(String event, long chatroomId) {
        JsonObject data = new JsonObject();
        data.addProperty("auth", "");
        data.addProperty("channel", "chatrooms." + chatroomId + ".v2");

        JsonObject command = new JsonObject();
        command.addProperty("event", event);
        command.add("data", data);
        return command.toString();
    }

    static long parseChatroomId(String channelJson) throws Exception {
        JsonObject channel = new JsonParser().parse(channelJson).getAsJsonObject();

        if (channel.has("data") && channel.get("data").isJsonObject()) {
            channel = channel.getAsJsonObject("data");
        }

        JsonElement chatroom = channel.get("chatroom");

        if (chatroom != null && chatroom.isJsonObject() && chatroom.getAsJsonObject().has("id")) {
            return chatroom.getAsJsonObject().get("id").getAsLong();
        }

        if (channel.has("chatroom_id")) {
            return channel.get("chatroom_id").getAsLong();
        }

        throw new Exception("channel has no chatroom id");
    }

    static Long chatroomIdFromChannel(String channel) {
        if (channel == null || !channel.startsWith("chatrooms.")) {
            return null;
        }

        String rest = channel.substring("chatrooms.".length());
        int dot = rest.indexOf('.');

        try {
            return Long.parseLong(dot < 0 ? rest : rest.substring(0, dot));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static ChatEvent parseChatMessage(CanonicalKey key, String data) {
        JsonObject message;

        try {
            message = new JsonParser().parse(data).getAsJsonObject();
        } catch (JsonParseException | IllegalStateException e) {
            return null;
        }

        JsonObject sender = message.has("sender") && message.get("sender").isJsonObject()
                ? message.getAsJsonObject("sender") : new JsonObject();
        String author = sender.has("username") ? sender.get("username").getAsString() : "unknown";
        String content = message.has("content") ? message.get("content").getAsString() : "";
        Long timestamp = null;

        if (message.has("created_at") && !message.get("created_at").isJsonNull()) {
            try {
                timestamp = OffsetDateTime.parse(message.get("created_at").getAsString()).toInstant().toEpochMilli();
            } catch (DateTimeParseException e) {
                OmniDock.LOGGER.fine("Ignoring bad Kick created_at " + message.get("created_at"));
            }
        }

        return ChatEvent.of(key, author, content, timestamp);
    }
}
