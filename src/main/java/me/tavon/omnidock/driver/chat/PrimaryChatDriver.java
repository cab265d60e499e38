package me.tavon.omnidock.driver.chat;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import me.tavon.omnidock.OmniDock;
import me.tavon.omnidock.channel.CanonicalKey;
import me.tavon.omnidock.stream.chat.ChatEvent;
import okhttp3.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Timer;
import java.util.TimerTask;
import java.util.concurrent.TimeUnit;

/**
 * The always-on chat. Frames are {@code TYPE payload}; {@code MSG} carries one message and
 * {@code HISTORY} a JSON array of earlier frames sent right after connecting.
 */
public class PrimaryChatDriver extends ChatSourceDriver {

    private static final long RECONNECT_DELAY = TimeUnit.SECONDS.toMillis(5);

    private OkHttpClient client;
    private String url;
    private String origin;
    private WebSocket webSocket;
    private Timer reconnectTimer;

    public PrimaryChatDriver(OkHttpClient client, String url, String origin, ChatSink sink) {
        super(sink);
        this.client = client;
        this.url = url;
        this.origin = origin;
    }

    @Override
    public String getSourceName() {
        return CanonicalKey.PRIMARY_CHAT.getPlatformName();
    }

    @Override
    synchronized void onSubscribe(CanonicalKey key) throws Exception {
        if (!CanonicalKey.PRIMARY_CHAT.equals(key)) {
            throw new Exception("only " + CanonicalKey.PRIMARY_CHAT + " is served here");
        }

        if (webSocket == null) {
            connect();
        }
    }

    @Override
    synchronized void onUnsubscribe(CanonicalKey key) {
        if (webSocket != null) {
            webSocket.close(1000, "unsubscribed");
            webSocket = null;
        }
    }

    @Override
    public synchronized void shutdown() {
        unsubscribe(CanonicalKey.PRIMARY_CHAT);

        if (reconnectTimer != null) {
            reconnectTimer.cancel();
            reconnectTimer = null;
        }
    }

    private void connect() {
        Request.Builder request = new Request.Builder().url(url);

        if (origin != null && !origin.isEmpty()) {
            request.addHeader("Origin", origin);
        }

        webSocket = client.newWebSocket(request.build(), new WebSocketListener() {
            @Override
            public void onOpen(WebSocket socket, Response response) {
                OmniDock.LOGGER.info("Connected to primary chat " + url);
            }

            @Override
            public void onMessage(WebSocket socket, String text) {
                for (ChatEvent event : parseFrame(text)) {
                    deliver(event);
                }
            }

            @Override
            public void onFailure(WebSocket socket, Throwable t, Response response) {
                OmniDock.LOGGER.warning("Primary chat connection failed: " + t.getMessage());
                dropped(socket);
            }

            @Override
            public void onClosed(WebSocket socket, int code, String reason) {
                dropped(socket);
            }
        });
    }

    private synchronized void dropped(WebSocket socket) {
        if (socket != webSocket) {
            return;
        }

        webSocket = null;

        if (!isSubscribed(CanonicalKey.PRIMARY_CHAT)) {
            return;
        }

        if (reconnectTimer == null) {
            reconnectTimer = new Timer("PrimaryChatDriver", true);
        }

        reconnectTimer.schedule(new TimerTask() {
            @Override
            public void run() {
                synchronized (PrimaryChatDriver.this) {
                    if (webSocket == null && isSubscribed(CanonicalKey.PRIMARY_CHAT)) {
                        connect();
                    }
                }
            }
        }, RECONNECT_DELAY);
    }

    static List<ChatEvent> parseFrame(String frame) {
        if (frame.startsWith("MSG ")) {
            ChatEvent event = parseMessage(frame.substring(4), false);
            return event == null ? Collections.<ChatEvent>emptyList() : Collections.singletonList(event);
        }

        if (!frame.startsWith("HISTORY ")) {
            return Collections.emptyList();
        }

        List<ChatEvent> events = new ArrayList<>();

        try {
            JsonArray history = new JsonParser().parse(frame.substring(8)).getAsJsonArray();

            for (JsonElement element : history) {
                String entry = element.getAsString();

                if (!entry.startsWith("MSG ")) {
                    continue;
                }

                ChatEvent event = parseMessage(entry.substring(4), true);

                if (event != null) {
                    events.add(event);
                }
            }
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException e) {
            OmniDock.LOGGER.warning("Could not parse primary chat history: " + e.getMessage());
        }

        return events;
    }

    static ChatEvent parseMessage(String json, boolean history) {
        JsonObject message;

        try {
            message = new JsonParser().parse(json).getAsJsonObject();
        } catch (JsonParseException | IllegalStateException e) {
            OmniDock.LOGGER.fine("Ignoring unparseable primary chat message");
            return null;
        }

        if (!message.has("nick") || !message.has("data")) {
            return null;
        }

        Long timestamp = message.has("timestamp") && message.get("timestamp").isJsonPrimitive()
                ? message.get("timestamp").getAsLong() : null;

        return new ChatEvent(CanonicalKey.PRIMARY_CHAT, message.get("nick").getAsString(),
                message.get("data").getAsString(), timestamp, history);
    }
}
