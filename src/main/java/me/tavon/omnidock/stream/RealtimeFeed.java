package me.tavon.omnidock.stream;

import me.tavon.omnidock.OmniDock;
import me.tavon.omnidock.config.OmniDockConfig;
import me.tavon.omnidock.registry.LiveEmbedRegistry;
import me.tavon.omnidock.registry.SourceEvent;
import okhttp3.*;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Long-lived connection to the realtime embed feed. Every embeds and banned-list frame is handed to
 * the registry as a full snapshot. Lost connections are retried with exponential backoff until the
 * attempt limit is reached; {@link #disconnect()} stops for good.
 */
public class RealtimeFeed extends WebSocketListener {

    private final OkHttpClient client;
    private final LiveEmbedRegistry registry;
    private final RealtimeMessageParser parser;
    private final String url;
    private final String origin;
    private final OmniDockConfig.Reconnect reconnect;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "RealtimeFeed");
        thread.setDaemon(true);
        return thread;
    });

    private WebSocket webSocket;
    private ScheduledFuture<?> reconnectTask;
    private int reconnectAttempts;
    private boolean intentionallyClosed = true;

    public RealtimeFeed(OkHttpClient client, LiveEmbedRegistry registry, OmniDockConfig config) {
        this(client, registry, new RealtimeMessageParser(), config.getRealtimeUrl(), config.getRealtimeOrigin(),
                config.getRealtimeReconnect());
    }

    RealtimeFeed(OkHttpClient client, LiveEmbedRegistry registry, RealtimeMessageParser parser, String url,
                 String origin, OmniDockConfig.Reconnect reconnect) {
        this.client = client;
        this.registry = registry;
        this.parser = parser;
        this.url = url;
        this.origin = origin;
        this.reconnect = reconnect;
    }

    public synchronized void connect() {
        if (webSocket != null) {
            return;
        }

        intentionallyClosed = false;

        Request.Builder request = new Request.Builder()
                .url(url)
                .addHeader("user-agent", "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 " +
                        "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36");

        if (origin != null && !origin.isEmpty()) {
            request.addHeader("Origin", origin);
        }

        OmniDock.LOGGER.fine("Connecting to realtime feed " + url);
        webSocket = client.newWebSocket(request.build(), this);
    }

    public synchronized void disconnect() {
        intentionallyClosed = true;

        if (reconnectTask != null) {
            reconnectTask.cancel(false);
            reconnectTask = null;
        }

        if (webSocket != null) {
            webSocket.close(1000, "closing");
            webSocket = null;
        }
    }

    public void shutdown() {
        disconnect();
        scheduler.shutdownNow();
    }

    /**
     * Parses one frame and submits what it carries.
     *
     * @return true if the frame produced a registry event
     */
    boolean handleFrame(String frame) {
        SourceEvent event = parser.parse(frame);

        if (event == null) {
            return false;
        }

        registry.submit(event);
        return true;
    }

    @Override
    public void onOpen(WebSocket webSocket, Response response) {
        synchronized (this) {
            reconnectAttempts = 0;
        }

        OmniDock.LOGGER.info("Connected to realtime feed " + url);
    }

    @Override
    public void onMessage(WebSocket webSocket, String text) {
        try {
            handleFrame(text);
        } catch (RuntimeException e) {
            OmniDock.LOGGER.warning("Could not apply realtime frame: " + e.getMessage());
        }
    }

    @Override
    public void onClosing(WebSocket webSocket, int code, String reason) {
        webSocket.close(1000, null);
    }

    @Override
    public void onClosed(WebSocket webSocket, int code, String reason) {
        OmniDock.LOGGER.info("Realtime feed closed (" + code + " " + reason + ")");
        connectionLost(webSocket);
    }

    @Override
    public void onFailure(WebSocket webSocket, Throwable t, Response response) {
        OmniDock.LOGGER.warning("Realtime feed failed: " + t.getMessage());
        connectionLost(webSocket);
    }

    private synchronized void connectionLost(WebSocket lost) {
        if (lost != webSocket) {
            return;
        }

        webSocket = null;

        if (intentionallyClosed) {
            return;
        }

        if (reconnectAttempts >= reconnect.getMaxAttempts()) {
            OmniDock.LOGGER.warning("Giving up on realtime feed after " + reconnectAttempts + " attempt(s)");
            return;
        }

        reconnectAttempts++;
        long delay = reconnect.delayFor(reconnectAttempts);
        OmniDock.LOGGER.info("Reconnecting to realtime feed in " + delay + "ms (attempt " + reconnectAttempts
                + "/" + reconnect.getMaxAttempts() + ")");

        reconnectTask = scheduler.schedule(() -> {
            synchronized (RealtimeFeed.this) {
                reconnectTask = null;

                if (intentionallyClosed) {
                    return;
                }
            }

            connect();
        }, delay, TimeUnit.MILLISECONDS);
    }
}
