package me.tavon.omnidock.driver.chat;

import me.tavon.omnidock.OmniDock;
import me.tavon.omnidock.channel.CanonicalKey;
import me.tavon.omnidock.channel.Platform;
import me.tavon.omnidock.stream.chat.ChatEvent;
import okhttp3.*;

import java.util.HashMap;
import java.util.Map;
import java.util.Timer;
import java.util.TimerTask;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Anonymous Twitch chat over IRC-on-WebSocket. One connection carries every joined channel; it is
 * opened on the first subscription and closed with the last one.
 */
public class TwitchChatDriver extends ChatSourceDriver {

    static final String IRC_URL = "wss://irc-ws.chat.twitch.tv/";
    private static final long RECONNECT_DELAY = TimeUnit.SECONDS.toMillis(5);

    private OkHttpClient client;
    private WebSocket webSocket;
    private boolean open;
    private Timer reconnectTimer;
    private final String nick = "justinfan" + ThreadLocalRandom.current().nextInt(10000, 999999);

    public TwitchChatDriver(OkHttpClient client, ChatSink sink) {
        super(sink);
        this.client = client;
    }

    @Override
    public String getSourceName() {
        return Platform.TWITCH.getKeyPrefix();
    }

    @Override
    synchronized void onSubscribe(CanonicalKey key) {
        if (webSocket == null) {
            connect();
            return;
        }

        // channels subscribed before the login completes are joined in onOpen
        if (open) {
            webSocket.send("JOIN #" + key.getId());
        }
    }

    @Override
    synchronized void onUnsubscribe(CanonicalKey key) {
        if (webSocket == null) {
            return;
        }

        if (getSubscriptions().isEmpty()) {
            webSocket.close(1000, "no channels left");
            webSocket = null;
            open = false;
            return;
        }

        if (open) {
            webSocket.send("PART #" + key.getId());
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

        if (reconnectTimer != null) {
            reconnectTimer.cancel();
            reconnectTimer = null;
        }
    }

    private void connect() {
        open = false;
        Request request = new Request.Builder().url(IRC_URL).build();

        webSocket = client.newWebSocket(request, new WebSocketListener() {
            @Override
            public void onOpen(WebSocket socket, Response response) {
                synchronized (TwitchChatDriver.this) {
                    socket.send("CAP REQ :twitch.tv/tags twitch.tv/commands");
                    socket.send("PASS SCHMOOPIIE");
                    socket.send("NICK " + nick);

                    for (CanonicalKey key : getSubscriptions()) {
                        socket.send("JOIN #" + key.getId());
                    }

                    open = true;
                }

                OmniDock.LOGGER.info("Connected to Twitch chat as " + nick);
            }

            @Override
            public void onMessage(WebSocket socket, String text) {
                for (String line : text.split("\r\n")) {
                    if (line.isEmpty()) {
                        continue;
                    }

                    if (line.startsWith("PING")) {
                        socket.send("PONG" + line.substring(4));
                        continue;
                    }

                    ChatEvent event = parseLine(line);

                    if (event != null) {
                        deliver(event);
                    }
                }
            }

            @Override
            public void onFailure(WebSocket socket, Throwable t, Response response) {
                OmniDock.LOGGER.warning("Twitch chat connection failed: " + t.getMessage());
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
        open = false;

        if (getSubscriptions().isEmpty()) {
            return;
        }

        if (reconnectTimer == null) {
            reconnectTimer = new Timer("TwitchChatDriver", true);
        }

        reconnectTimer.schedule(new TimerTask() {
            @Override
            public void run() {
                synchronized (TwitchChatDriver.this) {
                    if (webSocket == null && !getSubscriptions().isEmpty()) {
                        connect();
                    }
                }
            }
        }, RECONNECT_DELAY);
    }

    /**
     * Parses one IRC line. Only {@code PRIVMSG} produces an event.
     */
    static ChatEvent parseLine(String line) {
        Map<String, String> tags = new HashMap<>();
        String rest = line;

        if (rest.startsWith("@")) {
            int space = rest.indexOf(' ');

            if (space < 0) {
                return null;
            }

            for (String tag : rest.substring(1, space).split(";")) {
                int equals = tag.indexOf('=');

                if (equals > 0) {
                    tags.put(tag.substring(0, equals), unescapeTag(tag.substring(equals + 1)));
                }
            }

            rest = rest.substring(space + 1);
        }

        String prefix = null;

        if (rest.startsWith(":")) {
            int space = rest.indexOf(' ');

            if (space < 0) {
                return null;
            }

            prefix = rest.substring(1, space);
            rest = rest.substring(space + 1);
        }

        if (!rest.startsWith("PRIVMSG #")) {
            return null;
        }

        rest = rest.substring("PRIVMSG #".length());
        int textStart = rest.indexOf(" :");

        if (textStart <= 0) {
            return null;
        }

        String channel = rest.substring(0, textStart);
        String text = rest.substring(textStart + 2);
        String author = tags.get("display-name");

        if ((author == null || author.isEmpty()) && prefix != null) {
            int bang = prefix.indexOf('!');
            author = bang > 0 ? prefix.substring(0, bang) : prefix;
        }

        Long timestamp = null;
        String sentTs = tags.get("tmi-sent-ts");

        if (sentTs != null) {
            try {
                timestamp = Long.parseLong(sentTs);
            } catch (NumberFormatException e) {
                OmniDock.LOGGER.fine("Ignoring bad tmi-sent-ts " + sentTs);
            }
        }

        return ChatEvent.of(CanonicalKey.of(Platform.TWITCH, channel), author, text, timestamp);
    }

    private static String unescapeTag(String value) {
        return value.replace("\\s", " ").replace("\\:", ";").replace("\\\\", "\\");
    }
}
