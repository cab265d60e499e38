package me.tavon.omnidock.driver;

import me.tavon.omnidock.channel.CanonicalKey;
import me.tavon.omnidock.channel.EmbedRecord;
import me.tavon.omnidock.channel.Platform;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class TwitchDriver implements LivenessDriver {

    private OkHttpClient client;

    private static final Pattern IS_LIVE_PATTERN = Pattern.compile("\"isLive\"\\s*:\\s*true");
    private static final Pattern TYPE_LIVE_PATTERN = Pattern.compile("\"type\"\\s*:\\s*\"live\"");
    private static final Pattern TITLE_PATTERN = Pattern.compile("<meta property=\"og:title\" content=\"([^\"]*)\"");

    public TwitchDriver(OkHttpClient client) {
        this.client = client;
    }

    @Override
    public Platform getPlatform() {
        return Platform.TWITCH;
    }

    @Override
    public LivenessResult checkLive(String login) throws Exception {
        Request request = new Request.Builder()
                .url("https://www.twitch.tv/" + login)
                .get()
                .addHeader("user-agent", KickDriver.USER_AGENT)
                .addHeader("cache-control", "no-cache")
                .build();

        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();

            if (response.code() != 200 || body == null) {
                throw new Exception("Didn't get 200 or empty body");
            }

            return parseChannelPage(login, body.string());
        }
    }

    static LivenessResult parseChannelPage(String login, String html) {
        boolean live = IS_LIVE_PATTERN.matcher(html).find()
                || (TYPE_LIVE_PATTERN.matcher(html).find() && html.contains(login));

        if (!live) {
            return LivenessResult.offline();
        }

        String title = null;
        Matcher matcher = TITLE_PATTERN.matcher(html);

        if (matcher.find()) {
            title = matcher.group(1);
        }

        return LivenessResult.live(EmbedRecord.of(CanonicalKey.of(Platform.TWITCH, login), title));
    }
}
