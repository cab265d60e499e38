package me.tavon.omnidock.driver;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import me.tavon.omnidock.channel.CanonicalKey;
import me.tavon.omnidock.channel.EmbedRecord;
import me.tavon.omnidock.channel.Platform;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class KickDriver implements LivenessDriver {

    private OkHttpClient client;

    public static final String USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 " +
            "(KHTML, like Gecko) Chrome/134.0.0.0 Safari/537.36";

    public KickDriver(OkHttpClient client) {
        this.client = client;
    }

    @Override
    public Platform getPlatform() {
        return Platform.KICK;
    }

    @Override
    public LivenessResult checkLive(String slug) throws Exception {
        return parseChannel(slug, getChannelJson(client, slug));
    }

    public static String getChannelJson(OkHttpClient client, String slug) throws Exception {
        HttpUrl url = HttpUrl.get("https://kick.com/api/v2/channels/").newBuilder()
                .addPathSegment(slug)
                .build();

        Request request = new Request.Builder()
                .url(url)
                .get()
                .addHeader("accept", "application/json")
                .addHeader("origin", "https://kick.com")
                .addHeader("referer", "https://kick.com/" + slug)
                .addHeader("user-agent", USER_AGENT)
                .addHeader("cache-control", "no-cache")
                .build();

        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();

            if (response.code() != 200 || body == null) {
                throw new Exception("Didn't get 200 or empty body");
            }

            return body.string();
        }
    }

    static LivenessResult parseChannel(String slug, String json) {
        JsonElement element = new JsonParser().parse(json);

        if (!element.isJsonObject()) {
            return LivenessResult.failed("channel response is not an object");
        }

        JsonObject channel = element.getAsJsonObject();

        if (channel.has("data") && channel.get("data").isJsonObject()) {
            channel = channel.getAsJsonObject("data");
        }

        CanonicalKey key = CanonicalKey.of(Platform.KICK, slug);
        JsonObject livestream = objectOrNull(channel, "livestream");

        if (livestream != null && (livestream.has("id") || livestream.has("slug") || livestream.has("channel_id"))) {
            String title = stringOrNull(livestream, "session_title");
            Long viewers = livestream.has("viewer_count") && !livestream.get("viewer_count").isJsonNull()
                    ? livestream.get("viewer_count").getAsLong() : null;
            JsonObject thumbnail = objectOrNull(livestream, "thumbnail");
            String thumbnailUrl = thumbnail == null ? null : stringOrNull(thumbnail, "url");

            return LivenessResult.live(new EmbedRecord(key, slug, title, viewers, null, thumbnailUrl,
                    false, null));
        }

        JsonObject stream = objectOrNull(channel, "stream");

        if (stream != null && stream.has("is_live") && stream.get("is_live").getAsBoolean()) {
            return LivenessResult.live(EmbedRecord.of(key, stringOrNull(stream, "title")));
        }

        return LivenessResult.offline();
    }

    static JsonObject objectOrNull(JsonObject object, String member) {
        JsonElement element = object.get(member);
        return element == null || !element.isJsonObject() ? null : element.getAsJsonObject();
    }

    static String stringOrNull(JsonObject object, String member) {
        JsonElement element = object.get(member);
        return element == null || element.isJsonNull() ? null : element.getAsString();
    }
}
