package me.tavon.omnidock.driver;

import com.google.api.services.youtube.YouTube;
import com.google.api.services.youtube.model.SearchListResponse;
import com.google.api.services.youtube.model.SearchResult;
import com.google.api.services.youtube.model.Thumbnail;
import com.google.api.services.youtube.model.Video;
import com.google.api.services.youtube.model.VideoListResponse;
import me.tavon.omnidock.channel.CanonicalKey;
import me.tavon.omnidock.channel.EmbedRecord;
import me.tavon.omnidock.channel.Platform;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.math.BigInteger;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Polls a YouTube channel id. The live embed is keyed by the video id currently streaming, so the
 * returned record's key changes every broadcast.
 * <p>
 * With an API key the Data API is used; without one the channel's live playlist feed is read and the
 * first video verified against its watch page.
 */
public class YoutubeDriver implements LivenessDriver {

    private YouTube youtube;
    private OkHttpClient client;
    private String apiKey;

    private static final Pattern FEED_VIDEO_ID = Pattern.compile("<yt:videoId>([a-zA-Z0-9_-]{11})</yt:videoId>");
    private static final Pattern FEED_CHANNEL_ID = Pattern.compile("<yt:channelId>(UC[\\w-]{22})</yt:channelId>");
    private static final Pattern FEED_ENTRY_TITLE = Pattern.compile("<entry>[\\s\\S]*?<title>([^<]*)</title>");
    private static final Pattern[] LIVE_MARKERS = new Pattern[]{
            Pattern.compile("\"isLive\"\\s*:\\s*true"),
            Pattern.compile("\"isLiveNow\"\\s*:\\s*true"),
            Pattern.compile("\"status\"\\s*:\\s*\"LIVE\""),
            Pattern.compile("\"liveBroadcastDetails\"\\s*:\\s*\\{[^}]*\"isLiveNow\"\\s*:\\s*true")
    };

    public YoutubeDriver(YouTube youtube, OkHttpClient client, String apiKey) {
        this.youtube = youtube;
        this.client = client;
        this.apiKey = apiKey == null || apiKey.trim().isEmpty() ? null : apiKey.trim();
    }

    @Override
    public Platform getPlatform() {
        return Platform.YOUTUBE;
    }

    @Override
    public LivenessResult checkLive(String channelId) throws Exception {
        if (apiKey != null && youtube != null) {
            return checkLiveWithApi(channelId);
        }

        return checkLiveWithFeed(channelId);
    }

    private LivenessResult checkLiveWithApi(String channelId) throws Exception {
        YouTube.Search.List search;
        try {
            search = youtube.search().list("id");
        } catch (IOException e) {
            throw new Exception("Could not create search", e);
        }

        search.setKey(apiKey);
        search.setChannelId(channelId);
        search.setEventType("live");
        search.setType("video");
        search.setMaxResults(1L);
        search.setFields("items(id/videoId)");

        SearchListResponse searchResponse;
        try {
            searchResponse = search.execute();
        } catch (IOException e) {
            throw new Exception("Could not execute search", e);
        }

        List<SearchResult> results = searchResponse.getItems();

        if (results == null || results.isEmpty()) {
            return LivenessResult.offline();
        }

        String videoId = results.get(0).getId().getVideoId();

        YouTube.Videos.List videosListByIdRequest = youtube.videos().list("snippet,liveStreamingDetails");
        videosListByIdRequest.setKey(apiKey);
        videosListByIdRequest.setId(videoId);

        VideoListResponse response = videosListByIdRequest.execute();

        if (response.getItems() == null || response.getItems().isEmpty()) {
            throw new Exception("videos response is empty");
        }

        return toResult(response.getItems().get(0));
    }

    static LivenessResult toResult(Video video) {
        if (video.getSnippet() != null && !"live".equals(video.getSnippet().getLiveBroadcastContent())) {
            return LivenessResult.offline();
        }

        String title = video.getSnippet() == null ? null : video.getSnippet().getTitle();
        Long viewers = null;

        if (video.getLiveStreamingDetails() != null) {
            BigInteger concurrent = video.getLiveStreamingDetails().getConcurrentViewers();
            viewers = concurrent == null ? null : concurrent.longValue();
        }

        String thumbnailUrl = null;

        if (video.getSnippet() != null && video.getSnippet().getThumbnails() != null) {
            Thumbnail thumbnail = video.getSnippet().getThumbnails().getHigh();

            if (thumbnail == null) {
                thumbnail = video.getSnippet().getThumbnails().getDefault();
            }

            thumbnailUrl = thumbnail == null ? null : thumbnail.getUrl();
        }

        CanonicalKey key = CanonicalKey.of(Platform.YOUTUBE, video.getId());
        return LivenessResult.live(new EmbedRecord(key, video.getId(), title, viewers, null, thumbnailUrl,
                false, null));
    }

    private LivenessResult checkLiveWithFeed(String channelId) throws Exception {
        String playlistId = livePlaylistId(channelId);

        if (playlistId == null) {
            throw new Exception("not a channel id: " + channelId);
        }

        String feed = fetch("https://www.youtube.com/feeds/videos.xml?playlist_id=" + playlistId);
        FeedEntry entry = parseLiveFeed(feed, channelId);

        if (entry == null) {
            return LivenessResult.offline();
        }

        // the live playlist keeps the last broadcast after it ends
        if (!isLivePage(fetch("https://www.youtube.com/watch?v=" + entry.videoId))) {
            return LivenessResult.offline();
        }

        return LivenessResult.live(EmbedRecord.of(CanonicalKey.of(Platform.YOUTUBE, entry.videoId), entry.title));
    }

    private String fetch(String url) throws Exception {
        Request request = new Request.Builder()
                .url(url)
                .get()
                .addHeader("user-agent", KickDriver.USER_AGENT)
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

    static String livePlaylistId(String channelId) {
        if (channelId == null || !channelId.startsWith("UC") || channelId.length() < 3) {
            return null;
        }

        return "UULV" + channelId.substring(2);
    }

    static FeedEntry parseLiveFeed(String xml, String channelId) {
        Matcher videoMatcher = FEED_VIDEO_ID.matcher(xml);

        if (!videoMatcher.find()) {
            return null;
        }

        Matcher channelMatcher = FEED_CHANNEL_ID.matcher(xml);

        if (channelMatcher.find() && !channelMatcher.group(1).equals(channelId)) {
            return null;
        }

        Matcher titleMatcher = FEED_ENTRY_TITLE.matcher(xml);
        String title = titleMatcher.find() ? titleMatcher.group(1) : null;

        return new FeedEntry(videoMatcher.group(1), title);
    }

    static boolean isLivePage(String html) {
        for (Pattern marker : LIVE_MARKERS) {
            if (marker.matcher(html).find()) {
                return true;
            }
        }

        return false;
    }

    static final class FeedEntry {

        final String videoId;
        final String title;

        FeedEntry(String videoId, String title) {
            this.videoId = videoId;
            this.title = title;
        }
    }
}
