package me.tavon.omnidock.stream.chat;

import me.tavon.omnidock.channel.BookmarkedStreamer;
import me.tavon.omnidock.channel.CanonicalKey;
import me.tavon.omnidock.channel.EmbedRecord;
import me.tavon.omnidock.registry.LiveEmbedRegistry;
import me.tavon.omnidock.registry.RegistryState;

/**
 * Labels and colors chat sources from the registry's current state. A bookmarked streamer's nickname
 * and colors win over what the embed record says.
 */
public class RegistryDisplayResolver implements DisplayResolver {

    private final LiveEmbedRegistry registry;
    private final String primaryName;

    public RegistryDisplayResolver(LiveEmbedRegistry registry, String primaryName) {
        this.registry = registry;
        this.primaryName = primaryName;
    }

    @Override
    public DisplayAttributes resolve(CanonicalKey key) {
        if (CanonicalKey.PRIMARY_CHAT.equals(key)) {
            return new DisplayAttributes(primaryName, SourceColors.PRIMARY_COLOR, false);
        }

        RegistryState state = registry.state();
        BookmarkedStreamer streamer = state.findStreamer(key);

        if (streamer != null) {
            String color = streamer.getPlatformColor(key.getPlatform());

            if (isBlank(color)) {
                color = streamer.getMasterColor();
            }

            if (isBlank(color)) {
                color = SourceColors.forKey(key);
            }

            return new DisplayAttributes(streamer.getNickname(), color, streamer.isHideLabel());
        }

        EmbedRecord record = state.resolve(key);
        String label = record == null || isBlank(record.getTitle()) ? key.getId() : record.getTitle();

        return new DisplayAttributes(label, SourceColors.forKey(key), false);
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
