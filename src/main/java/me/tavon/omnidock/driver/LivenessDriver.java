package me.tavon.omnidock.driver;

import me.tavon.omnidock.channel.Platform;

public interface LivenessDriver {

    Platform getPlatform();

    /**
     * Checks whether the bookmarked identifier is live right now. Must be safe to call concurrently
     * for different identifiers.
     *
     * @throws Exception when the platform could not be reached or answered with something unusable
     */
    LivenessResult checkLive(String identifier) throws Exception;
}
