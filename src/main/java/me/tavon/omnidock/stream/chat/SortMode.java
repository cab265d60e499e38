package me.tavon.omnidock.stream.chat;

import com.google.gson.annotations.SerializedName;

public enum SortMode {

    /**
     * Source timestamp when the message has one, otherwise the arrival wall time; ties by arrival.
     */
    @SerializedName("timestamp")
    TIMESTAMP,

    /**
     * Strictly the order messages were ingested in.
     */
    @SerializedName("arrival")
    ARRIVAL
}
