package me.tavon.omnidock.stream.chat;

import me.tavon.omnidock.channel.CanonicalKey;

public interface DisplayResolver {

    DisplayAttributes resolve(CanonicalKey key);
}
