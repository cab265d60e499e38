package me.tavon.omnidock.driver.chat;

import me.tavon.omnidock.stream.chat.ChatEvent;

public interface ChatSink {

    void accept(ChatEvent event);
}
