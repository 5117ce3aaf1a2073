package com.questrail.pype.protocol.model;

import java.util.Objects;

/**
 * The three multicast group addresses assigned to one call, one per {@link Medium}.
 */
public record MediaAddresses(String audio, String video, String chat) {
    public MediaAddresses {
        Objects.requireNonNull(audio, "audio");
        Objects.requireNonNull(video, "video");
        Objects.requireNonNull(chat, "chat");
    }

    public String forMedium(Medium medium) {
        Objects.requireNonNull(medium, "medium");
        switch (medium) {
            case AUDIO:
                return audio;
            case VIDEO:
                return video;
            case CHAT:
                return chat;
            default:
                throw new IllegalArgumentException("Unhandled medium: " + medium);
        }
    }
}
