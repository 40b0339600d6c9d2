package com.phillippitts.modelrelay.domain;

import java.util.Objects;

/**
 * One turn of a chat transcript.
 *
 * @param role    speaker role, typically {@code system}, {@code user} or {@code assistant}
 * @param content message text (may be empty, never null)
 */
public record ChatMessage(String role, String content) {

    public ChatMessage {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public static ChatMessage system(String content) {
        return new ChatMessage("system", content);
    }

    public static ChatMessage user(String content) {
        return new ChatMessage("user", content);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage("assistant", content);
    }
}
