package com.phillippitts.modelrelay.domain;

import java.util.Objects;

/**
 * Result of a chat completion.
 *
 * <p>Immutable, so a cached instance can be handed to any number of callers without copying.
 *
 * @param content generated text
 * @param model   model that produced the text
 * @param usage   token accounting, {@link Usage#EMPTY} when the provider reports none
 */
public record ChatResponse(String content, String model, Usage usage) {

    public ChatResponse {
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(model, "model must not be null");
        if (usage == null) {
            usage = Usage.EMPTY;
        }
    }

    public static ChatResponse of(String content, String model) {
        return new ChatResponse(content, model, Usage.EMPTY);
    }
}
