package com.phillippitts.modelrelay.domain;

import java.util.Objects;

/** Result of an inline code completion. */
public record CompletionResponse(String text, String model, Usage usage) {

    public CompletionResponse {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(model, "model must not be null");
        if (usage == null) {
            usage = Usage.EMPTY;
        }
    }
}
