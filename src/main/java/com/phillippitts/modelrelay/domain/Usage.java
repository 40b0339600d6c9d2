package com.phillippitts.modelrelay.domain;

/**
 * Token accounting reported by a provider.
 */
public record Usage(int promptTokens, int completionTokens, int totalTokens) {

    public static final Usage EMPTY = new Usage(0, 0, 0);

    public Usage {
        if (promptTokens < 0 || completionTokens < 0 || totalTokens < 0) {
            throw new IllegalArgumentException("Token counts must be >= 0");
        }
    }

    /**
     * Creates usage with {@code totalTokens} derived from the two parts.
     */
    public static Usage of(int promptTokens, int completionTokens) {
        return new Usage(promptTokens, completionTokens, promptTokens + completionTokens);
    }
}
