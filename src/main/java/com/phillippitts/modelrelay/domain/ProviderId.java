package com.phillippitts.modelrelay.domain;

/**
 * Identifies an LLM backend the relay can dispatch to.
 */
public enum ProviderId {
    COPILOT("copilot"),
    CLAUDE("claude"),
    OPENAI("openai"),
    OLLAMA("ollama"),
    GHOSTLLM("ghostllm");

    private final String displayName;

    ProviderId(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Lower-case name used in logs, metric tags and the MDC.
     */
    public String displayName() {
        return displayName;
    }
}
