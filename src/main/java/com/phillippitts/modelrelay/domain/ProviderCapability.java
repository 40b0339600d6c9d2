package com.phillippitts.modelrelay.domain;

/**
 * Features a provider may advertise in its configuration.
 */
public enum ProviderCapability {
    CHAT_COMPLETION,
    CODE_COMPLETION,
    CODE_ANALYSIS,
    CODE_EXPLANATION,
    CODE_REFACTORING,
    TEST_GENERATION,
    PROJECT_CONTEXT,
    COMMIT_GENERATION,
    SECURITY_SCANNING,
    STREAMING
}
