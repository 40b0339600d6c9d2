package com.phillippitts.modelrelay.service.task;

/** Operation a task performs against its provider. */
public enum TaskKind {
    CHAT_COMPLETION,
    CODE_COMPLETION,
    CODE_ANALYSIS,
    CODE_EXPLANATION,
    HEALTH_CHECK
}
