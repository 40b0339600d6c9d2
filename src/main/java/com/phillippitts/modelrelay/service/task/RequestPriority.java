package com.phillippitts.modelrelay.service.task;

/** Caller-assigned urgency. Informational; dispatch order is not affected. */
public enum RequestPriority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL
}
