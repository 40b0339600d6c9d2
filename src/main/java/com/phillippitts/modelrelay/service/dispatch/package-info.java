/**
 * Worker dispatch: runs provider calls on an executor and enforces per-task deadlines.
 * {@link com.phillippitts.modelrelay.service.dispatch.event.TaskCompletedEvent} is published for
 * every task that reaches a terminal state.
 */
package com.phillippitts.modelrelay.service.dispatch;
