/**
 * Task model and registry. A {@link com.phillippitts.modelrelay.service.task.RequestTask} moves
 * PENDING, IN_PROGRESS, then exactly one of COMPLETED, FAILED or CANCELLED.
 */
package com.phillippitts.modelrelay.service.task;
