/**
 * Relay exception hierarchy.
 *
 * <p>All exceptions extend {@link com.phillippitts.modelrelay.exception.ModelRelayException}:
 * <ul>
 *   <li>{@link com.phillippitts.modelrelay.exception.RequestNotFoundException} - unknown request id</li>
 *   <li>{@link com.phillippitts.modelrelay.exception.RequestTimeoutException} - bounded wait elapsed</li>
 *   <li>{@link com.phillippitts.modelrelay.exception.NoProvidersException} - empty candidate list</li>
 *   <li>{@link com.phillippitts.modelrelay.exception.AllProvidersFailedException} - race without a winner</li>
 *   <li>{@link com.phillippitts.modelrelay.exception.ProviderException} - backend call failures, with
 *       {@link com.phillippitts.modelrelay.exception.RateLimitExceededException} and
 *       {@link com.phillippitts.modelrelay.exception.UnsupportedCapabilityException} as refinements</li>
 * </ul>
 *
 * <p>Per-task failures never surface as exceptions; they are captured in the task's error info.
 */
package com.phillippitts.modelrelay.exception;
