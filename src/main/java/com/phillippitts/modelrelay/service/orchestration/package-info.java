/**
 * Request orchestration: submission, waiting, cancellation, batch, race and broadcast over
 * multiple providers.
 *
 * <p>Entry point is {@link com.phillippitts.modelrelay.service.orchestration.RequestOrchestrator};
 * the Spring wiring lives in {@code config.orchestration.OrchestrationConfig}.
 */
package com.phillippitts.modelrelay.service.orchestration;
