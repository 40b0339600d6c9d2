/**
 * Spring configuration: executors, response cache wiring, orchestrator wiring and typed
 * properties under {@code config.properties}.
 */
package com.phillippitts.modelrelay.config;
