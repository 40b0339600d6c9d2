/**
 * Immutable request and response values exchanged with provider clients.
 *
 * <p>All types are records that validate in their compact constructors. A
 * {@link com.phillippitts.modelrelay.domain.ChatResponse} held by the response cache is shared
 * between callers as is.
 */
package com.phillippitts.modelrelay.domain;
