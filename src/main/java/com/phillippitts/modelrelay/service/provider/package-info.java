/**
 * Provider abstraction and routing.
 *
 * <p>{@link com.phillippitts.modelrelay.service.provider.ProviderClient} is the seam vendor
 * adapters implement. {@link com.phillippitts.modelrelay.service.provider.ProviderManager}
 * holds one client per provider, tracks health, and picks providers by capability.
 */
package com.phillippitts.modelrelay.service.provider;
