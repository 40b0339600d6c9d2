/**
 * Chat response caching.
 *
 * <p>{@link com.phillippitts.modelrelay.service.cache.TwoTierResponseCache} keeps a bounded map in
 * memory and mirrors it to SQLite through
 * {@link com.phillippitts.modelrelay.service.cache.ResponseCacheRepository}.
 * {@link com.phillippitts.modelrelay.service.cache.NoOpResponseCache} is wired when caching is off.
 */
package com.phillippitts.modelrelay.service.cache;
