/**
 * In-memory TTL response cache adapter.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.inmemory.cache;
