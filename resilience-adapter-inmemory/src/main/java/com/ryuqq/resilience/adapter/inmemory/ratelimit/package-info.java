/**
 * In-memory Rate Limit tracking adapter.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.inmemory.ratelimit;
