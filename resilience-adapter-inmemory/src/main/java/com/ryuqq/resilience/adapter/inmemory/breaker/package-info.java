/**
 * In-memory Circuit Breaker adapter.
 *
 * <p>Reference implementation of {@link com.ryuqq.resilience.core.protection.CircuitBreaker}
 * for single-process deployments. State is not persisted and is lost on restart.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.inmemory.breaker;
