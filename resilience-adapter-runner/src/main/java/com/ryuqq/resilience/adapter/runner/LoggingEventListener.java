package com.ryuqq.resilience.adapter.runner;

import com.ryuqq.resilience.core.event.CacheHit;
import com.ryuqq.resilience.core.event.CacheMiss;
import com.ryuqq.resilience.core.event.CircuitStateChanged;
import com.ryuqq.resilience.core.event.FallbackUsed;
import com.ryuqq.resilience.core.event.RateLimitWait;
import com.ryuqq.resilience.core.event.ResilienceEvent;
import com.ryuqq.resilience.core.event.ResilienceEventListener;
import com.ryuqq.resilience.core.event.RetryScheduled;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 이벤트를 DEBUG 로그로 남기는 수신자.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class LoggingEventListener implements ResilienceEventListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingEventListener.class);

    @Override
    public void onEvent(ResilienceEvent event) {
        if (!log.isDebugEnabled()) {
            return;
        }
        if (event instanceof CircuitStateChanged changed) {
            log.debug("[event] circuit {}: {} -> {} (failures={})",
                changed.dependencyKey(), changed.from(), changed.to(), changed.failureCount());
        } else if (event instanceof RetryScheduled retry) {
            log.debug("[event] retry {}: attempt {} failed ({}), delay={}ms",
                retry.dependencyKey(), retry.failedAttempt(), retry.errorKind(), retry.delay().toMillis());
        } else if (event instanceof CacheHit hit) {
            log.debug("[event] cache hit {}: {}", hit.dependencyKey(), hit.cacheKey());
        } else if (event instanceof CacheMiss miss) {
            log.debug("[event] cache miss {}: {}", miss.dependencyKey(), miss.cacheKey());
        } else if (event instanceof RateLimitWait wait) {
            log.debug("[event] rate limit wait {}: {}ms until {}",
                wait.dependencyKey(), wait.waitTime().toMillis(), wait.resetTime());
        } else if (event instanceof FallbackUsed fallback) {
            log.debug("[event] fallback {}: reason={}, attempts={}",
                fallback.dependencyKey(), fallback.reason(), fallback.attempts());
        }
    }
}
