package com.ryuqq.resilience.core.spi;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * 비동기 대기 SPI.
 *
 * <p>백오프 대기와 Rate Limit 대기에 사용됩니다. 스레드를 점유하지 않아야 하며,
 * 반환된 Future를 취소하면 대기를 중단합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 지정한 시간 후 완료되는 Future 반환.
     *
     * @param duration 대기 시간 (0 이상)
     * @return 대기 완료 Future
     */
    CompletableFuture<Void> sleep(Duration duration);
}
