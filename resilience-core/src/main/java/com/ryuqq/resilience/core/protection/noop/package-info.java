/**
 * Protection SPI의 NoOp 구현.
 *
 * <p>보호 없이 실행하고자 할 때 {@code ResilienceRegistry}에 주입합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.protection.noop;
