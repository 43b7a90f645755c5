/**
 * 런타임 환경 SPI.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.spi;
