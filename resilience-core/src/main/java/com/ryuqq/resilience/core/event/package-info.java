/**
 * Resilience 이벤트 모델.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.event;
