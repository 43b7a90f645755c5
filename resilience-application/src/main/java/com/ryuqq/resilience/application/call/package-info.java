/**
 * 호출자용 Resilient Call API.
 *
 * <ul>
 *   <li>{@link com.ryuqq.resilience.application.call.CallOrchestrator} - 호출 조정자</li>
 *   <li>{@link com.ryuqq.resilience.application.call.CallRequest} - 호출 요청</li>
 *   <li>{@link com.ryuqq.resilience.application.call.CallResult} - 출처가 표시된 호출 결과</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.application.call;
