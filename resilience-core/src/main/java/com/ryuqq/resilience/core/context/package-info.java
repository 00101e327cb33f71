/**
 * 실행 컨텍스트 패키지.
 *
 * <p>취소 신호와 데드라인을 작업과 가드 계층에 전달합니다.</p>
 *
 * <h2>리소스 규칙</h2>
 * <ul>
 *   <li>{@code withCancel()}/{@code withTimeout()}으로 만든 컨텍스트는 사용 후 반드시 {@code cancel()}</li>
 *   <li>데드라인 타이머는 하나의 데몬 스케줄러를 공유하며, 컨텍스트가 종료되면 즉시 제거됨</li>
 *   <li>루트 컨텍스트({@code background()})는 자식이나 리스너를 보관하지 않음</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.context;
