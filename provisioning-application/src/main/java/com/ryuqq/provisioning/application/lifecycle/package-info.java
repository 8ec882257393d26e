/**
 * App lifecycle application layer - 명령 조정 API.
 *
 * <p>저장소에서 스냅샷을 로드하고, Typestate 변형으로 복원하고, 연산을 호출한 뒤
 * 발생한 이벤트를 버전 조건부로 저장합니다.</p>
 *
 * <h2>핵심 클래스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.provisioning.application.lifecycle.AppLifecycleService} - 명령 조정자</li>
 *   <li>{@link com.ryuqq.provisioning.application.lifecycle.CommandResult} - 명령 결과 (Applied, Conflict, Rejected)</li>
 *   <li>{@link com.ryuqq.provisioning.application.lifecycle.AppLifecycleConfig} - 설정</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 저장소와 발행자는 core SPI로만 접근</li>
 *   <li><strong>낙관적 동시성:</strong> 로드한 version을 expectedVersion으로 전달</li>
 *   <li><strong>불변성:</strong> 결과 객체는 불변</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
package com.ryuqq.provisioning.application.lifecycle;
