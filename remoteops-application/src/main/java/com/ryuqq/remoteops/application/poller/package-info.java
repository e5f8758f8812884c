/**
 * Application Layer - 원격 Job 완료 대기 API.
 *
 * <p>Job을 제출하고 종료 상태 또는 데드라인까지 호출 스레드를 블로킹하며 폴링합니다.</p>
 *
 * <h2>핵심 컴포넌트</h2>
 * <ul>
 *   <li>{@link com.ryuqq.remoteops.application.poller.JobPoller} - 제출 및 폴링 루프</li>
 *   <li>{@link com.ryuqq.remoteops.application.poller.PollConfig} - timeout / checkInterval 설정</li>
 *   <li>{@link com.ryuqq.remoteops.application.poller.JobHandle} - 제출 결과 핸들</li>
 *   <li>{@link com.ryuqq.remoteops.application.poller.Sleeper} - 폴링 간 대기 전략</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>시간 주입:</strong> {@link java.time.Clock}과 Sleeper로 테스트에서 시간을 제어</li>
 *   <li><strong>재시도 없음:</strong> FAILED/CANCELLED/TIMEOUT 이후 재제출은 호출자 책임</li>
 * </ul>
 *
 * @author RemoteOps Team
 * @since 1.0.0
 */
package com.ryuqq.remoteops.application.poller;
