/**
 * Runner Adapter Layer - 모더레이션 Worker 구현체.
 *
 * <h2>구성 요소</h2>
 * <ul>
 *   <li>{@link com.ryuqq.moderation.adapter.runner.ModerationWorker} - 배달 하나를 끝까지 처리하는 Worker</li>
 *   <li>{@link com.ryuqq.moderation.adapter.runner.WorkerPool} - Runtime 구현, 고정 크기 스레드 풀</li>
 *   <li>{@link com.ryuqq.moderation.adapter.runner.DeadLetterMonitor} - dead-letter 토픽 모니터 및 replay</li>
 *   <li>{@link com.ryuqq.moderation.adapter.runner.ModerationWorkerApplication} - 실행 진입점</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (WorkerPool, ModerationWorker)
 *   ↓ implements
 * application (Runtime interface, codecs, ModerationService)
 *   ↓ depends on
 * core (TaskMessage, Outcome, RetryPolicy, WorkerState)
 *   ↓ depends on
 * core/spi (MessageBus, ResultStore, PredictionCache, ModerationModel)
 * </pre>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
package com.ryuqq.moderation.adapter.runner;
