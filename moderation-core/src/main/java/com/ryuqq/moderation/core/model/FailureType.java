package com.ryuqq.moderation.core.model;

/**
 * Dead-letter 라우팅 사유 분류.
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public enum FailureType {

    /**
     * 영구 실패: 재시도 없이 즉시 dead-letter.
     */
    PERMANENT,

    /**
     * 일시적 실패가 재시도 한도까지 반복됨.
     */
    EXHAUSTED_RETRIES
}
