package com.ryuqq.moderation.core.model;

/**
 * 모델 추론 결과.
 *
 * <p>Prediction Cache의 값이자 Result Store 완료 레코드의 내용입니다.
 * 동일한 입력에 대해 모델은 항상 동일한 Prediction을 반환합니다.</p>
 *
 * @param violation 위반 여부
 * @param probability 위반 확률 (0.0 ~ 1.0)
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public record Prediction(
    boolean violation,
    double probability
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException probability가 [0, 1] 범위를 벗어난 경우
     */
    public Prediction {
        if (Double.isNaN(probability) || probability < 0.0 || probability > 1.0) {
            throw new IllegalArgumentException("probability must be between 0.0 and 1.0 (current: " + probability + ")");
        }
    }

    /**
     * Prediction 생성.
     *
     * @param violation 위반 여부
     * @param probability 위반 확률
     * @return Prediction 인스턴스
     */
    public static Prediction of(boolean violation, double probability) {
        return new Prediction(violation, probability);
    }
}
