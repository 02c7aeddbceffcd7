package com.ryuqq.moderation.application.model;

/**
 * 로지스틱 모델 파라미터.
 *
 * <p>특징 순서: [판매자 인증 여부, 이미지 수, 설명 길이, 카테고리] (모두 0~1로 정규화).</p>
 *
 * @param verifiedSeller 판매자 인증 가중치
 * @param imagesQty 이미지 수 가중치
 * @param descriptionLength 설명 길이 가중치
 * @param category 카테고리 가중치
 * @param bias 절편
 * @param threshold 위반 판정 임계값 (0, 1)
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public record ModelWeights(
    double verifiedSeller,
    double imagesQty,
    double descriptionLength,
    double category,
    double bias,
    double threshold
) {

    /**
     * 기본 가중치.
     *
     * <p>인증되지 않은 판매자이면서 이미지가 적은 아이템에 높은 위반 확률을 줍니다.</p>
     */
    public static final ModelWeights DEFAULT = new ModelWeights(-6.0, -8.0, -0.5, 0.2, 2.5, 0.5);

    public ModelWeights {
        if (!Double.isFinite(verifiedSeller) || !Double.isFinite(imagesQty)
            || !Double.isFinite(descriptionLength) || !Double.isFinite(category) || !Double.isFinite(bias)) {
            throw new IllegalArgumentException("weights must be finite");
        }
        if (!(threshold > 0.0 && threshold < 1.0)) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0 (current: " + threshold + ")");
        }
    }
}
