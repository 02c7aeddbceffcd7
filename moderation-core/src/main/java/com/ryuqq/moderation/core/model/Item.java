package com.ryuqq.moderation.core.model;

/**
 * 모더레이션 대상 아이템 (판매자 인증 여부 포함).
 *
 * <p>Fingerprint와 모델 입력 특징값은 모두 이 레코드의 내용 필드에서만 계산됩니다.</p>
 *
 * @param id 아이템 ID
 * @param sellerId 판매자 ID
 * @param name 이름
 * @param description 설명
 * @param category 카테고리
 * @param imagesQty 이미지 개수 (0 이상)
 * @param sellerVerified 판매자 인증 여부
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public record Item(
    long id,
    long sellerId,
    String name,
    String description,
    int category,
    int imagesQty,
    boolean sellerVerified
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 범위를 벗어난 경우
     */
    public Item {
        if (id <= 0) {
            throw new IllegalArgumentException("id must be positive (current: " + id + ")");
        }
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (description == null) {
            throw new IllegalArgumentException("description cannot be null");
        }
        if (imagesQty < 0) {
            throw new IllegalArgumentException("imagesQty must be non-negative (current: " + imagesQty + ")");
        }
    }
}
