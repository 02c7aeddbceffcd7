package com.ryuqq.moderation.core.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 아이템 내용 기반의 결정적 캐시 키.
 *
 * <p>이름, 설명, 카테고리, 이미지 개수, 판매자 인증 여부만으로 계산되며,
 * 아이템 ID나 판매자 ID는 포함하지 않습니다. 따라서 내용이 같은 두 아이템은
 * 같은 Fingerprint를 가지고 예측 결과를 공유합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * SHA-256( len(name) ":" name "|" len(description) ":" description "|"
 *          category "|" imagesQty "|" (verified ? 1 : 0) )  → 소문자 hex 64자
 * </pre>
 *
 * <p>문자열 필드는 길이 접두사를 붙여 구분자 충돌을 막습니다.</p>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public final class Fingerprint {

    private static final int HEX_LENGTH = 64;

    private final String value;

    private Fingerprint(String value) {
        if (value == null || value.length() != HEX_LENGTH) {
            throw new IllegalArgumentException("Fingerprint must be a 64-character hex string (current: " + value + ")");
        }
        this.value = value;
    }

    /**
     * 아이템 내용으로부터 Fingerprint 계산.
     *
     * @param item 아이템
     * @return Fingerprint
     * @throws IllegalArgumentException item이 null인 경우
     */
    public static Fingerprint of(Item item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        String canonical = item.name().length() + ":" + item.name()
            + "|" + item.description().length() + ":" + item.description()
            + "|" + item.category()
            + "|" + item.imagesQty()
            + "|" + (item.sellerVerified() ? 1 : 0);
        return new Fingerprint(sha256Hex(canonical));
    }

    /**
     * 이미 계산된 hex 값으로 Fingerprint 복원.
     *
     * @param hex 64자 hex 문자열
     * @return Fingerprint
     * @throws IllegalArgumentException 형식이 올바르지 않은 경우
     */
    public static Fingerprint fromHex(String hex) {
        return new Fingerprint(hex == null ? null : hex.toLowerCase());
    }

    /**
     * Fingerprint 값 조회.
     *
     * @return 소문자 hex 문자열
     */
    public String getValue() {
        return value;
    }

    private static String sha256Hex(String canonical) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            // 모든 JDK는 SHA-256을 제공해야 함
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Fingerprint that = (Fingerprint) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Fingerprint{" + value.substring(0, 12) + "…}";
    }
}
