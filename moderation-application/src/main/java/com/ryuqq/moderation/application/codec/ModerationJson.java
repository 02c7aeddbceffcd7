package com.ryuqq.moderation.application.codec;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * 메시지 JSON 공용 설정.
 *
 * <p>모든 코덱은 같은 ObjectMapper 설정을 사용합니다. 알 수 없는 필드는 무시하고,
 * null 필드는 직렬화하지 않으며, 시각은 ISO-8601 문자열로 씁니다.</p>
 *
 * @author Moderation Team
 * @since 1.0.0
 */
public final class ModerationJson {

    private ModerationJson() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 코덱용 ObjectMapper 생성.
     *
     * @return 설정된 ObjectMapper
     */
    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * ISO-8601 시각 파싱.
     *
     * <p>오프셋이 없는 로컬 시각 ({@code 2024-01-01T12:00:00.123456})은 UTC로 간주합니다.</p>
     *
     * @param text 시각 문자열
     * @return Instant
     * @throws DateTimeParseException 두 형식 모두 아닌 경우
     */
    static Instant parseInstant(String text) {
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        }
    }
}
