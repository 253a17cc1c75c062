package com.sparta.redemption.domain.shortcode;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * 숏코드 조회 결과
 *
 * 불변식:
 * - DYNAMIC: customerId, expiresAt 필수
 * - STATIC: customerId, expiresAt 없음
 */
public record ShortCodeRecord(
        String code,
        String voucherId,
        ShortCodeKind kind,
        String customerId,
        Instant expiresAt
) {

    public ShortCodeRecord {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("숏코드는 필수입니다");
        }
        if (voucherId == null || voucherId.isBlank()) {
            throw new IllegalArgumentException("바우처 ID는 필수입니다");
        }
        if (kind == null) {
            throw new IllegalArgumentException("숏코드 종류는 필수입니다");
        }
        if (kind == ShortCodeKind.DYNAMIC && (customerId == null || customerId.isBlank() || expiresAt == null)) {
            throw new IllegalArgumentException("동적 숏코드는 고객 ID와 만료 시각이 필요합니다");
        }
        if (kind == ShortCodeKind.STATIC && (customerId != null || expiresAt != null)) {
            throw new IllegalArgumentException("고정 숏코드는 고객 ID와 만료 시각을 가질 수 없습니다");
        }
    }

    /**
     * 캐시/DB에서 읽은 값으로 복원 (불변식 검증 포함)
     */
    @JsonCreator
    public static ShortCodeRecord reconstruct(@JsonProperty("code") String code,
                                              @JsonProperty("voucherId") String voucherId,
                                              @JsonProperty("kind") ShortCodeKind kind,
                                              @JsonProperty("customerId") String customerId,
                                              @JsonProperty("expiresAt") Instant expiresAt) {
        return new ShortCodeRecord(code, voucherId, kind, customerId, expiresAt);
    }

    public static ShortCodeRecord dynamic(String code, String voucherId, String customerId, Instant expiresAt) {
        return new ShortCodeRecord(code, voucherId, ShortCodeKind.DYNAMIC, customerId, expiresAt);
    }

    public static ShortCodeRecord permanent(String code, String voucherId) {
        return new ShortCodeRecord(code, voucherId, ShortCodeKind.STATIC, null, null);
    }

    @JsonIgnore
    public boolean isDynamic() {
        return kind == ShortCodeKind.DYNAMIC;
    }

    /**
     * 논리적 만료 여부 (고정 코드는 만료되지 않음)
     */
    public boolean isExpiredAt(Instant now) {
        return isDynamic() && expiresAt.isBefore(now);
    }
}
