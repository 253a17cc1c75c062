package com.sparta.redemption.application.redemption.dto;

import com.sparta.redemption.domain.fraud.vo.GeoPoint;

import java.time.Instant;

/**
 * 오프라인 단말에서 사용 처리된 건
 *
 * @param token 단말이 받은 사용 토큰
 * @param location 사용 위치 (선택)
 * @param redeemedAt 단말에서 사용 처리한 시각
 */
public record OfflineRedemption(
        String token,
        GeoPoint location,
        Instant redeemedAt
) {

    public OfflineRedemption {
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("토큰은 필수입니다");
        }
        if (redeemedAt == null) {
            throw new IllegalArgumentException("사용 시각은 필수입니다");
        }
    }
}
