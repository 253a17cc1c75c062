package com.sparta.redemption.domain.fraud;

import com.sparta.redemption.domain.fraud.vo.GeoPoint;

import java.time.Instant;

/**
 * 사기 탐지 대상이 되는 사용 시도 (요청마다 생성, 저장하지 않음)
 */
public record RedemptionAttempt(
        String voucherId,
        String customerId,
        String providerId,
        GeoPoint location,
        Instant timestamp
) {

    public RedemptionAttempt {
        if (voucherId == null || customerId == null || providerId == null || timestamp == null) {
            throw new IllegalArgumentException("바우처/고객/제공자 ID와 시각은 필수입니다");
        }
    }
}
