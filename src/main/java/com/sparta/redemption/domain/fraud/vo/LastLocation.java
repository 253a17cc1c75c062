package com.sparta.redemption.domain.fraud.vo;

import java.time.Instant;

/**
 * 고객의 직전 사용 위치 (이동 속도 검사용)
 */
public record LastLocation(GeoPoint location, Instant timestamp, String providerId) {
}
