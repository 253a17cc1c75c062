package com.sparta.redemption.domain.fraud.vo;

import java.time.Instant;

/**
 * 고객의 직전 사용 기록 (연속 사용 검사용)
 */
public record LastRedemption(Instant timestamp, String voucherId) {
}
