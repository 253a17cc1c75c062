package com.sparta.redemption.domain.fraud;

import com.sparta.redemption.domain.fraud.vo.GeoPoint;

import java.time.Instant;
import java.util.List;

/**
 * 감사 로그(고객/제공자/관리자 대시보드)에 쌓이는 의심 사용 요약
 */
public record FraudAuditEntry(
        String voucherId,
        String customerId,
        String providerId,
        GeoPoint location,
        Instant timestamp,
        List<FraudFlag> flags,
        int riskScore
) {

    public static FraudAuditEntry of(RedemptionAttempt attempt, FraudCheckResult result) {
        return new FraudAuditEntry(
                attempt.voucherId(),
                attempt.customerId(),
                attempt.providerId(),
                attempt.location(),
                attempt.timestamp(),
                result.flags(),
                result.riskScore()
        );
    }
}
