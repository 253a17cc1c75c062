package com.sparta.redemption.infrastructure.kafka.fraud.message;

import com.sparta.redemption.domain.fraud.FraudCheckResult;
import com.sparta.redemption.domain.fraud.FraudFlag;
import com.sparta.redemption.domain.fraud.RedemptionAttempt;
import com.sparta.redemption.domain.fraud.vo.GeoPoint;

import java.time.Instant;
import java.util.List;

/**
 * 사기 의심 사용 건 메시지
 *
 * Kafka Topic: redemption-fraud-case
 * 메시지 키: customerId (같은 고객의 사례는 같은 파티션으로 라우팅)
 */
public record FraudCaseMessage(
        String voucherId,
        String customerId,
        String providerId,
        int riskScore,
        boolean requiresReview,
        List<FraudFlag> flags,
        GeoPoint location,
        Instant detectedAt
) {
    /**
     * 팩토리 메서드: 사용 시도 시각을 탐지 시각으로 사용
     */
    public static FraudCaseMessage of(RedemptionAttempt attempt, FraudCheckResult result) {
        return new FraudCaseMessage(
                attempt.voucherId(),
                attempt.customerId(),
                attempt.providerId(),
                result.riskScore(),
                result.requiresReview(),
                result.flags(),
                attempt.location(),
                attempt.timestamp()
        );
    }
}
