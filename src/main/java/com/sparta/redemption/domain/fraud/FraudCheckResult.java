package com.sparta.redemption.domain.fraud;

import java.util.List;

/**
 * 사기 탐지 결과
 *
 * 소프트 검증 정책: allowed는 항상 true.
 * 탐지 결과는 사용을 막지 않고 표시(주석)만 한다.
 */
public record FraudCheckResult(
        boolean allowed,
        List<FraudFlag> flags,
        int riskScore,
        boolean requiresReview
) {

    public static final int MAX_RISK_SCORE = 100;

    public FraudCheckResult {
        flags = flags == null ? List.of() : List.copyOf(flags);
        if (riskScore < 0 || riskScore > MAX_RISK_SCORE) {
            throw new IllegalArgumentException("위험 점수는 0 ~ 100 범위여야 합니다");
        }
    }

    /**
     * 플래그로부터 결과 생성
     *
     * @param flags 탐지된 플래그
     * @param reviewScoreThreshold 이 점수를 초과하면 검토 필요
     */
    public static FraudCheckResult fromFlags(List<FraudFlag> flags, int reviewScoreThreshold) {
        int score = Math.min(MAX_RISK_SCORE, flags.stream()
                .mapToInt(flag -> flag.severity().getScore())
                .sum());
        boolean requiresReview = flags.stream().anyMatch(FraudFlag::isHigh)
                || score > reviewScoreThreshold;
        return new FraudCheckResult(true, flags, score, requiresReview);
    }

    public static FraudCheckResult clean() {
        return new FraudCheckResult(true, List.of(), 0, false);
    }

    public boolean hasFlags() {
        return !flags.isEmpty();
    }
}
