package com.sparta.redemption.domain.token;

/**
 * 오프라인 검증 결과
 * 자격 증명 문제는 예외 대신 error로 전달한다
 */
public record OfflineVerification(
        boolean valid,
        RedemptionClaims claims,
        String error
) {

    public static OfflineVerification valid(RedemptionClaims claims) {
        return new OfflineVerification(true, claims, null);
    }

    public static OfflineVerification invalid(String error) {
        return new OfflineVerification(false, null, error);
    }
}
