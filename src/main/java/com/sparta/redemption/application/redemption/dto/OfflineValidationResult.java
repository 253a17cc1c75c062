package com.sparta.redemption.application.redemption.dto;

import com.sparta.redemption.domain.token.RedemptionClaims;

/**
 * 오프라인 토큰 검증 결과
 */
public record OfflineValidationResult(
        boolean valid,
        RedemptionClaims claims,
        String error
) {

    public static OfflineValidationResult accepted(RedemptionClaims claims) {
        return new OfflineValidationResult(true, claims, null);
    }

    public static OfflineValidationResult rejected(RedemptionClaims claims, String error) {
        return new OfflineValidationResult(false, claims, error);
    }
}
