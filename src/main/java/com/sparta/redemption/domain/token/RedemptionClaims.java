package com.sparta.redemption.domain.token;

import java.time.Instant;

/**
 * 사용 토큰에 담기는 클레임 (발급 후 불변)
 */
public record RedemptionClaims(
        String voucherId,
        String customerId,
        Instant issuedAt,
        Instant expiresAt
) {

    public RedemptionClaims {
        if (voucherId == null || voucherId.isBlank()) {
            throw new IllegalArgumentException("바우처 ID는 필수입니다");
        }
        if (customerId == null || customerId.isBlank()) {
            throw new IllegalArgumentException("고객 ID는 필수입니다");
        }
    }
}
