package com.sparta.redemption.application.redemption.dto;

import com.sparta.redemption.application.redemption.CredentialType;
import com.sparta.redemption.domain.fraud.FraudCheckResult;
import com.sparta.redemption.domain.voucher.VoucherSnapshot;

/**
 * 사용 처리 결과
 *
 * @param voucher 사용 처리 후 바우처 (REDEEMED)
 * @param fraudResult 사기 탐지 결과 (참고용, 사용을 막지 않음)
 * @param credentialType 제시된 사용 코드 종류
 */
public record RedemptionResult(
        VoucherSnapshot voucher,
        FraudCheckResult fraudResult,
        CredentialType credentialType
) {
}
