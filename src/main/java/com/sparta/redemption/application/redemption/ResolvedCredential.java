package com.sparta.redemption.application.redemption;

/**
 * 바우처/고객으로 해석된 사용 코드
 *
 * @param shortCode 숏코드로 해석된 경우의 코드 (토큰이면 null)
 */
public record ResolvedCredential(
        String voucherId,
        String customerId,
        CredentialType credentialType,
        String shortCode
) {

    public ResolvedCredential {
        if (voucherId == null || voucherId.isBlank()) {
            throw new IllegalArgumentException("바우처 ID는 필수입니다");
        }
        if (customerId == null || customerId.isBlank()) {
            throw new IllegalArgumentException("고객 ID는 필수입니다");
        }
        if (credentialType == null) {
            throw new IllegalArgumentException("사용 코드 종류는 필수입니다");
        }
    }

    public static ResolvedCredential token(String voucherId, String customerId) {
        return new ResolvedCredential(voucherId, customerId, CredentialType.TOKEN, null);
    }

    public static ResolvedCredential dynamicCode(String voucherId, String customerId, String code) {
        return new ResolvedCredential(voucherId, customerId, CredentialType.DYNAMIC_CODE, code);
    }

    public static ResolvedCredential staticCode(String voucherId, String customerId, String code) {
        return new ResolvedCredential(voucherId, customerId, CredentialType.STATIC_CODE, code);
    }
}
