package com.sparta.redemption.domain.fraud;

/**
 * 감사 로그 조회 범위
 */
public enum FraudLogScope {
    CUSTOMER,
    PROVIDER,
    ADMIN
}
