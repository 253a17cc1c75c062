package com.sparta.redemption.application.redemption;

/**
 * 제시된 사용 코드의 종류
 */
public enum CredentialType {
    TOKEN,
    DYNAMIC_CODE,
    STATIC_CODE
}
