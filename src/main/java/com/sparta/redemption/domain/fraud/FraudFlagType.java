package com.sparta.redemption.domain.fraud;

public enum FraudFlagType {
    RAPID_REDEMPTION,
    VELOCITY,
    LOCATION_ANOMALY
}
