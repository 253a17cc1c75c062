package com.sparta.redemption.domain.fraud;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 사기 의심 플래그
 */
public record FraudFlag(
        FraudFlagType type,
        FraudSeverity severity,
        String message,
        Map<String, Object> details
) {

    public FraudFlag {
        if (type == null || severity == null) {
            throw new IllegalArgumentException("플래그 종류와 심각도는 필수입니다");
        }
        details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static FraudFlag of(FraudFlagType type, FraudSeverity severity, String message,
                               Map<String, Object> details) {
        return new FraudFlag(type, severity, message, details);
    }

    @JsonIgnore
    public boolean isHigh() {
        return severity == FraudSeverity.HIGH;
    }
}
