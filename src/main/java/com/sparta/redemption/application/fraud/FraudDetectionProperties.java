package com.sparta.redemption.application.fraud;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 사기 탐지 임계값/보관 기간 설정 - redemption.fraud
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "redemption.fraud")
public class FraudDetectionProperties {

    // 연속 사용
    @NotNull
    private Duration rapidRedemptionWindow = Duration.ofMinutes(5);

    @NotNull
    private Duration rapidRedemptionHighWindow = Duration.ofMinutes(1);

    @NotNull
    private Duration lastRedemptionTtl = Duration.ofHours(1);

    // 이동 속도 (km/h)
    @Positive
    private double velocityThresholdKmh = 60.0;

    @Positive
    private double velocityHighKmh = 100.0;

    @NotNull
    private Duration lastLocationTtl = Duration.ofHours(24);

    // 평소 위치 이탈 (km)
    @Positive
    private double anomalyRadiusKm = 30.0;

    @Positive
    private double anomalyHighKm = 50.0;

    @Min(1)
    private int anomalyMinSamples = 3;

    @Min(1)
    private int locationHistorySize = 10;

    @NotNull
    private Duration locationHistoryTtl = Duration.ofDays(7);

    // 감사 로그
    @Min(1)
    private int auditTrailSize = 100;

    @NotNull
    private Duration auditRetention = Duration.ofDays(30);

    // 이 점수를 초과하면 검토 필요 + 관리자 로그 적재
    @Min(0)
    private int reviewScoreThreshold = 70;

    // 개별 검사 대기 시간
    @NotNull
    private Duration checkTimeout = Duration.ofSeconds(2);
}
