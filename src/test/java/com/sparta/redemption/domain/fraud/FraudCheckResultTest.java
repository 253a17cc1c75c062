package com.sparta.redemption.domain.fraud;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * 위험 점수 계산 테스트
 */
@DisplayName("FraudCheckResult 테스트")
class FraudCheckResultTest {

    private static final int REVIEW_THRESHOLD = 70;

    @Test
    @DisplayName("플래그가 없으면 점수 0, 검토 불필요")
    void 플래그_없음() {
        // when
        FraudCheckResult result = FraudCheckResult.fromFlags(List.of(), REVIEW_THRESHOLD);

        // then
        assertThat(result.allowed()).isTrue();
        assertThat(result.riskScore()).isZero();
        assertThat(result.requiresReview()).isFalse();
    }

    @Test
    @DisplayName("HIGH 플래그 하나만 있어도 검토가 필요하다")
    void HIGH_플래그_검토_필요() {
        // given
        List<FraudFlag> flags = List.of(flag(FraudFlagType.VELOCITY, FraudSeverity.HIGH));

        // when
        FraudCheckResult result = FraudCheckResult.fromFlags(flags, REVIEW_THRESHOLD);

        // then
        assertThat(result.riskScore()).isEqualTo(40);
        assertThat(result.requiresReview()).isTrue();
        assertThat(result.allowed()).isTrue();
    }

    @Test
    @DisplayName("MEDIUM 플래그만 있으면 점수가 기준 이하일 때 검토가 필요 없다")
    void MEDIUM_플래그_검토_불필요() {
        // given
        List<FraudFlag> flags = List.of(
                flag(FraudFlagType.RAPID_REDEMPTION, FraudSeverity.MEDIUM),
                flag(FraudFlagType.LOCATION_ANOMALY, FraudSeverity.MEDIUM));

        // when
        FraudCheckResult result = FraudCheckResult.fromFlags(flags, REVIEW_THRESHOLD);

        // then
        assertThat(result.riskScore()).isEqualTo(40);
        assertThat(result.requiresReview()).isFalse();
    }

    @Test
    @DisplayName("위험 점수는 100을 넘지 않는다")
    void 점수_상한() {
        // given
        List<FraudFlag> flags = List.of(
                flag(FraudFlagType.RAPID_REDEMPTION, FraudSeverity.HIGH),
                flag(FraudFlagType.VELOCITY, FraudSeverity.HIGH),
                flag(FraudFlagType.LOCATION_ANOMALY, FraudSeverity.HIGH));

        // when
        FraudCheckResult result = FraudCheckResult.fromFlags(flags, REVIEW_THRESHOLD);

        // then
        assertThat(result.riskScore()).isEqualTo(100);
        assertThat(result.requiresReview()).isTrue();
    }

    private static FraudFlag flag(FraudFlagType type, FraudSeverity severity) {
        return FraudFlag.of(type, severity, "테스트", Map.of());
    }
}
