package com.sparta.redemption.domain.voucher;

import com.sparta.redemption.domain.voucher.exception.IllegalVoucherTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * 바우처 상태 전이 검증 테스트
 */
@DisplayName("VoucherStateMachine 테스트")
class VoucherStateMachineTest {

    private final VoucherStateMachine stateMachine = new VoucherStateMachine();

    @Test
    @DisplayName("DRAFT → PUBLISHED → CLAIMED → REDEEMED 순서의 전이는 모두 허용된다")
    void 정상_생명주기_전이() {
        // when & then
        assertThatCode(() -> {
            stateMachine.validateTransition(VoucherState.DRAFT, VoucherState.PUBLISHED);
            stateMachine.validateTransition(VoucherState.PUBLISHED, VoucherState.CLAIMED);
            stateMachine.validateTransition(VoucherState.CLAIMED, VoucherState.REDEEMED);
            stateMachine.validateTransition(VoucherState.REDEEMED, VoucherState.EXPIRED);
        }).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("DRAFT에서 바로 REDEEMED로 가면 예외가 발생한다")
    void 단계_건너뛰기_실패() {
        // when & then
        assertThatThrownBy(() -> stateMachine.validateTransition(VoucherState.DRAFT, VoucherState.REDEEMED))
                .isInstanceOf(IllegalVoucherTransitionException.class)
                .hasMessage("허용되지 않는 상태 전이입니다: DRAFT → REDEEMED (허용: PUBLISHED)");
    }

    @ParameterizedTest
    @EnumSource(VoucherState.class)
    @DisplayName("EXPIRED에서는 어떤 상태로도 갈 수 없다")
    void 만료_상태는_종료_상태(VoucherState requested) {
        // when & then
        assertThatThrownBy(() -> stateMachine.validateTransition(VoucherState.EXPIRED, requested))
                .isInstanceOf(IllegalVoucherTransitionException.class)
                .hasMessageContaining("허용: 없음");
        assertThat(VoucherState.EXPIRED.isTerminal()).isTrue();
    }

    @Test
    @DisplayName("같은 상태로의 전이는 전이표에 없으므로 거부된다")
    void 같은_상태_전이_거부() {
        // when & then
        assertThatThrownBy(() -> stateMachine.validateTransition(VoucherState.CLAIMED, VoucherState.CLAIMED))
                .isInstanceOf(IllegalVoucherTransitionException.class);
    }

    @Test
    @DisplayName("예외에는 현재 상태, 요청 상태, 허용 상태가 담긴다")
    void 예외_정보_확인() {
        // when
        IllegalVoucherTransitionException exception = assertThrows(
                IllegalVoucherTransitionException.class,
                () -> stateMachine.validateTransition(VoucherState.PUBLISHED, VoucherState.REDEEMED));

        // then
        assertThat(exception.getCurrentState()).isEqualTo(VoucherState.PUBLISHED);
        assertThat(exception.getRequestedState()).isEqualTo(VoucherState.REDEEMED);
        assertThat(exception.getAllowedStates()).containsExactlyInAnyOrder(VoucherState.CLAIMED, VoucherState.EXPIRED);
        assertThat(exception.getCode()).isEqualTo("V003");
    }

    @Test
    @DisplayName("canTransition은 예외 없이 허용 여부만 반환한다")
    void 전이_가능_여부() {
        // when & then
        assertThat(stateMachine.canTransition(VoucherState.CLAIMED, VoucherState.REDEEMED)).isTrue();
        assertThat(stateMachine.canTransition(VoucherState.REDEEMED, VoucherState.REDEEMED)).isFalse();
        assertThat(stateMachine.canTransition(null, VoucherState.REDEEMED)).isFalse();
    }
}
