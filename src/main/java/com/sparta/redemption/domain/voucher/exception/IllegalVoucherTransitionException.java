package com.sparta.redemption.domain.voucher.exception;

import com.sparta.redemption.common.exception.BusinessException;
import com.sparta.redemption.common.exception.ErrorCode;
import com.sparta.redemption.domain.voucher.VoucherState;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * 상태 전이표에 없는 전이를 요청했을 때 발생하는 예외
 */
public class IllegalVoucherTransitionException extends BusinessException {

    private final VoucherState currentState;
    private final VoucherState requestedState;
    private final Set<VoucherState> allowedStates;

    public IllegalVoucherTransitionException(VoucherState currentState,
                                             VoucherState requestedState,
                                             Set<VoucherState> allowedStates) {
        super(ErrorCode.V003, String.format(
                "허용되지 않는 상태 전이입니다: %s → %s (허용: %s)",
                currentState, requestedState, describe(allowedStates)));
        this.currentState = currentState;
        this.requestedState = requestedState;
        this.allowedStates = Set.copyOf(allowedStates);
    }

    private static String describe(Set<VoucherState> allowedStates) {
        if (allowedStates.isEmpty()) {
            return "없음";
        }
        return allowedStates.stream()
                .sorted()
                .map(Enum::name)
                .collect(Collectors.joining(", "));
    }

    public VoucherState getCurrentState() {
        return currentState;
    }

    public VoucherState getRequestedState() {
        return requestedState;
    }

    public Set<VoucherState> getAllowedStates() {
        return allowedStates;
    }
}
