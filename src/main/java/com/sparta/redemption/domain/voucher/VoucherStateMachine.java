package com.sparta.redemption.domain.voucher;

import com.sparta.redemption.domain.voucher.exception.IllegalVoucherTransitionException;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.Set;

/**
 * 바우처 상태 전이 검증기
 *
 * 전이표:
 * - DRAFT → PUBLISHED
 * - PUBLISHED → CLAIMED, EXPIRED
 * - CLAIMED → REDEEMED, EXPIRED
 * - REDEEMED → EXPIRED
 * - EXPIRED → (없음)
 *
 * 저장된 상태를 직접 읽지 않는다. 현재 상태는 호출자가 전달한다.
 */
@Component
public class VoucherStateMachine {

    /**
     * 상태 전이 검증
     *
     * @param current 현재 상태
     * @param requested 요청 상태
     * @throws IllegalVoucherTransitionException 전이표에 없는 전이인 경우
     */
    public void validateTransition(VoucherState current, VoucherState requested) {
        Objects.requireNonNull(current, "현재 상태는 필수입니다");
        Objects.requireNonNull(requested, "요청 상태는 필수입니다");

        Set<VoucherState> allowed = current.allowedTransitions();
        if (!allowed.contains(requested)) {
            throw new IllegalVoucherTransitionException(current, requested, allowed);
        }
    }

    public boolean canTransition(VoucherState current, VoucherState requested) {
        return current != null && requested != null
                && current.allowedTransitions().contains(requested);
    }
}
