package com.sparta.redemption.domain.voucher;

import java.util.EnumSet;
import java.util.Set;

/**
 * 바우처 생명주기 상태
 */
public enum VoucherState {
    DRAFT,
    PUBLISHED,
    CLAIMED,
    REDEEMED,
    EXPIRED;

    /**
     * 현재 상태에서 이동할 수 있는 상태 집합
     */
    public Set<VoucherState> allowedTransitions() {
        return switch (this) {
            case DRAFT -> EnumSet.of(PUBLISHED);
            case PUBLISHED -> EnumSet.of(CLAIMED, EXPIRED);
            case CLAIMED -> EnumSet.of(REDEEMED, EXPIRED);
            case REDEEMED -> EnumSet.of(EXPIRED);
            case EXPIRED -> EnumSet.noneOf(VoucherState.class);
        };
    }

    public boolean isTerminal() {
        return allowedTransitions().isEmpty();
    }
}
