package com.sparta.redemption.domain.voucher;

import java.util.Optional;

/**
 * 외부 바우처 저장소 계약
 *
 * 상태 변경과 사용 횟수 증가는 저장소 측에서 원자적으로 수행되어야 한다.
 * false 반환은 동시 요청과의 충돌을 의미한다.
 */
public interface VoucherStore {

    Optional<VoucherSnapshot> getVoucher(String voucherId);

    /**
     * 사용 횟수 1 증가
     * @return 증가 성공 시 true, 충돌 시 false
     */
    boolean incrementRedemption(String voucherId);

    /**
     * 현재 상태가 from일 때만 to로 변경 (compare-and-swap)
     * @return 변경 성공 시 true, 충돌 시 false
     */
    boolean setState(String voucherId, VoucherState from, VoucherState to);
}
