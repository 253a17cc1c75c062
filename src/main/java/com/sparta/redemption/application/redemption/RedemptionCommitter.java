package com.sparta.redemption.application.redemption;

import com.sparta.redemption.domain.voucher.VoucherSnapshot;
import com.sparta.redemption.domain.voucher.VoucherState;
import com.sparta.redemption.domain.voucher.VoucherStore;
import com.sparta.redemption.domain.voucher.exception.VoucherStateConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 사용 확정 처리 (트랜잭션 전용)
 *
 * 상태 CAS(현재 상태 → REDEEMED)와 사용 횟수 증가를 한 트랜잭션에서 수행한다.
 * 둘 중 하나라도 실패하면 예외로 롤백된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RedemptionCommitter {

    private final VoucherStore voucherStore;

    /**
     * @param voucher 전이 검증을 마친 바우처 (state는 읽은 시점의 상태)
     * @throws VoucherStateConflictException 다른 요청이 먼저 상태를 바꿨거나 횟수 증가에 실패한 경우
     */
    @Transactional
    public void commit(VoucherSnapshot voucher) {
        String voucherId = voucher.voucherId();

        if (!voucherStore.setState(voucherId, voucher.state(), VoucherState.REDEEMED)) {
            log.warn("바우처 상태 변경 충돌: voucherId={}, expected={}", voucherId, voucher.state());
            throw new VoucherStateConflictException(voucherId);
        }

        if (!voucherStore.incrementRedemption(voucherId)) {
            log.warn("사용 횟수 증가 실패: voucherId={}", voucherId);
            throw new VoucherStateConflictException(voucherId, "사용 횟수 증가 실패");
        }
    }
}
