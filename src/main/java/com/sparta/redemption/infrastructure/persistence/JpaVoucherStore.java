package com.sparta.redemption.infrastructure.persistence;

import com.sparta.redemption.domain.voucher.VoucherSnapshot;
import com.sparta.redemption.domain.voucher.VoucherState;
import com.sparta.redemption.domain.voucher.VoucherStore;
import com.sparta.redemption.domain.voucher.entity.Voucher;
import com.sparta.redemption.domain.voucher.repository.VoucherRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * VoucherStore JPA 구현체
 *
 * 상태 변경/횟수 증가는 조건부 UPDATE 한 번으로 수행한다 (행 락 없이 원자적).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaVoucherStore implements VoucherStore {

    private final VoucherRepository voucherRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<VoucherSnapshot> getVoucher(String voucherId) {
        return voucherRepository.findById(voucherId)
                .map(Voucher::toSnapshot);
    }

    @Override
    @Transactional
    public boolean incrementRedemption(String voucherId) {
        return voucherRepository.incrementRedemptionCount(voucherId) == 1;
    }

    @Override
    @Transactional
    public boolean setState(String voucherId, VoucherState from, VoucherState to) {
        int updated = voucherRepository.updateStateIfCurrent(voucherId, from, to);
        if (updated == 0) {
            log.debug("조건부 상태 변경 실패: voucherId={}, from={}, to={}", voucherId, from, to);
        }
        return updated == 1;
    }
}
