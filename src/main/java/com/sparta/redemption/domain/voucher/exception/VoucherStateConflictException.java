package com.sparta.redemption.domain.voucher.exception;

import com.sparta.redemption.common.exception.BusinessException;
import com.sparta.redemption.common.exception.ErrorCode;

/**
 * 조건부 상태 변경(CAS)에서 동시 요청에 밀렸을 때 발생하는 예외
 */
public class VoucherStateConflictException extends BusinessException {
    public VoucherStateConflictException(String voucherId) {
        super(ErrorCode.V002, "다른 요청이 먼저 바우처 상태를 변경했습니다: " + voucherId);
    }

    public VoucherStateConflictException(String voucherId, String reason) {
        super(ErrorCode.V002, String.format("바우처[%s] 처리 충돌: %s", voucherId, reason));
    }
}
