package com.sparta.redemption.domain.voucher.exception;

import com.sparta.redemption.common.exception.BusinessException;
import com.sparta.redemption.common.exception.ErrorCode;

/**
 * 바우처를 찾을 수 없을 때 발생하는 예외
 */
public class VoucherNotFoundException extends BusinessException {
    public VoucherNotFoundException(String voucherId) {
        super(ErrorCode.V001, "바우처를 찾을 수 없습니다: " + voucherId);
    }
}
