package com.sparta.redemption.domain.voucher.exception;

import com.sparta.redemption.common.exception.BusinessException;
import com.sparta.redemption.common.exception.ErrorCode;

/**
 * 오프라인 동기화 요청 제공자와 바우처 제공자가 다를 때 발생하는 예외
 */
public class VoucherProviderMismatchException extends BusinessException {
    public VoucherProviderMismatchException(String voucherId, String providerId) {
        super(ErrorCode.V004, String.format("바우처[%s]는 제공자[%s]의 바우처가 아닙니다", voucherId, providerId));
    }
}
