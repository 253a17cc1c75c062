package com.sparta.redemption.domain.token.exception;

import com.sparta.redemption.common.exception.BusinessException;
import com.sparta.redemption.common.exception.ErrorCode;

/**
 * 위변조되었거나 다른 키로 서명된 토큰일 때 발생하는 예외
 */
public class InvalidTokenSignatureException extends BusinessException {
    public InvalidTokenSignatureException() {
        super(ErrorCode.R003);
    }

    public InvalidTokenSignatureException(Throwable cause) {
        super(ErrorCode.R003, ErrorCode.R003.getMessage(), cause);
    }
}
