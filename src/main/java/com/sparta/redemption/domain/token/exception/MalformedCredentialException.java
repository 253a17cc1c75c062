package com.sparta.redemption.domain.token.exception;

import com.sparta.redemption.common.exception.BusinessException;
import com.sparta.redemption.common.exception.ErrorCode;

/**
 * 해석할 수 없는 사용 코드(토큰/숏코드)일 때 발생하는 예외
 */
public class MalformedCredentialException extends BusinessException {
    public MalformedCredentialException() {
        super(ErrorCode.R001);
    }

    public MalformedCredentialException(String message) {
        super(ErrorCode.R001, message);
    }

    public MalformedCredentialException(String message, Throwable cause) {
        super(ErrorCode.R001, message, cause);
    }
}
