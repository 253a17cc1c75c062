package com.sparta.redemption.domain.token.exception;

import com.sparta.redemption.common.exception.BusinessException;
import com.sparta.redemption.common.exception.ErrorCode;

import java.time.Instant;

/**
 * 온라인 검증에서 만료 시각이 지난 토큰일 때 발생하는 예외
 */
public class TokenExpiredException extends BusinessException {
    public TokenExpiredException() {
        super(ErrorCode.R002);
    }

    public TokenExpiredException(Instant expiresAt) {
        super(ErrorCode.R002, "만료된 사용 토큰입니다 (만료: " + expiresAt + ")");
    }
}
