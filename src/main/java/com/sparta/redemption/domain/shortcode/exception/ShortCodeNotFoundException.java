package com.sparta.redemption.domain.shortcode.exception;

import com.sparta.redemption.common.exception.BusinessException;
import com.sparta.redemption.common.exception.ErrorCode;

/**
 * 조회할 수 없는 사용 코드일 때 발생하는 예외
 */
public class ShortCodeNotFoundException extends BusinessException {
    public ShortCodeNotFoundException() {
        super(ErrorCode.R004);
    }

    public ShortCodeNotFoundException(String code) {
        super(ErrorCode.R004, "존재하지 않는 사용 코드입니다: " + code);
    }
}
