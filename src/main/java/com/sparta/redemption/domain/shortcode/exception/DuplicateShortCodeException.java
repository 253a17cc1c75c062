package com.sparta.redemption.domain.shortcode.exception;

import com.sparta.redemption.common.exception.BusinessException;
import com.sparta.redemption.common.exception.ErrorCode;

/**
 * 이미 등록된 고정 숏코드를 다시 등록하려 할 때 발생하는 예외
 */
public class DuplicateShortCodeException extends BusinessException {
    public DuplicateShortCodeException(String code) {
        super(ErrorCode.R005, "이미 등록된 숏코드입니다: " + code);
    }
}
