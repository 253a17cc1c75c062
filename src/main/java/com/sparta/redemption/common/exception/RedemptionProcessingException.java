package com.sparta.redemption.common.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 예상하지 못한 오류를 감싸서 다시 던지는 예외
 * 작업 이름과 바우처/고객 ID 등의 컨텍스트를 함께 전달한다
 */
public class RedemptionProcessingException extends BusinessException {

    private final String operation;
    private final Map<String, String> metadata;

    public RedemptionProcessingException(String operation, Map<String, String> metadata, Throwable cause) {
        super(ErrorCode.COMMON004,
                String.format("%s 처리 중 오류가 발생했습니다 %s", operation, metadata),
                cause);
        this.operation = operation;
        this.metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public String getOperation() {
        return operation;
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }
}
