package com.sparta.redemption.common.exception;

/**
 * 에러 코드 정의
 * 호출 서비스가 사용자 응답으로 매핑할 수 있도록 코드와 기본 메시지를 함께 관리
 */
public enum ErrorCode {
    // 사용 코드(토큰/숏코드) 관련 에러
    R001("R001", "형식이 올바르지 않은 사용 코드입니다"),
    R002("R002", "만료된 사용 토큰입니다"),
    R003("R003", "서명이 유효하지 않은 사용 토큰입니다"),
    R004("R004", "존재하지 않는 사용 코드입니다"),
    R005("R005", "이미 등록된 숏코드입니다"),

    // 바우처 관련 에러
    V001("V001", "바우처를 찾을 수 없습니다"),
    V002("V002", "다른 요청이 먼저 바우처 상태를 변경했습니다"),
    V003("V003", "허용되지 않는 바우처 상태 전이입니다"),
    V004("V004", "다른 제공자의 바우처입니다"),

    // 공통 에러
    COMMON004("COMMON004", "서버 내부 오류가 발생했습니다");

    private final String code;
    private final String message;

    ErrorCode(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
