package com.sparta.redemption.domain.shortcode;

/**
 * 숏코드 종류
 * - DYNAMIC: 고객 1명에게 발급되는 단기 코드 (캐시에만 저장)
 * - STATIC: 인쇄 캠페인용 영구 코드 (DB + 캐시)
 */
public enum ShortCodeKind {
    DYNAMIC,
    STATIC
}
