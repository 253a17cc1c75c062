package com.sparta.redemption.domain.shortcode;

import java.util.Optional;

/**
 * 고정 숏코드 영구 저장소 계약
 * create는 원자적 생성이어야 한다 (중복 시 false)
 */
public interface StaticShortCodeStore {

    boolean create(String code, String voucherId);

    Optional<ShortCodeRecord> find(String code);

    boolean delete(String code);
}
