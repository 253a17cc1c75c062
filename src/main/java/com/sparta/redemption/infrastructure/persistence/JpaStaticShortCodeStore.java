package com.sparta.redemption.infrastructure.persistence;

import com.sparta.redemption.domain.shortcode.ShortCodeRecord;
import com.sparta.redemption.domain.shortcode.StaticShortCodeStore;
import com.sparta.redemption.domain.shortcode.entity.StaticShortCode;
import com.sparta.redemption.domain.shortcode.repository.StaticShortCodeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * StaticShortCodeStore JPA 구현체
 *
 * 중복 검사는 code PK 제약에 맡긴다 (조회 후 저장하지 않음).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JpaStaticShortCodeStore implements StaticShortCodeStore {

    private final StaticShortCodeRepository staticShortCodeRepository;

    /**
     * 원자적 생성
     * saveAndFlush가 자체 트랜잭션에서 INSERT하므로 PK 위반은 여기서 바로 드러난다
     *
     * @return 중복이면 false
     */
    @Override
    public boolean create(String code, String voucherId) {
        try {
            staticShortCodeRepository.saveAndFlush(StaticShortCode.register(code, voucherId));
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("이미 등록된 고정 숏코드: code={}", code);
            return false;
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ShortCodeRecord> find(String code) {
        return staticShortCodeRepository.findById(code)
                .map(entity -> ShortCodeRecord.permanent(entity.getCode(), entity.getVoucherId()));
    }

    @Override
    @Transactional
    public boolean delete(String code) {
        return staticShortCodeRepository.deleteByCode(code) > 0;
    }
}
