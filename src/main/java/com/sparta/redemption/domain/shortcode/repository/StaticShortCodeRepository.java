package com.sparta.redemption.domain.shortcode.repository;

import com.sparta.redemption.domain.shortcode.entity.StaticShortCode;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * 고정 숏코드 저장소 인터페이스
 */
public interface StaticShortCodeRepository extends JpaRepository<StaticShortCode, String> {

    /**
     * 코드 삭제 - 직접 DELETE 쿼리
     * @return 삭제된 행 수
     */
    @Modifying
    @Query("DELETE FROM StaticShortCode s WHERE s.code = :code")
    int deleteByCode(@Param("code") String code);
}
