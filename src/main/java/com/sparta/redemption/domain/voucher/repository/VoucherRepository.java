package com.sparta.redemption.domain.voucher.repository;

import com.sparta.redemption.domain.voucher.VoucherState;
import com.sparta.redemption.domain.voucher.entity.Voucher;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * 바우처 저장소 인터페이스
 */
public interface VoucherRepository extends JpaRepository<Voucher, String> {

    /**
     * 조건부 상태 변경 - 현재 상태가 일치할 때만 UPDATE
     * @return 업데이트된 행 수 (0이면 다른 요청이 먼저 변경함)
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Voucher v SET v.state = :to " +
           "WHERE v.voucherId = :voucherId AND v.state = :from")
    int updateStateIfCurrent(@Param("voucherId") String voucherId,
                             @Param("from") VoucherState from,
                             @Param("to") VoucherState to);

    /**
     * 사용 횟수 증가 - 직접 UPDATE 쿼리
     * @return 업데이트된 행 수
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Voucher v SET v.redemptionCount = v.redemptionCount + 1 " +
           "WHERE v.voucherId = :voucherId")
    int incrementRedemptionCount(@Param("voucherId") String voucherId);
}
