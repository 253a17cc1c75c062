package com.sparta.redemption.infrastructure.persistence;

import com.sparta.redemption.IntegrationTestBase;
import com.sparta.redemption.domain.shortcode.ShortCodeRecord;
import com.sparta.redemption.domain.voucher.VoucherSnapshot;
import com.sparta.redemption.domain.voucher.VoucherState;
import com.sparta.redemption.domain.voucher.entity.Voucher;
import com.sparta.redemption.domain.voucher.repository.VoucherRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * JPA 저장소 어댑터 통합 테스트
 * 실제 MySQL의 PK 제약조건과 조건부 UPDATE 동작 검증
 */
@DisplayName("JPA 저장소 어댑터 통합 테스트")
class JpaStoreIntegrationTest extends IntegrationTestBase {

    @Autowired
    private JpaVoucherStore voucherStore;

    @Autowired
    private JpaStaticShortCodeStore staticShortCodeStore;

    @Autowired
    private VoucherRepository voucherRepository;

    @Test
    @DisplayName("조건부 상태 변경은 현재 상태가 일치할 때만 성공한다")
    void 조건부_상태_변경() {
        // given
        String voucherId = "V-" + UUID.randomUUID();
        voucherRepository.save(Voucher.builder()
                .voucherId(voucherId)
                .providerId("P001")
                .state(VoucherState.CLAIMED)
                .redemptionCount(0)
                .build());

        // when
        boolean first = voucherStore.setState(voucherId, VoucherState.CLAIMED, VoucherState.REDEEMED);
        boolean second = voucherStore.setState(voucherId, VoucherState.CLAIMED, VoucherState.REDEEMED);
        boolean incremented = voucherStore.incrementRedemption(voucherId);

        // then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(incremented).isTrue();

        VoucherSnapshot snapshot = voucherStore.getVoucher(voucherId).orElseThrow();
        assertThat(snapshot.state()).isEqualTo(VoucherState.REDEEMED);
        assertThat(snapshot.redemptionCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("없는 바우처는 빈 결과, 횟수 증가는 실패를 반환한다")
    void 없는_바우처() {
        // when & then
        assertThat(voucherStore.getVoucher("V-NONE")).isEmpty();
        assertThat(voucherStore.incrementRedemption("V-NONE")).isFalse();
        assertThat(voucherStore.setState("V-NONE", VoucherState.CLAIMED, VoucherState.REDEEMED)).isFalse();
    }

    @Test
    @DisplayName("같은 고정 숏코드는 한 번만 등록되고 폐기 후 조회되지 않는다")
    void 고정_숏코드_등록_폐기() {
        // given
        String code = "CAMP" + UUID.randomUUID().toString().replace("-", "").substring(0, 8).toUpperCase();

        // when
        boolean created = staticShortCodeStore.create(code, "V001");
        boolean duplicated = staticShortCodeStore.create(code, "V002");
        Optional<ShortCodeRecord> found = staticShortCodeStore.find(code);
        boolean deleted = staticShortCodeStore.delete(code);
        boolean deletedAgain = staticShortCodeStore.delete(code);

        // then
        assertThat(created).isTrue();
        assertThat(duplicated).isFalse();
        assertThat(found).hasValueSatisfying(record -> {
            assertThat(record.voucherId()).isEqualTo("V001");
            assertThat(record.isDynamic()).isFalse();
        });
        assertThat(deleted).isTrue();
        assertThat(deletedAgain).isFalse();
        assertThat(staticShortCodeStore.find(code)).isEmpty();
    }
}
