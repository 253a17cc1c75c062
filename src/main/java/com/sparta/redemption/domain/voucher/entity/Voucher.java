package com.sparta.redemption.domain.voucher.entity;

import com.sparta.redemption.domain.voucher.VoucherSnapshot;
import com.sparta.redemption.domain.voucher.VoucherState;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 바우처 엔티티 (사용 검증에 필요한 컬럼만 매핑)
 */
@Entity
@Table(name = "vouchers", indexes = {
        @Index(name = "idx_vouchers_provider_id", columnList = "provider_id")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Voucher {

    @Id
    @Column(name = "id")
    private String voucherId;

    @Column(name = "provider_id", nullable = false)
    private String providerId;

    @Enumerated(value = EnumType.STRING)
    @Column(name = "state", nullable = false)
    private VoucherState state;

    @Column(name = "redemption_count", nullable = false)
    private int redemptionCount;

    public VoucherSnapshot toSnapshot() {
        return VoucherSnapshot.reconstruct(voucherId, providerId, state, redemptionCount);
    }
}
