package com.sparta.redemption.domain.voucher;

/**
 * 외부 바우처 저장소에서 읽어 온 바우처 조회 모델
 * 저장소에서 읽을 때마다 reconstruct로 불변식을 검증한다
 */
public record VoucherSnapshot(
        String voucherId,
        String providerId,
        VoucherState state,
        int redemptionCount
) {

    public VoucherSnapshot {
        if (voucherId == null || voucherId.isBlank()) {
            throw new IllegalArgumentException("바우처 ID는 필수입니다");
        }
        if (providerId == null || providerId.isBlank()) {
            throw new IllegalArgumentException("제공자 ID는 필수입니다");
        }
        if (state == null) {
            throw new IllegalArgumentException("바우처 상태는 필수입니다");
        }
        if (redemptionCount < 0) {
            throw new IllegalArgumentException("사용 횟수는 음수일 수 없습니다");
        }
    }

    public static VoucherSnapshot reconstruct(String voucherId, String providerId,
                                              VoucherState state, int redemptionCount) {
        return new VoucherSnapshot(voucherId, providerId, state, redemptionCount);
    }

    /**
     * 사용 처리 결과
     * @return 상태가 REDEEMED이고 사용 횟수가 1 증가한 새로운 스냅샷 (불변)
     */
    public VoucherSnapshot redeemed() {
        return new VoucherSnapshot(voucherId, providerId, VoucherState.REDEEMED, redemptionCount + 1);
    }

    public boolean belongsTo(String providerId) {
        return this.providerId.equals(providerId);
    }
}
