package com.sparta.redemption.application.redemption.dto;

import java.util.List;

/**
 * 오프라인 사용 건 동기화 결과
 *
 * @param syncedVoucherIds 동기화된(또는 이미 사용 처리되어 있던) 바우처 ID
 * @param errors 건별 실패 내역
 */
public record OfflineSyncResult(
        List<String> syncedVoucherIds,
        List<SyncError> errors
) {

    public OfflineSyncResult {
        syncedVoucherIds = List.copyOf(syncedVoucherIds);
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * @param index 요청 목록에서의 위치
     * @param maskedCredential 마스킹된 토큰 (서명된 원문은 응답에 담지 않는다)
     */
    public record SyncError(int index, String maskedCredential, String errorCode, String message) {
    }
}
