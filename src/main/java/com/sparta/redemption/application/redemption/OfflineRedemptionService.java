package com.sparta.redemption.application.redemption;

import com.sparta.redemption.application.redemption.dto.OfflineRedemption;
import com.sparta.redemption.application.redemption.dto.OfflineSyncResult;
import com.sparta.redemption.application.redemption.dto.OfflineValidationResult;
import com.sparta.redemption.application.token.TokenService;
import com.sparta.redemption.common.exception.BusinessException;
import com.sparta.redemption.common.exception.ErrorCode;
import com.sparta.redemption.common.exception.RedemptionProcessingException;
import com.sparta.redemption.domain.token.OfflineVerification;
import com.sparta.redemption.domain.token.RedemptionClaims;
import com.sparta.redemption.domain.token.exception.MalformedCredentialException;
import com.sparta.redemption.domain.voucher.VoucherSnapshot;
import com.sparta.redemption.domain.voucher.VoucherState;
import com.sparta.redemption.domain.voucher.VoucherStateMachine;
import com.sparta.redemption.domain.voucher.VoucherStore;
import com.sparta.redemption.domain.voucher.exception.VoucherNotFoundException;
import com.sparta.redemption.domain.voucher.exception.VoucherProviderMismatchException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 오프라인 단말 사용 처리 서비스
 *
 * - validateOffline: 네트워크가 끊긴 단말에서 받은 토큰을 만료와 무관하게 검증
 * - syncOfflineRedemptions: 연결이 복구된 뒤 단말에 쌓인 사용 건을 일괄 확정
 *
 * 동기화는 건별로 독립적이다. 한 건의 실패가 나머지 건을 중단시키지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OfflineRedemptionService {

    private final TokenService tokenService;
    private final VoucherStore voucherStore;
    private final VoucherStateMachine stateMachine;
    private final RedemptionOrchestrator orchestrator;

    /**
     * 오프라인 토큰 검증
     * 서명/경과 시간 검증 후 바우처가 존재하고 아직 사용 가능한 상태인지 확인한다
     */
    public OfflineValidationResult validateOffline(String token) {
        OfflineVerification verification = tokenService.verifyOfflineToken(token);
        if (!verification.valid()) {
            return OfflineValidationResult.rejected(null, verification.error());
        }

        RedemptionClaims claims = verification.claims();
        Optional<VoucherSnapshot> voucher;
        try {
            voucher = voucherStore.getVoucher(claims.voucherId());
        } catch (RuntimeException e) {
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("voucherId", claims.voucherId());
            metadata.put("customerId", claims.customerId());
            throw new RedemptionProcessingException("validateOffline", metadata, e);
        }

        if (voucher.isEmpty()) {
            return OfflineValidationResult.rejected(claims, "바우처를 찾을 수 없습니다");
        }
        if (!stateMachine.canTransition(voucher.get().state(), VoucherState.REDEEMED)) {
            return OfflineValidationResult.rejected(claims,
                    "사용할 수 없는 바우처 상태입니다: " + voucher.get().state());
        }
        return OfflineValidationResult.accepted(claims);
    }

    /**
     * 오프라인 사용 건 동기화
     *
     * @param providerId 동기화를 요청한 제공자 ID
     * @param redemptions 단말에 쌓인 사용 건
     * @return 동기화된 바우처 ID와 건별 실패 내역
     */
    public OfflineSyncResult syncOfflineRedemptions(String providerId, List<OfflineRedemption> redemptions) {
        if (providerId == null || providerId.isBlank()) {
            throw new IllegalArgumentException("제공자 ID는 필수입니다");
        }

        List<String> synced = new ArrayList<>();
        List<OfflineSyncResult.SyncError> errors = new ArrayList<>();

        for (int index = 0; index < redemptions.size(); index++) {
            OfflineRedemption redemption = redemptions.get(index);
            try {
                synced.add(syncOne(providerId, redemption));
            } catch (BusinessException e) {
                log.warn("오프라인 사용 건 동기화 실패: providerId={}, code={}, message={}",
                        providerId, e.getCode(), e.getMessage());
                errors.add(new OfflineSyncResult.SyncError(
                        index, TokenService.mask(redemption.token()), e.getCode(), e.getMessage()));
            } catch (RuntimeException e) {
                log.error("오프라인 사용 건 동기화 중 예상하지 못한 오류: providerId={}", providerId, e);
                errors.add(new OfflineSyncResult.SyncError(index, TokenService.mask(redemption.token()),
                        ErrorCode.COMMON004.getCode(), ErrorCode.COMMON004.getMessage()));
            }
        }

        log.info("오프라인 사용 건 동기화 완료: providerId={}, synced={}, failed={}",
                providerId, synced.size(), errors.size());
        return new OfflineSyncResult(synced, errors);
    }

    private String syncOne(String providerId, OfflineRedemption redemption) {
        // 허용 시간은 동기화 시각이 아니라 단말에서 사용한 시각을 기준으로 본다
        OfflineVerification verification =
                tokenService.verifyOfflineToken(redemption.token(), redemption.redeemedAt());
        if (!verification.valid()) {
            throw new MalformedCredentialException(verification.error());
        }

        RedemptionClaims claims = verification.claims();
        String voucherId = claims.voucherId();

        VoucherSnapshot voucher = voucherStore.getVoucher(voucherId)
                .orElseThrow(() -> new VoucherNotFoundException(voucherId));
        if (!voucher.belongsTo(providerId)) {
            throw new VoucherProviderMismatchException(voucherId, providerId);
        }

        // 같은 건을 다시 올려도 이미 반영된 것으로 본다
        if (voucher.state() == VoucherState.REDEEMED) {
            log.debug("이미 사용 처리된 오프라인 건: voucherId={}", voucherId);
            return voucherId;
        }

        orchestrator.complete(
                ResolvedCredential.token(voucherId, claims.customerId()),
                redemption.location(),
                redemption.redeemedAt());
        return voucherId;
    }
}
