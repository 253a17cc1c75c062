package com.sparta.redemption.application.redemption;

import com.sparta.redemption.application.fraud.FraudDetectionEngine;
import com.sparta.redemption.application.redemption.dto.RedemptionResult;
import com.sparta.redemption.application.shortcode.ShortCodeService;
import com.sparta.redemption.application.token.TokenService;
import com.sparta.redemption.common.exception.BusinessException;
import com.sparta.redemption.common.exception.RedemptionProcessingException;
import com.sparta.redemption.domain.fraud.FraudCheckResult;
import com.sparta.redemption.domain.fraud.RedemptionAttempt;
import com.sparta.redemption.domain.fraud.vo.GeoPoint;
import com.sparta.redemption.domain.shortcode.ShortCodeRecord;
import com.sparta.redemption.domain.shortcode.exception.ShortCodeNotFoundException;
import com.sparta.redemption.domain.token.RedemptionClaims;
import com.sparta.redemption.domain.token.exception.MalformedCredentialException;
import com.sparta.redemption.domain.voucher.VoucherSnapshot;
import com.sparta.redemption.domain.voucher.VoucherState;
import com.sparta.redemption.domain.voucher.VoucherStateMachine;
import com.sparta.redemption.domain.voucher.VoucherStore;
import com.sparta.redemption.domain.voucher.exception.VoucherNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 바우처 사용 처리 오케스트레이터
 *
 * 처리 순서:
 * 1. 사용 코드 해석 (토큰 → TokenService, 그 외 → ShortCodeService)
 * 2. 바우처 조회 + 사기 탐지 (참고용, 사용을 막지 않음)
 * 3. 상태 전이 검증 (현재 상태 → REDEEMED)
 * 4. 사용 확정 (상태 CAS + 사용 횟수 증가, 한 트랜잭션)
 * 5. 동적 숏코드 무효화, 사기 의심 건 발행
 *
 * 해석할 수 없는 사용 코드는 사기 신호로 취급하지 않고 즉시 실패시킨다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RedemptionOrchestrator {

    private final TokenService tokenService;
    private final ShortCodeService shortCodeService;
    private final FraudDetectionEngine fraudDetectionEngine;
    private final VoucherStateMachine stateMachine;
    private final VoucherStore voucherStore;
    private final RedemptionCommitter committer;
    private final FraudCasePublisher fraudCasePublisher;
    private final Clock clock;

    /**
     * 바우처 사용 처리
     *
     * @param credential 제시된 사용 코드 (토큰 또는 숏코드)
     * @param customerId 인증된 고객 ID
     * @param location 사용 위치 (선택)
     * @return 사용 처리 결과
     */
    public RedemptionResult redeem(String credential, String customerId, GeoPoint location) {
        ResolvedCredential resolved = resolve(credential, customerId);
        return complete(resolved, location, clock.instant());
    }

    /**
     * 사용 코드를 바우처/고객으로 해석
     * 다른 고객에게 묶인 코드는 이 고객에게는 존재하지 않는 코드로 취급한다
     */
    public ResolvedCredential resolve(String credential, String customerId) {
        if (credential == null || credential.isBlank()) {
            throw new MalformedCredentialException("사용 코드가 비어 있습니다");
        }

        if (tokenService.isTokenShaped(credential)) {
            RedemptionClaims claims = tokenService.verifyToken(credential);
            requireSameCustomer(claims.voucherId(), claims.customerId(), customerId);
            return ResolvedCredential.token(claims.voucherId(), claims.customerId());
        }

        ShortCodeRecord record = shortCodeService.lookupShortCode(credential);
        if (record == null) {
            throw new ShortCodeNotFoundException(credential);
        }

        if (record.isDynamic()) {
            requireSameCustomer(record.voucherId(), record.customerId(), customerId);
            return ResolvedCredential.dynamicCode(record.voucherId(), record.customerId(), record.code());
        }

        if (customerId == null || customerId.isBlank()) {
            throw new IllegalArgumentException("고정 숏코드 사용에는 고객 ID가 필요합니다");
        }
        return ResolvedCredential.staticCode(record.voucherId(), customerId, record.code());
    }

    /**
     * 해석된 사용 코드로 사용 확정
     * 오프라인 동기화도 이 경로를 사용한다 (attemptedAt = 단말에서 사용한 시각)
     *
     * @param resolved 해석된 사용 코드
     * @param location 사용 위치 (선택)
     * @param attemptedAt 사용 시각
     */
    public RedemptionResult complete(ResolvedCredential resolved, GeoPoint location, Instant attemptedAt) {
        String voucherId = resolved.voucherId();
        String customerId = resolved.customerId();

        try {
            VoucherSnapshot voucher = voucherStore.getVoucher(voucherId)
                    .orElseThrow(() -> new VoucherNotFoundException(voucherId));

            RedemptionAttempt attempt = new RedemptionAttempt(
                    voucherId, customerId, voucher.providerId(), location, attemptedAt);
            FraudCheckResult fraudResult = fraudDetectionEngine.checkRedemption(attempt);

            stateMachine.validateTransition(voucher.state(), VoucherState.REDEEMED);
            committer.commit(voucher);

            if (resolved.credentialType() == CredentialType.DYNAMIC_CODE) {
                shortCodeService.invalidateShortCode(resolved.shortCode());
            }
            if (fraudResult.hasFlags()) {
                publishFraudCase(attempt, fraudResult);
            }

            log.info("바우처 사용 완료: voucherId={}, customerId={}, credentialType={}, riskScore={}",
                    voucherId, customerId, resolved.credentialType(), fraudResult.riskScore());

            return new RedemptionResult(voucher.redeemed(), fraudResult, resolved.credentialType());
        } catch (BusinessException e) {
            throw e;
        } catch (RuntimeException e) {
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("voucherId", voucherId);
            metadata.put("customerId", customerId);
            throw new RedemptionProcessingException("redeem", metadata, e);
        }
    }

    private void requireSameCustomer(String voucherId, String boundCustomerId, String customerId) {
        if (!boundCustomerId.equals(customerId)) {
            log.warn("다른 고객에게 발급된 사용 코드 제시: voucherId={}, customerId={}", voucherId, customerId);
            throw new ShortCodeNotFoundException();
        }
    }

    private void publishFraudCase(RedemptionAttempt attempt, FraudCheckResult result) {
        try {
            fraudCasePublisher.publishFraudCase(attempt, result);
        } catch (RuntimeException e) {
            log.error("사기 의심 건 발행 실패: voucherId={}", attempt.voucherId(), e);
        }
    }
}
