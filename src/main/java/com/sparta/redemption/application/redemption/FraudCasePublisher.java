package com.sparta.redemption.application.redemption;

import com.sparta.redemption.domain.fraud.FraudCheckResult;
import com.sparta.redemption.domain.fraud.RedemptionAttempt;

/**
 * 사기 의심 사용 건 발행 (사례 관리 시스템 연동)
 * 구현체는 발행 실패를 호출자에게 전파하지 않아야 한다
 */
public interface FraudCasePublisher {

    void publishFraudCase(RedemptionAttempt attempt, FraudCheckResult result);
}
