package com.sparta.redemption.infrastructure.kafka.fraud.producer;

import com.sparta.redemption.application.redemption.FraudCasePublisher;
import com.sparta.redemption.domain.fraud.FraudCheckResult;
import com.sparta.redemption.domain.fraud.RedemptionAttempt;
import com.sparta.redemption.infrastructure.kafka.fraud.message.FraudCaseMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * 사기 의심 사용 건 Kafka Producer
 *
 * 파티션 전략:
 * - 메시지 키: customerId
 * - 같은 고객의 사례는 발행 순서대로 처리된다
 *
 * 발행은 best-effort이며 실패해도 사용 처리에 영향을 주지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FraudCaseKafkaProducer implements FraudCasePublisher {

    static final String TOPIC = "redemption-fraud-case";

    private final KafkaTemplate<String, FraudCaseMessage> kafkaTemplate;

    @Override
    public void publishFraudCase(RedemptionAttempt attempt, FraudCheckResult result) {
        FraudCaseMessage message = FraudCaseMessage.of(attempt, result);
        String customerId = attempt.customerId();

        try {
            kafkaTemplate.send(TOPIC, customerId, message)
                    .whenComplete((sendResult, ex) -> {
                        if (ex != null) {
                            log.error("[Kafka Producer] 사기 의심 건 발행 실패 - voucherId: {}, customerId: {}",
                                    attempt.voucherId(), customerId, ex);
                        } else {
                            log.info("[Kafka Producer] 사기 의심 건 발행 성공 - voucherId: {}, riskScore: {}, partition: {}",
                                    attempt.voucherId(), result.riskScore(),
                                    sendResult.getRecordMetadata().partition());
                        }
                    });
        } catch (RuntimeException e) {
            // 브로커 메타데이터 조회 실패 등은 send 호출 시점에 바로 던져진다
            log.error("[Kafka Producer] 사기 의심 건 발행 요청 실패 - voucherId: {}, customerId: {}",
                    attempt.voucherId(), customerId, e);
        }
    }
}
