package com.sparta.redemption.application.fraud;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparta.redemption.domain.fraud.FraudAuditEntry;
import com.sparta.redemption.domain.fraud.FraudLogScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 사기 의심 사용 감사 로그 (Redis List)
 *
 * 키:
 * - fraud:log:customer:{customerId}
 * - fraud:log:provider:{providerId}
 * - fraud:log:admin:high_risk (위험 점수가 검토 기준을 넘는 경우만)
 *
 * 각 목록은 최신 N건만 유지하고 보관 기간이 지나면 만료된다.
 * 목록별 기록은 서로 독립적이며 실패해도 사용 처리에 영향을 주지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FraudAuditTrail {

    static final String CUSTOMER_LOG_PREFIX = "fraud:log:customer:";
    static final String PROVIDER_LOG_PREFIX = "fraud:log:provider:";
    static final String ADMIN_LOG_KEY = "fraud:log:admin:high_risk";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final FraudDetectionProperties properties;

    public void record(FraudAuditEntry entry) {
        String json;
        try {
            json = objectMapper.writeValueAsString(entry);
        } catch (JsonProcessingException e) {
            log.error("감사 로그 직렬화 실패: voucherId={}", entry.voucherId(), e);
            return;
        }

        append(CUSTOMER_LOG_PREFIX + entry.customerId(), json);
        append(PROVIDER_LOG_PREFIX + entry.providerId(), json);
        if (entry.riskScore() > properties.getReviewScoreThreshold()) {
            append(ADMIN_LOG_KEY, json);
        }
    }

    /**
     * 감사 로그 조회 (오래된 순)
     *
     * @param scope 조회 범위
     * @param id 고객/제공자 ID (ADMIN은 무시)
     * @return 조회 실패 시 빈 목록
     */
    public List<FraudAuditEntry> getFraudLogs(FraudLogScope scope, String id) {
        String key = keyOf(scope, id);
        try {
            List<String> values = redisTemplate.opsForList().range(key, 0, -1);
            if (values == null) {
                return List.of();
            }

            List<FraudAuditEntry> entries = new ArrayList<>(values.size());
            for (String value : values) {
                entries.add(objectMapper.readValue(value, FraudAuditEntry.class));
            }
            return entries;
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("감사 로그 조회 실패: key={}", key, e);
            return List.of();
        }
    }

    private void append(String key, String json) {
        try {
            redisTemplate.opsForList().rightPush(key, json);
            redisTemplate.opsForList().trim(key, -properties.getAuditTrailSize(), -1);
            redisTemplate.expire(key, properties.getAuditRetention());
        } catch (RuntimeException e) {
            log.error("감사 로그 기록 실패: key={}", key, e);
        }
    }

    private static String keyOf(FraudLogScope scope, String id) {
        return switch (scope) {
            case CUSTOMER -> CUSTOMER_LOG_PREFIX + id;
            case PROVIDER -> PROVIDER_LOG_PREFIX + id;
            case ADMIN -> ADMIN_LOG_KEY;
        };
    }
}
