package com.sparta.redemption.application.fraud;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparta.redemption.domain.fraud.FraudAuditEntry;
import com.sparta.redemption.domain.fraud.FraudCheckResult;
import com.sparta.redemption.domain.fraud.FraudFlag;
import com.sparta.redemption.domain.fraud.FraudFlagType;
import com.sparta.redemption.domain.fraud.FraudLogScope;
import com.sparta.redemption.domain.fraud.FraudSeverity;
import com.sparta.redemption.domain.fraud.RedemptionAttempt;
import com.sparta.redemption.domain.fraud.vo.GeoPoint;
import com.sparta.redemption.domain.fraud.vo.LastLocation;
import com.sparta.redemption.domain.fraud.vo.LastRedemption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 사용 시도 사기 탐지 엔진
 *
 * 검사 항목 (병렬 실행, 서로 독립):
 * 1. 연속 사용: 직전 사용과 5분 이내 (1분 이내 HIGH)
 * 2. 이동 속도: 다른 제공자 간 이동 속도 60km/h 초과 (100km/h 초과 HIGH)
 * 3. 위치 이탈: 최근 위치 평균 거리 30km 초과 (50km 초과 HIGH)
 *
 * Redis 키 (고객별 이력, last-write-wins):
 * - fraud:last_redemption:{customerId} (1시간)
 * - fraud:location_history:{customerId} (24시간)
 * - fraud:location_pattern:{customerId} (List, 최근 10건, 7일)
 *
 * 소프트 정책: 결과는 항상 allowed=true이며 사용을 막지 않는다.
 * 개별 검사의 오류/시간 초과는 로그만 남기고 플래그 없음으로 처리한다.
 */
@Slf4j
@Service
public class FraudDetectionEngine {

    static final String LAST_REDEMPTION_PREFIX = "fraud:last_redemption:";
    static final String LOCATION_HISTORY_PREFIX = "fraud:location_history:";
    static final String LOCATION_PATTERN_PREFIX = "fraud:location_pattern:";

    private final Executor executor;
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final FraudDetectionProperties properties;
    private final FraudAuditTrail auditTrail;

    public FraudDetectionEngine(@Qualifier("fraudCheckExecutor") Executor executor,
                                StringRedisTemplate redisTemplate,
                                ObjectMapper objectMapper,
                                FraudDetectionProperties properties,
                                FraudAuditTrail auditTrail) {
        this.executor = executor;
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.auditTrail = auditTrail;
    }

    /**
     * 사용 시도 검사
     *
     * @param attempt 사용 시도
     * @return 탐지 결과 (allowed는 항상 true)
     */
    public FraudCheckResult checkRedemption(RedemptionAttempt attempt) {
        CompletableFuture<Optional<FraudFlag>> rapid =
                runCheck("rapid_redemption", () -> checkRapidRedemption(attempt));
        CompletableFuture<Optional<FraudFlag>> velocity =
                runCheck("velocity", () -> checkVelocity(attempt));
        CompletableFuture<Optional<FraudFlag>> anomaly =
                runCheck("location_anomaly", () -> checkLocationAnomaly(attempt));

        // 플래그 순서: 연속 사용 → 이동 속도 → 위치 이탈
        List<FraudFlag> flags = new ArrayList<>();
        rapid.join().ifPresent(flags::add);
        velocity.join().ifPresent(flags::add);
        anomaly.join().ifPresent(flags::add);

        FraudCheckResult result = FraudCheckResult.fromFlags(flags, properties.getReviewScoreThreshold());

        if (result.hasFlags()) {
            log.warn("사기 의심 사용 감지: voucherId={}, customerId={}, providerId={}, riskScore={}, flags={}",
                    attempt.voucherId(), attempt.customerId(), attempt.providerId(),
                    result.riskScore(), flags.stream().map(FraudFlag::type).toList());
            auditTrail.record(FraudAuditEntry.of(attempt, result));
        }

        return result;
    }

    /**
     * 감사 로그 조회 (오래된 순)
     */
    public List<FraudAuditEntry> getFraudLogs(FraudLogScope scope, String id) {
        return auditTrail.getFraudLogs(scope, id);
    }

    private CompletableFuture<Optional<FraudFlag>> runCheck(String name, Supplier<Optional<FraudFlag>> check) {
        try {
            return CompletableFuture.supplyAsync(check, executor)
                    .completeOnTimeout(Optional.empty(), properties.getCheckTimeout().toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(e -> {
                        log.error("사기 탐지 검사 실패: check={}", name, e);
                        return Optional.empty();
                    });
        } catch (RejectedExecutionException e) {
            log.error("사기 탐지 검사 실행 거부: check={}", name, e);
            return CompletableFuture.completedFuture(Optional.empty());
        }
    }

    /**
     * 연속 사용 검사
     * 직전 사용 기록을 읽은 뒤 현재 사용으로 덮어쓴다
     */
    Optional<FraudFlag> checkRapidRedemption(RedemptionAttempt attempt) {
        String key = LAST_REDEMPTION_PREFIX + attempt.customerId();

        try {
            String previousJson = redisTemplate.opsForValue().get(key);
            redisTemplate.opsForValue().set(key,
                    objectMapper.writeValueAsString(new LastRedemption(attempt.timestamp(), attempt.voucherId())),
                    properties.getLastRedemptionTtl());

            if (previousJson == null) {
                return Optional.empty();
            }

            LastRedemption previous = objectMapper.readValue(previousJson, LastRedemption.class);
            Duration gap = Duration.between(previous.timestamp(), attempt.timestamp());
            if (gap.isNegative()) {
                // 순서가 뒤바뀐 요청은 동시 사용으로 본다
                gap = Duration.ZERO;
            }

            if (gap.compareTo(properties.getRapidRedemptionWindow()) >= 0) {
                return Optional.empty();
            }

            FraudSeverity severity = gap.compareTo(properties.getRapidRedemptionHighWindow()) < 0
                    ? FraudSeverity.HIGH
                    : FraudSeverity.MEDIUM;

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("previousVoucherId", previous.voucherId());
            details.put("minutesApart", Math.round(gap.toMillis() / 6_000.0) / 10.0);

            return Optional.of(FraudFlag.of(FraudFlagType.RAPID_REDEMPTION, severity,
                    String.format("%d초 간격으로 연속 사용되었습니다", gap.toSeconds()), details));
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("연속 사용 검사 실패: customerId={}", attempt.customerId(), e);
            return Optional.empty();
        }
    }

    /**
     * 이동 속도 검사
     * 위치가 있을 때만 수행하며, 같은 제공자(다중 지점) 간 이동은 검사하지 않는다
     */
    Optional<FraudFlag> checkVelocity(RedemptionAttempt attempt) {
        if (attempt.location() == null) {
            return Optional.empty();
        }
        String key = LOCATION_HISTORY_PREFIX + attempt.customerId();

        try {
            String previousJson = redisTemplate.opsForValue().get(key);
            redisTemplate.opsForValue().set(key,
                    objectMapper.writeValueAsString(
                            new LastLocation(attempt.location(), attempt.timestamp(), attempt.providerId())),
                    properties.getLastLocationTtl());

            if (previousJson == null) {
                return Optional.empty();
            }

            LastLocation previous = objectMapper.readValue(previousJson, LastLocation.class);
            if (previous.location() == null || attempt.providerId().equals(previous.providerId())) {
                return Optional.empty();
            }

            double distanceKm = previous.location().distanceKmTo(attempt.location());
            Duration elapsed = Duration.between(previous.timestamp(), attempt.timestamp());

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("previousProviderId", previous.providerId());
            details.put("distanceKm", Math.round(distanceKm));

            if (elapsed.isZero() || elapsed.isNegative()) {
                return Optional.of(FraudFlag.of(FraudFlagType.VELOCITY, FraudSeverity.HIGH,
                        "서로 다른 위치에서 동시에 사용되었습니다", details));
            }

            double hours = elapsed.toMillis() / 3_600_000.0;
            double speedKmh = distanceKm / hours;
            if (speedKmh <= properties.getVelocityThresholdKmh()) {
                return Optional.empty();
            }

            details.put("hours", Math.round(hours * 10) / 10.0);
            details.put("speedKmh", Math.round(speedKmh));

            FraudSeverity severity = speedKmh > properties.getVelocityHighKmh()
                    ? FraudSeverity.HIGH
                    : FraudSeverity.MEDIUM;
            return Optional.of(FraudFlag.of(FraudFlagType.VELOCITY, severity,
                    String.format("비정상적인 이동 속도: %dkm/h", Math.round(speedKmh)), details));
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("이동 속도 검사 실패: customerId={}", attempt.customerId(), e);
            return Optional.empty();
        }
    }

    /**
     * 위치 이탈 검사
     * 표본이 부족하면 위치만 기록하고, 충분하면 최근 위치들과의 평균 거리를 본다
     */
    Optional<FraudFlag> checkLocationAnomaly(RedemptionAttempt attempt) {
        if (attempt.location() == null) {
            return Optional.empty();
        }
        String key = LOCATION_PATTERN_PREFIX + attempt.customerId();

        try {
            List<String> history = redisTemplate.opsForList().range(key, 0, -1);

            List<GeoPoint> samples = new ArrayList<>();
            if (history != null) {
                for (String json : history) {
                    samples.add(objectMapper.readValue(json, GeoPoint.class));
                }
            }

            appendLocation(key, attempt.location());

            if (samples.size() < properties.getAnomalyMinSamples()) {
                return Optional.empty();
            }

            double averageKm = samples.stream()
                    .mapToDouble(sample -> sample.distanceKmTo(attempt.location()))
                    .average()
                    .orElse(0.0);

            if (averageKm <= properties.getAnomalyRadiusKm()) {
                return Optional.empty();
            }

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("averageDistanceKm", Math.round(averageKm));
            details.put("samples", samples.size());

            FraudSeverity severity = averageKm > properties.getAnomalyHighKm()
                    ? FraudSeverity.HIGH
                    : FraudSeverity.MEDIUM;
            return Optional.of(FraudFlag.of(FraudFlagType.LOCATION_ANOMALY, severity,
                    String.format("평소 사용 위치에서 평균 %dkm 떨어진 곳에서 사용되었습니다", Math.round(averageKm)),
                    details));
        } catch (JsonProcessingException | RuntimeException e) {
            log.error("위치 이탈 검사 실패: customerId={}", attempt.customerId(), e);
            return Optional.empty();
        }
    }

    private void appendLocation(String key, GeoPoint location) throws JsonProcessingException {
        redisTemplate.opsForList().rightPush(key, objectMapper.writeValueAsString(location));
        redisTemplate.opsForList().trim(key, -properties.getLocationHistorySize(), -1);
        redisTemplate.expire(key, properties.getLocationHistoryTtl());
    }
}
