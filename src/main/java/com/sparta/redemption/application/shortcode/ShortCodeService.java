package com.sparta.redemption.application.shortcode;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparta.redemption.common.exception.BusinessException;
import com.sparta.redemption.common.exception.RedemptionProcessingException;
import com.sparta.redemption.domain.shortcode.ShortCodeKind;
import com.sparta.redemption.domain.shortcode.ShortCodeRecord;
import com.sparta.redemption.domain.shortcode.StaticShortCodeStore;
import com.sparta.redemption.domain.shortcode.exception.DuplicateShortCodeException;
import com.sparta.redemption.domain.shortcode.exception.ShortCodeNotFoundException;
import com.sparta.redemption.domain.token.exception.MalformedCredentialException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 숏코드 발급/조회 서비스
 *
 * 저장 계층:
 * - 동적 코드: Redis에만 저장 (SET NX + TTL), 고객 1명에게 묶임
 * - 고정 코드: DB에 영구 저장 후 Redis에 만료 없이 캐시 (인쇄물 캠페인용)
 *
 * Redis 키: shortcode:{code}
 * 값: ShortCodeRecord JSON
 *
 * 동적/고정 코드는 같은 키 공간을 쓰므로 발급 시 서로의 저장소를 확인해 겹치지 않게 한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ShortCodeService {

    private static final String KEY_PREFIX = "shortcode:";
    private static final int MAX_CODE_LENGTH = 20;
    private static final Pattern CODE_SHAPE = Pattern.compile("^[A-Z0-9]+$");
    private static final Pattern CUSTOM_CODE = Pattern.compile("^[A-Z0-9]{4,20}$");

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final StaticShortCodeStore staticShortCodeStore;
    private final ShortCodeProperties properties;
    private final Clock clock;

    private final SecureRandom random = new SecureRandom();

    /**
     * 동적 숏코드 발급
     */
    public String generateShortCode(String voucherId, String customerId) {
        return generateShortCode(voucherId, customerId, ShortCodeKind.DYNAMIC);
    }

    /**
     * 숏코드 발급
     *
     * @param voucherId 바우처 ID
     * @param customerId 고객 ID (DYNAMIC일 때 필수)
     * @param kind 코드 종류
     * @return 발급된 코드
     */
    public String generateShortCode(String voucherId, String customerId, ShortCodeKind kind) {
        requireText(voucherId, "바우처 ID는 필수입니다");
        if (kind == ShortCodeKind.STATIC) {
            return generateStaticCode(voucherId, null);
        }
        requireText(customerId, "동적 숏코드는 고객 ID가 필요합니다");

        try {
            for (int attempt = 1; attempt <= properties.getMaxGenerationAttempts(); attempt++) {
                String code = randomCode();
                if (staticShortCodeStore.find(code).isPresent()) {
                    log.debug("고정 숏코드와 충돌, 재발급: attempt={}", attempt);
                    continue;
                }
                Instant expiresAt = clock.instant().plus(properties.getDynamicTtl());
                ShortCodeRecord record = ShortCodeRecord.dynamic(code, voucherId, customerId, expiresAt);

                // SET NX: 다른 코드와 겹치지 않을 때만 저장
                Boolean stored = redisTemplate.opsForValue()
                        .setIfAbsent(key(code), toJson(record), properties.getDynamicTtl());

                if (Boolean.TRUE.equals(stored)) {
                    log.info("동적 숏코드 발급: voucherId={}, customerId={}, expiresAt={}",
                            voucherId, customerId, expiresAt);
                    return code;
                }
                log.debug("동적 숏코드 충돌, 재발급: attempt={}", attempt);
            }
            throw new IllegalStateException("숏코드 발급 재시도 횟수 초과: " + properties.getMaxGenerationAttempts());
        } catch (RuntimeException e) {
            throw wrap("generateShortCode", voucherId, customerId, e);
        }
    }

    /**
     * 고정 숏코드 발급 (인쇄물 캠페인용)
     *
     * @param voucherId 바우처 ID
     * @param customCode 운영자가 지정한 코드 (null이면 무작위 발급)
     * @throws MalformedCredentialException 지정 코드가 ^[A-Z0-9]{4,20}$ 형식이 아닌 경우
     * @throws DuplicateShortCodeException 이미 등록된 코드인 경우
     */
    public String generateStaticCode(String voucherId, String customCode) {
        requireText(voucherId, "바우처 ID는 필수입니다");
        if (customCode != null && !CUSTOM_CODE.matcher(customCode).matches()) {
            throw new MalformedCredentialException("고정 숏코드는 영문 대문자/숫자 4~20자여야 합니다");
        }

        String code;
        try {
            code = customCode != null
                    ? registerCustomCode(customCode, voucherId)
                    : registerRandomCode(voucherId);
        } catch (RuntimeException e) {
            throw wrap("generateStaticCode", voucherId, null, e);
        }

        cacheQuietly(code, ShortCodeRecord.permanent(code, voucherId), null);
        log.info("고정 숏코드 등록: code={}, voucherId={}", code, voucherId);
        return code;
    }

    /**
     * 숏코드 조회
     * 캐시 → (미스) DB 순서로 조회하고, DB에서 찾은 고정 코드는 캐시에 다시 채운다
     *
     * @return 코드가 없거나 만료되었거나 형식이 맞지 않으면 null
     */
    public ShortCodeRecord lookupShortCode(String code) {
        if (!isCodeShaped(code)) {
            return null;
        }

        try {
            String cached = redisTemplate.opsForValue().get(key(code));
            if (cached != null) {
                ShortCodeRecord record = readRecord(code, cached);
                if (record != null) {
                    if (record.isExpiredAt(clock.instant())) {
                        log.debug("만료된 동적 숏코드 제거: code={}", code);
                        redisTemplate.delete(key(code));
                        return null;
                    }
                    return record;
                }
            }

            Optional<ShortCodeRecord> stored = staticShortCodeStore.find(code);
            if (stored.isEmpty()) {
                return null;
            }

            ShortCodeRecord record = stored.get();
            cacheQuietly(code, record, properties.getStaticCacheTtl());
            log.debug("고정 숏코드 캐시 재적재: code={}", code);
            return record;
        } catch (RuntimeException e) {
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("code", code);
            throw new RedemptionProcessingException("lookupShortCode", metadata, e);
        }
    }

    /**
     * 캐시에서 숏코드 제거 (실패해도 예외를 던지지 않음)
     */
    public void invalidateShortCode(String code) {
        if (code == null) {
            return;
        }
        try {
            redisTemplate.delete(key(code));
            log.debug("숏코드 캐시 제거: code={}", code);
        } catch (RuntimeException e) {
            log.error("숏코드 캐시 제거 실패: code={}", code, e);
        }
    }

    /**
     * 고정 숏코드 폐기 (DB + 캐시)
     *
     * @throws ShortCodeNotFoundException 등록되지 않은 코드인 경우
     */
    public void revokeStaticCode(String code) {
        if (!isCodeShaped(code)) {
            throw new ShortCodeNotFoundException(code);
        }

        boolean deleted;
        try {
            deleted = staticShortCodeStore.delete(code);
        } catch (RuntimeException e) {
            Map<String, String> metadata = new LinkedHashMap<>();
            metadata.put("code", code);
            throw new RedemptionProcessingException("revokeStaticCode", metadata, e);
        }
        if (!deleted) {
            throw new ShortCodeNotFoundException(code);
        }

        invalidateShortCode(code);
        log.info("고정 숏코드 폐기: code={}", code);
    }

    private String registerCustomCode(String code, String voucherId) {
        if (isCached(code) || !staticShortCodeStore.create(code, voucherId)) {
            throw new DuplicateShortCodeException(code);
        }
        return code;
    }

    private String registerRandomCode(String voucherId) {
        for (int attempt = 1; attempt <= properties.getMaxGenerationAttempts(); attempt++) {
            String code = randomCode();
            if (!isCached(code) && staticShortCodeStore.create(code, voucherId)) {
                return code;
            }
            log.debug("고정 숏코드 충돌, 재발급: attempt={}", attempt);
        }
        throw new IllegalStateException("숏코드 발급 재시도 횟수 초과: " + properties.getMaxGenerationAttempts());
    }

    private String randomCode() {
        String alphabet = properties.getAlphabet();
        StringBuilder code = new StringBuilder(properties.getLength());
        for (int i = 0; i < properties.getLength(); i++) {
            code.append(alphabet.charAt(random.nextInt(alphabet.length())));
        }
        return code.toString();
    }

    /**
     * 발급 문자 집합으로 만든 코드 또는 운영자 지정 코드(영문 대문자/숫자) 형태인지 확인
     */
    private boolean isCodeShaped(String code) {
        if (code == null || code.isBlank() || code.length() > MAX_CODE_LENGTH) {
            return false;
        }
        return CODE_SHAPE.matcher(code).matches() || isInAlphabet(code);
    }

    private boolean isInAlphabet(String code) {
        String alphabet = properties.getAlphabet();
        return code.chars().allMatch(ch -> alphabet.indexOf(ch) >= 0);
    }

    private boolean isCached(String code) {
        return Boolean.TRUE.equals(redisTemplate.hasKey(key(code)));
    }

    /**
     * 캐시 값 해석, 읽을 수 없는 값은 제거 후 null
     */
    private ShortCodeRecord readRecord(String code, String json) {
        try {
            return objectMapper.readValue(json, ShortCodeRecord.class);
        } catch (JsonProcessingException e) {
            log.error("숏코드 캐시 값 해석 실패, 제거: code={}", code, e);
            redisTemplate.delete(key(code));
            return null;
        }
    }

    /**
     * 캐시 저장 (실패 시 로그만 남김, 다음 조회에서 DB로부터 다시 채워진다)
     * 이미 다른 값이 있으면 덮어쓰지 않는다
     *
     * @param ttl null이면 만료 없음
     */
    private void cacheQuietly(String code, ShortCodeRecord record, Duration ttl) {
        try {
            Boolean stored = ttl == null
                    ? redisTemplate.opsForValue().setIfAbsent(key(code), toJson(record))
                    : redisTemplate.opsForValue().setIfAbsent(key(code), toJson(record), ttl);
            if (!Boolean.TRUE.equals(stored)) {
                log.warn("숏코드 캐시 키가 이미 사용 중: code={}", code);
            }
        } catch (RuntimeException e) {
            log.error("숏코드 캐시 저장 실패: code={}", code, e);
        }
    }

    private String toJson(ShortCodeRecord record) {
        try {
            return objectMapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("숏코드 직렬화 실패: " + record.code(), e);
        }
    }

    private RuntimeException wrap(String operation, String voucherId, String customerId, RuntimeException e) {
        if (e instanceof BusinessException) {
            return e;
        }
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("voucherId", voucherId);
        metadata.put("customerId", customerId);
        return new RedemptionProcessingException(operation, metadata, e);
    }

    private static String key(String code) {
        return KEY_PREFIX + code;
    }

    private static void requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
    }
}
