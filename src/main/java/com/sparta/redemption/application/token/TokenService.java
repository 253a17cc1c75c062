package com.sparta.redemption.application.token;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sparta.redemption.domain.token.OfflineVerification;
import com.sparta.redemption.domain.token.RedemptionClaims;
import com.sparta.redemption.domain.token.exception.InvalidTokenSignatureException;
import com.sparta.redemption.domain.token.exception.MalformedCredentialException;
import com.sparta.redemption.domain.token.exception.TokenExpiredException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.SignatureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Base64;
import java.util.Date;
import java.util.Set;

/**
 * 사용 토큰(QR) 발급 및 검증 서비스
 *
 * 알고리즘: ES256 (P-256 ECDSA)
 * - 발급: 개인키 서명
 * - 검증: 공개키
 *
 * 검증 모드:
 * - 온라인(verifyToken): 만료 시각을 엄격하게 적용
 * - 오프라인(verifyOfflineToken): 만료는 무시하고 발급 후 경과 시간(기본 24시간)만 제한
 *   네트워크가 끊긴 단말에서도 사용을 받되 유출된 토큰의 재사용 범위를 제한한다
 */
@Slf4j
@Service
public class TokenService {

    static final String CLAIM_VOUCHER_ID = "voucherId";
    static final String CLAIM_CUSTOMER_ID = "customerId";

    private final RedemptionTokenProperties properties;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final PrivateKey privateKey;
    private final JwtParser parser;

    public TokenService(RedemptionTokenProperties properties, Clock clock, ObjectMapper objectMapper) {
        this.properties = properties;
        this.clock = clock;
        this.objectMapper = objectMapper;
        this.privateKey = EcKeyParser.parsePrivateKey(properties.getPrivateKey());

        PublicKey publicKey = EcKeyParser.parsePublicKey(properties.getPublicKey());
        this.parser = Jwts.parser()
                .verifyWith(publicKey)
                .requireIssuer(properties.getIssuer())
                .requireAudience(properties.getAudience())
                .clock(() -> Date.from(clock.instant()))
                .build();

        log.info("사용 토큰 서비스 초기화: issuer={}, defaultTtl={}, offlineMaxAge={}",
                properties.getIssuer(), properties.getDefaultTtl(), properties.getOfflineMaxAge());
    }

    /**
     * 기본 유효 시간으로 토큰 발급
     */
    public String generateToken(String voucherId, String customerId) {
        return generateToken(voucherId, customerId, properties.getDefaultTtl());
    }

    /**
     * 사용 토큰 발급
     * 불투명한 voucherId, customerId 외의 개인정보는 담지 않는다
     *
     * @param voucherId 바우처 ID
     * @param customerId 고객 ID
     * @param ttl 유효 시간 (양수)
     * @return compact JWS 문자열
     */
    public String generateToken(String voucherId, String customerId, Duration ttl) {
        requireText(voucherId, "바우처 ID는 필수입니다");
        requireText(customerId, "고객 ID는 필수입니다");
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("토큰 유효 시간은 0보다 커야 합니다");
        }

        // JWT 시각 클레임은 초 단위
        Instant issuedAt = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant expiresAt = issuedAt.plus(ttl);

        String token = Jwts.builder()
                .issuer(properties.getIssuer())
                .audience().add(properties.getAudience()).and()
                .claim(CLAIM_VOUCHER_ID, voucherId)
                .claim(CLAIM_CUSTOMER_ID, customerId)
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(expiresAt))
                .signWith(privateKey, Jwts.SIG.ES256)
                .compact();

        log.debug("사용 토큰 발급: voucherId={}, expiresAt={}", voucherId, expiresAt);
        return token;
    }

    /**
     * 온라인(엄격) 검증
     *
     * @throws TokenExpiredException 만료 시각이 지난 경우
     * @throws InvalidTokenSignatureException 서명이 맞지 않는 경우
     * @throws MalformedCredentialException 해석할 수 없거나 필수 클레임이 없는 경우
     */
    public RedemptionClaims verifyToken(String token) {
        if (!isTokenShaped(token)) {
            throw new MalformedCredentialException("토큰 형식이 아닙니다");
        }

        try {
            Claims claims = parser.parseSignedClaims(token).getPayload();
            return toRedemptionClaims(claims);
        } catch (ExpiredJwtException e) {
            Date expiration = e.getClaims().getExpiration();
            log.debug("만료된 토큰: expiresAt={}", expiration);
            throw new TokenExpiredException(expiration != null ? expiration.toInstant() : null);
        } catch (SignatureException e) {
            log.warn("토큰 서명 검증 실패: token={}", mask(token));
            throw new InvalidTokenSignatureException(e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new MalformedCredentialException("사용 토큰을 해석할 수 없습니다", e);
        }
    }

    /**
     * 오프라인 검증 - 만료는 무시하고 발급 후 경과 시간만 제한
     * 자격 증명 문제는 예외 없이 결과로 반환한다
     */
    public OfflineVerification verifyOfflineToken(String token) {
        return verifyOffline(token, null);
    }

    /**
     * 오프라인 사용 건 검증 - 단말에서 사용한 시각을 기준으로 경과 시간을 제한
     * 발급 시각 <= 사용 시각 <= 발급 시각 + 허용 시간이어야 하며, 사용 시각은 현재보다 늦을 수 없다
     *
     * @param redeemedAt 단말에서 사용 처리한 시각
     */
    public OfflineVerification verifyOfflineToken(String token, Instant redeemedAt) {
        if (redeemedAt == null) {
            throw new IllegalArgumentException("사용 시각은 필수입니다");
        }
        return verifyOffline(token, redeemedAt);
    }

    private OfflineVerification verifyOffline(String token, Instant redeemedAt) {
        if (!isTokenShaped(token)) {
            return OfflineVerification.invalid("토큰 형식이 아닙니다");
        }

        Claims claims;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
        } catch (ExpiredJwtException e) {
            // 서명 검증을 통과한 뒤에 만료 검사가 수행되므로 클레임은 신뢰할 수 있다
            // 발급자/대상 검사는 만료 검사 뒤에 수행되므로 직접 확인
            claims = e.getClaims();
            if (!hasExpectedIssuerAndAudience(claims)) {
                return OfflineVerification.invalid("발급자 또는 대상이 일치하지 않습니다");
            }
        } catch (SignatureException e) {
            log.warn("오프라인 토큰 서명 검증 실패: token={}", mask(token));
            return OfflineVerification.invalid("서명이 유효하지 않습니다");
        } catch (JwtException | IllegalArgumentException e) {
            return OfflineVerification.invalid("토큰을 해석할 수 없습니다");
        }

        Date issuedAt = claims.getIssuedAt();
        if (issuedAt == null) {
            return OfflineVerification.invalid("발급 시각(iat)이 없습니다");
        }

        Instant issued = issuedAt.toInstant();
        Instant now = clock.instant();
        Instant reference = now;
        if (redeemedAt != null) {
            if (redeemedAt.isAfter(now)) {
                return OfflineVerification.invalid("사용 시각이 현재 시각보다 늦습니다");
            }
            if (redeemedAt.isBefore(issued)) {
                return OfflineVerification.invalid("사용 시각이 토큰 발급 시각보다 이릅니다");
            }
            reference = redeemedAt;
        }

        if (issued.isBefore(reference.minus(properties.getOfflineMaxAge()))) {
            return OfflineVerification.invalid(
                    "오프라인 허용 시간(" + properties.getOfflineMaxAge().toHours() + "시간)이 지난 토큰입니다");
        }

        try {
            return OfflineVerification.valid(toRedemptionClaims(claims));
        } catch (IllegalArgumentException e) {
            return OfflineVerification.invalid("필수 클레임이 없습니다");
        }
    }

    /**
     * 서명 검증 없이 클레임만 해석 (진단/로그 전용)
     * 인가 판단에 사용하면 안 된다
     *
     * @return 해석 실패 시 null
     */
    public RedemptionClaims decodeToken(String token) {
        if (!isTokenShaped(token)) {
            return null;
        }

        try {
            byte[] payload = Base64.getUrlDecoder().decode(token.split("\\.")[1]);
            JsonNode node = objectMapper.readTree(payload);
            return new RedemptionClaims(
                    node.path(CLAIM_VOUCHER_ID).asText(null),
                    node.path(CLAIM_CUSTOMER_ID).asText(null),
                    epochSeconds(node, "iat"),
                    epochSeconds(node, "exp")
            );
        } catch (IOException | IllegalArgumentException e) {
            log.debug("토큰 디코딩 실패: token={}", mask(token));
            return null;
        }
    }

    /**
     * 토큰 형태 여부 (점으로 구분된 3개의 비어 있지 않은 구간)
     */
    public boolean isTokenShaped(String credential) {
        if (credential == null) {
            return false;
        }
        String[] parts = credential.split("\\.", -1);
        return parts.length == 3 && Arrays.stream(parts).noneMatch(String::isEmpty);
    }

    private RedemptionClaims toRedemptionClaims(Claims claims) {
        return new RedemptionClaims(
                claims.get(CLAIM_VOUCHER_ID, String.class),
                claims.get(CLAIM_CUSTOMER_ID, String.class),
                toInstant(claims.getIssuedAt()),
                toInstant(claims.getExpiration())
        );
    }

    private boolean hasExpectedIssuerAndAudience(Claims claims) {
        Set<String> audience = claims.getAudience();
        return properties.getIssuer().equals(claims.getIssuer())
                && audience != null
                && audience.contains(properties.getAudience());
    }

    private static Instant epochSeconds(JsonNode node, String field) {
        JsonNode value = node.path(field);
        return value.canConvertToLong() ? Instant.ofEpochSecond(value.asLong()) : null;
    }

    private static Instant toInstant(Date date) {
        return date != null ? date.toInstant() : null;
    }

    private static void requireText(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * 로그/응답용 토큰 마스킹 (앞 6자만 노출)
     */
    public static String mask(String token) {
        if (token == null || token.length() < 10) {
            return "***";
        }
        return token.substring(0, 6) + "...";
    }
}
