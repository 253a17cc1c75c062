package com.sparta.redemption.application.shortcode;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sparta.redemption.common.exception.RedemptionProcessingException;
import com.sparta.redemption.domain.shortcode.ShortCodeKind;
import com.sparta.redemption.domain.shortcode.ShortCodeRecord;
import com.sparta.redemption.domain.shortcode.StaticShortCodeStore;
import com.sparta.redemption.domain.shortcode.exception.DuplicateShortCodeException;
import com.sparta.redemption.domain.shortcode.exception.ShortCodeNotFoundException;
import com.sparta.redemption.domain.token.exception.MalformedCredentialException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * 숏코드 발급/조회 서비스 테스트
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("ShortCodeService 테스트")
class ShortCodeServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private StaticShortCodeStore staticShortCodeStore;

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final ShortCodeProperties properties = new ShortCodeProperties();

    private ShortCodeService shortCodeService;

    @BeforeEach
    void setUp() {
        shortCodeService = new ShortCodeService(redisTemplate, objectMapper, staticShortCodeStore,
                properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("동적 코드는 설정된 길이와 문자 집합으로 발급되고 TTL과 함께 SET NX로 저장된다")
    void 동적_코드_발급() throws Exception {
        // given
        given(redisTemplate.opsForValue()).willReturn(valueOperations);
        given(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).willReturn(true);

        // when
        String code = shortCodeService.generateShortCode("V001", "C001");

        // then
        assertThat(code).hasSize(8);
        assertThat(code.chars()).allMatch(ch -> properties.getAlphabet().indexOf(ch) >= 0);

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).setIfAbsent(eq("shortcode:" + code), json.capture(), eq(Duration.ofSeconds(300)));

        ShortCodeRecord stored = objectMapper.readValue(json.getValue(), ShortCodeRecord.class);
        assertThat(stored.kind()).isEqualTo(ShortCodeKind.DYNAMIC);
        assertThat(stored.customerId()).isEqualTo("C001");
        assertThat(stored.expiresAt()).isEqualTo(NOW.plusSeconds(300));
    }

    @Test
    @DisplayName("동적 코드가 이미 쓰이고 있으면 새 코드로 다시 시도한다")
    void 동적_코드_충돌_재시도() {
        // given
        given(redisTemplate.opsForValue()).willReturn(valueOperations);
        given(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).willReturn(false, true);

        // when
        String code = shortCodeService.generateShortCode("V001", "C001");

        // then
        assertThat(code).isNotBlank();
        verify(valueOperations, times(2)).setIfAbsent(anyString(), anyString(), any(Duration.class));
    }

    @Test
    @DisplayName("재시도 횟수를 넘기면 처리 오류가 발생한다")
    void 동적_코드_재시도_초과() {
        // given
        given(redisTemplate.opsForValue()).willReturn(valueOperations);
        given(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).willReturn(false);

        // when & then
        assertThatThrownBy(() -> shortCodeService.generateShortCode("V001", "C001"))
                .isInstanceOf(RedemptionProcessingException.class);
        verify(valueOperations, times(5)).setIfAbsent(anyString(), anyString(), any(Duration.class));
    }

    @Test
    @DisplayName("동적 코드는 고객 ID 없이 발급할 수 없다")
    void 동적_코드_고객_필수() {
        // when & then
        assertThatThrownBy(() -> shortCodeService.generateShortCode("V001", null, ShortCodeKind.DYNAMIC))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("동적 숏코드는 고객 ID가 필요합니다");
        verifyNoInteractions(redisTemplate);
    }

    @Test
    @DisplayName("운영자가 지정한 고정 코드는 DB에 등록된 뒤 만료 없이 캐시된다")
    void 고정_코드_지정_발급() {
        // given
        given(staticShortCodeStore.create("SPRING2024", "V001")).willReturn(true);
        given(redisTemplate.opsForValue()).willReturn(valueOperations);

        // when
        String code = shortCodeService.generateStaticCode("V001", "SPRING2024");

        // then
        assertThat(code).isEqualTo("SPRING2024");
        verify(valueOperations).setIfAbsent(eq("shortcode:SPRING2024"), anyString());
    }

    @Test
    @DisplayName("같은 문자열의 동적 코드가 캐시에 살아 있으면 고정 코드로 등록할 수 없다")
    void 고정_코드_동적_코드와_충돌() {
        // given
        given(redisTemplate.hasKey("shortcode:SPRING2024")).willReturn(true);

        // when & then
        assertThatThrownBy(() -> shortCodeService.generateStaticCode("V001", "SPRING2024"))
                .isInstanceOf(DuplicateShortCodeException.class);
        verify(staticShortCodeStore, never()).create(anyString(), anyString());
    }

    @Test
    @DisplayName("무작위 동적 코드가 등록된 고정 코드와 겹치면 새 코드로 다시 시도한다")
    void 동적_코드_고정_코드와_충돌() {
        // given
        given(staticShortCodeStore.find(anyString()))
                .willReturn(Optional.of(ShortCodeRecord.permanent("SPRING2024", "V009")), Optional.empty());
        given(redisTemplate.opsForValue()).willReturn(valueOperations);
        given(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).willReturn(true);

        // when
        String code = shortCodeService.generateShortCode("V001", "C001");

        // then
        verify(staticShortCodeStore, times(2)).find(anyString());
        verify(valueOperations, times(1)).setIfAbsent(eq("shortcode:" + code), anyString(), any(Duration.class));
    }

    @Test
    @DisplayName("설정한 문자 집합이 소문자여도 발급한 동적 코드를 다시 조회할 수 있다")
    void 사용자_정의_문자_집합_조회() {
        // given
        properties.setAlphabet("abcdefghjkmnpqrstuvwxyz23456789");
        given(redisTemplate.opsForValue()).willReturn(valueOperations);
        given(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class))).willReturn(true);
        String code = shortCodeService.generateShortCode("V001", "C001");

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(valueOperations).setIfAbsent(eq("shortcode:" + code), json.capture(), any(Duration.class));
        given(valueOperations.get("shortcode:" + code)).willReturn(json.getValue());

        // when
        ShortCodeRecord result = shortCodeService.lookupShortCode(code);

        // then
        assertThat(code).matches("[a-z2-9]{8}");
        assertThat(result).isNotNull();
        assertThat(result.code()).isEqualTo(code);
        assertThat(result.customerId()).isEqualTo("C001");
    }

    @Test
    @DisplayName("지정 코드 형식이 맞지 않으면 형식 오류가 발생한다")
    void 고정_코드_형식_오류() {
        // when & then
        assertThatThrownBy(() -> shortCodeService.generateStaticCode("V001", "spring"))
                .isInstanceOf(MalformedCredentialException.class);
        assertThatThrownBy(() -> shortCodeService.generateStaticCode("V001", "AB1"))
                .isInstanceOf(MalformedCredentialException.class);
        verifyNoInteractions(staticShortCodeStore);
    }

    @Test
    @DisplayName("이미 등록된 고정 코드는 충돌 예외가 발생한다")
    void 고정_코드_중복() {
        // given
        given(staticShortCodeStore.create("SPRING2024", "V002")).willReturn(false);

        // when & then
        assertThatThrownBy(() -> shortCodeService.generateStaticCode("V002", "SPRING2024"))
                .isInstanceOf(DuplicateShortCodeException.class)
                .hasMessage("이미 등록된 숏코드입니다: SPRING2024");
        verify(redisTemplate, never()).opsForValue();
    }

    @Test
    @DisplayName("코드가 될 수 없는 값은 저장소를 조회하지 않고 null을 반환한다")
    void 형식이_아닌_코드_조회() {
        // when & then
        assertThat(shortCodeService.lookupShortCode("")).isNull();
        assertThat(shortCodeService.lookupShortCode("abcd2345")).isNull();
        assertThat(shortCodeService.lookupShortCode("ABCD-2345")).isNull();
        assertThat(shortCodeService.lookupShortCode("A".repeat(21))).isNull();
        verifyNoInteractions(redisTemplate, staticShortCodeStore);
    }

    @Test
    @DisplayName("캐시에 있는 유효한 동적 코드를 반환한다")
    void 캐시_조회_성공() throws Exception {
        // given
        ShortCodeRecord record = ShortCodeRecord.dynamic("ABCD2345", "V001", "C001", NOW.plusSeconds(60));
        given(redisTemplate.opsForValue()).willReturn(valueOperations);
        given(valueOperations.get("shortcode:ABCD2345")).willReturn(objectMapper.writeValueAsString(record));

        // when
        ShortCodeRecord result = shortCodeService.lookupShortCode("ABCD2345");

        // then
        assertThat(result).isEqualTo(record);
        verifyNoInteractions(staticShortCodeStore);
    }

    @Test
    @DisplayName("논리적으로 만료된 동적 코드는 캐시에서 지우고 null을 반환한다")
    void 만료된_동적_코드() throws Exception {
        // given
        ShortCodeRecord record = ShortCodeRecord.dynamic("ABCD2345", "V001", "C001", NOW.minusSeconds(1));
        given(redisTemplate.opsForValue()).willReturn(valueOperations);
        given(valueOperations.get("shortcode:ABCD2345")).willReturn(objectMapper.writeValueAsString(record));

        // when
        ShortCodeRecord result = shortCodeService.lookupShortCode("ABCD2345");

        // then
        assertThat(result).isNull();
        verify(redisTemplate).delete("shortcode:ABCD2345");
    }

    @Test
    @DisplayName("캐시 미스 시 DB의 고정 코드를 찾아 1시간 TTL로 캐시를 다시 채운다")
    void 캐시_미스_DB_조회() {
        // given
        given(redisTemplate.opsForValue()).willReturn(valueOperations);
        given(valueOperations.get("shortcode:SPRING2024")).willReturn(null);
        given(staticShortCodeStore.find("SPRING2024"))
                .willReturn(Optional.of(ShortCodeRecord.permanent("SPRING2024", "V001")));

        // when
        ShortCodeRecord result = shortCodeService.lookupShortCode("SPRING2024");

        // then
        assertThat(result.voucherId()).isEqualTo("V001");
        assertThat(result.kind()).isEqualTo(ShortCodeKind.STATIC);
        verify(valueOperations).setIfAbsent(eq("shortcode:SPRING2024"), anyString(), eq(Duration.ofHours(1)));
    }

    @Test
    @DisplayName("캐시와 DB 어디에도 없으면 null을 반환한다")
    void 없는_코드() {
        // given
        given(redisTemplate.opsForValue()).willReturn(valueOperations);
        given(valueOperations.get("shortcode:ZZZZ9999")).willReturn(null);
        given(staticShortCodeStore.find("ZZZZ9999")).willReturn(Optional.empty());

        // when & then
        assertThat(shortCodeService.lookupShortCode("ZZZZ9999")).isNull();
    }

    @Test
    @DisplayName("조회 중 Redis 오류는 컨텍스트를 담아 다시 던진다")
    void 조회_중_오류() {
        // given
        given(redisTemplate.opsForValue()).willReturn(valueOperations);
        given(valueOperations.get("shortcode:ABCD2345"))
                .willThrow(new RedisConnectionFailureException("connection refused"));

        // when & then
        assertThatThrownBy(() -> shortCodeService.lookupShortCode("ABCD2345"))
                .isInstanceOf(RedemptionProcessingException.class)
                .satisfies(e -> {
                    RedemptionProcessingException exception = (RedemptionProcessingException) e;
                    assertThat(exception.getOperation()).isEqualTo("lookupShortCode");
                    assertThat(exception.getMetadata()).containsEntry("code", "ABCD2345");
                });
    }

    @Test
    @DisplayName("캐시 삭제 실패는 예외로 전파되지 않는다")
    void 무효화_실패_무시() {
        // given
        willThrow(new RedisConnectionFailureException("connection refused"))
                .given(redisTemplate).delete(anyString());

        // when & then
        assertThatCode(() -> shortCodeService.invalidateShortCode("ABCD2345"))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("고정 코드를 폐기하면 DB와 캐시에서 모두 지운다")
    void 고정_코드_폐기() {
        // given
        given(staticShortCodeStore.delete("SPRING2024")).willReturn(true);

        // when
        shortCodeService.revokeStaticCode("SPRING2024");

        // then
        verify(redisTemplate).delete("shortcode:SPRING2024");
    }

    @Test
    @DisplayName("등록되지 않은 고정 코드를 폐기하면 NotFound 예외가 발생한다")
    void 없는_고정_코드_폐기() {
        // given
        given(staticShortCodeStore.delete("SPRING2024")).willReturn(false);

        // when & then
        assertThatThrownBy(() -> shortCodeService.revokeStaticCode("SPRING2024"))
                .isInstanceOf(ShortCodeNotFoundException.class);
        verifyNoInteractions(redisTemplate);
    }
}
