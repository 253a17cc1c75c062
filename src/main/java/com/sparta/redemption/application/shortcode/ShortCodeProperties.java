package com.sparta.redemption.application.shortcode;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * 숏코드 설정 - redemption.short-code
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "redemption.short-code")
public class ShortCodeProperties {

    // 혼동하기 쉬운 0, O, I, l 제외
    @NotBlank
    private String alphabet = "123456789ABCDEFGHJKLMNPQRSTUVWXYZ";

    @Min(4)
    @Max(20)
    private int length = 8;

    // 동적 코드 유효 시간
    @NotNull
    private Duration dynamicTtl = Duration.ofSeconds(300);

    // 캐시 미스 후 DB에서 다시 채운 고정 코드의 캐시 유지 시간
    @NotNull
    private Duration staticCacheTtl = Duration.ofHours(1);

    @Min(1)
    private int maxGenerationAttempts = 5;
}
