package com.sparta.redemption.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 사기 탐지 검사 전용 스레드 풀
 *
 * 검사 3종을 병렬로 실행한다.
 * 큐가 가득 차면 호출 스레드에서 실행하여 검사를 누락하지 않는다.
 */
@Configuration
public class FraudExecutorConfig {

    @Bean(name = "fraudCheckExecutor")
    public Executor fraudCheckExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(6);
        executor.setMaxPoolSize(24);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("fraud-check-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.initialize();
        return executor;
    }
}
