package com.foo.tariff.config;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;

/**
 * 조항 참조 조회 전용 실행기. 계산 경로는 이 실행기를 쓰지 않는다.
 */
@Slf4j
@Configuration
public class ExecutorConfig {

    private static final int QUEUE_CAPACITY = 100;

    @Bean("explanationExecutor")
    public ThreadPoolTaskExecutor explanationExecutor(TariffEngineProperties properties) {
        int threads = Math.max(1, properties.getExplanationThreads());
        log.info("Creating explanation executor with {} thread(s) and MDC propagation", threads);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(QUEUE_CAPACITY);
        executor.setThreadNamePrefix("clause-lookup-");
        executor.setTaskDecorator(mdcPropagating());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    private TaskDecorator mdcPropagating() {
        return runnable -> {
            final Map<String, String> context = MDC.getCopyOfContextMap();
            return () -> {
                if (context != null) {
                    MDC.setContextMap(context);
                }
                try {
                    runnable.run();
                } finally {
                    MDC.clear();
                }
            };
        };
    }
}
