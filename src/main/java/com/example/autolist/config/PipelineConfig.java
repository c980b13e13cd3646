package com.example.autolist.config;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * 벌크 작업 실행기 및 시간 소스 설정
 */
@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 벌크 작업 전용 스레드 풀
     * 작업 하나가 스레드 하나를 점유하며 해당 작업의 레지스트리 항목에 대한 유일한 writer가 됩니다.
     */
    @Bean
    @Qualifier("bulkJobExecutor")
    public ThreadPoolTaskExecutor bulkJobExecutor(PipelineProperties properties) {
        PipelineProperties.Executor config = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getCorePoolSize());
        executor.setMaxPoolSize(config.getMaxPoolSize());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("bulk-job-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }
}
