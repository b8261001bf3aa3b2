package com.servicebooking.booking.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Bounded pool for external calendar fetches. A fetch that outlives its timeout keeps its
 * thread until the HTTP call returns, so the queue is small and overflow is rejected
 * (the caller treats rejection as a degraded calendar).
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "calendarExecutor")
    public Executor calendarExecutor(
            @Value("${booking.calendar.pool-size:8}") int poolSize,
            @Value("${booking.calendar.queue-capacity:50}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("calendar-");
        executor.initialize();
        return executor;
    }
}
