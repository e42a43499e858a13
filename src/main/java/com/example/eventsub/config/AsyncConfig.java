package com.example.eventsub.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
public class AsyncConfig {

    /**
     * Pool for fire-and-forget cooldown writes.
     */
    @Bean(name = "taskExecutor")
    public Executor taskExecutor(@Value("${app.async.core-pool-size:4}") int corePoolSize,
                                 @Value("${app.async.max-pool-size:16}") int maxPoolSize,
                                 @Value("${app.async.queue-capacity:200}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        // Bounded; rejected cooldown writes are dropped by CooldownGate
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("EventSub-");
        executor.initialize();
        return executor;
    }
}
