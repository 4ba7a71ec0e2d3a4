package com.demo.chathub.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools of the hub.
 *
 * relayExecutor runs one writer task per connection plus one relay task per channel
 * receiver. Those tasks block for the lifetime of a subscription, so the pool hands
 * every task its own thread instead of queueing it.
 */
@Configuration
public class ExecutorConfig {

    @Bean(name = "relayExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor relayExecutor(
            @Value("${chat.executor.relay.core-size:16}") int coreSize,
            @Value("${chat.executor.relay.max-size:4096}") int maxSize) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("session-relay-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "completionExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor completionExecutor(
            @Value("${chat.executor.completion.core-size:4}") int coreSize,
            @Value("${chat.executor.completion.max-size:16}") int maxSize,
            @Value("${chat.executor.completion.queue-capacity:500}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("llm-completion-");
        executor.initialize();
        return executor;
    }
}
