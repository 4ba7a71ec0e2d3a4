package com.demo.chathub.config;

import lombok.extern.slf4j.Slf4j;
import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redis is only used for cross-node presence, so the pool stays small.
 */
@Slf4j
@Configuration
public class RedisConfig {

    @Value("${spring.data.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.data.redis.port:6379}")
    private int redisPort;

    @Value("${presence.redis.pool-size:8}")
    private int poolSize;

    @Value("${presence.redis.timeout-ms:3000}")
    private int timeoutMs;

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient() {
        String address = "redis://" + redisHost + ":" + redisPort;
        Config config = new Config();
        config.useSingleServer()
                .setAddress(address)
                .setConnectionPoolSize(poolSize)
                .setConnectionMinimumIdleSize(Math.min(2, poolSize))
                .setTimeout(timeoutMs)
                .setConnectTimeout(timeoutMs)
                .setRetryAttempts(2)
                .setRetryInterval(1000);

        log.info("Presence store: redis={}, poolSize={}", address, poolSize);
        return Redisson.create(config);
    }
}
