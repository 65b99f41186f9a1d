package com.openwash.booking.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redisson client for the distributed reservation strategy.
 * Only created when {@code capacity.reservation.strategy=distributed}; the other strategies need no Redis.
 */
@Configuration
@ConditionalOnProperty(name = "capacity.reservation.strategy", havingValue = "distributed")
public class RedissonConfig {

    @Value("${capacity.redis.address:redis://localhost:6379}")
    private String address;

    @Value("${capacity.redis.connect-timeout-ms:3000}")
    private int connectTimeoutMs;

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient() {
        Config config = new Config();
        config.useSingleServer()
                .setAddress(address)
                .setConnectTimeout(connectTimeoutMs);
        return Redisson.create(config);
    }
}
