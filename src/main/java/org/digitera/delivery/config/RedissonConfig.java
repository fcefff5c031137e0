package org.digitera.delivery.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Redisson 配置
 * - 仅在 digitera.delivery.redisson.enabled=true 时启用
 */
@Configuration
@ConditionalOnProperty(prefix = "digitera.delivery.redisson", name = "enabled", havingValue = "true")
public class RedissonConfig {

    @Bean(destroyMethod = "shutdown")
    public RedissonClient redissonClient(DeliveryProperties properties) {
        Config config = new Config();
        config.useSingleServer().setAddress(properties.getRedisson().getAddress());
        return Redisson.create(config);
    }
}
