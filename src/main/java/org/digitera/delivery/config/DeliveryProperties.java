package org.digitera.delivery.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 交付核心配置（digitera.delivery.*）
 */
@Data
@ConfigurationProperties(prefix = "digitera.delivery")
public class DeliveryProperties {

    private Token token = new Token();

    private Blob blob = new Blob();

    private Catalog catalog = new Catalog();

    private Mq mq = new Mq();

    private Redisson redisson = new Redisson();

    /**
     * 下载令牌
     */
    @Data
    public static class Token {
        /**
         * HMAC 签名密钥
         */
        private String secret;
        /**
         * 令牌有效期
         */
        private Duration ttl = Duration.ofMinutes(5);
    }

    /**
     * 文件存储临时地址
     */
    @Data
    public static class Blob {
        private String baseUrl;
        private String signingSecret;
        private Duration urlTtl = Duration.ofMinutes(2);
    }

    /**
     * 商品目录服务
     */
    @Data
    public static class Catalog {
        private String baseUrl;
        private Duration connectTimeout = Duration.ofSeconds(1);
        private Duration readTimeout = Duration.ofSeconds(2);
    }

    @Data
    public static class Mq {
        private boolean enabled;
    }

    @Data
    public static class Redisson {
        private boolean enabled;
        private String address = "redis://localhost:6379";
    }
}
