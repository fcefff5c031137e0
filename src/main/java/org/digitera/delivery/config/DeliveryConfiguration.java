package org.digitera.delivery.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(DeliveryProperties.class)
public class DeliveryConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * 商品目录客户端：短超时，目录不可达时快速失败
     */
    @Bean
    public RestTemplate catalogRestTemplate(RestTemplateBuilder builder, DeliveryProperties properties) {
        DeliveryProperties.Catalog catalog = properties.getCatalog();
        return builder
                .rootUri(catalog.getBaseUrl())
                .setConnectTimeout(catalog.getConnectTimeout())
                .setReadTimeout(catalog.getReadTimeout())
                .build();
    }
}
