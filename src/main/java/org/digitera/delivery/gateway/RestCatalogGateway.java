package org.digitera.delivery.gateway;

import lombok.extern.slf4j.Slf4j;
import org.digitera.delivery.exception.BusinessException;
import org.digitera.delivery.exception.ErrorCode;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * 基于HTTP的商品目录客户端
 * 超时时间由 digitera.delivery.catalog.* 配置，失败不做本地重试
 */
@Slf4j
@Component
public class RestCatalogGateway implements ICatalogGateway {

    private static final String PRODUCT_PATH = "/api/catalog/products/{productId}";

    private final RestTemplate restTemplate;

    public RestCatalogGateway(@Qualifier("catalogRestTemplate") RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    @Override
    public CatalogProduct resolveProduct(String productId) {
        try {
            return restTemplate.getForObject(PRODUCT_PATH, CatalogProduct.class, productId);
        } catch (HttpClientErrorException.NotFound e) {
            log.warn("[商品不存在] productId={}", productId);
            return null;
        } catch (RestClientException e) {
            log.error("[商品目录不可用] productId={}, errorMsg={}", productId, e.getMessage());
            throw new BusinessException(ErrorCode.COLLABORATOR_UNAVAILABLE,
                    "商品目录不可用: " + e.getMessage(), e);
        }
    }
}
