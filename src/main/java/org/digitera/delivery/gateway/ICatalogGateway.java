package org.digitera.delivery.gateway;

/**
 * 商品目录（外部只读服务）
 * - 下单时获取价格
 * - 履约时重新获取下载次数上限与有效期策略
 */
public interface ICatalogGateway {

    /**
     * 查询商品
     *
     * @param productId 商品ID
     * @return 商品信息；商品不存在时返回 null
     * @throws org.digitera.delivery.exception.BusinessException COLLABORATOR_UNAVAILABLE 目录不可达
     */
    CatalogProduct resolveProduct(String productId);
}
