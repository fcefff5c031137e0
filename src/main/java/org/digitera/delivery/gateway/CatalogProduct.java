package org.digitera.delivery.gateway;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 商品目录返回的商品信息
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CatalogProduct {

    private String productId;

    private String name;

    /**
     * 是否可售
     */
    private boolean available;

    private BigDecimal price;

    private String currency;

    /**
     * 下载次数上限，null 表示不限
     */
    private Integer downloadLimit;

    /**
     * 履约后授权有效天数，null 表示永不过期
     */
    private Integer downloadExpiryDays;

    /**
     * 文件存储引用
     */
    private String fileBlobRef;

    /**
     * 授权类型，非空时履约会为购买者生成许可证密钥
     */
    private String licenseType;
}
