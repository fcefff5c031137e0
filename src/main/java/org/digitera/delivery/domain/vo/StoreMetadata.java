package org.digitera.delivery.domain.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 创作者升级时提交的店铺信息
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StoreMetadata {

    private String storeName;

    private String storeDescription;
}
