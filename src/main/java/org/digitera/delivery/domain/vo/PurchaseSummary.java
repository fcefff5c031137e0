package org.digitera.delivery.domain.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 已购商品汇总
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PurchaseSummary {

    private Long userId;

    private int totalItems;

    private int totalDownloads;

    private List<PurchasedItemView> items;
}
