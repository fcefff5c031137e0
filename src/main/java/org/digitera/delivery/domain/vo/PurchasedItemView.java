package org.digitera.delivery.domain.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.digitera.delivery.domain.EntitlementStatus;

import java.time.LocalDateTime;

/**
 * 已购商品列表项
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PurchasedItemView {

    private String entitlementId;

    private String productId;

    private String orderId;

    private EntitlementStatus status;

    private String licenseKey;

    /**
     * 剩余下载次数，null 表示不限
     */
    private Integer remainingDownloads;

    private Integer downloadsConsumed;

    /**
     * 过期时间，null 表示永不过期
     */
    private LocalDateTime expiresAt;

    private LocalDateTime lastAccessTime;
}
