package org.digitera.delivery.domain;

import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 下载授权
 *
 * 用途：记录用户对某个已购商品的下载权利
 * - 每个 (订单, 订单行) 恰好一条，由唯一约束保证
 * - downloadsConsumed 永不超过 downloadLimit（数据库 CHECK 约束兜底）
 * - orderId 仅用于审计与退款撤销，不做级联修改
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("entitlement")
public class Entitlement {

    /**
     * 主键
     */
    private Long id;

    /**
     * 授权ID（业务唯一标识）
     */
    private String entitlementId;

    private Long userId;

    private String productId;

    /**
     * 来源订单
     */
    private String orderId;

    /**
     * 来源订单行
     */
    private Integer lineNo;

    /**
     * 文件存储引用（履约时从商品目录获取）
     */
    private String fileBlobRef;

    /**
     * 许可证密钥，仅授权类商品有值，创建后不变
     */
    private String licenseKey;

    /**
     * 下载次数上限，null 表示不限
     */
    private Integer downloadLimit;

    /**
     * 已消耗下载次数
     */
    private Integer downloadsConsumed;

    /**
     * 过期时间，null 表示永不过期
     */
    private LocalDateTime expiresAt;

    private EntitlementStatus status;

    /**
     * 最近一次成功下载时间
     */
    private LocalDateTime lastAccessTime;

    private LocalDateTime createTime;

    private LocalDateTime updateTime;

    /**
     * 剩余下载次数，null 表示不限
     */
    public Integer remainingDownloads() {
        if (downloadLimit == null) {
            return null;
        }
        return Math.max(0, downloadLimit - (downloadsConsumed == null ? 0 : downloadsConsumed));
    }

    public boolean isExpiredAt(LocalDateTime now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
