package org.digitera.delivery.domain.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 兑换成功后的下载凭证
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DownloadGrant {

    private String entitlementId;

    /**
     * 文件存储的临时访问地址
     */
    private String url;

    private Instant urlExpiresAt;

    /**
     * 剩余下载次数，null 表示不限
     */
    private Integer remainingDownloads;
}
