package org.digitera.delivery.domain;

import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 下载审计日志
 * - 记录每一次下载尝试及其结果
 * - 只追加，从不修改或删除
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("download_event")
public class DownloadEvent {

    private Long id;

    /**
     * 授权ID（令牌无法解析时为 UNKNOWN）
     */
    private String entitlementId;

    /**
     * 令牌ID
     */
    private String tokenId;

    private Long userId;

    private DownloadOutcome outcome;

    /**
     * 客户端标识（不透明）
     */
    private String clientRef;

    /**
     * 附加说明
     */
    private String detail;

    private String traceId;

    private LocalDateTime createTime;
}
