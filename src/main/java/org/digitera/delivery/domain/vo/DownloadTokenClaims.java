package org.digitera.delivery.domain.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 下载令牌载荷
 * 时间均为毫秒时间戳
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DownloadTokenClaims {

    private String tokenId;

    private String entitlementId;

    private Long userId;

    private long issuedAt;

    private long expiresAt;

    /**
     * 一次性令牌
     */
    private boolean singleUse;
}
