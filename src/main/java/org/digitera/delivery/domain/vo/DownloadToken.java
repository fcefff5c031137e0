package org.digitera.delivery.domain.vo;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 签发给客户端的下载令牌
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DownloadToken {

    /**
     * 签名后的令牌字符串
     */
    private String token;

    private String tokenId;

    private String entitlementId;

    private Instant issuedAt;

    private Instant expiresAt;

    private boolean singleUse;
}
