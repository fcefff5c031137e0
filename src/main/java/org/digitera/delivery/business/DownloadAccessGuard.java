package org.digitera.delivery.business;

import lombok.extern.slf4j.Slf4j;
import org.digitera.delivery.config.DeliveryProperties;
import org.digitera.delivery.domain.DownloadEvent;
import org.digitera.delivery.domain.DownloadOutcome;
import org.digitera.delivery.domain.Entitlement;
import org.digitera.delivery.domain.EntitlementStatus;
import org.digitera.delivery.domain.vo.DownloadGrant;
import org.digitera.delivery.domain.vo.DownloadToken;
import org.digitera.delivery.domain.vo.DownloadTokenClaims;
import org.digitera.delivery.exception.BusinessException;
import org.digitera.delivery.exception.ErrorCode;
import org.digitera.delivery.gateway.BlobAccessUrl;
import org.digitera.delivery.gateway.IFileBlobGateway;
import org.digitera.delivery.service.IDownloadAuditService;
import org.digitera.delivery.service.IEntitlementService;
import org.digitera.delivery.util.BusinessIdUtil;
import org.digitera.delivery.util.DownloadTokenCodec;
import org.digitera.delivery.util.TraceIdUtil;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * 下载访问控制
 * <p>
 * 签发令牌：只校验授权归属与状态，不消耗次数
 * 兑换令牌：
 * 1. 校验签名与有效期
 * 2. 一次性令牌占用使用标记
 * 3. 消耗一次下载次数
 * 4. 写入审计日志
 * 5. 向文件存储申请临时地址
 * <p>
 * 每一次拒绝都先写审计日志再抛出异常；整个过程不持有任何锁，也不开启事务。
 */
@Slf4j
@Service
public class DownloadAccessGuard {

    static final String UNKNOWN_ENTITLEMENT = "UNKNOWN";
    private static final int MAX_ENTITLEMENT_ID_LENGTH = 64;

    private final IEntitlementService entitlementService;
    private final IDownloadAuditService downloadAuditService;
    private final IFileBlobGateway fileBlobGateway;
    private final DownloadTokenCodec downloadTokenCodec;
    private final DeliveryProperties properties;
    private final Clock clock;

    public DownloadAccessGuard(IEntitlementService entitlementService,
                               IDownloadAuditService downloadAuditService,
                               IFileBlobGateway fileBlobGateway,
                               DownloadTokenCodec downloadTokenCodec,
                               DeliveryProperties properties,
                               Clock clock) {
        this.entitlementService = entitlementService;
        this.downloadAuditService = downloadAuditService;
        this.fileBlobGateway = fileBlobGateway;
        this.downloadTokenCodec = downloadTokenCodec;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 签发下载令牌
     *
     * @param userId 请求用户
     * @param entitlementId 授权ID
     * @param singleUse 是否一次性令牌
     * @return 令牌
     * @throws BusinessException NOT_ENTITLED 授权不存在、不属于该用户、不可用或已过期
     */
    public DownloadToken issueToken(Long userId, String entitlementId, boolean singleUse) {
        Entitlement entitlement = entitlementId == null ? null : entitlementService.findByEntitlementId(entitlementId);
        String denial = null;
        if (entitlement == null) {
            denial = "授权不存在";
        } else if (!Objects.equals(entitlement.getUserId(), userId)) {
            denial = "授权不属于当前用户";
        } else if (entitlement.getStatus() != EntitlementStatus.ACTIVE) {
            denial = "授权状态为 " + entitlement.getStatus();
        } else if (entitlement.isExpiredAt(LocalDateTime.now(clock))) {
            denial = "授权已过期";
        }
        if (denial != null) {
            String auditedId = entitlementId == null || entitlementId.length() > MAX_ENTITLEMENT_ID_LENGTH
                    ? UNKNOWN_ENTITLEMENT : entitlementId;
            audit(auditedId, null, userId,
                    DownloadOutcome.DENIED_NOT_ENTITLED, null, denial);
            throw new BusinessException(ErrorCode.NOT_ENTITLED, denial);
        }

        Instant issuedAt = clock.instant();
        Instant expiresAt = issuedAt.plus(properties.getToken().getTtl());
        DownloadTokenClaims claims = DownloadTokenClaims.builder()
                .tokenId(BusinessIdUtil.newTokenId())
                .entitlementId(entitlementId)
                .userId(userId)
                .issuedAt(issuedAt.toEpochMilli())
                .expiresAt(expiresAt.toEpochMilli())
                .singleUse(singleUse)
                .build();
        String token = downloadTokenCodec.encode(claims);

        log.info("[下载令牌已签发] entitlementId={}, tokenId={}, userId={}, singleUse={}, expiresAt={}, traceId={}",
                entitlementId, claims.getTokenId(), userId, singleUse, expiresAt, TraceIdUtil.getTraceId());
        return DownloadToken.builder()
                .token(token)
                .tokenId(claims.getTokenId())
                .entitlementId(entitlementId)
                .issuedAt(issuedAt)
                .expiresAt(expiresAt)
                .singleUse(singleUse)
                .build();
    }

    /**
     * 兑换下载令牌
     *
     * @param token 令牌
     * @param clientRef 客户端标识（仅记录）
     * @return 下载凭证（临时地址与剩余次数）
     * @throws BusinessException TOKEN_INVALID / ENTITLEMENT_REVOKED / ENTITLEMENT_EXPIRED / ENTITLEMENT_EXHAUSTED
     */
    public DownloadGrant redeem(String token, String clientRef) {
        // ==================== 1. 校验令牌 ====================
        DownloadTokenClaims claims;
        try {
            claims = downloadTokenCodec.decode(token);
        } catch (BusinessException e) {
            audit(downloadTokenCodec.peekEntitlementId(token).orElse(UNKNOWN_ENTITLEMENT), null, null,
                    DownloadOutcome.DENIED_TOKEN_INVALID, clientRef, e.getMessage());
            throw e;
        }
        String entitlementId = claims.getEntitlementId();
        if (clock.millis() >= claims.getExpiresAt()) {
            audit(entitlementId, claims.getTokenId(), claims.getUserId(),
                    DownloadOutcome.DENIED_TOKEN_INVALID, clientRef, "令牌已过期");
            throw new BusinessException(ErrorCode.TOKEN_INVALID, "下载令牌已过期");
        }

        // ==================== 2. 一次性令牌 ====================
        if (claims.isSingleUse() && !downloadAuditService.claimSingleUseToken(claims.getTokenId(), entitlementId)) {
            audit(entitlementId, claims.getTokenId(), claims.getUserId(),
                    DownloadOutcome.DENIED_TOKEN_INVALID, clientRef, "一次性令牌已被使用");
            throw new BusinessException(ErrorCode.TOKEN_INVALID, "一次性令牌已被使用");
        }

        // ==================== 3. 消耗下载次数 ====================
        Entitlement entitlement;
        try {
            entitlement = entitlementService.consume(entitlementId);
        } catch (BusinessException e) {
            audit(entitlementId, claims.getTokenId(), claims.getUserId(),
                    DownloadOutcome.fromDenial(e.getErrorCode()), clientRef, e.getMessage());
            throw e;
        }

        // ==================== 4. 审计 ====================
        audit(entitlementId, claims.getTokenId(), claims.getUserId(), DownloadOutcome.GRANTED, clientRef, null);

        // ==================== 5. 临时地址 ====================
        BlobAccessUrl accessUrl = fileBlobGateway.getTemporaryAccessUrl(entitlement.getFileBlobRef());
        return DownloadGrant.builder()
                .entitlementId(entitlementId)
                .url(accessUrl.getUrl())
                .urlExpiresAt(accessUrl.getExpiresAt())
                .remainingDownloads(entitlement.remainingDownloads())
                .build();
    }

    private void audit(String entitlementId, String tokenId, Long userId,
                       DownloadOutcome outcome, String clientRef, String detail) {
        downloadAuditService.append(DownloadEvent.builder()
                .entitlementId(entitlementId)
                .tokenId(tokenId)
                .userId(userId)
                .outcome(outcome)
                .clientRef(clientRef)
                .detail(detail)
                .traceId(TraceIdUtil.getTraceId())
                .build());
    }
}
