package org.digitera.delivery.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.digitera.delivery.domain.DownloadEvent;
import org.digitera.delivery.domain.DownloadOutcome;
import org.digitera.delivery.domain.DownloadTokenMarker;
import org.digitera.delivery.mapper.DownloadEventMapper;
import org.digitera.delivery.mapper.DownloadTokenMarkerMapper;
import org.digitera.delivery.service.IDownloadAuditService;
import org.digitera.delivery.util.TraceIdUtil;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 下载审计日志服务实现
 * - 每次下载尝试（成功或拒绝）一条记录
 * - 一次性令牌的使用标记也在这里维护，主键冲突即视为重放
 */
@Slf4j
@Service
public class DownloadAuditServiceImpl extends ServiceImpl<DownloadEventMapper, DownloadEvent>
        implements IDownloadAuditService {

    private final DownloadTokenMarkerMapper downloadTokenMarkerMapper;
    private final Clock clock;

    public DownloadAuditServiceImpl(DownloadTokenMarkerMapper downloadTokenMarkerMapper, Clock clock) {
        this.downloadTokenMarkerMapper = downloadTokenMarkerMapper;
        this.clock = clock;
    }

    @Override
    public void append(DownloadEvent event) {
        if (event.getCreateTime() == null) {
            event.setCreateTime(LocalDateTime.now(clock));
        }
        if (event.getTraceId() == null) {
            event.setTraceId(TraceIdUtil.getTraceId());
        }
        baseMapper.insert(event);

        if (event.getOutcome().isDenied()) {
            log.warn("[下载被拒绝] entitlementId={}, tokenId={}, userId={}, outcome={}, detail={}, traceId={}",
                    event.getEntitlementId(), event.getTokenId(), event.getUserId(), event.getOutcome(),
                    event.getDetail(), event.getTraceId());
        } else {
            log.info("[下载已放行] entitlementId={}, tokenId={}, userId={}, traceId={}",
                    event.getEntitlementId(), event.getTokenId(), event.getUserId(), event.getTraceId());
        }
    }

    @Override
    public List<DownloadEvent> listForEntitlement(String entitlementId) {
        return this.lambdaQuery()
                .eq(DownloadEvent::getEntitlementId, entitlementId)
                .orderByAsc(DownloadEvent::getCreateTime)
                .orderByAsc(DownloadEvent::getId)
                .list();
    }

    @Override
    public long countDeniedSince(String entitlementId, LocalDateTime since) {
        return this.lambdaQuery()
                .eq(DownloadEvent::getEntitlementId, entitlementId)
                .ne(DownloadEvent::getOutcome, DownloadOutcome.GRANTED)
                .ge(DownloadEvent::getCreateTime, since)
                .count();
    }

    @Override
    public boolean claimSingleUseToken(String tokenId, String entitlementId) {
        try {
            downloadTokenMarkerMapper.insert(DownloadTokenMarker.builder()
                    .tokenId(tokenId)
                    .entitlementId(entitlementId)
                    .createTime(LocalDateTime.now(clock))
                    .build());
            return true;
        } catch (DuplicateKeyException e) {
            log.warn("[一次性令牌重放] tokenId={}, entitlementId={}, traceId={}",
                    tokenId, entitlementId, TraceIdUtil.getTraceId());
            return false;
        }
    }
}
