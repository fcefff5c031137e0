package org.digitera.delivery.service;

import com.baomidou.mybatisplus.extension.service.IService;
import org.digitera.delivery.domain.DownloadEvent;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 下载审计日志服务接口
 * 只追加，写入失败直接向上抛出
 */
public interface IDownloadAuditService extends IService<DownloadEvent> {

    void append(DownloadEvent event);

    /**
     * 按时间顺序查询某个授权的下载记录
     */
    List<DownloadEvent> listForEntitlement(String entitlementId);

    /**
     * 统计某个时间点之后的拒绝次数（异常访问检测的原始数据）
     */
    long countDeniedSince(String entitlementId, LocalDateTime since);

    /**
     * 占用一次性令牌
     *
     * @return true: 首次使用；false: 令牌已被使用（重放）
     */
    boolean claimSingleUseToken(String tokenId, String entitlementId);
}
