package org.digitera.delivery.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 幂等性工具类
 * - 使用Redis记录已完整处理过的业务操作，作为重复请求的快速路径
 * - 仅是优化：数据库条件更新与唯一约束才是幂等性的最终保证
 * - 未配置Redis时所有请求都视为首次执行
 */
@Slf4j
@Component
public class IdempotentUtil {

    private final StringRedisTemplate redisTemplate;

    private static final String IDEMPOTENT_KEY_PREFIX = "idempotent:";
    // 默认过期时间（秒）
    private static final long DEFAULT_EXPIRE_TIME = 24 * 3600;

    public IdempotentUtil(@Autowired(required = false) StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    /**
     * 检查操作是否已执行过
     *
     * @param businessId 业务ID
     * @param operationType 操作类型（如 PAYMENT_CONFIRMATION）
     * @return true: 已执行过；false: 首次执行或Redis不可用
     */
    public boolean isOperated(String businessId, String operationType) {
        if (redisTemplate == null) {
            return false;
        }
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(buildKey(businessId, operationType)));
        } catch (RuntimeException e) {
            log.warn("[幂等性检查失败] 按首次执行处理, businessId={}, operationType={}, errorMsg={}",
                    businessId, operationType, e.getMessage());
            return false;
        }
    }

    /**
     * 标记操作已执行（setIfAbsent 保证原子性）
     *
     * @return true: 标记成功；false: 已存在或Redis不可用
     */
    public boolean markAsOperated(String businessId, String operationType) {
        if (redisTemplate == null) {
            return false;
        }
        try {
            Boolean success = redisTemplate.opsForValue().setIfAbsent(
                    buildKey(businessId, operationType),
                    String.valueOf(System.currentTimeMillis()),
                    DEFAULT_EXPIRE_TIME,
                    TimeUnit.SECONDS
            );
            return Boolean.TRUE.equals(success);
        } catch (RuntimeException e) {
            log.warn("[幂等性标记失败] businessId={}, operationType={}, errorMsg={}",
                    businessId, operationType, e.getMessage());
            return false;
        }
    }

    private String buildKey(String businessId, String operationType) {
        return IDEMPOTENT_KEY_PREFIX + operationType + ":" + businessId;
    }
}
