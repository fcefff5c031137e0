package org.digitera.delivery.util;

import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 分布式锁工具类
 * - 基于Redisson可重入锁，用于串行化同一订单的并发支付通知
 * - 未启用Redisson时直接放行（正确性由数据库条件更新保证）
 */
@Slf4j
@Component
public class DistributedLockUtil {

    private static final String LOCK_KEY_PREFIX = "lock:";

    private final RedissonClient redissonClient;

    public DistributedLockUtil(@Autowired(required = false) RedissonClient redissonClient) {
        this.redissonClient = redissonClient;
    }

    /**
     * 尝试加锁
     *
     * @param resourceKey 资源标识
     * @param waitTime 最长等待时间
     * @param leaseTime 持有时间（到期自动释放）
     * @param unit 时间单位
     * @return 是否获得锁
     */
    public boolean tryLock(String resourceKey, long waitTime, long leaseTime, TimeUnit unit) {
        if (redissonClient == null) {
            return true;
        }
        RLock lock = redissonClient.getLock(buildLockKey(resourceKey));
        try {
            return lock.tryLock(waitTime, leaseTime, unit);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public void unlock(String resourceKey) {
        if (redissonClient == null) {
            return;
        }
        RLock lock = redissonClient.getLock(buildLockKey(resourceKey));
        if (lock.isHeldByCurrentThread()) {
            lock.unlock();
        } else {
            log.debug("[分布式锁] 锁已过期或不属于当前线程, resourceKey={}", resourceKey);
        }
    }

    private static String buildLockKey(String resourceKey) {
        return LOCK_KEY_PREFIX + resourceKey;
    }
}
