package org.digitera.delivery.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.digitera.delivery.domain.CreatorCapability;
import org.digitera.delivery.domain.UserAccount;
import org.digitera.delivery.domain.vo.StoreMetadata;
import org.digitera.delivery.exception.BusinessException;
import org.digitera.delivery.exception.ErrorCode;
import org.digitera.delivery.mapper.CreatorCapabilityMapper;
import org.digitera.delivery.mapper.UserAccountMapper;
import org.digitera.delivery.service.IRoleTransitionService;
import org.digitera.delivery.util.SlugUtil;
import org.digitera.delivery.util.TraceIdUtil;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 角色变更服务实现
 *
 * 执行流程：
 * 1. 校验店铺信息
 * 2. 条件更新角色 BUYER -> CREATOR（CAS，并发只有一个成功）
 * 3. 生成唯一店铺标识并写入店铺记录
 * 2、3 在同一事务中，任一步失败整体回滚
 */
@Slf4j
@Service
public class RoleTransitionServiceImpl extends ServiceImpl<CreatorCapabilityMapper, CreatorCapability>
        implements IRoleTransitionService {

    private static final int MAX_STORE_NAME_LENGTH = 100;
    private static final int MAX_STORE_DESCRIPTION_LENGTH = 1000;
    private static final String STATUS_ACTIVE = "ACTIVE";

    private final UserAccountMapper userAccountMapper;
    private final Clock clock;

    public RoleTransitionServiceImpl(UserAccountMapper userAccountMapper, Clock clock) {
        this.userAccountMapper = userAccountMapper;
        this.clock = clock;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public CreatorCapability promoteToCreator(Long userId, StoreMetadata metadata) {
        String traceId = TraceIdUtil.getTraceId();
        validate(metadata);
        LocalDateTime now = LocalDateTime.now(clock);

        // ==================== 1. 角色条件更新 ====================
        int rows = userAccountMapper.promoteToCreator(userId, now);
        if (rows == 0) {
            UserAccount account = userId == null ? null : userAccountMapper.selectById(userId);
            if (account == null) {
                throw new BusinessException(ErrorCode.UNKNOWN_USER, "用户不存在: " + userId);
            }
            log.warn("[重复升级创作者] userId={}, role={}, traceId={}", userId, account.getRole(), traceId);
            throw new BusinessException(ErrorCode.ALREADY_CREATOR);
        }

        // ==================== 2. 店铺记录 ====================
        String storeName = metadata.getStoreName().trim();
        CreatorCapability capability = CreatorCapability.builder()
                .userId(userId)
                .storeName(storeName)
                .storeSlug(uniqueSlug(storeName))
                .storeDescription(metadata.getStoreDescription())
                .status(STATUS_ACTIVE)
                .createTime(now)
                .updateTime(now)
                .build();
        try {
            this.save(capability);
        } catch (DuplicateKeyException e) {
            log.warn("[店铺记录冲突] userId={}, storeSlug={}, traceId={}", userId, capability.getStoreSlug(), traceId);
            throw new BusinessException(ErrorCode.STORE_SLUG_CONFLICT, "店铺标识冲突: " + capability.getStoreSlug(), e);
        }

        log.info("[已升级为创作者] userId={}, storeName={}, storeSlug={}, traceId={}",
                userId, storeName, capability.getStoreSlug(), traceId);
        return capability;
    }

    @Override
    public CreatorCapability findByUserId(Long userId) {
        return this.lambdaQuery()
                .eq(CreatorCapability::getUserId, userId)
                .one();
    }

    /**
     * 店铺名转换为 URL 标识，已被占用时依次追加 -2、-3 ...
     */
    private String uniqueSlug(String storeName) {
        String base = SlugUtil.slugify(storeName);
        String candidate = base;
        int suffix = 2;
        while (this.lambdaQuery().eq(CreatorCapability::getStoreSlug, candidate).count() > 0) {
            candidate = base + "-" + suffix++;
        }
        return candidate;
    }

    private static void validate(StoreMetadata metadata) {
        if (metadata == null || !StringUtils.hasText(metadata.getStoreName())) {
            throw new BusinessException(ErrorCode.INVALID_STORE_METADATA, "店铺名称不能为空");
        }
        if (metadata.getStoreName().trim().length() > MAX_STORE_NAME_LENGTH) {
            throw new BusinessException(ErrorCode.INVALID_STORE_METADATA,
                    "店铺名称不能超过 " + MAX_STORE_NAME_LENGTH + " 个字符");
        }
        if (metadata.getStoreDescription() != null
                && metadata.getStoreDescription().length() > MAX_STORE_DESCRIPTION_LENGTH) {
            throw new BusinessException(ErrorCode.INVALID_STORE_METADATA,
                    "店铺简介不能超过 " + MAX_STORE_DESCRIPTION_LENGTH + " 个字符");
        }
    }
}
