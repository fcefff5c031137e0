package org.digitera.delivery.service;

import com.baomidou.mybatisplus.extension.service.IService;
import org.digitera.delivery.domain.CreatorCapability;
import org.digitera.delivery.domain.vo.StoreMetadata;

/**
 * 角色变更服务接口
 */
public interface IRoleTransitionService extends IService<CreatorCapability> {

    /**
     * 买家升级为创作者
     *
     * 核心特性：
     * - 角色更新为条件更新（仅 BUYER 可升级），并发请求只有一个成功
     * - 同一事务内创建唯一的店铺记录
     * - 不支持降级
     *
     * @param userId 用户ID
     * @param metadata 店铺信息
     * @return 新建的店铺记录
     */
    CreatorCapability promoteToCreator(Long userId, StoreMetadata metadata);

    /**
     * 查询用户的店铺记录，非创作者返回 null
     */
    CreatorCapability findByUserId(Long userId);
}
