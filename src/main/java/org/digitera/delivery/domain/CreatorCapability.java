package org.digitera.delivery.domain;

import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 创作者能力记录（店铺元数据）
 * - 当且仅当用户角色为 CREATOR 时存在
 * - user_id 唯一约束，保证每个用户至多一条
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("creator_capability")
public class CreatorCapability {

    private Long id;

    private Long userId;

    /**
     * 店铺名称
     */
    private String storeName;

    /**
     * 店铺 URL 标识（全局唯一）
     */
    private String storeSlug;

    private String storeDescription;

    /**
     * ACTIVE
     */
    private String status;

    private LocalDateTime createTime;

    private LocalDateTime updateTime;
}
