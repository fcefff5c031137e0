package org.digitera.delivery.domain;

import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 用户身份
 * - role 只能经由条件更新从 BUYER 变为 CREATOR
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("user_account")
public class UserAccount {

    /**
     * 主键（即 userId）
     */
    private Long id;

    private String email;

    /**
     * 当前角色
     */
    private UserRole role;

    private LocalDateTime createTime;

    private LocalDateTime updateTime;
}
