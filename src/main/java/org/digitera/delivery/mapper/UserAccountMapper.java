package org.digitera.delivery.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Update;
import org.digitera.delivery.domain.UserAccount;

import java.time.LocalDateTime;

@Mapper
public interface UserAccountMapper extends BaseMapper<UserAccount> {

    /**
     * 买家升级为创作者（条件更新，CAS）
     * 只有当前角色为 BUYER 时才会更新，并发请求中只有一个能成功
     *
     * @param userId 用户ID
     * @param now 当前时间
     * @return 更新行数（0表示用户不存在或已是创作者）
     */
    @Update("""
            UPDATE user_account
            SET role = 'CREATOR',
                update_time = #{now}
            WHERE id = #{userId}
              AND role = 'BUYER'
            """)
    int promoteToCreator(@Param("userId") Long userId, @Param("now") LocalDateTime now);
}
