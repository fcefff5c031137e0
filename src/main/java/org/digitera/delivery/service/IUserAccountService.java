package org.digitera.delivery.service;

import com.baomidou.mybatisplus.extension.service.IService;
import org.digitera.delivery.domain.UserAccount;

public interface IUserAccountService extends IService<UserAccount> {

    /**
     * 注册买家账户，邮箱已存在时返回已有账户
     */
    UserAccount registerBuyer(String email);

    /**
     * @throws org.digitera.delivery.exception.BusinessException UNKNOWN_USER
     */
    UserAccount getUser(Long userId);
}
