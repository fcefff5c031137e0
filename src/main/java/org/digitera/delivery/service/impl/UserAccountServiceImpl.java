package org.digitera.delivery.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import lombok.extern.slf4j.Slf4j;
import org.digitera.delivery.domain.UserAccount;
import org.digitera.delivery.domain.UserRole;
import org.digitera.delivery.exception.BusinessException;
import org.digitera.delivery.exception.ErrorCode;
import org.digitera.delivery.mapper.UserAccountMapper;
import org.digitera.delivery.service.IUserAccountService;
import org.digitera.delivery.util.TraceIdUtil;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Locale;

/**
 * 用户账户服务实现
 * 新用户一律以 BUYER 身份注册，角色升级由 RoleTransitionServiceImpl 负责
 */
@Slf4j
@Service
public class UserAccountServiceImpl extends ServiceImpl<UserAccountMapper, UserAccount>
        implements IUserAccountService {

    private static final int MAX_EMAIL_LENGTH = 255;

    private final Clock clock;

    public UserAccountServiceImpl(Clock clock) {
        this.clock = clock;
    }

    @Override
    public UserAccount registerBuyer(String email) {
        String normalized = normalizeEmail(email);
        UserAccount existing = findByEmail(normalized);
        if (existing != null) {
            log.info("[账户已存在] userId={}, traceId={}", existing.getId(), TraceIdUtil.getTraceId());
            return existing;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        UserAccount account = UserAccount.builder()
                .email(normalized)
                .role(UserRole.BUYER)
                .createTime(now)
                .updateTime(now)
                .build();
        try {
            this.save(account);
        } catch (DuplicateKeyException e) {
            // 并发注册同一邮箱
            UserAccount winner = findByEmail(normalized);
            if (winner == null) {
                throw e;
            }
            return winner;
        }
        log.info("[账户已注册] userId={}, role=BUYER, traceId={}", account.getId(), TraceIdUtil.getTraceId());
        return account;
    }

    @Override
    public UserAccount getUser(Long userId) {
        UserAccount account = userId == null ? null : this.getById(userId);
        if (account == null) {
            throw new BusinessException(ErrorCode.UNKNOWN_USER, "用户不存在: " + userId);
        }
        return account;
    }

    private UserAccount findByEmail(String email) {
        return this.lambdaQuery()
                .eq(UserAccount::getEmail, email)
                .one();
    }

    private static String normalizeEmail(String email) {
        if (!StringUtils.hasText(email)) {
            throw new BusinessException(ErrorCode.INVALID_ACCOUNT, "邮箱不能为空");
        }
        String normalized = email.trim().toLowerCase(Locale.ROOT);
        if (normalized.length() > MAX_EMAIL_LENGTH || normalized.indexOf('@') <= 0) {
            throw new BusinessException(ErrorCode.INVALID_ACCOUNT, "邮箱格式错误");
        }
        return normalized;
    }
}
