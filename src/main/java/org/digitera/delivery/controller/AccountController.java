package org.digitera.delivery.controller;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.digitera.delivery.domain.CreatorCapability;
import org.digitera.delivery.domain.UserAccount;
import org.digitera.delivery.domain.vo.StoreMetadata;
import org.digitera.delivery.service.IRoleTransitionService;
import org.digitera.delivery.service.IUserAccountService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 账户控制器
 *
 * API规范：
 * - POST /api/account/register - 注册买家账户
 * - POST /api/account/creator-upgrade - 升级为创作者（201，重复升级返回409）
 * - GET /api/account/{userId} - 查询账户与店铺信息
 */
@RestController
@RequestMapping("/api/account")
public class AccountController {

    private final IUserAccountService userAccountService;
    private final IRoleTransitionService roleTransitionService;

    public AccountController(IUserAccountService userAccountService,
                             IRoleTransitionService roleTransitionService) {
        this.userAccountService = userAccountService;
        this.roleTransitionService = roleTransitionService;
    }

    @PostMapping("/register")
    public ResponseEntity<Map<String, Object>> register(@RequestBody RegisterRequest request) {
        UserAccount account = userAccountService.registerBuyer(request.getEmail());
        return ResponseEntity.ok(ApiResponses.success("注册成功", account));
    }

    /**
     * 请求体：
     * {
     *     "storeName": "Jane's Art Store",
     *     "storeDescription": "..."
     * }
     */
    @PostMapping("/creator-upgrade")
    public ResponseEntity<Map<String, Object>> upgradeToCreator(@RequestHeader("X-User-Id") Long userId,
                                                                @RequestBody StoreMetadata metadata) {
        CreatorCapability capability = roleTransitionService.promoteToCreator(userId, metadata);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponses.success("已升级为创作者", capability));
    }

    @GetMapping("/{userId}")
    public ResponseEntity<Map<String, Object>> getAccount(@PathVariable Long userId) {
        UserAccount account = userAccountService.getUser(userId);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("account", account);
        data.put("store", roleTransitionService.findByUserId(userId));
        return ResponseEntity.ok(ApiResponses.success("查询成功", data));
    }

    @Data
    @NoArgsConstructor
    public static class RegisterRequest {
        private String email;
    }
}
