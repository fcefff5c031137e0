package org.digitera.delivery.controller;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.digitera.delivery.business.DownloadAccessGuard;
import org.digitera.delivery.domain.DownloadEvent;
import org.digitera.delivery.domain.vo.DownloadGrant;
import org.digitera.delivery.domain.vo.DownloadToken;
import org.digitera.delivery.service.IDownloadAuditService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * 下载控制器
 *
 * API规范：
 * - POST /api/download/token - 签发下载令牌
 * - GET /api/download/redeem?token= - 兑换令牌，302 跳转到临时地址
 * - GET /api/download/history/{entitlementId} - 下载审计记录
 */
@RestController
@RequestMapping("/api/download")
public class DownloadController {

    private static final String CLIENT_REF_HEADER = "X-Client-Ref";

    private final DownloadAccessGuard downloadAccessGuard;
    private final IDownloadAuditService downloadAuditService;

    public DownloadController(DownloadAccessGuard downloadAccessGuard,
                              IDownloadAuditService downloadAuditService) {
        this.downloadAccessGuard = downloadAccessGuard;
        this.downloadAuditService = downloadAuditService;
    }

    @PostMapping("/token")
    public ResponseEntity<Map<String, Object>> issueToken(@RequestHeader("X-User-Id") Long userId,
                                                          @RequestBody IssueTokenRequest request) {
        DownloadToken token = downloadAccessGuard.issueToken(userId, request.getEntitlementId(),
                Boolean.TRUE.equals(request.getSingleUse()));
        return ResponseEntity.ok(ApiResponses.success("令牌已签发", token));
    }

    @GetMapping("/redeem")
    public ResponseEntity<Map<String, Object>> redeem(@RequestParam("token") String token,
                                                      @RequestHeader(value = CLIENT_REF_HEADER, required = false)
                                                      String clientRef) {
        DownloadGrant grant = downloadAccessGuard.redeem(token, clientRef);
        return ResponseEntity.status(HttpStatus.FOUND)
                .header(HttpHeaders.LOCATION, grant.getUrl())
                .body(ApiResponses.success("跳转下载", grant));
    }

    @GetMapping("/history/{entitlementId}")
    public ResponseEntity<Map<String, Object>> history(@PathVariable String entitlementId) {
        List<DownloadEvent> events = downloadAuditService.listForEntitlement(entitlementId);
        return ResponseEntity.ok(ApiResponses.success("查询成功", events));
    }

    @Data
    @NoArgsConstructor
    public static class IssueTokenRequest {
        private String entitlementId;
        private Boolean singleUse;
    }
}
