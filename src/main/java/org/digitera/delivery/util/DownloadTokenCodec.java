package org.digitera.delivery.util;

import org.digitera.delivery.config.DeliveryProperties;
import org.digitera.delivery.domain.vo.DownloadTokenClaims;
import org.digitera.delivery.exception.BusinessException;
import org.digitera.delivery.exception.ErrorCode;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.Optional;

/**
 * 下载令牌编解码
 * 格式：base64url(载荷).base64url(HMAC-SHA256签名)
 * 载荷：v1|tokenId|entitlementId|userId|issuedAt|expiresAt|S(一次性)/M(可复用)
 * 令牌本身不可伪造，过期与重放检查由调用方完成
 */
@Component
public class DownloadTokenCodec {

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String VERSION = "v1";
    private static final String SEPARATOR = "|";
    private static final int FIELD_COUNT = 7;
    private static final int MAX_ID_LENGTH = 64;

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final byte[] secret;

    public DownloadTokenCodec(DeliveryProperties properties) {
        String configured = properties.getToken().getSecret();
        if (!StringUtils.hasText(configured)) {
            throw new IllegalStateException("digitera.delivery.token.secret 未配置");
        }
        this.secret = configured.getBytes(StandardCharsets.UTF_8);
    }

    public String encode(DownloadTokenClaims claims) {
        String payload = String.join(SEPARATOR,
                VERSION,
                claims.getTokenId(),
                claims.getEntitlementId(),
                String.valueOf(claims.getUserId()),
                String.valueOf(claims.getIssuedAt()),
                String.valueOf(claims.getExpiresAt()),
                claims.isSingleUse() ? "S" : "M");
        byte[] payloadBytes = payload.getBytes(StandardCharsets.UTF_8);
        return ENCODER.encodeToString(payloadBytes) + "." + ENCODER.encodeToString(sign(payloadBytes));
    }

    /**
     * 解析并校验签名
     *
     * @throws BusinessException TOKEN_INVALID 格式错误或签名不匹配
     */
    public DownloadTokenClaims decode(String token) {
        if (!StringUtils.hasText(token)) {
            throw invalid("令牌为空");
        }
        int dot = token.indexOf('.');
        if (dot <= 0 || dot != token.lastIndexOf('.') || dot == token.length() - 1) {
            throw invalid("令牌格式错误");
        }
        byte[] payloadBytes;
        byte[] signature;
        try {
            payloadBytes = DECODER.decode(token.substring(0, dot));
            signature = DECODER.decode(token.substring(dot + 1));
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.TOKEN_INVALID, "令牌编码错误", e);
        }
        if (!MessageDigest.isEqual(sign(payloadBytes), signature)) {
            throw invalid("令牌签名不匹配");
        }

        String[] fields = new String(payloadBytes, StandardCharsets.UTF_8).split("\\|", -1);
        if (fields.length != FIELD_COUNT || !VERSION.equals(fields[0])) {
            throw invalid("令牌载荷格式错误");
        }
        try {
            return DownloadTokenClaims.builder()
                    .tokenId(fields[1])
                    .entitlementId(fields[2])
                    .userId(Long.valueOf(fields[3]))
                    .issuedAt(Long.parseLong(fields[4]))
                    .expiresAt(Long.parseLong(fields[5]))
                    .singleUse("S".equals(fields[6]))
                    .build();
        } catch (NumberFormatException e) {
            throw new BusinessException(ErrorCode.TOKEN_INVALID, "令牌载荷格式错误", e);
        }
    }

    /**
     * 不校验签名，仅尝试读出授权ID，用于拒绝时的审计记录
     */
    public Optional<String> peekEntitlementId(String token) {
        if (!StringUtils.hasText(token) || token.indexOf('.') <= 0) {
            return Optional.empty();
        }
        try {
            String payload = new String(DECODER.decode(token.substring(0, token.indexOf('.'))),
                    StandardCharsets.UTF_8);
            String[] fields = payload.split("\\|", -1);
            if (fields.length == FIELD_COUNT && StringUtils.hasText(fields[2])
                    && fields[2].length() <= MAX_ID_LENGTH) {
                return Optional.of(fields[2]);
            }
            return Optional.empty();
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private byte[] sign(byte[] payload) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret, HMAC_ALGORITHM));
            return mac.doFinal(payload);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("下载令牌签名失败", e);
        }
    }

    private static BusinessException invalid(String message) {
        return new BusinessException(ErrorCode.TOKEN_INVALID, message);
    }
}
