package org.digitera.delivery.gateway;

import org.digitera.delivery.config.DeliveryProperties;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;

/**
 * 生成带签名和过期时间的 CDN 临时地址
 * 格式：{baseUrl}/{fileBlobRef}?expires={epochSecond}&signature={hmacHex}
 */
@Component
public class SignedUrlFileBlobGateway implements IFileBlobGateway {

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final DeliveryProperties properties;
    private final Clock clock;

    public SignedUrlFileBlobGateway(DeliveryProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public BlobAccessUrl getTemporaryAccessUrl(String fileBlobRef) {
        DeliveryProperties.Blob blob = properties.getBlob();
        Instant expiresAt = clock.instant().plus(blob.getUrlTtl());
        long expires = expiresAt.getEpochSecond();
        String signature = sign(blob.getSigningSecret(), fileBlobRef + ":" + expires);
        String url = blob.getBaseUrl() + "/" + URLEncoder.encode(fileBlobRef, StandardCharsets.UTF_8)
                + "?expires=" + expires + "&signature=" + signature;
        return BlobAccessUrl.builder()
                .url(url)
                .expiresAt(expiresAt)
                .build();
    }

    private static String sign(String secret, String content) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(content.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("文件地址签名失败", e);
        }
    }
}
