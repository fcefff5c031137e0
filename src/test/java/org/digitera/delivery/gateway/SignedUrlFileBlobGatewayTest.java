package org.digitera.delivery.gateway;

import org.digitera.delivery.config.DeliveryProperties;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SignedUrlFileBlobGatewayTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void buildsTimeBoxedSignedUrl() {
        SignedUrlFileBlobGateway gateway = gateway("secret-a");

        BlobAccessUrl accessUrl = gateway.getTemporaryAccessUrl("products/p-1/book.pdf");

        assertEquals(NOW.plus(Duration.ofMinutes(2)), accessUrl.getExpiresAt());
        assertTrue(accessUrl.getUrl().startsWith("https://cdn.test/files/products%2Fp-1%2Fbook.pdf?expires="
                + accessUrl.getExpiresAt().getEpochSecond() + "&signature="));
        assertTrue(accessUrl.getUrl().matches(".*signature=[0-9a-f]{64}$"));
    }

    @Test
    void signatureDependsOnSecret() {
        String a = gateway("secret-a").getTemporaryAccessUrl("f.zip").getUrl();
        String b = gateway("secret-b").getTemporaryAccessUrl("f.zip").getUrl();
        assertNotEquals(a, b);
    }

    private static SignedUrlFileBlobGateway gateway(String secret) {
        DeliveryProperties properties = new DeliveryProperties();
        properties.getBlob().setBaseUrl("https://cdn.test/files");
        properties.getBlob().setSigningSecret(secret);
        properties.getBlob().setUrlTtl(Duration.ofMinutes(2));
        return new SignedUrlFileBlobGateway(properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }
}
