package org.digitera.delivery.util;

import java.util.Locale;
import java.util.UUID;

/**
 * 业务ID生成
 */
public final class BusinessIdUtil {

    private BusinessIdUtil() {
    }

    /**
     * 订单号：ORD-XXXXXXXX
     */
    public static String newOrderId() {
        return "ORD-" + randomHex(8);
    }

    /**
     * 授权ID：ENT-XXXXXXXXXXXXXXXX
     */
    public static String newEntitlementId() {
        return "ENT-" + randomHex(16);
    }

    /**
     * 许可证密钥：DIG-XXXXXXXX-{productId}
     */
    public static String newLicenseKey(String productId) {
        return "DIG-" + randomHex(8) + "-" + productId;
    }

    public static String newTokenId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    private static String randomHex(int length) {
        return UUID.randomUUID().toString().replace("-", "").substring(0, length).toUpperCase(Locale.ROOT);
    }
}
