package org.digitera.delivery.util;

import java.util.UUID;

/**
 * 全链路追踪工具类
 * - 每个 HTTP 请求 / MQ 消息各自持有一个追踪ID
 * - 写入日志、订单历史与下载审计日志
 */
public final class TraceIdUtil {

    private static final ThreadLocal<String> TRACE_ID_HOLDER = new ThreadLocal<>();

    private TraceIdUtil() {
    }

    public static String generateTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static void setTraceId(String traceId) {
        TRACE_ID_HOLDER.set(traceId);
    }

    /**
     * 获取当前追踪ID，未设置时返回 null
     */
    public static String getTraceId() {
        return TRACE_ID_HOLDER.get();
    }

    public static void clearTraceId() {
        TRACE_ID_HOLDER.remove();
    }
}
