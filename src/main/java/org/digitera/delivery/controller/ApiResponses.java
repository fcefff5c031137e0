package org.digitera.delivery.controller;

import org.digitera.delivery.util.TraceIdUtil;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 统一响应体：{code, message, traceId, data}
 */
final class ApiResponses {

    static final String SUCCESS = "SUCCESS";

    private ApiResponses() {
    }

    static Map<String, Object> success(String message, Object data) {
        return body(SUCCESS, message, data);
    }

    static Map<String, Object> body(String code, String message, Object data) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("code", code);
        response.put("message", message);
        response.put("traceId", TraceIdUtil.getTraceId());
        if (data != null) {
            response.put("data", data);
        }
        return response;
    }
}
