package com.williamcallahan.shelf_scan.controller.support;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Small helper for producing consistent error payloads across controllers.
 */
public final class ErrorResponseUtils {

    private ErrorResponseUtils() {
        // Utility class
    }

    public static Map<String, Object> errorBody(String message) {
        return errorBody(message, null);
    }

    public static Map<String, Object> errorBody(String message, String detail) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        if (detail != null && !detail.isBlank()) {
            body.put("message", detail);
        }
        return body;
    }
}
