package com.ninesync.controller;

import com.ninesync.imap.ImapException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response bodies shared by the REST controllers
 */
final class ApiResponses {

    private ApiResponses() {}

    static Map<String, Object> success() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "success");
        return response;
    }

    static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "error");
        response.put("message", message);
        return ResponseEntity.status(status).body(response);
    }

    /**
     * HTTP status for a client error
     */
    static ResponseEntity<Map<String, Object>> error(ImapException e) {
        HttpStatus status = switch (e.getKind()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case AUTHENTICATION -> HttpStatus.UNAUTHORIZED;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case NOT_SUPPORTED -> HttpStatus.NOT_IMPLEMENTED;
            case INVALID_STATE -> HttpStatus.CONFLICT;
            default -> HttpStatus.BAD_GATEWAY;
        };
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "error");
        response.put("kind", e.getKind().name());
        response.put("message", e.getMessage());
        return ResponseEntity.status(status).body(response);
    }
}
