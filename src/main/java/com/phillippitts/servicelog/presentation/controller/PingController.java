package com.phillippitts.servicelog.presentation.controller;

import com.phillippitts.servicelog.logging.ServiceLogger;
import com.phillippitts.servicelog.request.ServletInboundRequest;
import com.phillippitts.servicelog.web.LoggerInjectingFilter;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Lightweight endpoint to generate a request that traverses the injecting filter
 * so the request-scoped fields (trace.id, client.*, network.forwarded_ip) can be checked.
 */
@RestController
class PingController {

    private final ServiceLogger serviceLogger;

    PingController(ServiceLogger serviceLogger) {
        this.serviceLogger = serviceLogger;
    }

    @GetMapping("/ping")
    ResponseEntity<Map<String, Object>> ping(HttpServletRequest request) {
        LoggerInjectingFilter.scopedLogger(request)
                .orElseGet(() -> serviceLogger.forRequest(ServletInboundRequest.of(request)))
                .info("Ping received from %s", request.getRemoteAddr());
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "timestamp", Instant.now().toString()
        ));
    }
}
