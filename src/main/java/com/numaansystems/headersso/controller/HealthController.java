package com.numaansystems.headersso.controller;

import com.numaansystems.headersso.config.HeaderAuthProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Liveness endpoint for the proxy and load balancer. Exempt from header
 * authentication.
 */
@RestController
public class HealthController {

    private final HeaderAuthProperties properties;

    public HealthController(HeaderAuthProperties properties) {
        this.properties = properties;
    }

    @GetMapping("/healthz")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> healthInfo = new HashMap<>();
        healthInfo.put("status", "UP");
        healthInfo.put("service", "header-sso");
        healthInfo.put("headerAuth", properties.isEnabled());
        healthInfo.put("provisioning", properties.provisioning().isEnabled());

        return ResponseEntity.ok(healthInfo);
    }
}
