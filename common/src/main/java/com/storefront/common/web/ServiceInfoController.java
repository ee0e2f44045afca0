package com.storefront.common.web;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root and health endpoints exposed by every storefront service.
 * Imported explicitly by each application class.
 */
@RestController
@EnableConfigurationProperties(ServiceInfoProperties.class)
public class ServiceInfoController {

    private final ServiceInfoProperties properties;
    private final String serviceName;

    public ServiceInfoController(ServiceInfoProperties properties,
                                 @Value("${spring.application.name}") String serviceName) {
        this.properties = properties;
        this.serviceName = serviceName;
    }

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", properties.getDisplayName() != null ? properties.getDisplayName() : serviceName);
        body.put("version", properties.getVersion());
        body.put("status", "running");
        body.put("endpoints", properties.getEndpoints());
        body.putAll(properties.getAttributes());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", serviceName);
        return ResponseEntity.ok(body);
    }
}
