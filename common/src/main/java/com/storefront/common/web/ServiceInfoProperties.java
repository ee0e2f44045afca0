package com.storefront.common.web;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@ConfigurationProperties(prefix = "service-info")
public class ServiceInfoProperties {

    // Human readable name shown on the root endpoint, e.g. "Inventory API"
    private String displayName;

    private String version = "1.0.0";

    private List<String> endpoints = new ArrayList<>();

    // Extra root-endpoint fields, written after the standard ones. Keys with '_' need the [key] form in YAML.
    private Map<String, String> attributes = new LinkedHashMap<>();
}
