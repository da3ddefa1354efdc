package com.roommesh.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "relay")
public class RelayProperties {

    /**
     * STOMP over WebSocket endpoint.
     */
    private String endpoint = "/ws";

    private List<String> allowedOriginPatterns = new ArrayList<>(List.of("*"));

    public String getEndpoint() { return endpoint; }
    public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

    public List<String> getAllowedOriginPatterns() { return allowedOriginPatterns; }
    public void setAllowedOriginPatterns(List<String> allowedOriginPatterns) { this.allowedOriginPatterns = allowedOriginPatterns; }
}
