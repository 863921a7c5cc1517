package com.deepansh.foundry.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Strongly-typed configuration for the MCP tool layer.
 * Bound from application.yml under the "mcp" prefix.
 */
@ConfigurationProperties(prefix = "mcp")
@Data
public class McpProperties {

    /** Master switch; false yields an empty tool catalog */
    private boolean enabled = true;

    /** Built-in tools to advertise. Empty means all of them. */
    private List<String> allowedTools = new ArrayList<>();

    private Gateway gateway = new Gateway();
    private Normalizer normalizer = new Normalizer();

    @Data
    public static class Gateway {
        /** Environment variable the token is normally supplied through */
        public static final String TOKEN_ENV_VAR = "COPILOT_MCP_TOKEN";
        public static final String TOKEN_PROPERTY = "mcp.gateway.token";

        private String endpoint = "https://api.githubcopilot.com/mcp/";
        private String token = "";
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 30000;

        public boolean hasToken() {
            return token != null && !token.isBlank();
        }
    }

    @Data
    public static class Normalizer {
        private int recencyWindowDays = 30;
        private List<String> strippedSortTokens = new ArrayList<>(
                List.of("sort:updated-desc", "sort:updated-asc", "sort:updated"));
    }
}
