package com.deepansh.foundry.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection and run-loop settings for the Azure AI Foundry Agents service.
 * Bound from application.yml under the "foundry" prefix.
 */
@ConfigurationProperties(prefix = "foundry")
@Data
public class FoundryProperties {

    /** Format: https://{resource}.services.ai.azure.com/api/projects/{project} */
    private String projectEndpoint = "";

    /** Entra ID bearer token for the project endpoint (FOUNDRY_API_TOKEN) */
    private String apiToken = "";

    private String apiVersion = "2025-05-01";

    /** Model deployment name, e.g. gpt-4o */
    private String deploymentName = "";

    /** Optional system instructions; a default listing the enabled tools is used when blank */
    private String instructions;

    private String agentName = "McpAgent";

    private Duration pollInterval = Duration.ofMillis(500);

    /** Upper bound on a single run before it is cancelled */
    private Duration runTimeout = Duration.ofMinutes(5);

    /** Keep threads created by a turn so the caller can continue the conversation */
    private boolean retainThreads = true;

    private int connectTimeoutMs = 5000;
    private int readTimeoutMs = 60000;
}
