package com.deepansh.foundry.tool;

import com.deepansh.foundry.config.McpProperties;
import com.deepansh.foundry.mcp.McpGatewayClient;
import com.deepansh.foundry.mcp.McpGatewayException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Dispatches one normalized tool call to the MCP gateway.
 *
 * Never throws for invocation problems. Unknown tools, a missing credential,
 * upstream HTTP errors and timeouts all come back as a {@link ToolCallFailure}
 * payload so the run can continue and the model can explain what went wrong.
 *
 * Exactly one INFO line is logged per call: tool name and the HTTP-equivalent
 * status. Arguments and credentials are never logged.
 */
@Component
@Slf4j
public class ToolInvoker {

    public static final int STATUS_UNAUTHORIZED = 401;
    public static final int STATUS_NOT_FOUND = 404;
    public static final int STATUS_INTERNAL_ERROR = 500;

    static final String NO_RESULT_ERROR = "MCP gateway returned no result";

    static final String MISSING_CREDENTIAL_ERROR =
            "MCP gateway credential is missing: " + McpProperties.Gateway.TOKEN_ENV_VAR;
    static final String MISSING_CREDENTIAL_FIX =
            "Set the " + McpProperties.Gateway.TOKEN_ENV_VAR + " environment variable or the "
                    + McpProperties.Gateway.TOKEN_PROPERTY + " property to a GitHub token with MCP access";

    private final ToolCatalog catalog;
    private final McpGatewayClient gatewayClient;
    private final ObjectMapper objectMapper;

    public ToolInvoker(ToolCatalog catalog, McpGatewayClient gatewayClient, ObjectMapper objectMapper) {
        this.catalog = catalog;
        this.gatewayClient = gatewayClient;
        this.objectMapper = objectMapper;
    }

    public JsonNode invoke(String toolName, JsonNode arguments, InvocationContext context) {
        if (!catalog.contains(toolName)) {
            logOutcome(toolName, STATUS_NOT_FOUND, context);
            return failure(toolName,
                    String.format("Unknown tool '%s'. Available tools: %s", toolName, catalog.names()),
                    "Call one of the available tools instead");
        }

        if (!gatewayClient.hasCredential()) {
            logOutcome(toolName, STATUS_UNAUTHORIZED, context);
            return failure(toolName, MISSING_CREDENTIAL_ERROR, MISSING_CREDENTIAL_FIX);
        }

        try {
            McpSchema.CallToolResult result = gatewayClient.callTool(toolName, arguments);
            if (result == null) {
                logOutcome(toolName, McpGatewayClient.STATUS_BAD_GATEWAY, context);
                return failure(toolName, NO_RESULT_ERROR, null);
            }
            logOutcome(toolName, McpGatewayClient.STATUS_OK, context);

            if (Boolean.TRUE.equals(result.isError())) {
                return failure(toolName, firstText(result), null);
            }
            JsonNode output = objectMapper.valueToTree(result);
            return output != null && output.isObject() ? output : failure(toolName, NO_RESULT_ERROR, null);

        } catch (McpGatewayException e) {
            logOutcome(toolName, e.getStatus(), context);
            return failure(toolName, e.getMessage(),
                    e.getStatus() == STATUS_UNAUTHORIZED || e.getStatus() == 403
                            ? "Check that " + McpProperties.Gateway.TOKEN_ENV_VAR + " is valid and has MCP access"
                            : null);
        } catch (RuntimeException e) {
            logOutcome(toolName, STATUS_INTERNAL_ERROR, context);
            log.debug("Unexpected MCP failure for [{}]", toolName, e);
            return failure(toolName, "MCP call failed: " + e.getMessage(), null);
        }
    }

    /** Builds the same failure payload the gateway path produces, for callers that fail before dispatch. */
    public JsonNode failure(String toolName, String error, String howToFix) {
        return ToolCallFailure.builder()
                .function(toolName)
                .error(error)
                .howToFix(howToFix)
                .build()
                .toJson(objectMapper);
    }

    private String firstText(McpSchema.CallToolResult result) {
        if (result.content() != null) {
            for (McpSchema.Content item : result.content()) {
                if (item instanceof McpSchema.TextContent text && text.text() != null) {
                    return text.text();
                }
            }
        }
        return "Tool reported an error without details";
    }

    private void logOutcome(String toolName, int status, InvocationContext context) {
        log.info("MCP tools/call [{}] => {} [run={}, call={}]",
                toolName, status, context.runId(), context.callId());
    }
}
