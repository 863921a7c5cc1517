package com.deepansh.foundry.tool;

import com.deepansh.foundry.config.McpProperties;
import com.deepansh.foundry.mcp.McpGatewayClient;
import com.deepansh.foundry.mcp.McpGatewayException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.spec.McpSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ToolInvokerTest {

    @Mock McpGatewayClient gatewayClient;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final InvocationContext context = new InvocationContext("thread-1", "run-1", "call-1");
    private ToolInvoker invoker;

    @BeforeEach
    void setUp() {
        invoker = new ToolInvoker(ToolCatalog.fromProperties(new McpProperties()), gatewayClient, objectMapper);
    }

    @Test
    void invoke_missingCredential_returnsFailureNamingTheVariable() {
        when(gatewayClient.hasCredential()).thenReturn(false);

        JsonNode result = invoker.invoke(GitHubTools.SEARCH_REPOSITORIES, args("{\"query\":\"azure\"}"), context);

        assertThat(result.get("success").asBoolean()).isFalse();
        assertThat(result.get("function").asText()).isEqualTo(GitHubTools.SEARCH_REPOSITORIES);
        assertThat(result.get("error").asText()).contains("missing").contains("COPILOT_MCP_TOKEN");
        assertThat(result.get("howToFix").asText()).contains("mcp.gateway.token");
        verify(gatewayClient, never()).callTool(any(), any());
    }

    @Test
    void invoke_unknownTool_listsAvailableToolsWithoutCallingGateway() {
        JsonNode result = invoker.invoke("delete_repository", args("{}"), context);

        assertThat(result.get("success").asBoolean()).isFalse();
        assertThat(result.get("error").asText())
                .contains("Unknown tool 'delete_repository'")
                .contains(GitHubTools.LIST_ISSUES);
        verifyNoInteractions(gatewayClient);
    }

    @Test
    void invoke_success_returnsGatewayResult() {
        when(gatewayClient.hasCredential()).thenReturn(true);
        when(gatewayClient.callTool(eq(GitHubTools.LIST_ISSUES), any()))
                .thenReturn(new McpSchema.CallToolResult(List.of(new McpSchema.TextContent("#1 Bug")), false));

        JsonNode result = invoker.invoke(GitHubTools.LIST_ISSUES, args("{\"owner\":\"o\",\"repo\":\"r\"}"), context);

        assertThat(result.path("success").isMissingNode()).isTrue();
        assertThat(result.at("/content/0/type").asText()).isEqualTo("text");
        assertThat(result.at("/content/0/text").asText()).isEqualTo("#1 Bug");
    }

    @Test
    void invoke_gatewayAnsweredWithoutResult_becomesFailure() {
        when(gatewayClient.hasCredential()).thenReturn(true);
        when(gatewayClient.callTool(any(), any())).thenReturn(null);

        JsonNode result = invoker.invoke(GitHubTools.LIST_ISSUES, args("{}"), context);

        assertThat(result.isObject()).isTrue();
        assertThat(result.toString()).isNotEmpty();
        assertThat(result.get("success").asBoolean()).isFalse();
        assertThat(result.get("error").asText()).isEqualTo("MCP gateway returned no result");
    }

    @Test
    void invoke_rpcError_becomesFailure() {
        when(gatewayClient.hasCredential()).thenReturn(true);
        when(gatewayClient.callTool(any(), any()))
                .thenThrow(new McpGatewayException(200, "MCP error -32602: Invalid params"));

        JsonNode result = invoker.invoke(GitHubTools.LIST_ISSUES, args("{}"), context);

        assertThat(result.get("success").asBoolean()).isFalse();
        assertThat(result.get("error").asText()).isEqualTo("MCP error -32602: Invalid params");
    }

    @Test
    void invoke_toolReportedError_usesItsText() {
        when(gatewayClient.hasCredential()).thenReturn(true);
        when(gatewayClient.callTool(any(), any()))
                .thenReturn(new McpSchema.CallToolResult(List.of(new McpSchema.TextContent("Validation Failed")), true));

        JsonNode result = invoker.invoke(GitHubTools.SEARCH_REPOSITORIES, args("{}"), context);

        assertThat(result.get("error").asText()).isEqualTo("Validation Failed");
    }

    @Test
    void invoke_unauthorized_suggestsCheckingToken() {
        when(gatewayClient.hasCredential()).thenReturn(true);
        when(gatewayClient.callTool(any(), any()))
                .thenThrow(new McpGatewayException(401, "MCP call failed: HTTP 401 Unauthorized"));

        JsonNode result = invoker.invoke(GitHubTools.LIST_ISSUES, args("{}"), context);

        assertThat(result.get("error").asText()).contains("401");
        assertThat(result.get("howToFix").asText()).contains("COPILOT_MCP_TOKEN");
    }

    @Test
    void invoke_timeout_becomesFailure() {
        when(gatewayClient.hasCredential()).thenReturn(true);
        when(gatewayClient.callTool(any(), any())).thenThrow(
                new McpGatewayException(504, "MCP call timed out or could not connect: Read timed out"));

        JsonNode result = invoker.invoke(GitHubTools.GET_FILE_CONTENTS, args("{}"), context);

        assertThat(result.get("success").asBoolean()).isFalse();
        assertThat(result.get("error").asText()).startsWith("MCP call timed out").contains("Read timed out");
        assertThat(result.has("howToFix")).isFalse();
    }

    @Test
    void invoke_unexpectedException_neverEscapes() {
        when(gatewayClient.hasCredential()).thenReturn(true);
        when(gatewayClient.callTool(any(), any())).thenThrow(new IllegalStateException("boom"));

        JsonNode result = invoker.invoke(GitHubTools.GET_FILE_CONTENTS, args("{}"), InvocationContext.none());

        assertThat(result.get("error").asText()).isEqualTo("MCP call failed: boom");
    }

    private JsonNode args(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (Exception e) {
            throw new IllegalArgumentException(e);
        }
    }
}
