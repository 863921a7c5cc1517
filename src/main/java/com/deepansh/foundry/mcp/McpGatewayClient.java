package com.deepansh.foundry.mcp;

import com.deepansh.foundry.config.McpProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import io.modelcontextprotocol.spec.McpError;
import io.modelcontextprotocol.spec.McpSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Streamable-HTTP client for the MCP gateway (GitHub Copilot MCP by default),
 * built on the MCP Java SDK.
 *
 * Every call runs in its own session: initialize handshake, tools/call, graceful close.
 * The SDK owns the JSON-RPC envelope, request ids, session headers and SSE framing.
 *
 * Failures are translated into {@link McpGatewayException}:
 * - JSON-RPC error answer  → status 200, "MCP error <code>: <message>"
 * - timeout / no connection → status 504
 * - anything else           → status 401/403 when the transport reports one, else 502
 *
 * Never logs the bearer token or the tool arguments.
 */
@Component
@Slf4j
public class McpGatewayClient {

    public static final int STATUS_OK = 200;
    public static final int STATUS_BAD_GATEWAY = 502;
    public static final int STATUS_GATEWAY_TIMEOUT = 504;
    public static final int STATUS_INTERRUPTED = 499;

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final McpProperties.Gateway gateway;
    private final ObjectMapper objectMapper;
    private final Supplier<McpSyncClient> sessions;

    @Autowired
    public McpGatewayClient(McpProperties props, ObjectMapper objectMapper) {
        this(props, objectMapper, () -> openSession(props.getGateway()));
    }

    McpGatewayClient(McpProperties props, ObjectMapper objectMapper, Supplier<McpSyncClient> sessions) {
        this.gateway = props.getGateway();
        this.objectMapper = objectMapper;
        this.sessions = sessions;
    }

    public boolean hasCredential() {
        return gateway.hasToken();
    }

    public String endpoint() {
        return gateway.getEndpoint();
    }

    /**
     * Issues tools/call for one tool.
     *
     * @return the tool result, or null when the gateway answered without one
     * @throws McpGatewayException on a JSON-RPC error, a transport failure or a timeout
     */
    public McpSchema.CallToolResult callTool(String toolName, JsonNode arguments) {
        Map<String, Object> args = arguments == null || arguments.isNull()
                ? Map.of()
                : objectMapper.convertValue(arguments, ARGUMENTS_TYPE);

        McpSyncClient client = sessions.get();
        try {
            client.initialize();
            McpSchema.CallToolResult result = client.callTool(new McpSchema.CallToolRequest(toolName, args));
            log.debug("MCP tools/call [{}] returned (isError={})", toolName,
                    result != null ? result.isError() : null);
            return result;
        } catch (McpError e) {
            McpSchema.JSONRPCResponse.JSONRPCError error = e.getJsonRpcError();
            throw new McpGatewayException(STATUS_OK, error != null
                    ? "MCP error " + error.code() + ": " + error.message()
                    : "MCP error: " + e.getMessage());
        } catch (RuntimeException e) {
            throw translate(toolName, e);
        } finally {
            close(client);
        }
    }

    McpGatewayException translate(String toolName, RuntimeException e) {
        String detail = rootMessage(e);
        if (hasCause(e, InterruptedException.class)) {
            Thread.currentThread().interrupt();
            return new McpGatewayException(STATUS_INTERRUPTED, "MCP call was cancelled");
        }
        if (hasCause(e, TimeoutException.class) || hasCause(e, HttpTimeoutException.class)
                || hasCause(e, ConnectException.class)) {
            return new McpGatewayException(STATUS_GATEWAY_TIMEOUT,
                    "MCP call timed out or could not connect: " + detail);
        }
        log.debug("MCP transport failure for [{}]", toolName, e);
        int status = detail.contains("401") ? 401 : detail.contains("403") ? 403 : STATUS_BAD_GATEWAY;
        return new McpGatewayException(status, "MCP call failed: " + detail);
    }

    private static McpSyncClient openSession(McpProperties.Gateway gateway) {
        URI uri = URI.create(gateway.getEndpoint());
        HttpClientStreamableHttpTransport transport = HttpClientStreamableHttpTransport
                .builder(uri.getScheme() + "://" + uri.getRawAuthority())
                .endpoint(uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath())
                .customizeClient(client -> client.connectTimeout(Duration.ofMillis(gateway.getConnectTimeoutMs())))
                .customizeRequest(request -> request.header("Authorization", "Bearer " + gateway.getToken()))
                .build();

        return McpClient.sync(transport)
                .requestTimeout(Duration.ofMillis(gateway.getReadTimeoutMs()))
                .capabilities(McpSchema.ClientCapabilities.builder().build())
                .build();
    }

    private static void close(McpSyncClient client) {
        try {
            client.closeGracefully();
        } catch (RuntimeException e) {
            log.debug("MCP session did not close cleanly: {}", e.getMessage());
        }
    }

    private static boolean hasCause(Throwable e, Class<? extends Throwable> type) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (type.isInstance(t)) {
                return true;
            }
        }
        return false;
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
        return message.length() > 500 ? message.substring(0, 500) + "..." : message;
    }
}
