package com.deepansh.foundry.api;

import com.deepansh.foundry.core.RunOrchestrator;
import com.deepansh.foundry.core.TurnRequest;
import com.deepansh.foundry.core.TurnResult;
import com.deepansh.foundry.mcp.McpGatewayClient;
import com.deepansh.foundry.model.ChatRequest;
import com.deepansh.foundry.model.ChatResponse;
import com.deepansh.foundry.resilience.IdempotencyService;
import com.deepansh.foundry.tool.McpTool;
import com.deepansh.foundry.tool.ToolCatalog;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Chat endpoint for the MCP-enabled agent, plus catalog introspection.
 *
 * POST /api/mcp/chat
 *   Optional header: Idempotency-Key: <uuid>
 *   A repeated key within 24h returns the cached response without starting a run.
 *
 * POST /api/mcp/chat/stream
 *   Same body, answered as Server-Sent Events ending with data:[DONE]
 *
 * GET /api/mcp/discover  tools/list shaped view of the enabled catalog
 * GET /api/mcp/info      gateway endpoint, credential presence, enabled tools
 * GET /api/mcp/health
 */
@RestController
@RequestMapping("/api/mcp")
@RequiredArgsConstructor
@Slf4j
public class McpChatController {

    static final String IDEMPOTENCY_HEADER = "Idempotency-Key";

    private final RunOrchestrator orchestrator;
    private final ToolCatalog catalog;
    private final McpGatewayClient gatewayClient;
    private final IdempotencyService idempotencyService;
    private final ChatStreamService chatStreamService;
    private final ObjectMapper objectMapper;

    @PostMapping("/chat")
    public ResponseEntity<ChatResponse> chat(
            @Valid @RequestBody ChatRequest request,
            @RequestHeader(value = IDEMPOTENCY_HEADER, required = false) String idempotencyKey) {

        log.info("Chat request [threadId={}, autoApprove={}, requireTools={}, idempotencyKey={}]",
                request.getThreadId(), request.isAutoApprove(), request.isRequireTools(), idempotencyKey);

        boolean idempotent = idempotencyKey != null && !idempotencyKey.isBlank();
        if (idempotent) {
            Optional<ChatResponse> cached = idempotencyService.findCompleted(idempotencyKey)
                    .flatMap(this::readCached);
            if (cached.isPresent()) {
                return ResponseEntity.ok(cached.get());
            }
            if (!idempotencyService.claim(idempotencyKey)) {
                log.warn("Idempotency key {} already claimed, running anyway", idempotencyKey);
            }
        }

        ChatResponse response;
        try {
            response = toResponse(orchestrator.runTurn(toTurnRequest(request)));
        } catch (RuntimeException e) {
            if (idempotent) {
                idempotencyService.release(idempotencyKey);
            }
            throw e;
        }

        if (idempotent) {
            try {
                idempotencyService.complete(idempotencyKey, objectMapper.writeValueAsString(response));
            } catch (JsonProcessingException e) {
                log.warn("Failed to cache chat response for key={}", idempotencyKey, e);
                idempotencyService.release(idempotencyKey);
            }
        }
        return ResponseEntity.ok(response);
    }

    @PostMapping(value = "/chat/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@Valid @RequestBody ChatRequest request) {
        log.info("Streaming chat request [threadId={}, autoApprove={}, requireTools={}]",
                request.getThreadId(), request.isAutoApprove(), request.isRequireTools());
        return chatStreamService.stream(toTurnRequest(request));
    }

    @GetMapping("/discover")
    public ResponseEntity<Map<String, Object>> discover() {
        List<Map<String, Object>> tools = catalog.list().stream()
                .map(McpTool::toMcpDescriptor)
                .toList();
        return ResponseEntity.ok(Map.of(
                "jsonrpc", "2.0",
                "result", Map.of("tools", tools)));
    }

    @GetMapping("/info")
    public ResponseEntity<Map<String, Object>> info() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("gatewayEndpoint", gatewayClient.endpoint());
        info.put("credentialConfigured", gatewayClient.hasCredential());
        info.put("enabledTools", catalog.names());
        info.put("features", List.of(
                "GitHub MCP tools over streamable HTTP",
                "Parallel tool call resolution",
                "Search query repair",
                "Idempotent chat requests",
                "Streaming chat responses"));
        return ResponseEntity.ok(info);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    private Optional<ChatResponse> readCached(String json) {
        try {
            return Optional.of(objectMapper.readValue(json, ChatResponse.class));
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize cached chat response, running fresh", e);
            return Optional.empty();
        }
    }

    private static TurnRequest toTurnRequest(ChatRequest request) {
        return TurnRequest.builder()
                .message(request.getMessage())
                .threadId(request.getThreadId())
                .autoApprove(request.isAutoApprove())
                .requireTools(request.isRequireTools())
                .build();
    }

    private ChatResponse toResponse(TurnResult result) {
        return ChatResponse.builder()
                .response(result.getText())
                .citations(result.getCitations())
                .threadId(result.getThreadId())
                .runId(result.getRunId())
                .agentId(result.getAgentId())
                .toolCalls(result.getToolCalls())
                .build();
    }
}
