package com.deepansh.foundry.runtime;

import com.deepansh.foundry.config.FoundryProperties;
import com.deepansh.foundry.exception.AgentException;
import com.deepansh.foundry.tool.McpTool;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriBuilder;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * {@link ConversationRuntime} backed by the Azure AI Foundry Agents REST API.
 *
 * Endpoints used (all relative to the project endpoint, all with ?api-version=):
 *
 * | Operation          | Call                                              |
 * |--------------------|---------------------------------------------------|
 * | createAgent        | POST   /assistants                                |
 * | deleteAgent        | DELETE /assistants/{agentId}                      |
 * | createThread       | POST   /threads                                   |
 * | deleteThread       | DELETE /threads/{threadId}                        |
 * | createMessage      | POST   /threads/{threadId}/messages               |
 * | createRun          | POST   /threads/{threadId}/runs                   |
 * | getRun             | GET    /threads/{threadId}/runs/{runId}           |
 * | submitToolOutputs  | POST   .../runs/{runId}/submit_tool_outputs       |
 * | cancelRun          | POST   .../runs/{runId}/cancel                    |
 * | listMessages       | GET    /threads/{threadId}/messages?order=desc    |
 *
 * Error handling:
 *
 * | Answer         | Exception                                              |
 * |----------------|--------------------------------------------------------|
 * | 401 / 403      | AgentException naming FOUNDRY_API_TOKEN (not retried)  |
 * | 429, 5xx       | FoundryServerException (retried, counts toward the CB) |
 * | other 4xx      | AgentException (not retried)                           |
 * | network error  | ResourceAccessException (retried)                      |
 *
 * The bearer token is never logged.
 */
@Component("foundryAgentsClient")
@Slf4j
public class FoundryAgentsClient implements ConversationRuntime {

    static final String SUBMIT_TOOL_OUTPUTS = "submit_tool_outputs";

    private final FoundryProperties props;
    private final RestClient restClient;

    public FoundryAgentsClient(FoundryProperties props,
                               @Qualifier("foundryRestClientBuilder") RestClient.Builder restClientBuilder) {
        this.props = props;

        if (props.getProjectEndpoint() == null || props.getProjectEndpoint().isBlank()) {
            log.error("foundry.project-endpoint is not set! Set env var: FOUNDRY_PROJECT_ENDPOINT");
        }
        if (props.getApiToken() == null || props.getApiToken().isBlank()) {
            log.error("foundry.api-token is not set! Set env var: FOUNDRY_API_TOKEN");
        }

        this.restClient = restClientBuilder.clone()
                .baseUrl(props.getProjectEndpoint())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getApiToken())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Override
    public String createAgent(AgentSpec spec) {
        Map<String, Object> body = new HashMap<>();
        body.put("model", spec.getModel());
        body.put("name", spec.getName());
        body.put("instructions", spec.getInstructions());
        body.put("tools", spec.getTools().stream().map(McpTool::toFunctionDefinition).toList());

        JsonNode agent = post("createAgent", uri("/assistants"), body);
        return requireId("createAgent", agent);
    }

    @Override
    public void deleteAgent(String agentId) {
        delete("deleteAgent", uri("/assistants/{agentId}", agentId));
    }

    @Override
    public String createThread() {
        JsonNode thread = post("createThread", uri("/threads"), Map.of());
        return requireId("createThread", thread);
    }

    @Override
    public void deleteThread(String threadId) {
        delete("deleteThread", uri("/threads/{threadId}", threadId));
    }

    @Override
    public void createMessage(String threadId, String content) {
        post("createMessage", uri("/threads/{threadId}/messages", threadId),
                Map.of("role", "user", "content", content));
    }

    @Override
    public RunState createRun(String threadId, String agentId) {
        JsonNode run = post("createRun", uri("/threads/{threadId}/runs", threadId),
                Map.of("assistant_id", agentId));
        return parseRun(threadId, run);
    }

    @Override
    public RunState getRun(String threadId, String runId) {
        JsonNode run = restClient.get()
                .uri(uri("/threads/{threadId}/runs/{runId}", threadId, runId))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    throw failure("getRun", res.getStatusCode().value(),
                            new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8));
                })
                .body(JsonNode.class);
        return parseRun(threadId, run);
    }

    @Override
    public RunState submitToolOutputs(String threadId, String runId, List<ToolOutput> outputs) {
        List<Map<String, String>> toolOutputs = outputs.stream()
                .map(o -> Map.of("tool_call_id", o.toolCallId(), "output", o.output()))
                .toList();

        JsonNode run = post("submitToolOutputs",
                uri("/threads/{threadId}/runs/{runId}/submit_tool_outputs", threadId, runId),
                Map.of("tool_outputs", toolOutputs));
        return parseRun(threadId, run);
    }

    @Override
    public RunState cancelRun(String threadId, String runId) {
        JsonNode run = post("cancelRun", uri("/threads/{threadId}/runs/{runId}/cancel", threadId, runId),
                Map.of());
        return parseRun(threadId, run);
    }

    @Override
    public List<ThreadMessage> listMessages(String threadId) {
        JsonNode page = restClient.get()
                .uri(uriBuilder -> uriBuilder.path("/threads/{threadId}/messages")
                        .queryParam("api-version", props.getApiVersion())
                        .queryParam("order", "desc")
                        .build(threadId))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    throw failure("listMessages", res.getStatusCode().value(),
                            new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8));
                })
                .body(JsonNode.class);

        List<ThreadMessage> messages = new ArrayList<>();
        if (page != null) {
            for (JsonNode message : page.path("data")) {
                messages.add(parseMessage(message));
            }
        }
        return messages;
    }

    // ─── Wire → domain ────────────────────────────────────────────────────────

    RunState parseRun(String threadId, JsonNode run) {
        if (run == null) {
            throw new AgentException("Foundry returned an empty run");
        }
        String wireStatus = run.path("status").asText(null);
        RunStatus status = RunStatus.fromWire(wireStatus);

        RunState.RunStateBuilder state = RunState.builder()
                .id(run.path("id").asText(null))
                .threadId(run.path("thread_id").asText(threadId))
                .status(status);

        if (status == RunStatus.REQUIRES_ACTION) {
            JsonNode action = run.path("required_action");
            String actionType = action.path("type").asText(null);
            state.requiredActionType(actionType);

            List<ToolCallRequest> pending = new ArrayList<>();
            for (JsonNode call : action.path(SUBMIT_TOOL_OUTPUTS).path("tool_calls")) {
                if (!"function".equals(call.path("type").asText("function"))) {
                    continue;
                }
                JsonNode function = call.path("function");
                JsonNode arguments = function.path("arguments");
                pending.add(new ToolCallRequest(
                        call.path("id").asText(),
                        function.path("name").asText(null),
                        arguments.isTextual() ? arguments.asText() : arguments.isMissingNode() ? "" : arguments.toString()));
            }
            state.pendingToolCalls(pending);
        }

        if (status == RunStatus.FAILED) {
            String message = run.path("last_error").path("message").asText(null);
            state.lastError(message != null && !message.isBlank()
                    ? message
                    : "Run ended with status '" + wireStatus + "'");
        }

        return state.build();
    }

    ThreadMessage parseMessage(JsonNode message) {
        List<MessageContent> content = new ArrayList<>();
        for (JsonNode item : message.path("content")) {
            String type = item.path("type").asText();
            if (!MessageContent.TEXT.equals(type)) {
                content.add(new MessageContent(type, null, List.of()));
                continue;
            }
            JsonNode text = item.path("text");
            List<MessageAnnotation> annotations = new ArrayList<>();
            for (JsonNode annotation : text.path("annotations")) {
                JsonNode citation = annotation.path(MessageAnnotation.URL_CITATION);
                annotations.add(new MessageAnnotation(
                        annotation.path("type").asText(),
                        citation.path("title").asText(""),
                        citation.path("url").asText(null)));
            }
            content.add(new MessageContent(type, text.path("value").asText(""), annotations));
        }
        return new ThreadMessage(
                message.path("id").asText(null),
                ThreadMessage.Role.fromWire(message.path("role").asText()),
                message.path("run_id").asText(null),
                content);
    }

    // ─── HTTP helpers ─────────────────────────────────────────────────────────

    private Function<UriBuilder, URI> uri(String path, Object... variables) {
        return uriBuilder -> uriBuilder.path(path)
                .queryParam("api-version", props.getApiVersion())
                .build(variables);
    }

    private JsonNode post(String operation, Function<UriBuilder, URI> uri, Object body) {
        log.debug("Foundry {}", operation);
        return restClient.post()
                .uri(uri)
                .body(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    throw failure(operation, res.getStatusCode().value(),
                            new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8));
                })
                .body(JsonNode.class);
    }

    private void delete(String operation, Function<UriBuilder, URI> uri) {
        log.debug("Foundry {}", operation);
        restClient.delete()
                .uri(uri)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (req, res) -> {
                    throw failure(operation, res.getStatusCode().value(),
                            new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8));
                })
                .toBodilessEntity();
    }

    private RuntimeException failure(String operation, int status, String body) {
        log.error("Foundry {} failed [{}]: {}", operation, status, body);
        if (status == 401 || status == 403) {
            return new AgentException("Foundry " + operation + " was rejected [" + status
                    + "]. Check the FOUNDRY_API_TOKEN environment variable.");
        }
        if (status == 429 || status >= 500) {
            return new FoundryServerException(status, "Foundry " + operation + " failed [" + status + "]");
        }
        return new AgentException("Foundry " + operation + " failed [" + status + "]");
    }

    private String requireId(String operation, JsonNode node) {
        String id = node != null ? node.path("id").asText(null) : null;
        if (id == null || id.isBlank()) {
            throw new AgentException("Foundry " + operation + " returned no id");
        }
        return id;
    }
}
