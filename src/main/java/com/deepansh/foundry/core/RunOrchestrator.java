package com.deepansh.foundry.core;

import com.deepansh.foundry.config.FoundryProperties;
import com.deepansh.foundry.exception.AgentException;
import com.deepansh.foundry.exception.InvalidChatRequestException;
import com.deepansh.foundry.exception.InvalidToolArgumentsException;
import com.deepansh.foundry.exception.RunCancelledException;
import com.deepansh.foundry.exception.ToolsUnavailableException;
import com.deepansh.foundry.exception.UpstreamRunFailedException;
import com.deepansh.foundry.runtime.AgentSpec;
import com.deepansh.foundry.runtime.ConversationRuntime;
import com.deepansh.foundry.runtime.RunState;
import com.deepansh.foundry.runtime.RunStatus;
import com.deepansh.foundry.runtime.ToolCallRequest;
import com.deepansh.foundry.runtime.ToolOutput;
import com.deepansh.foundry.tool.ArgumentNormalizer;
import com.deepansh.foundry.tool.InvocationContext;
import com.deepansh.foundry.tool.McpTool;
import com.deepansh.foundry.tool.ToolCatalog;
import com.deepansh.foundry.tool.ToolInvoker;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/**
 * Drives one chat turn through the agents service.
 *
 * Per-turn flow:
 * 1. Create a transient agent advertising the enabled MCP tools
 * 2. Reuse the caller's thread or create one, post the user message
 * 3. Start a run and poll it:
 *    - QUEUED / IN_PROGRESS → sleep poll-interval, poll again
 *    - REQUIRES_ACTION      → normalize + invoke every pending call in parallel,
 *                             submit the whole batch once, keep polling
 *    - COMPLETED            → extract text + citations from the newest assistant message
 *    - FAILED               → UpstreamRunFailedException, no retry
 * 4. Cleanup (always): delete the agent, delete a thread this turn created
 *    unless it is retained after success
 *
 * Tool problems never end a run; they travel back to the model as failure payloads.
 * Interrupting the calling thread cancels the turn with RunCancelledException.
 */
@Service
@Slf4j
public class RunOrchestrator {

    public static final String NO_TOOLS_MESSAGE =
            "No MCP tools are configured or enabled. Configure at least one tool under "
                    + "'mcp.allowed-tools' and set 'mcp.enabled=true'.";

    static final String NOT_APPROVED_ERROR = "Tool call was not approved by the user";
    static final String NOT_APPROVED_FIX = "Resend the message with autoApprove=true to allow tool execution";

    private final ConversationRuntime runtime;
    private final ToolCatalog catalog;
    private final ArgumentNormalizer normalizer;
    private final ToolInvoker invoker;
    private final ResponseExtractor extractor;
    private final FoundryProperties props;
    private final AsyncTaskExecutor toolExecutor;
    private final Clock clock;

    public RunOrchestrator(ConversationRuntime runtime,
                           ToolCatalog catalog,
                           ArgumentNormalizer normalizer,
                           ToolInvoker invoker,
                           ResponseExtractor extractor,
                           FoundryProperties props,
                           @Qualifier("toolTaskExecutor") AsyncTaskExecutor toolExecutor,
                           Clock clock) {
        this.runtime = runtime;
        this.catalog = catalog;
        this.normalizer = normalizer;
        this.invoker = invoker;
        this.extractor = extractor;
        this.props = props;
        this.toolExecutor = toolExecutor;
        this.clock = clock;
    }

    public TurnResult runTurn(TurnRequest request) {
        if (request.getMessage() == null || request.getMessage().isBlank()) {
            throw new InvalidChatRequestException("message must not be blank");
        }

        if (catalog.isEmpty()) {
            if (request.isRequireTools()) {
                throw new ToolsUnavailableException(NO_TOOLS_MESSAGE);
            }
            log.warn("Chat turn answered without a run: no MCP tools enabled");
            return TurnResult.builder()
                    .text(NO_TOOLS_MESSAGE)
                    .threadId(request.getThreadId())
                    .build();
        }

        TurnContext context = TurnContext.builder()
                .message(request.getMessage())
                .autoApprove(request.isAutoApprove())
                .threadId(blankToNull(request.getThreadId()))
                .build();

        boolean succeeded = false;
        try {
            TurnResult result = execute(context);
            succeeded = true;
            return result;
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted() && !(e instanceof RunCancelledException)) {
                throw new RunCancelledException("Chat turn was cancelled", e);
            }
            throw e;
        } finally {
            cleanup(context, succeeded);
        }
    }

    private TurnResult execute(TurnContext context) {
        long start = System.currentTimeMillis();

        context.setAgentId(runtime.createAgent(AgentSpec.builder()
                .model(props.getDeploymentName())
                .name(props.getAgentName())
                .instructions(resolveInstructions())
                .tools(catalog.list())
                .build()));

        if (context.getThreadId() == null) {
            context.setThreadId(runtime.createThread());
            context.setThreadCreated(true);
        }

        runtime.createMessage(context.getThreadId(), context.getMessage());

        RunState run = runtime.createRun(context.getThreadId(), context.getAgentId());
        context.setRunId(run.getId());
        context.setLastStatus(run.getStatus());

        log.info("Run started [agent={}, thread={}, run={}, newThread={}]",
                context.getAgentId(), context.getThreadId(), context.getRunId(), context.isThreadCreated());

        driveToCompletion(context, run);

        ExtractedResponse extracted = extractor.extract(runtime.listMessages(context.getThreadId()));

        log.info("Run complete [run={}, polls={}, toolCalls={}, latency={}ms]",
                context.getRunId(), context.getPollCount(), context.getToolCalls().size(),
                System.currentTimeMillis() - start);

        boolean threadWillBeDeleted = context.isThreadCreated() && !props.isRetainThreads();
        return TurnResult.builder()
                .text(extracted.text())
                .citations(extracted.citations())
                .threadId(threadWillBeDeleted ? null : context.getThreadId())
                .runId(context.getRunId())
                .agentId(context.getAgentId())
                .toolCalls(List.copyOf(context.getToolCalls()))
                .pollCount(context.getPollCount())
                .build();
    }

    private void driveToCompletion(TurnContext context, RunState initial) {
        Instant deadline = clock.instant().plus(props.getRunTimeout());
        RunState run = initial;

        while (true) {
            context.setLastStatus(run.getStatus());

            switch (run.getStatus()) {
                case COMPLETED -> {
                    return;
                }
                case FAILED -> throw new UpstreamRunFailedException(run.getId(),
                        "Run failed: " + (run.getLastError() != null ? run.getLastError() : "no error details"));
                case REQUIRES_ACTION -> {
                    if (run.getPendingToolCalls().isEmpty()) {
                        cancelQuietly(context);
                        throw new UpstreamRunFailedException(run.getId(),
                                "Run requested an unsupported action: " + run.getRequiredActionType());
                    }
                    List<ToolOutput> outputs = resolveBatch(context, run.getPendingToolCalls());
                    runtime.submitToolOutputs(context.getThreadId(), run.getId(), outputs);
                    log.debug("Submitted {} tool output(s) [run={}]", outputs.size(), run.getId());
                    context.setLastStatus(RunStatus.IN_PROGRESS);
                }
                default -> {
                    // QUEUED / IN_PROGRESS
                }
            }

            if (!clock.instant().isBefore(deadline)) {
                cancelQuietly(context);
                throw new UpstreamRunFailedException(run.getId(),
                        "Run did not finish within " + props.getRunTimeout());
            }

            sleep(props.getPollInterval());
            run = runtime.getRun(context.getThreadId(), context.getRunId());
            context.recordPoll();
        }
    }

    // ─── Tool batch ───────────────────────────────────────────────────────────

    private record Resolution(ToolOutput output, ToolCallRecord record) {
    }

    /**
     * Resolves every call of the batch on the tool executor and waits for all of them.
     * Output order matches request order. If the turn is cancelled while waiting, every
     * call still running is interrupted.
     */
    private List<ToolOutput> resolveBatch(TurnContext context, List<ToolCallRequest> calls) {
        log.info("Run requires action: {} tool call(s) {} [run={}]", calls.size(),
                calls.stream().map(ToolCallRequest::toolName).collect(Collectors.toList()), context.getRunId());

        List<Future<Resolution>> futures = new ArrayList<>(calls.size());
        List<Resolution> resolutions = new ArrayList<>(calls.size());
        try {
            for (ToolCallRequest call : calls) {
                futures.add(toolExecutor.submit(() -> resolve(context, call)));
            }
            for (Future<Resolution> future : futures) {
                resolutions.add(future.get());
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new RunCancelledException("Chat turn was cancelled while tools were running", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            throw new AgentException("Tool batch could not be resolved", e.getCause());
        }

        List<ToolOutput> outputs = new ArrayList<>(calls.size());
        for (Resolution resolution : resolutions) {
            outputs.add(resolution.output());
            context.getToolCalls().add(resolution.record());
        }
        return outputs;
    }

    private Resolution resolve(TurnContext context, ToolCallRequest call) {
        long start = System.currentTimeMillis();
        JsonNode output;

        if (!context.isAutoApprove()) {
            output = invoker.failure(call.toolName(), NOT_APPROVED_ERROR, NOT_APPROVED_FIX);
        } else {
            InvocationContext invocation = new InvocationContext(context.getThreadId(), context.getRunId(), call.id());
            try {
                JsonNode arguments = normalizer.normalize(call.toolName(), call.rawArguments());
                output = invoker.invoke(call.toolName(), arguments, invocation);
            } catch (InvalidToolArgumentsException e) {
                log.warn("Invalid arguments for [{}] [call={}]", call.toolName(), call.id());
                output = invoker.failure(call.toolName(), e.getMessage(),
                        "Send the arguments as a JSON object matching the tool's input schema");
            }
        }

        boolean success = output.path("success").asBoolean(true);
        return new Resolution(
                new ToolOutput(call.id(), output.toString()),
                new ToolCallRecord(call.toolName(), call.id(), success, System.currentTimeMillis() - start));
    }

    // ─── Helpers ──────────────────────────────────────────────────────────────

    private void sleep(Duration interval) {
        try {
            Thread.sleep(interval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RunCancelledException("Chat turn was cancelled while waiting for the run", e);
        }
    }

    /**
     * Best-effort teardown. The interrupt flag is cleared for the duration so the
     * HTTP calls can go through, then restored.
     */
    private void cleanup(TurnContext context, boolean succeeded) {
        boolean interrupted = Thread.interrupted();
        try {
            if (!succeeded && context.runStillActive()) {
                cancelQuietly(context);
            }
            if (context.getAgentId() != null) {
                try {
                    runtime.deleteAgent(context.getAgentId());
                } catch (RuntimeException e) {
                    log.warn("Failed to delete agent {}: {}", context.getAgentId(), e.getMessage());
                }
            }
            if (context.isThreadCreated() && (!succeeded || !props.isRetainThreads())) {
                try {
                    runtime.deleteThread(context.getThreadId());
                } catch (RuntimeException e) {
                    log.warn("Failed to delete thread {}: {}", context.getThreadId(), e.getMessage());
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void cancelQuietly(TurnContext context) {
        try {
            runtime.cancelRun(context.getThreadId(), context.getRunId());
            context.setLastStatus(RunStatus.FAILED);
        } catch (RuntimeException e) {
            log.warn("Failed to cancel run {}: {}", context.getRunId(), e.getMessage());
        }
    }

    private String resolveInstructions() {
        if (props.getInstructions() != null && !props.getInstructions().isBlank()) {
            return props.getInstructions();
        }
        String toolNames = catalog.list().stream().map(McpTool::getName).collect(Collectors.joining(", "));
        return """
                You are a helpful assistant with access to GitHub through MCP (Model Context Protocol) tools.

                Available tools: %s

                When using tools:
                - Base answers on the tool results, not on memory
                - Cite the GitHub URLs you used
                - If a tool returns success=false, explain the error and its howToFix \
                instead of calling the same tool again with the same arguments

                Be concise and accurate.
                """.formatted(toolNames);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
