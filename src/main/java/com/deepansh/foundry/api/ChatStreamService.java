package com.deepansh.foundry.api;

import com.deepansh.foundry.config.FoundryProperties;
import com.deepansh.foundry.core.RunOrchestrator;
import com.deepansh.foundry.core.TurnRequest;
import com.deepansh.foundry.core.TurnResult;
import com.deepansh.foundry.exception.RunCancelledException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.Future;

/**
 * Runs a chat turn off the request thread and streams it as Server-Sent Events.
 *
 * Stream shape:
 *   data:<answer text, one data line per text line>
 *   data:[DONE]
 *
 * On failure a single {@code data:{"error": "..."}} event is sent instead of [DONE].
 * A cancelled turn (client gone, emitter timeout) ends the stream without a terminator.
 * Tool calls the run requests mid-stream are resolved by the orchestrator like any other turn.
 */
@Service
@Slf4j
public class ChatStreamService {

    public static final String DONE = "[DONE]";

    private final RunOrchestrator orchestrator;
    private final AsyncTaskExecutor streamExecutor;
    private final long timeoutMs;

    public ChatStreamService(RunOrchestrator orchestrator,
                             @Qualifier("chatStreamExecutor") AsyncTaskExecutor streamExecutor,
                             FoundryProperties props) {
        this.orchestrator = orchestrator;
        this.streamExecutor = streamExecutor;
        // the run deadline plus room for cleanup
        this.timeoutMs = props.getRunTimeout().plusSeconds(30).toMillis();
    }

    public SseEmitter stream(TurnRequest request) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        Future<?> turn = streamExecutor.submit(() -> runTurn(request, emitter));

        emitter.onTimeout(() -> {
            log.warn("Streaming chat timed out after {}ms, cancelling the turn", timeoutMs);
            turn.cancel(true);
        });
        emitter.onError(e -> turn.cancel(true));
        return emitter;
    }

    void runTurn(TurnRequest request, SseEmitter emitter) {
        try {
            TurnResult result = orchestrator.runTurn(request);
            if (result.getText() != null && !result.getText().isEmpty()) {
                emitter.send(textEvent(result.getText()));
            }
            emitter.send(SseEmitter.event().data(DONE));
            emitter.complete();
        } catch (RunCancelledException e) {
            log.info("Streaming request was cancelled");
            emitter.complete();
        } catch (IOException e) {
            log.info("Streaming client went away: {}", e.getMessage());
            emitter.completeWithError(e);
        } catch (RuntimeException e) {
            log.error("Error during streaming response", e);
            sendError(emitter, e);
        }
    }

    private static SseEmitter.SseEventBuilder textEvent(String text) {
        SseEmitter.SseEventBuilder event = SseEmitter.event();
        for (String line : text.split("\r?\n", -1)) {
            event.data(line);
        }
        return event;
    }

    private static void sendError(SseEmitter emitter, RuntimeException error) {
        try {
            emitter.send(SseEmitter.event()
                    .data(Map.of("error", String.valueOf(error.getMessage())), MediaType.APPLICATION_JSON));
            emitter.complete();
        } catch (IOException e) {
            emitter.completeWithError(e);
        }
    }
}
