package com.deepansh.foundry.core;

import com.deepansh.foundry.runtime.RunStatus;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Holds all mutable state for a single turn.
 * Passed through the run loop and the cleanup step instead of scattered locals.
 */
@Data
@Builder
public class TurnContext {

    private String message;
    private boolean autoApprove;

    private String agentId;
    private String threadId;

    /** True when the thread was created by this turn (and so may be deleted by it) */
    private boolean threadCreated;

    private String runId;
    private RunStatus lastStatus;

    @Builder.Default
    private List<ToolCallRecord> toolCalls = new ArrayList<>();

    private int pollCount;

    public void recordPoll() {
        pollCount++;
    }

    public boolean runStillActive() {
        return runId != null && (lastStatus == null || !lastStatus.isTerminal());
    }
}
