package com.deepansh.foundry.runtime;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Snapshot of a run returned by every runtime call that touches it.
 * pendingToolCalls is only populated in REQUIRES_ACTION.
 */
@Value
@Builder(toBuilder = true)
public class RunState {

    String id;
    String threadId;
    RunStatus status;

    @Builder.Default
    List<ToolCallRequest> pendingToolCalls = List.of();

    /** Set when status is FAILED */
    String lastError;

    /** The agents API required_action.type, kept for diagnostics */
    String requiredActionType;
}
