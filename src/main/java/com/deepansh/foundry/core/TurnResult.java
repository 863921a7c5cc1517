package com.deepansh.foundry.core;

import com.deepansh.foundry.model.Citation;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of one chat turn.
 *
 * runId and agentId are null for the informational answer given when no
 * tools are enabled, since no run is started in that case. threadId is null
 * when the thread was created by this turn and not retained.
 */
@Value
@Builder
public class TurnResult {

    String text;

    @Builder.Default
    List<Citation> citations = List.of();

    String threadId;
    String runId;
    String agentId;

    @Builder.Default
    List<ToolCallRecord> toolCalls = List.of();

    int pollCount;
}
