package com.deepansh.foundry.core;

/** One resolved tool call of a turn, in the order the agent requested it. */
public record ToolCallRecord(String toolName, String callId, boolean success, long latencyMs) {
}
