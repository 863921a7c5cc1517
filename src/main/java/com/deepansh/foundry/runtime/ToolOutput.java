package com.deepansh.foundry.runtime;

/**
 * Output submitted for one {@link ToolCallRequest}: serialized JSON,
 * either the tool's result or a failure payload.
 */
public record ToolOutput(String toolCallId, String output) {
}
