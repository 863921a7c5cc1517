package com.deepansh.foundry.runtime;

/**
 * One pending tool invocation surfaced by a requires-action run.
 *
 * @param id           opaque id the output must be submitted under
 * @param toolName     name the model asked for (not necessarily in the catalog)
 * @param rawArguments JSON text exactly as the model produced it
 */
public record ToolCallRequest(String id, String toolName, String rawArguments) {
}
