package com.deepansh.foundry.tool;

/**
 * Correlation ids for one tool call, used only for logging.
 */
public record InvocationContext(String threadId, String runId, String callId) {

    public static InvocationContext none() {
        return new InvocationContext(null, null, null);
    }
}
