package com.deepansh.foundry.exception;

import lombok.Getter;

/**
 * The conversation runtime reported a terminal failure for a run,
 * or the run could not be driven to a terminal state.
 */
@Getter
public class UpstreamRunFailedException extends AgentException {

    private final String runId;

    public UpstreamRunFailedException(String runId, String message) {
        super(message);
        this.runId = runId;
    }
}
