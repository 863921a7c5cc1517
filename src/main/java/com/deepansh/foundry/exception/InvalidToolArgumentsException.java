package com.deepansh.foundry.exception;

import lombok.Getter;

/**
 * Tool-call arguments that are not parseable JSON.
 * Never reaches the caller: the orchestrator folds it into a failure payload.
 */
@Getter
public class InvalidToolArgumentsException extends AgentException {

    private final String toolName;

    public InvalidToolArgumentsException(String toolName, String message, Throwable cause) {
        super(message, cause);
        this.toolName = toolName;
    }
}
