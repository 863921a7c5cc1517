package com.deepansh.foundry.exception;

/**
 * Raised when the caller required tool use but the catalog has no enabled tools.
 */
public class ToolsUnavailableException extends AgentException {

    public ToolsUnavailableException(String message) {
        super(message);
    }
}
