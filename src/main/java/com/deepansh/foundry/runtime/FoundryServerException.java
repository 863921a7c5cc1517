package com.deepansh.foundry.runtime;

import lombok.Getter;

/**
 * 5xx or 429 from the agents service. Retried by the foundryRuntime instance,
 * unlike AgentException.
 */
@Getter
public class FoundryServerException extends RuntimeException {

    private final int status;

    public FoundryServerException(int status, String message) {
        super(message);
        this.status = status;
    }
}
