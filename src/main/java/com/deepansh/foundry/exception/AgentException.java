package com.deepansh.foundry.exception;

/**
 * Base for every error this service raises on purpose.
 * Unchecked so it can cross the Resilience4j proxies untouched.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
