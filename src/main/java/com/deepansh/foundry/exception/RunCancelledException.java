package com.deepansh.foundry.exception;

/**
 * The thread driving a run was interrupted. The interrupt flag is
 * restored before this is thrown.
 */
public class RunCancelledException extends AgentException {

    public RunCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
