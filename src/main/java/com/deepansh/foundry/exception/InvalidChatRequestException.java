package com.deepansh.foundry.exception;

/** Caller input rejected before any run is created. */
public class InvalidChatRequestException extends AgentException {

    public InvalidChatRequestException(String message) {
        super(message);
    }
}
