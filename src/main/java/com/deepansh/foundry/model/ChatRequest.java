package com.deepansh.foundry.model;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class ChatRequest {

    @NotBlank(message = "message must not be blank")
    private String message;

    /**
     * Optional. Continues an existing conversation thread.
     * If null, the turn creates a new thread and returns its id.
     */
    private String threadId;

    /** When false, every tool call the agent requests is declined instead of executed. */
    private boolean autoApprove = true;

    /** When true, an empty tool catalog is an error (503) rather than an informational answer. */
    private boolean requireTools = false;
}
