package com.deepansh.foundry.core;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TurnRequest {

    String message;

    /** Caller-owned thread to continue; null starts a new one. */
    String threadId;

    @Builder.Default
    boolean autoApprove = true;

    @Builder.Default
    boolean requireTools = false;
}
