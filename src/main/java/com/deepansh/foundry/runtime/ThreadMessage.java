package com.deepansh.foundry.runtime;

import java.util.List;

public record ThreadMessage(String id, Role role, String runId, List<MessageContent> content) {

    public enum Role {
        USER, ASSISTANT;

        public static Role fromWire(String role) {
            return "user".equalsIgnoreCase(role) ? USER : ASSISTANT;
        }
    }

    public ThreadMessage {
        content = content != null ? List.copyOf(content) : List.of();
    }
}
