package com.deepansh.foundry.tool;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Value;

/**
 * Structured failure fed back to the model as tool output instead of aborting the run.
 *
 * Serialized shape: {"success": false, "function": ..., "error": ..., "howToFix": ...}
 * where howToFix is omitted when there is no concrete guidance.
 */
@Value
@Builder
public class ToolCallFailure {

    String function;
    String error;
    String howToFix;

    public ObjectNode toJson(ObjectMapper objectMapper) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("success", false);
        node.put("function", function);
        node.put("error", error);
        if (howToFix != null && !howToFix.isBlank()) {
            node.put("howToFix", howToFix);
        }
        return node;
    }
}
