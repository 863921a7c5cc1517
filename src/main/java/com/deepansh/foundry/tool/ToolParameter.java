package com.deepansh.foundry.tool;

import lombok.Builder;
import lombok.Value;

/** One named argument of an MCP tool. */
@Value
@Builder
public class ToolParameter {

    @Builder.Default
    String type = "string";
    String description;
    boolean required;
}
