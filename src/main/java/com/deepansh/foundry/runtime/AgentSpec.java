package com.deepansh.foundry.runtime;

import com.deepansh.foundry.tool.McpTool;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/** What to create a transient per-turn agent with. */
@Value
@Builder
public class AgentSpec {
    String model;
    String name;
    String instructions;
    List<McpTool> tools;
}
