package com.deepansh.foundry.tool;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable description of one callable MCP tool.
 *
 * Rendered two ways: as an OpenAI-style function definition when the agent is
 * created, and as an MCP tools/list descriptor for the discovery endpoint.
 * Both renderings share the same JSON Schema built from {@link #getParameters()}.
 */
@Value
public class McpTool {

    String name;
    String description;
    /** Declaration order is preserved */
    Map<String, ToolParameter> parameters;

    public McpTool(String name, String description, Map<String, ToolParameter> parameters) {
        this.name = name;
        this.description = description;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static Builder named(String name) {
        return new Builder(name);
    }

    public List<String> requiredParameters() {
        List<String> required = new ArrayList<>();
        parameters.forEach((paramName, param) -> {
            if (param.isRequired()) required.add(paramName);
        });
        return required;
    }

    /** JSON Schema for the tool input: { type, properties, required } */
    public Map<String, Object> toInputSchema() {
        Map<String, Object> properties = new LinkedHashMap<>();
        parameters.forEach((paramName, param) -> properties.put(paramName, Map.of(
                "type", param.getType(),
                "description", param.getDescription())));

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", properties);
        schema.put("required", requiredParameters());
        return schema;
    }

    /**
     * Function-tool format expected by the agents API:
     * { "type": "function", "function": { "name", "description", "parameters" } }
     */
    public Map<String, Object> toFunctionDefinition() {
        return Map.of(
                "type", "function",
                "function", Map.of(
                        "name", name,
                        "description", description,
                        "parameters", toInputSchema()
                )
        );
    }

    /** MCP tools/list entry: { name, description, inputSchema } */
    public Map<String, Object> toMcpDescriptor() {
        Map<String, Object> descriptor = new LinkedHashMap<>();
        descriptor.put("name", name);
        descriptor.put("description", description);
        descriptor.put("inputSchema", toInputSchema());
        return descriptor;
    }

    public static final class Builder {
        private final String name;
        private String description = "";
        private final Map<String, ToolParameter> parameters = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder required(String paramName, String description) {
            parameters.put(paramName, ToolParameter.builder().description(description).required(true).build());
            return this;
        }

        public Builder optional(String paramName, String description) {
            parameters.put(paramName, ToolParameter.builder().description(description).required(false).build());
            return this;
        }

        public McpTool build() {
            return new McpTool(name, description, parameters);
        }
    }
}
