package com.deepansh.foundry.tool;

import com.deepansh.foundry.config.McpProperties;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable registry of the tools advertised to the model.
 *
 * Built once at startup and shared by every run. Iteration order is insertion
 * order, so the agent always sees the tools in the same sequence.
 */
@Slf4j
public class ToolCatalog {

    private final Map<String, McpTool> tools;

    public ToolCatalog(List<McpTool> tools) {
        Map<String, McpTool> indexed = new LinkedHashMap<>();
        for (McpTool tool : tools) {
            if (indexed.putIfAbsent(tool.getName(), tool) != null) {
                throw new IllegalArgumentException("Duplicate tool name: " + tool.getName());
            }
        }
        this.tools = Collections.unmodifiableMap(indexed);
    }

    /**
     * Filters the built-in GitHub tools by {@code mcp.enabled} and {@code mcp.allowed-tools}.
     * Unknown names in the allow-list are logged and ignored.
     */
    public static ToolCatalog fromProperties(McpProperties props) {
        if (!props.isEnabled()) {
            log.warn("MCP tools disabled (mcp.enabled=false), catalog is empty");
            return new ToolCatalog(List.of());
        }

        List<McpTool> builtIn = GitHubTools.all();
        Set<String> allowed = Set.copyOf(props.getAllowedTools());
        if (allowed.isEmpty()) {
            return logged(new ToolCatalog(builtIn));
        }

        allowed.stream()
                .filter(name -> builtIn.stream().noneMatch(t -> t.getName().equals(name)))
                .forEach(name -> log.warn("Ignoring unknown tool in mcp.allowed-tools: [{}]", name));

        return logged(new ToolCatalog(builtIn.stream()
                .filter(t -> allowed.contains(t.getName()))
                .toList()));
    }

    private static ToolCatalog logged(ToolCatalog catalog) {
        catalog.list().forEach(tool -> log.info("Registered MCP tool: [{}]", tool.getName()));
        log.info("Total MCP tools enabled: {}", catalog.size());
        return catalog;
    }

    public List<McpTool> list() {
        return List.copyOf(tools.values());
    }

    public Optional<McpTool> get(String name) {
        return Optional.ofNullable(name).map(tools::get);
    }

    public boolean contains(String name) {
        return name != null && tools.containsKey(name);
    }

    public List<String> names() {
        return List.copyOf(tools.keySet());
    }

    public boolean isEmpty() {
        return tools.isEmpty();
    }

    public int size() {
        return tools.size();
    }
}
