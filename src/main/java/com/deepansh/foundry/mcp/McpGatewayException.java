package com.deepansh.foundry.mcp;

import com.deepansh.foundry.exception.AgentException;
import lombok.Getter;

/** Non-2xx or unreadable response from the MCP gateway. */
@Getter
public class McpGatewayException extends AgentException {

    private final int status;

    public McpGatewayException(int status, String message) {
        super(message);
        this.status = status;
    }
}
