package com.arrmcp.dispatch;

import com.arrmcp.tools.RegisteredTool;
import com.arrmcp.tools.ToolRequest;

public record Invocation(ToolRequest request, RegisteredTool tool) {

    public String toolName() {
        return tool.name();
    }

    public boolean streaming() {
        return tool.streaming();
    }
}
