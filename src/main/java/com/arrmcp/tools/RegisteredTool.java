package com.arrmcp.tools;

import java.util.Objects;

public record RegisteredTool(ToolDefinition definition, Handler handler) {
    public RegisteredTool {
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(handler, "handler");
    }

    public String name() {
        return definition.name();
    }

    public boolean streaming() {
        return handler instanceof StreamingHandler;
    }
}
