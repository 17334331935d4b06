package com.arrmcp.tools;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonPropertyOrder({"name", "description", "parameters"})
public record ToolDefinition(
    String name,
    String description,
    @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, ParamSpec> parameters
) {
    public ToolDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Tool name must not be blank");
        }
        description = description != null ? description : "";
        parameters = parameters == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public ToolDefinition(String name, String description) {
        this(name, description, Map.of());
    }
}
