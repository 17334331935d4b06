package com.arrmcp.tools;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolRequest(
    @JsonProperty("tool_name") String toolName,
    @JsonProperty("input") JsonNode input,
    @JsonProperty("request_id") String requestId,
    @JsonProperty("timeout") Integer timeoutMillis,
    @JsonProperty("access_token") String accessToken
) {
    @JsonCreator
    public ToolRequest {
        if (input == null || input.isNull() || input.isMissingNode()) {
            input = JsonNodeFactory.instance.objectNode();
        }
    }

    public ToolRequest(String toolName, JsonNode input) {
        this(toolName, input, null, null, null);
    }

    @JsonIgnore
    public boolean hasDeadline() {
        return timeoutMillis != null && timeoutMillis > 0;
    }
}
