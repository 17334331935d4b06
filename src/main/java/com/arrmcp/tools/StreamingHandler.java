package com.arrmcp.tools;

import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

public interface StreamingHandler extends Handler {

    JsonNode handleProgressively(ToolRequest request, PartialSink partials) throws Exception;

    @FunctionalInterface
    interface PartialSink {
        void emit(JsonNode content) throws IOException;
    }
}
