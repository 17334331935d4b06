package com.arrmcp.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

public interface ToolResponse {

    boolean terminal();

    record Final(JsonNode result) implements ToolResponse {
        public Final {
            result = result != null ? result : NullNode.getInstance();
        }

        @Override public boolean terminal() { return true; }
    }

    record Partial(JsonNode content, boolean done) implements ToolResponse {
        public Partial {
            content = content != null ? content : NullNode.getInstance();
        }

        @Override public boolean terminal() { return done; }
    }

    record Error(ErrorCode code, String message) implements ToolResponse {
        public static Error of(DispatchException e) {
            return new Error(e.code(), e.getMessage());
        }

        @Override public boolean terminal() { return true; }
    }
}
