package com.arrmcp.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Executes one tool. Throwing fails the call; the exception message is
 * surfaced to the caller verbatim. Implementations doing blocking I/O should
 * stop when their thread is interrupted.
 */
@FunctionalInterface
public interface Handler {
    JsonNode handle(ToolRequest request) throws Exception;
}
