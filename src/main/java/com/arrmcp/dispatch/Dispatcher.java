package com.arrmcp.dispatch;

import com.arrmcp.observability.GatewayMetrics;
import com.arrmcp.tools.ParameterValidator;
import com.arrmcp.tools.StreamingHandler;
import com.arrmcp.tools.ToolRegistry;
import com.arrmcp.tools.ToolRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Resolves a request to a registered tool, validates its input and runs the
 * handler, turning every outcome into a {@link ToolResponse}. Holds no
 * per-request state; calls never retry.
 *
 * <p>Requests carrying a timeout run on a worker thread so the caller can give
 * up at the deadline. The worker is interrupted on expiry; a handler that
 * ignores the interrupt keeps running but its result is discarded.
 */
public class Dispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final ToolRegistry registry;
    private final ParameterValidator validator;
    private final GatewayMetrics metrics;
    private final ExecutorService workers;

    public Dispatcher(ToolRegistry registry, GatewayMetrics metrics) {
        this(registry, new ParameterValidator(), metrics);
    }

    public Dispatcher(ToolRegistry registry, ParameterValidator validator, GatewayMetrics metrics) {
        this.registry = registry;
        this.validator = validator;
        this.metrics = metrics;
        var seq = new AtomicInteger();
        this.workers = Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "tool-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public ToolResponse run(ToolRequest request) {
        Invocation invocation;
        try {
            invocation = resolve(request);
        } catch (DispatchException e) {
            return ToolResponse.Error.of(e);
        }
        if (invocation.streaming()) {
            log.error("Tool {} streams its output but the caller accepts a single response", invocation.toolName());
            return new ToolResponse.Error(ErrorCode.STREAMING_UNSUPPORTED, "Streaming not supported");
        }
        return execute(invocation);
    }

    public Invocation resolve(ToolRequest request) {
        var name = request.toolName();
        if (name == null || name.isBlank()) {
            log.warn("Rejected request without tool_name");
            throw new DispatchException(ErrorCode.MISSING_TOOL_NAME, "Missing tool_name in request");
        }
        if (!request.input().isObject()) {
            log.warn("Rejected request for {}: input is not an object", name);
            throw new DispatchException(ErrorCode.MALFORMED_REQUEST, "Invalid request format: input must be a JSON object");
        }
        log.debug("Received request for tool: {}", name);

        var tool = registry.resolve(name).orElseThrow(() -> {
            log.warn("Unknown tool requested: {}", name);
            return new DispatchException(ErrorCode.UNKNOWN_TOOL, "Unknown tool: " + name);
        });

        validator.validate(request.input(), tool.definition().parameters()).ifPresent(v -> {
            log.warn("Parameter validation failed for tool {}: {}", name, v.message());
            throw new DispatchException(ErrorCode.INVALID_PARAMETER, "Parameter validation failed: " + v.message());
        });
        return new Invocation(request, tool);
    }

    public ToolResponse execute(Invocation invocation) {
        var name = invocation.toolName();
        var handler = invocation.tool().handler();
        var request = invocation.request();
        long start = System.nanoTime();
        try {
            JsonNode result = callWithDeadline(request, () -> handler.handle(request));
            metrics.record(name, "success", start);
            log.debug("Successfully processed request for tool: {}", name);
            return new ToolResponse.Final(result);
        } catch (DispatchException e) {
            metrics.record(name, outcomeOf(e), start);
            log.error("Handler error for tool {}: {}", name, e.getMessage());
            return ToolResponse.Error.of(e);
        } catch (Exception e) {
            metrics.record(name, "failure", start);
            log.error("Handler error for tool {}: {}", name, messageOf(e));
            return new ToolResponse.Error(ErrorCode.HANDLER_FAILURE, messageOf(e));
        }
    }

    public void stream(Invocation invocation, FrameSink sink) throws IOException {
        if (!(invocation.tool().handler() instanceof StreamingHandler handler)) {
            throw new DispatchException(ErrorCode.STREAMING_UNSUPPORTED,
                    "Tool " + invocation.toolName() + " does not stream");
        }
        var name = invocation.toolName();
        var request = invocation.request();
        var gate = new TerminalGate(sink);
        long start = System.nanoTime();

        JsonNode terminalContent;
        String outcome;
        try {
            terminalContent = callWithDeadline(request,
                    () -> handler.handleProgressively(request, gate::partial));
            outcome = "success";
            log.debug("Streamed response completed for tool: {}", name);
        } catch (DispatchException e) {
            terminalContent = errorContent(e.getMessage());
            outcome = outcomeOf(e);
            log.error("Streaming handler error for tool {}: {}", name, e.getMessage());
        } catch (Exception e) {
            terminalContent = errorContent(messageOf(e));
            outcome = "failure";
            log.error("Streaming handler error for tool {}: {}", name, messageOf(e));
        }
        metrics.record(name, outcome, start);
        gate.finish(terminalContent);
    }

    private <T> T callWithDeadline(ToolRequest request, Callable<T> call) throws Exception {
        if (!request.hasDeadline()) {
            return call.call();
        }
        long timeoutMs = request.timeoutMillis();
        Future<T> future = workers.submit(call);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DispatchException(ErrorCode.TIMEOUT,
                    "Tool " + request.toolName() + " timed out after " + timeoutMs + " ms");
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof Exception ex) throw ex;
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new DispatchException(ErrorCode.HANDLER_FAILURE, "Request interrupted", e);
        }
    }

    private static JsonNode errorContent(String message) {
        return JsonNodeFactory.instance.objectNode().put("error", message);
    }

    private static String outcomeOf(DispatchException e) {
        return e.code() == ErrorCode.TIMEOUT ? "timeout" : "failure";
    }

    static String messageOf(Throwable t) {
        var msg = t.getMessage();
        return msg != null ? msg : t.getClass().getSimpleName();
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }

    private static final class TerminalGate {
        private final FrameSink sink;
        private boolean done;

        TerminalGate(FrameSink sink) {
            this.sink = sink;
        }

        synchronized void partial(JsonNode content) throws IOException {
            if (done) return;
            sink.accept(new ToolResponse.Partial(content, false));
        }

        synchronized void finish(JsonNode content) throws IOException {
            if (done) return;
            done = true;
            sink.accept(new ToolResponse.Partial(content, true));
        }
    }
}
