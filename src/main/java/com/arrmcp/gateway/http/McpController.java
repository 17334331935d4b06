package com.arrmcp.gateway.http;

import com.arrmcp.dispatch.DispatchException;
import com.arrmcp.dispatch.Dispatcher;
import com.arrmcp.dispatch.Envelopes;
import com.arrmcp.dispatch.ErrorCode;
import com.arrmcp.observability.ServiceHealthAggregator;
import com.arrmcp.shared.config.ArrMcpConfig;
import com.arrmcp.tools.ToolRegistry;
import com.arrmcp.tools.ToolRequest;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class McpController {

    private static final Logger log = LoggerFactory.getLogger(McpController.class);

    private final ToolRegistry registry;
    private final Dispatcher dispatcher;
    private final ServiceHealthAggregator health;
    private final ObjectMapper mapper;
    private final boolean streamingEnabled;

    @Autowired
    public McpController(ToolRegistry registry, Dispatcher dispatcher, ServiceHealthAggregator health,
                         ObjectMapper mapper, ArrMcpConfig config) {
        this(registry, dispatcher, health, mapper, config.server().streaming());
    }

    public McpController(ToolRegistry registry, Dispatcher dispatcher, ServiceHealthAggregator health,
                         ObjectMapper mapper, boolean streamingEnabled) {
        this.registry = registry;
        this.dispatcher = dispatcher;
        this.health = health;
        this.mapper = mapper;
        this.streamingEnabled = streamingEnabled;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @GetMapping("/v1/service-health")
    public ResponseEntity<Map<String, Object>> serviceHealth() {
        var report = health.checkAll();
        var body = new LinkedHashMap<String, Object>();
        body.put("status", report.status());
        body.put("services", report.services());
        if (!report.healthy()) {
            log.warn("Service health degraded: {}", report.services());
        }
        return ResponseEntity.status(report.healthy() ? 200 : 503).body(body);
    }

    @GetMapping("/v1/tools")
    public Map<String, Object> tools() {
        return Map.of("tools", registry.listAll());
    }

    @PostMapping("/v1/run")
    public Object run(@RequestBody(required = false) byte[] body, HttpServletResponse response) {
        var invocation = dispatcher.resolve(readRequest(body));

        if (invocation.streaming()) {
            if (!streamingEnabled) {
                log.error("Tool {} streams its output but streaming is disabled", invocation.toolName());
                var code = ErrorCode.STREAMING_UNSUPPORTED;
                return ResponseEntity.status(code.httpStatus())
                        .body(Envelopes.error("Streaming not supported", code));
            }
            response.setContentType(MediaType.APPLICATION_NDJSON_VALUE);
            StreamingResponseBody frames = out -> dispatcher.stream(invocation, frame -> {
                out.write(mapper.writeValueAsBytes(Envelopes.toWire(frame)));
                out.write('\n');
                out.flush();
            });
            return frames;
        }

        var frame = dispatcher.execute(invocation);
        return ResponseEntity.status(Envelopes.httpStatus(frame)).body(Envelopes.toWire(frame));
    }

    // Without this mapping Spring answers OPTIONS with an empty 200
    @RequestMapping(value = {"/health", "/v1/service-health", "/v1/tools", "/v1/run"}, method = RequestMethod.OPTIONS)
    public void options() throws HttpRequestMethodNotSupportedException {
        throw new HttpRequestMethodNotSupportedException("OPTIONS", List.of("GET", "POST"));
    }

    // Content-Type is ignored; the body is always read as JSON
    private ToolRequest readRequest(byte[] body) {
        if (body == null || body.length == 0) {
            throw new DispatchException(ErrorCode.MALFORMED_REQUEST, "Invalid request format");
        }
        try {
            var request = mapper.readValue(body, ToolRequest.class);
            if (request == null) {
                throw new DispatchException(ErrorCode.MALFORMED_REQUEST, "Invalid request format");
            }
            return request;
        } catch (IOException e) {
            log.warn("Invalid request format: {}", e.getMessage());
            throw new DispatchException(ErrorCode.MALFORMED_REQUEST, "Invalid request format", e);
        }
    }
}
