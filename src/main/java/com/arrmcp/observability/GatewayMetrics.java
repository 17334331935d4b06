package com.arrmcp.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

public class GatewayMetrics {

    public static final String EXECUTIONS = "arrmcp.tool.executions";
    public static final String LATENCY = "arrmcp.tool.latency";

    private final MeterRegistry registry;

    public GatewayMetrics() {
        this(new SimpleMeterRegistry());
    }

    public GatewayMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter toolExecutions(String tool, String outcome) {
        return Counter.builder(EXECUTIONS)
                .tag("tool", tool)
                .tag("outcome", outcome)
                .register(registry);
    }

    public Timer toolLatency(String tool) {
        return Timer.builder(LATENCY).tag("tool", tool).register(registry);
    }

    public void record(String tool, String outcome, long startNanos) {
        toolExecutions(tool, outcome).increment();
        toolLatency(tool).record(Duration.ofNanos(System.nanoTime() - startNanos));
    }
}
