package com.arrmcp.observability;

import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class GatewayMetricsTest {

    @Test
    void recordCountsByOutcomeAndTimesPerTool() {
        var metrics = new GatewayMetrics();
        metrics.record("Echo", "success", System.nanoTime());
        metrics.record("Echo", "success", System.nanoTime());
        metrics.record("Echo", "failure", System.nanoTime());

        assertEquals(2.0, metrics.toolExecutions("Echo", "success").count());
        assertEquals(1.0, metrics.toolExecutions("Echo", "failure").count());
        assertEquals(3, metrics.toolLatency("Echo").count());
        assertTrue(metrics.toolLatency("Echo").totalTime(TimeUnit.NANOSECONDS) >= 0);
    }

    @Test
    void metersAreRegisteredUnderGatewayNames() {
        var metrics = new GatewayMetrics();
        metrics.record("X", "timeout", System.nanoTime());
        assertNotNull(metrics.registry().find(GatewayMetrics.EXECUTIONS).tag("outcome", "timeout").counter());
        assertNotNull(metrics.registry().find(GatewayMetrics.LATENCY).tag("tool", "X").timer());
    }
}
