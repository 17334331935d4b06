package com.arrmcp.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ServiceHealthAggregatorTest {

    private final ServiceHealthAggregator aggregator = new ServiceHealthAggregator(500);

    @AfterEach
    void tearDown() {
        aggregator.close();
    }

    private static ServiceChecker checker(String name, Exception failure) throws Exception {
        var checker = mock(ServiceChecker.class);
        when(checker.name()).thenReturn(name);
        if (failure != null) doThrow(failure).when(checker).check();
        return checker;
    }

    @Test
    void noCheckersIsOk() {
        var report = aggregator.checkAll();
        assertEquals("ok", report.status());
        assertTrue(report.services().isEmpty());
        assertTrue(report.healthy());
    }

    @Test
    void allHealthy() throws Exception {
        aggregator.register(checker("A", null));
        aggregator.register(checker("B", null));

        var report = aggregator.checkAll();
        assertEquals("ok", report.status());
        assertEquals(Map.of("A", "healthy", "B", "healthy"), report.services());
    }

    @Test
    void oneFailingCheckerDegrades() throws Exception {
        aggregator.register(checker("A", null));
        aggregator.register(checker("B", new IOException("x down")));

        var report = aggregator.checkAll();
        assertEquals("degraded", report.status());
        assertFalse(report.healthy());
        assertEquals(Map.of("A", "healthy", "B", "unhealthy: x down"), report.services());
    }

    @Test
    void slowCheckerTimesOutWithoutBlockingOthers() throws Exception {
        aggregator.register(new ServiceChecker() {
            @Override public String name() { return "Slow"; }
            @Override public void check() throws Exception { Thread.sleep(10_000); }
        });
        aggregator.register(checker("Fast", null));

        long start = System.nanoTime();
        var report = aggregator.checkAll();
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;

        assertEquals("degraded", report.status());
        assertTrue(report.services().get("Slow").startsWith("unhealthy: timed out"));
        assertEquals("healthy", report.services().get("Fast"));
        assertTrue(elapsedMs < 5_000, "took " + elapsedMs + " ms");
    }

    @Test
    void checksOnEveryCall() throws Exception {
        var a = checker("A", null);
        aggregator.register(a);
        aggregator.checkAll();
        aggregator.checkAll();
        verify(a, times(2)).check();
    }

    @Test
    void rejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new ServiceHealthAggregator(0));
    }
}
