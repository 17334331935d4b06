package com.arrmcp.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs every registered {@link ServiceChecker} on each call. Results are never
 * cached. A failing or slow checker only marks itself unhealthy.
 */
public class ServiceHealthAggregator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ServiceHealthAggregator.class);

    private final List<ServiceChecker> checkers = new CopyOnWriteArrayList<>();
    private final long checkTimeoutMs;
    private final ExecutorService pool;

    public ServiceHealthAggregator(long checkTimeoutMs) {
        if (checkTimeoutMs <= 0) {
            throw new IllegalArgumentException("check timeout must be positive: " + checkTimeoutMs);
        }
        this.checkTimeoutMs = checkTimeoutMs;
        var seq = new AtomicInteger();
        this.pool = Executors.newCachedThreadPool(r -> {
            var t = new Thread(r, "health-check-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void register(ServiceChecker checker) {
        checkers.add(checker);
        log.info("Registered health checker: {}", checker.name());
    }

    public int size() {
        return checkers.size();
    }

    public ServiceHealthReport checkAll() {
        var snapshot = List.copyOf(checkers);
        var futures = new LinkedHashMap<String, Future<?>>();
        for (var checker : snapshot) {
            futures.put(checker.name(), pool.submit(() -> {
                checker.check();
                return null;
            }));
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(checkTimeoutMs);
        var services = new LinkedHashMap<String, String>();
        boolean allHealthy = true;
        for (var entry : futures.entrySet()) {
            var outcome = await(entry.getKey(), entry.getValue(), deadline);
            if (!ServiceHealthReport.HEALTHY.equals(outcome)) allHealthy = false;
            services.put(entry.getKey(), outcome);
        }
        return new ServiceHealthReport(
            allHealthy ? ServiceHealthReport.OK : ServiceHealthReport.DEGRADED, services);
    }

    private String await(String name, Future<?> future, long deadlineNanos) {
        try {
            long remaining = Math.max(0, deadlineNanos - System.nanoTime());
            future.get(remaining, TimeUnit.NANOSECONDS);
            return ServiceHealthReport.HEALTHY;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Health check for {} timed out after {} ms", name, checkTimeoutMs);
            return unhealthy("timed out after " + checkTimeoutMs + " ms");
        } catch (ExecutionException e) {
            var cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Health check for {} failed: {}", name, cause.getMessage());
            return unhealthy(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return unhealthy("interrupted");
        }
    }

    private static String unhealthy(String detail) {
        return "unhealthy: " + detail;
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }
}
