package com.arrmcp.observability;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ServiceHealthReport(String status, Map<String, String> services) {

    public static final String OK = "ok";
    public static final String DEGRADED = "degraded";
    public static final String HEALTHY = "healthy";

    public ServiceHealthReport {
        services = services == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(services));
    }

    public boolean healthy() {
        return OK.equals(status);
    }
}
