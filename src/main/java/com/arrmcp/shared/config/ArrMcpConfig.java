package com.arrmcp.shared.config;

import java.util.Set;

public record ArrMcpConfig(
    ServerConfig server,
    HealthConfig health,
    ServicesConfig services
) {
    public static final Set<String> LOG_LEVELS = Set.of("debug", "info", "warn", "error");

    public record ServerConfig(String host, int port, String logLevel, boolean streaming) {
        public static ServerConfig defaults() {
            return new ServerConfig("localhost", 8080, "info", true);
        }
    }

    public record HealthConfig(long checkTimeoutMs) {
        public static HealthConfig defaults() {
            return new HealthConfig(10_000);
        }
    }

    public record ServiceEndpoint(String url, String apiKey) {
        public static final ServiceEndpoint NONE = new ServiceEndpoint("", "");

        public ServiceEndpoint {
            url = url != null ? url.strip() : "";
            apiKey = apiKey != null ? apiKey.strip() : "";
        }

        public boolean configured() {
            return !url.isEmpty() && !apiKey.isEmpty();
        }
    }

    public record ServicesConfig(ServiceEndpoint sonarr, ServiceEndpoint radarr, ServiceEndpoint prowlarr) {
        public ServicesConfig {
            sonarr = sonarr != null ? sonarr : ServiceEndpoint.NONE;
            radarr = radarr != null ? radarr : ServiceEndpoint.NONE;
            prowlarr = prowlarr != null ? prowlarr : ServiceEndpoint.NONE;
        }

        public boolean anyConfigured() {
            return sonarr.configured() || radarr.configured() || prowlarr.configured();
        }
    }
}
