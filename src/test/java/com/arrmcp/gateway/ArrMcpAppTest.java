package com.arrmcp.gateway;

import com.arrmcp.shared.config.ArrMcpConfig;
import com.arrmcp.shared.config.ArrMcpConfig.HealthConfig;
import com.arrmcp.shared.config.ArrMcpConfig.ServerConfig;
import com.arrmcp.shared.config.ArrMcpConfig.ServiceEndpoint;
import com.arrmcp.shared.config.ArrMcpConfig.ServicesConfig;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ArrMcpAppTest {

    private final ArrMcpConfig config = new ArrMcpConfig(
            new ServerConfig("0.0.0.0", 9000, "debug", true),
            HealthConfig.defaults(),
            new ServicesConfig(new ServiceEndpoint("http://sonarr:8989", "k"), null, null));

    @Test
    void springPropertiesCarryServerSettings() {
        var props = ArrMcpApp.springProperties(config);
        assertEquals(9000, props.get("server.port"));
        assertEquals("0.0.0.0", props.get("server.address"));
        assertEquals("debug", props.get("logging.level.com.arrmcp"));
        assertEquals("graceful", props.get("server.shutdown"));
        assertEquals("15s", props.get("spring.lifecycle.timeout-per-shutdown-phase"));
    }

    @Test
    void bannerListsServicesAndEndpoints() {
        var banner = ArrMcpApp.banner(config);
        assertTrue(banner.contains("Sonarr: http://sonarr:8989"));
        assertTrue(banner.contains("Radarr: not configured"));
        assertTrue(banner.contains("POST http://0.0.0.0:9000/v1/run"));
    }

    @Test
    void gatewayConfigInstallsConfiguredTools() {
        var gateway = new GatewayConfig();
        try (var health = gateway.serviceHealthAggregator(config)) {
            var registry = gateway.toolRegistry(config, health);
            assertEquals(5, registry.size());
            assertEquals(1, health.size());
            try (var dispatcher = gateway.dispatcher(registry, gateway.gatewayMetrics())) {
                assertNotNull(dispatcher);
            }
        }
    }
}
