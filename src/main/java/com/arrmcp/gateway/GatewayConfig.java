package com.arrmcp.gateway;

import com.arrmcp.arr.ArrToolCatalog;
import com.arrmcp.dispatch.Dispatcher;
import com.arrmcp.observability.GatewayMetrics;
import com.arrmcp.observability.ServiceHealthAggregator;
import com.arrmcp.shared.config.ArrMcpConfig;
import com.arrmcp.tools.ToolRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GatewayConfig {

    @Bean
    public GatewayMetrics gatewayMetrics() {
        return new GatewayMetrics();
    }

    @Bean(destroyMethod = "close")
    public ServiceHealthAggregator serviceHealthAggregator(ArrMcpConfig config) {
        return new ServiceHealthAggregator(config.health().checkTimeoutMs());
    }

    @Bean
    public ToolRegistry toolRegistry(ArrMcpConfig config, ServiceHealthAggregator health) {
        var registry = new ToolRegistry();
        ArrToolCatalog.install(config.services(), registry, health);
        return registry;
    }

    @Bean(destroyMethod = "close")
    public Dispatcher dispatcher(ToolRegistry registry, GatewayMetrics metrics) {
        return new Dispatcher(registry, metrics);
    }
}
