package com.arrmcp.gateway;

import com.arrmcp.shared.config.ArrMcpConfig;
import com.arrmcp.shared.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.LinkedHashMap;
import java.util.Map;

@SpringBootApplication(scanBasePackages = "com.arrmcp")
public class ArrMcpApp {

    private static final Logger log = LoggerFactory.getLogger(ArrMcpApp.class);

    public static void main(String[] args) {
        ArrMcpConfig config;
        try {
            config = ConfigLoader.validate(ConfigLoader.load());
        } catch (RuntimeException e) {
            log.error("Configuration error: {}", e.getMessage());
            System.exit(1);
            return;
        }

        System.out.println(banner(config));

        var app = new SpringApplication(ArrMcpApp.class);
        app.setBannerMode(Banner.Mode.OFF);
        app.setDefaultProperties(springProperties(config));
        app.addInitializers((ConfigurableApplicationContext ctx) ->
                ctx.getBeanFactory().registerSingleton("arrMcpConfig", config));
        app.run(args);
        log.info("arr-mcp listening on {}:{}", config.server().host(), config.server().port());
    }

    static Map<String, Object> springProperties(ArrMcpConfig config) {
        var props = new LinkedHashMap<String, Object>();
        props.put("server.port", config.server().port());
        props.put("server.address", config.server().host());
        props.put("server.shutdown", "graceful");
        props.put("spring.lifecycle.timeout-per-shutdown-phase", "15s");
        props.put("logging.level.com.arrmcp", config.server().logLevel());
        return props;
    }

    static String banner(ArrMcpConfig config) {
        var services = config.services();
        var sb = new StringBuilder();
        sb.append("\n  arr-mcp gateway\n");
        sb.append("  ---------------\n");
        sb.append("  Services:\n");
        appendService(sb, "Sonarr", services.sonarr());
        appendService(sb, "Radarr", services.radarr());
        appendService(sb, "Prowlarr", services.prowlarr());
        var base = "http://" + config.server().host() + ":" + config.server().port();
        sb.append("  Endpoints:\n");
        sb.append("    GET  ").append(base).append("/health\n");
        sb.append("    GET  ").append(base).append("/v1/service-health\n");
        sb.append("    GET  ").append(base).append("/v1/tools\n");
        sb.append("    POST ").append(base).append("/v1/run\n");
        return sb.toString();
    }

    private static void appendService(StringBuilder sb, String name, ArrMcpConfig.ServiceEndpoint endpoint) {
        sb.append("    ").append(name).append(": ")
          .append(endpoint.configured() ? endpoint.url() : "not configured")
          .append('\n');
    }
}
