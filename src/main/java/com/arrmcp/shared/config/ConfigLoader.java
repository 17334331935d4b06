package com.arrmcp.shared.config;

import com.arrmcp.shared.config.ArrMcpConfig.HealthConfig;
import com.arrmcp.shared.config.ArrMcpConfig.ServerConfig;
import com.arrmcp.shared.config.ArrMcpConfig.ServiceEndpoint;
import com.arrmcp.shared.config.ArrMcpConfig.ServicesConfig;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;

public class ConfigLoader {

    public static final String CONFIG_PATH_ENV = "ARR_MCP_CONFIG";

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".arr-mcp", "config.yaml"
    );

    public static ArrMcpConfig load() {
        var override = System.getenv(CONFIG_PATH_ENV);
        return load(override != null && !override.isBlank() ? Path.of(override) : DEFAULT_PATH);
    }

    public static ArrMcpConfig load(Path path) {
        return load(path, System::getenv);
    }

    static ArrMcpConfig load(Path path, UnaryOperator<String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var server = section(raw, "server");
        var health = section(raw, "health");
        var services = section(raw, "services");

        var serverDef = ServerConfig.defaults();
        var healthDef = HealthConfig.defaults();

        var portText = envOrDefault(env, "ARR_MCP_PORT",
            str(server, "port", serverDef.port()));
        int port;
        try {
            port = Integer.parseInt(portText.strip());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid server port: " + portText, e);
        }

        return new ArrMcpConfig(
            new ServerConfig(
                envOrDefault(env, "ARR_MCP_HOST", str(server, "host", serverDef.host())),
                port,
                envOrDefault(env, "ARR_MCP_LOG_LEVEL",
                    str(server, "log-level", serverDef.logLevel())).toLowerCase(Locale.ROOT),
                Boolean.parseBoolean(str(server, "streaming", serverDef.streaming()))
            ),
            new HealthConfig(
                Long.parseLong(str(health, "check-timeout-ms", healthDef.checkTimeoutMs()))
            ),
            new ServicesConfig(
                endpoint(env, "SONARR", section(services, "sonarr")),
                endpoint(env, "RADARR", section(services, "radarr")),
                endpoint(env, "PROWLARR", section(services, "prowlarr"))
            )
        );
    }

    private static ServiceEndpoint endpoint(UnaryOperator<String> env, String prefix, Map<String, Object> yaml) {
        return new ServiceEndpoint(
            envOrDefault(env, prefix + "_URL", str(yaml, "url", "")),
            envOrDefault(env, prefix + "_API_KEY", str(yaml, "api-key", ""))
        );
    }

    public static ArrMcpConfig validate(ArrMcpConfig config) {
        var server = config.server();
        if (server.host() == null || server.host().isBlank()) {
            throw new IllegalStateException("Server host must not be empty");
        }
        if (server.port() < 1 || server.port() > 65535) {
            throw new IllegalStateException("Invalid server port: " + server.port());
        }
        if (!ArrMcpConfig.LOG_LEVELS.contains(server.logLevel())) {
            throw new IllegalStateException("Invalid log level: " + server.logLevel()
                + " (expected one of debug, info, warn, error)");
        }
        if (config.health().checkTimeoutMs() <= 0) {
            throw new IllegalStateException("Health check timeout must be positive: " + config.health().checkTimeoutMs());
        }
        if (!config.services().anyConfigured()) {
            throw new IllegalStateException(
                "No services configured. Set url and api-key for at least one of sonarr, radarr, prowlarr");
        }
        return config;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> parent, String key) {
        var value = parent.get(key);
        return value instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
    }

    private static String str(Map<String, Object> yaml, String key, Object fallback) {
        var value = yaml.get(key);
        return String.valueOf(value != null ? value : fallback);
    }

    private static String envOrDefault(UnaryOperator<String> env, String name, String fallback) {
        var val = env.apply(name);
        return val != null && !val.isEmpty() ? val : fallback;
    }
}
