package com.arrmcp.arr;

import com.arrmcp.observability.ServiceHealthAggregator;
import com.arrmcp.shared.config.ArrMcpConfig.ServicesConfig;
import com.arrmcp.tools.ParamSpec;
import com.arrmcp.tools.ParamType;
import com.arrmcp.tools.ToolDefinition;
import com.arrmcp.tools.ToolRegistry;
import com.arrmcp.tools.ToolRequest;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class ArrToolCatalog {

    private static final Logger log = LoggerFactory.getLogger(ArrToolCatalog.class);

    private ArrToolCatalog() {}

    public static void install(ServicesConfig services, ToolRegistry registry, ServiceHealthAggregator health) {
        if (services.sonarr().configured()) {
            var sonarr = new SonarrClient(services.sonarr().url(), services.sonarr().apiKey());
            installSonarr(sonarr, registry);
            health.register(sonarr);
        }
        if (services.radarr().configured()) {
            var radarr = new RadarrClient(services.radarr().url(), services.radarr().apiKey());
            installRadarr(radarr, registry);
            health.register(radarr);
        }
        if (services.prowlarr().configured()) {
            var prowlarr = new ProwlarrClient(services.prowlarr().url(), services.prowlarr().apiKey());
            installProwlarr(prowlarr, registry);
            health.register(prowlarr);
        }
        log.info("Installed {} media-service tools", registry.size());
    }

    public static void installSonarr(SonarrClient client, ToolRegistry registry) {
        registry.register(new ToolDefinition("SonarrSearch", "Search for TV shows in Sonarr",
                Map.of("query", ParamSpec.required(ParamType.STRING, "The search query for TV shows"))),
            req -> wrap("results", client.searchSeries(text(req, "query"))));
        registry.register(new ToolDefinition("SonarrList", "List TV shows in Sonarr"),
            req -> wrap("series", client.series()));
        registry.register(new ToolDefinition("SonarrAddSeries", "Add a new TV series to Sonarr",
                Map.of("seriesData", ParamSpec.required(ParamType.OBJECT,
                    "The TV series data to add (requires tvdbId, title, qualityProfileId, rootFolderPath)"))),
            req -> wrap("series", client.addSeries(req.input().get("seriesData"))));
        registry.register(new ToolDefinition("SonarrGetProfiles", "Get quality profiles from Sonarr"),
            req -> wrap("profiles", client.qualityProfiles()));
        registry.register(new ToolDefinition("SonarrGetRootFolders", "Get root folders from Sonarr"),
            req -> wrap("folders", client.rootFolders()));
    }

    public static void installRadarr(RadarrClient client, ToolRegistry registry) {
        registry.register(new ToolDefinition("RadarrSearch", "Search for movies in Radarr",
                Map.of("query", ParamSpec.required(ParamType.STRING, "The search query for movies"))),
            req -> wrap("results", client.searchMovies(text(req, "query"))));
        registry.register(new ToolDefinition("RadarrList", "List movies in Radarr"),
            req -> wrap("movies", client.movies()));
        registry.register(new ToolDefinition("RadarrAddMovie", "Add a new movie to Radarr",
                Map.of("movieData", ParamSpec.required(ParamType.OBJECT,
                    "The movie data to add (requires tmdbId, title, qualityProfileId, rootFolderPath)"))),
            req -> wrap("movie", client.addMovie(req.input().get("movieData"))));
        registry.register(new ToolDefinition("RadarrGetProfiles", "Get quality profiles from Radarr"),
            req -> wrap("profiles", client.qualityProfiles()));
        registry.register(new ToolDefinition("RadarrGetRootFolders", "Get root folders from Radarr"),
            req -> wrap("folders", client.rootFolders()));
    }

    public static void installProwlarr(ProwlarrClient client, ToolRegistry registry) {
        var params = new LinkedHashMap<String, ParamSpec>();
        params.put("query", ParamSpec.required(ParamType.STRING, "The search query for content"));
        params.put("categories", ParamSpec.arrayOf(ParamType.INTEGER, false, "Optional category IDs to filter results"));
        registry.register(new ToolDefinition("ProwlarrSearch", "Search for content using Prowlarr indexers", params),
            req -> wrap("results", client.search(text(req, "query"), categories(req))));
        registry.register(new ToolDefinition("ProwlarrIndexers", "List Prowlarr indexers"),
            req -> wrap("indexers", client.indexers()));
    }

    private static String text(ToolRequest req, String param) {
        var value = req.input().path(param).asText("");
        if (value.isBlank()) {
            throw new IllegalArgumentException("missing or invalid '" + param + "' parameter");
        }
        return value;
    }

    static List<Integer> categories(ToolRequest req) {
        var ids = new ArrayList<Integer>();
        for (var node : req.input().path("categories")) {
            if (node.isNumber() && node.canConvertToExactIntegral() && node.canConvertToInt()) {
                ids.add(node.asInt());
            }
        }
        return ids;
    }

    private static JsonNode wrap(String key, JsonNode value) {
        var out = JsonNodeFactory.instance.objectNode();
        out.set(key, value);
        return out;
    }
}
