package com.arrmcp.arr;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.http.HttpClient;
import java.util.List;
import java.util.stream.Collectors;

public class ProwlarrClient extends ArrClient {

    public ProwlarrClient(String baseUrl, String apiKey) {
        this(baseUrl, apiKey, defaultHttpClient(), new ObjectMapper());
    }

    public ProwlarrClient(String baseUrl, String apiKey, HttpClient httpClient, ObjectMapper mapper) {
        super("Prowlarr", baseUrl, apiKey, "/api/v1", httpClient, mapper);
    }

    public JsonNode indexers() throws IOException, InterruptedException {
        return get("/indexer");
    }

    public JsonNode categories() throws IOException, InterruptedException {
        return get("/indexer/category");
    }

    public JsonNode search(String query, List<Integer> categories) throws IOException, InterruptedException {
        var path = new StringBuilder("/search?query=").append(encode(query));
        if (categories != null && !categories.isEmpty()) {
            var joined = categories.stream().map(String::valueOf).collect(Collectors.joining(","));
            path.append("&categories=").append(encode(joined));
        }
        return get(path.toString());
    }
}
