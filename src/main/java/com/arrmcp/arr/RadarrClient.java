package com.arrmcp.arr;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.http.HttpClient;
import java.util.List;

public class RadarrClient extends LibraryClient {

    public RadarrClient(String baseUrl, String apiKey) {
        this(baseUrl, apiKey, defaultHttpClient(), new ObjectMapper());
    }

    public RadarrClient(String baseUrl, String apiKey, HttpClient httpClient, ObjectMapper mapper) {
        super("Radarr", "movie", baseUrl, apiKey, httpClient, mapper);
    }

    public JsonNode movies() throws IOException, InterruptedException {
        return listItems();
    }

    public JsonNode searchMovies(String term) throws IOException, InterruptedException {
        return lookupItems(term);
    }

    public JsonNode addMovie(JsonNode movieData) throws IOException, InterruptedException {
        return addItem(movieData);
    }

    @Override
    protected List<String> requiredAddFields() {
        return List.of("tmdbId", "title", "qualityProfileId", "rootFolderPath");
    }

    @Override
    protected void applyAddDefaults(ObjectNode item) {
        if (!item.has("monitored")) item.put("monitored", true);
        if (!item.has("minimumAvailability")) item.put("minimumAvailability", "released");
        if (!item.has("addOptions")) item.putObject("addOptions").put("searchForMovie", true);
    }
}
