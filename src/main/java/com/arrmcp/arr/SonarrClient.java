package com.arrmcp.arr;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.http.HttpClient;
import java.util.List;

public class SonarrClient extends LibraryClient {

    public SonarrClient(String baseUrl, String apiKey) {
        this(baseUrl, apiKey, defaultHttpClient(), new ObjectMapper());
    }

    public SonarrClient(String baseUrl, String apiKey, HttpClient httpClient, ObjectMapper mapper) {
        super("Sonarr", "series", baseUrl, apiKey, httpClient, mapper);
    }

    public JsonNode series() throws IOException, InterruptedException {
        return listItems();
    }

    public JsonNode searchSeries(String term) throws IOException, InterruptedException {
        return lookupItems(term);
    }

    public JsonNode addSeries(JsonNode seriesData) throws IOException, InterruptedException {
        return addItem(seriesData);
    }

    @Override
    protected List<String> requiredAddFields() {
        return List.of("tvdbId", "title", "qualityProfileId", "rootFolderPath");
    }

    @Override
    protected void applyAddDefaults(ObjectNode item) {
        if (!item.has("monitored")) item.put("monitored", true);
        if (!item.has("seasonFolder")) item.put("seasonFolder", true);
        if (!item.has("addOptions")) item.putObject("addOptions").put("searchForMissingEpisodes", true);
    }
}
