package com.arrmcp.arr;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.http.HttpClient;
import java.util.List;
import java.util.Map;

public abstract class LibraryClient extends ArrClient {

    static final int MAX_GET_TERM_LENGTH = 100;

    private final String collection;

    protected LibraryClient(String name, String collection, String baseUrl, String apiKey,
                            HttpClient httpClient, ObjectMapper mapper) {
        super(name, baseUrl, apiKey, "/api/v3", httpClient, mapper);
        this.collection = collection;
    }

    protected abstract List<String> requiredAddFields();

    protected abstract void applyAddDefaults(ObjectNode item);

    protected JsonNode listItems() throws IOException, InterruptedException {
        return get("/" + collection);
    }

    protected JsonNode lookupItems(String term) throws IOException, InterruptedException {
        if (term.length() < MAX_GET_TERM_LENGTH) {
            return get("/" + collection + "/lookup?term=" + encode(term));
        }
        return post("/" + collection + "/lookup", Map.of("term", term));
    }

    protected JsonNode addItem(JsonNode data) throws IOException, InterruptedException {
        if (!data.isObject()) {
            throw new IllegalArgumentException("data to add must be a JSON object");
        }
        for (var field : requiredAddFields()) {
            if (!data.has(field)) {
                throw new IllegalArgumentException("missing required field for adding " + collection + ": " + field);
            }
        }
        var item = ((ObjectNode) data).deepCopy();
        applyAddDefaults(item);
        return post("/" + collection, item);
    }

    public JsonNode qualityProfiles() throws IOException, InterruptedException {
        return get("/qualityprofile");
    }

    public JsonNode rootFolders() throws IOException, InterruptedException {
        return get("/rootfolder");
    }
}
