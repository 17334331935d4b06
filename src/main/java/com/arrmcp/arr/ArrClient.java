package com.arrmcp.arr;

import com.arrmcp.observability.ServiceChecker;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Base JSON client for one *arr service. Every call sends the {@code X-Api-Key}
 * header; paths are relative to the service's versioned API root.
 */
public abstract class ArrClient implements ServiceChecker {

    private static final Logger log = LoggerFactory.getLogger(ArrClient.class);

    static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
    static final Duration CHECK_TIMEOUT = Duration.ofSeconds(5);

    private final String name;
    private final String baseUrl;
    private final String apiKey;
    private final String apiRoot;
    private final HttpClient httpClient;
    protected final ObjectMapper mapper;

    protected ArrClient(String name, String baseUrl, String apiKey, String apiRoot,
                        HttpClient httpClient, ObjectMapper mapper) {
        this.name = name;
        this.baseUrl = baseUrl.replaceAll("/+$", "");
        this.apiKey = apiKey;
        this.apiRoot = apiRoot;
        this.httpClient = httpClient;
        this.mapper = mapper;
    }

    protected static HttpClient defaultHttpClient() {
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void check() throws Exception {
        var req = request("/system/status", CHECK_TIMEOUT).GET().build();
        var resp = httpClient.send(req, HttpResponse.BodyHandlers.discarding());
        if (resp.statusCode() >= 400) {
            throw new IOException("health check failed with status: " + resp.statusCode());
        }
    }

    protected JsonNode get(String path) throws IOException, InterruptedException {
        return send(request(path, REQUEST_TIMEOUT).GET().build());
    }

    protected JsonNode post(String path, Object body) throws IOException, InterruptedException {
        var json = mapper.writeValueAsString(body);
        return send(request(path, REQUEST_TIMEOUT)
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build());
    }

    protected static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private HttpRequest.Builder request(String path, Duration timeout) {
        return HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + apiRoot + path))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .header("X-Api-Key", apiKey)
                .timeout(timeout);
    }

    private JsonNode send(HttpRequest req) throws IOException, InterruptedException {
        log.debug("{} {} {}", name, req.method(), req.uri().getPath());
        var resp = httpClient.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() >= 400) {
            throw new ArrApiException(resp.statusCode(), resp.body());
        }
        var body = resp.body();
        return body == null || body.isBlank() ? NullNode.getInstance() : mapper.readTree(body);
    }
}
