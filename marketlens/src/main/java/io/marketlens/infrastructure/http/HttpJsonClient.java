package io.marketlens.infrastructure.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.marketlens.domain.common.Deadline;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Small JSON-over-HTTP helper shared by the HTTP bridges.
 *
 * Every request's timeout is the caller's remaining deadline. Non-2xx responses
 * throw {@link IOException} with the status; the body is not surfaced.
 */
public final class HttpJsonClient {

    private static final Duration MIN_TIMEOUT = Duration.ofMillis(1);

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final String baseUrl;

    public HttpJsonClient(HttpClient httpClient, ObjectMapper mapper, String baseUrl) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public JsonNode get(String path, Map<String, String> query, Deadline deadline)
            throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path + queryString(query)))
            .timeout(timeout(deadline))
            .header("Accept", "application/json")
            .GET()
            .build();
        return execute(request);
    }

    public JsonNode post(String path, JsonNode body, Deadline deadline)
            throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + path))
            .timeout(timeout(deadline))
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
            .build();
        return execute(request);
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    private JsonNode execute(HttpRequest request) throws IOException, InterruptedException {
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new IOException("HTTP " + response.statusCode() + " from " + request.uri().getPath());
        }
        String body = response.body();
        return body == null || body.isBlank() ? mapper.nullNode() : mapper.readTree(body);
    }

    private static Duration timeout(Deadline deadline) {
        Duration remaining = deadline.remaining();
        return remaining.compareTo(MIN_TIMEOUT) < 0 ? MIN_TIMEOUT : remaining;
    }

    static String queryString(Map<String, String> query) {
        if (query == null || query.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("&", "?", "");
        for (Map.Entry<String, String> e : new TreeMap<>(query).entrySet()) {
            joiner.add(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
                + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
        }
        return joiner.toString();
    }
}
