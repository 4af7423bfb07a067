package io.github.drompincen.tasksync.gateway.github;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Posts GraphQL documents to the GitHub API and unwraps the {@code data} node.
 */
public class GraphQlTransport {

    private static final Logger log = LoggerFactory.getLogger(GraphQlTransport.class);
    private static final int MAX_ERROR_BODY = 500;

    private final HttpClient httpClient;
    private final URI endpoint;
    private final String token;
    private final Duration requestTimeout;
    private final ObjectMapper objectMapper;

    public GraphQlTransport(HttpClient httpClient, URI endpoint, String token,
                            Duration requestTimeout, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.token = token;
        this.requestTimeout = requestTimeout;
        this.objectMapper = objectMapper;
    }

    /**
     * @param variables may contain null values; they are sent as JSON nulls
     * @return the {@code data} node, never null
     * @throws GitHubApiException on transport failure, a non-2xx status or GraphQL errors
     */
    public JsonNode execute(String query, Map<String, Object> variables) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("query", query);
        if (variables != null && !variables.isEmpty()) {
            payload.set("variables", objectMapper.valueToTree(variables));
        }

        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(endpoint)
                    .timeout(requestTimeout)
                    .header("Authorization", "Bearer " + token)
                    .header("Content-Type", "application/json")
                    .header("Accept", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(payload)))
                    .build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new GitHubApiException("GitHub API request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GitHubApiException("GitHub API request interrupted", e);
        }

        int status = response.statusCode();
        String body = response.body() != null ? response.body() : "";
        if (status < 200 || status >= 300) {
            throw new GitHubApiException("GitHub API returned HTTP " + status + ": " + truncate(body), status, List.of());
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new GitHubApiException("GitHub API returned malformed JSON: " + e.getMessage(), e);
        }

        JsonNode errors = root.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            List<String> types = new ArrayList<>();
            List<String> messages = new ArrayList<>();
            for (JsonNode error : errors) {
                if (error.hasNonNull("type")) {
                    types.add(error.get("type").asText());
                }
                messages.add(error.path("message").asText("unknown error"));
            }
            log.debug("GraphQL errors: {}", errors);
            throw new GitHubApiException("GraphQL errors: " + String.join("; ", messages), status, types);
        }

        JsonNode data = root.path("data");
        return data.isMissingNode() || data.isNull() ? objectMapper.createObjectNode() : data;
    }

    private static String truncate(String body) {
        return body.length() > MAX_ERROR_BODY ? body.substring(0, MAX_ERROR_BODY) + "..." : body;
    }
}
