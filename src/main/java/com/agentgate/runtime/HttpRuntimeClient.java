package com.agentgate.runtime;

import com.agentgate.core.model.ModelSelection;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * {@link RuntimeClient} over {@link HttpClient}. Any status of 400 or above is
 * raised as {@link RuntimeCommunicationException}.
 */
public class HttpRuntimeClient implements RuntimeClient {

    private static final Logger log = LoggerFactory.getLogger(HttpRuntimeClient.class);

    private final String baseUrl;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Executor eventExecutor;
    private final Duration requestTimeout;

    public HttpRuntimeClient(String baseUrl, HttpClient httpClient, ObjectMapper objectMapper,
                             Executor eventExecutor, Duration requestTimeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.eventExecutor = eventExecutor;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public String createSession(String title) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("title", title);
        JsonNode response = send("POST", "/session", body.toString());
        JsonNode id = response.path("id");
        if (!id.isTextual() || id.asText().isBlank()) {
            throw new RuntimeCommunicationException("Session create response has no id: " + response, 200);
        }
        return id.asText();
    }

    @Override
    public void sendPrompt(String sessionId, ModelSelection model, String text) {
        ObjectNode body = objectMapper.createObjectNode();
        ObjectNode modelNode = body.putObject("model");
        modelNode.put("providerID", model.providerId());
        modelNode.put("modelID", model.modelId());
        ObjectNode part = body.putArray("parts").addObject();
        part.put("type", "text");
        part.put("text", text);
        if (model.agentId() != null && !model.agentId().isBlank()) {
            body.put("agent", model.agentId());
        }
        send("POST", "/session/" + encode(sessionId) + "/prompt_async", body.toString());
    }

    @Override
    public void deleteSession(String sessionId) {
        send("DELETE", "/session/" + encode(sessionId), null);
    }

    @Override
    public EventSubscription subscribe() {
        var request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/event"))
                .header("Accept", "text/event-stream")
                .GET()
                .build();
        try {
            HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
            if (response.statusCode() >= 400) {
                response.body().close();
                throw new RuntimeCommunicationException(
                        "Runtime GET /event failed (HTTP %d)".formatted(response.statusCode()),
                        response.statusCode());
            }
            return new SseEventSubscription(response.body(), objectMapper, eventExecutor);
        } catch (IOException e) {
            throw new RuntimeCommunicationException("Runtime request failed: GET /event", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeCommunicationException("Interrupted subscribing to " + baseUrl, e);
        }
    }

    @Override
    public void setProviderAuth(String providerId, String apiKey, Path directory) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("type", "api");
        body.put("key", apiKey);
        send("PUT", "/auth/" + encode(providerId) + "?directory=" + encode(directory.toString()),
                body.toString());
        log.debug("Pushed credentials for provider {}", providerId);
    }

    JsonNode send(String method, String path, String jsonBody) {
        var builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Accept", "application/json");
        if (jsonBody != null) {
            builder.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(jsonBody));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        try {
            var response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                throw new RuntimeCommunicationException("Runtime %s %s failed (HTTP %d): %s"
                        .formatted(method, path, response.statusCode(), response.body()),
                        response.statusCode());
            }
            String responseBody = response.body();
            if (responseBody == null || responseBody.isBlank()) {
                return objectMapper.createObjectNode();
            }
            try {
                return objectMapper.readTree(responseBody);
            } catch (IOException e) {
                // prompt_async and auth answer with plain text or a bare boolean
                return objectMapper.createObjectNode();
            }
        } catch (IOException e) {
            throw new RuntimeCommunicationException("Runtime request failed: " + method + " " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeCommunicationException("Interrupted during " + method + " " + path, e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
