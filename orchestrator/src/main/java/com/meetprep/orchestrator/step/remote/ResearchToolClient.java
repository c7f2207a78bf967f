package com.meetprep.orchestrator.step.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * HTTP client for the external research tool service.
 *
 * One endpoint per tool:
 * <pre>
 *   POST {baseUrl}/tools/{name}
 *   {"job_id": "...", "inputs": {...}}  →  {"output": ...}
 * </pre>
 *
 * Calls are made from pipeline worker threads, so blocking I/O is fine here.
 */
public class ResearchToolClient {

    private static final Logger log = LoggerFactory.getLogger(ResearchToolClient.class);

    /** The subset of the tool response we read. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ToolResponse(Object output) {}

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     requestTimeout;

    public ResearchToolClient(String baseUrl, Duration requestTimeout, ObjectMapper objectMapper) {
        this.baseUrl        = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.requestTimeout = requestTimeout;
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Invoke one tool and return its output value.
     *
     * @throws ResearchToolException on a non-2xx status, I/O failure or an
     *         unparseable body
     * @throws InterruptedException  if the calling job is cancelled mid-call
     */
    public Object invoke(String toolName, String jobId, Map<String, Object> inputs)
            throws InterruptedException {
        log.debug("Invoking tool '{}' for job {} with inputs {}", toolName, jobId, inputs.keySet());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("job_id", jobId);
        payload.put("inputs", inputs);
        String body = toJson(payload);

        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + "/tools/" + toolName))
                    .timeout(requestTimeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception e) {
            throw new ResearchToolException("Tool '" + toolName + "' unreachable: " + e.getMessage(), e);
        }

        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new ResearchToolException(
                    "Tool '" + toolName + "' failed with HTTP " + resp.statusCode() + ": " + resp.body());
        }
        try {
            ToolResponse parsed = json.readValue(resp.body(), ToolResponse.class);
            if (parsed == null || parsed.output() == null) {
                throw new ResearchToolException("Tool '" + toolName + "' returned no output");
            }
            return parsed.output();
        } catch (JsonProcessingException e) {
            throw new ResearchToolException("Failed to parse response of tool '" + toolName + "'", e);
        }
    }

    public String baseUrl() {
        return baseUrl;
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ResearchToolException("JSON serialization failed", e);
        }
    }
}
