package com.featureforge.coordinator.collaborator;

import com.featureforge.coordinator.collaborator.dto.*;
import com.featureforge.coordinator.model.Chunk;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * HTTP client for the agent service that plans features, generates code and
 * manages integrations (pull requests).
 *
 * One adapter implements all three collaborator interfaces. Uses
 * java.net.http.HttpClient directly so every header and status code is
 * visible here.
 *
 * Error mapping: connection problems, 429 and 5xx are retryable; any other
 * non-2xx status is not.
 */
@Component
public class AgentServiceClient implements FeaturePlanner, CodeGenerator, IntegrationGateway {

    private static final Logger log = LoggerFactory.getLogger(AgentServiceClient.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final Duration     timeout;

    public AgentServiceClient(
            @Value("${featureforge.agent-service.base-url}") String baseUrl,
            @Value("${featureforge.agent-service.timeout:PT5M}") Duration timeout,
            ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // FeaturePlanner
    // ------------------------------------------------------------------

    @Override
    public List<ChunkPlan> decompose(String featureDescription, String repositoryStructure) {
        log.info("Requesting decomposition ({} chars of structure)", repositoryStructure.length());
        String body = toJson(new PlanRequest(featureDescription, repositoryStructure));
        PlanResponse resp = read(post("/plan", body, "plan"), PlanResponse.class, "plan");
        if (resp.chunks() == null) {
            throw new CollaboratorException("plan response has no 'chunks' field", false);
        }
        List<ChunkPlan> plans = resp.chunks().stream()
                .map(PlanResponse.PlannedChunk::toChunkPlan)
                .collect(Collectors.toList());
        log.info("Planner proposed {} chunk(s)", plans.size());
        return plans;
    }

    // ------------------------------------------------------------------
    // CodeGenerator
    // ------------------------------------------------------------------

    @Override
    public GeneratedChange generate(Chunk chunk, Map<String, String> existingFiles) {
        String body = toJson(new GenerateRequest(
                chunk.getId(), chunk.getDescription(), chunk.getFiles(), existingFiles));
        String op = "generate for chunk " + chunk.getId();
        GenerateResponse resp = read(post("/generate", body, op), GenerateResponse.class, op);
        if (resp.modified_files() == null || resp.modified_files().isEmpty()) {
            throw new CollaboratorException(op + " returned no modified files", true);
        }
        String message = resp.commit_message() == null || resp.commit_message().isBlank()
                ? "Implement " + chunk.getDescription()
                : resp.commit_message();
        return new GeneratedChange(resp.modified_files(), message);
    }

    // ------------------------------------------------------------------
    // IntegrationGateway
    // ------------------------------------------------------------------

    @Override
    public String open(Chunk chunk, Map<String, String> changedFiles, String commitMessage) {
        String body = toJson(new OpenIntegrationRequest(
                chunk.getId(), chunk.getDescription(), changedFiles, commitMessage));
        String op = "open integration for chunk " + chunk.getId();
        IntegrationResponse resp = read(post("/integrations", body, op), IntegrationResponse.class, op);
        if (resp.handle() == null || resp.handle().isBlank()) {
            throw new CollaboratorException(op + " returned no handle", true);
        }
        log.info("Opened integration {} for chunk {}", resp.handle(), chunk.getId());
        return resp.handle();
    }

    @Override
    public boolean complete(String handle) {
        String path = "/integrations/" + URLEncoder.encode(handle, StandardCharsets.UTF_8) + "/complete";
        String op = "complete integration " + handle;
        IntegrationResponse resp = read(post(path, "{}", op), IntegrationResponse.class, op);
        return Boolean.TRUE.equals(resp.merged());
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    /** POST a JSON body; returns the response body as a String. */
    private String post(String path, String jsonBody, String opName) {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept",       "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                .build();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new CollaboratorException(opName + " failed", e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CollaboratorException(opName + " interrupted", e, true);
        }

        int status = resp.statusCode();
        if (status < 200 || status >= 300) {
            boolean retryable = status == 429 || status >= 500;
            throw new CollaboratorException(
                    opName + " failed: HTTP " + status + ": " + resp.body(), retryable);
        }
        return resp.body();
    }

    private <T> T read(String body, Class<T> type, String opName) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new CollaboratorException("Failed to parse " + opName + " response", e, false);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new CollaboratorException("JSON serialization failed", e, false);
        }
    }
}
