package com.omrchecker.orchestrator.parsing.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.omrchecker.orchestrator.config.OmrProperties;
import com.omrchecker.orchestrator.parsing.http.OutboundHttpClient;
import com.omrchecker.orchestrator.parsing.model.HttpFetchResult;
import com.omrchecker.orchestrator.parsing.model.RecognitionResult;
import com.omrchecker.orchestrator.parsing.model.ScanConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Calls a recognition service over HTTP. Request body:
 * {@code {"image": base64, "fileName": ..., "template": {...}, "config": {...}}}; a 2xx response must carry
 * {@code {"answers": {...}, "multiMarkedCount": n}}. Non-2xx responses with an {@code error} field use it as
 * the failure reason.
 */
@Service
public class RemoteOmrEngine implements OmrEngine {
    private static final Logger log = LoggerFactory.getLogger(RemoteOmrEngine.class);

    private final OmrProperties properties;
    private final OutboundHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public RemoteOmrEngine(OmrProperties properties, OutboundHttpClient httpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public RecognitionResult recognize(Path image, ScanConfig scanConfig) throws RecognitionException {
        String url = properties.getEngine().getUrl();
        if (url == null || url.isBlank()) {
            throw new RecognitionException("engine_not_configured");
        }
        String body = buildRequest(image, scanConfig == null ? ScanConfig.defaults() : scanConfig);
        HttpFetchResult result = httpClient.postJson(url, body, Duration.ofSeconds(properties.getEngine().getTimeoutSeconds()));
        if (!result.isSuccessful()) {
            String reason = engineError(result);
            log.debug("Recognition failed for {}: {}", image.getFileName(), reason);
            throw new RecognitionException(reason);
        }
        return parseResponse(result.bodyAsString());
    }

    private String buildRequest(Path image, ScanConfig scanConfig) throws RecognitionException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(image);
        } catch (IOException e) {
            throw new RecognitionException("Failed to read image: " + image.getFileName(), e);
        }
        ObjectNode request = objectMapper.createObjectNode();
        request.put("image", Base64.getEncoder().encodeToString(bytes));
        request.put("fileName", image.getFileName().toString());
        putDocument(request, "template", scanConfig.templateJson());
        putDocument(request, "config", scanConfig.configJson());
        try {
            return objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new RecognitionException("Unable to encode recognition request", e);
        }
    }

    private void putDocument(ObjectNode request, String field, String json) throws RecognitionException {
        if (json == null || json.isBlank()) {
            return;
        }
        try {
            request.set(field, objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new RecognitionException("Invalid " + field + " document", e);
        }
    }

    private RecognitionResult parseResponse(String body) throws RecognitionException {
        if (body == null || body.isBlank()) {
            throw new RecognitionException("empty_engine_response");
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new RecognitionException("Malformed engine response", e);
        }
        JsonNode answersNode = root.path("answers");
        if (!answersNode.isObject()) {
            throw new RecognitionException("Engine response has no answers");
        }
        Map<String, String> answers = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = answersNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            answers.put(field.getKey(), field.getValue().isNull() ? "" : field.getValue().asText());
        }
        int ambiguityCount = root.path("multiMarkedCount").asInt(root.path("multi_marked_count").asInt(0));
        return new RecognitionResult(answers, ambiguityCount);
    }

    private String engineError(HttpFetchResult result) {
        if (result.errorCode() == null) {
            String body = result.bodyAsString();
            if (body != null && !body.isBlank()) {
                try {
                    JsonNode error = objectMapper.readTree(body).path("error");
                    if (error.isTextual() && !error.asText().isBlank()) {
                        return error.asText();
                    }
                } catch (JsonProcessingException e) {
                    log.debug("Engine error body is not JSON: {}", e.getMessage());
                }
            }
        }
        return "engine_" + result.describeFailure();
    }
}
