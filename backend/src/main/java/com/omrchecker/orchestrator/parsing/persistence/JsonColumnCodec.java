package com.omrchecker.orchestrator.parsing.persistence;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.omrchecker.orchestrator.parsing.model.ScanConfig;
import com.omrchecker.orchestrator.parsing.model.SheetOutcome;
import com.omrchecker.orchestrator.parsing.model.SheetStatus;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Converts sheet outcomes and scan configs to and from the text columns they are stored in.
 * Parsed sheets keep {@code {"answers": {...}, "multi_marked_count": n}} in {@code result_json};
 * failed sheets keep only {@code error_message}.
 */
@Component
public class JsonColumnCodec {
    private final ObjectMapper objectMapper;

    public JsonColumnCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String writeSuccess(SheetOutcome.Success success) {
        if (success == null) {
            return null;
        }
        return write(new StoredResult(success.answers(), success.ambiguityCount()));
    }

    public SheetOutcome readOutcome(SheetStatus status, String resultJson, String errorMessage) {
        switch (status) {
            case PARSED -> {
                if (resultJson == null || resultJson.isBlank()) {
                    throw new DataRetrievalFailureException("Parsed sheet has no stored result");
                }
                StoredResult stored = read(resultJson, StoredResult.class);
                return new SheetOutcome.Success(stored.answers(), stored.multiMarkedCount());
            }
            case FAILED -> {
                return new SheetOutcome.Failure(errorMessage);
            }
            default -> {
                return null;
            }
        }
    }

    public String writeScanConfig(ScanConfig scanConfig) {
        if (scanConfig == null || scanConfig.isDefault()) {
            return null;
        }
        return write(scanConfig);
    }

    public ScanConfig readScanConfig(String json) {
        if (json == null || json.isBlank()) {
            return ScanConfig.defaults();
        }
        return read(json, ScanConfig.class);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new InvalidDataAccessApiUsageException("Unable to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("Unable to decode stored " + type.getSimpleName(), e);
        }
    }

    record StoredResult(
        @JsonProperty("answers") Map<String, String> answers,
        @JsonProperty("multi_marked_count") int multiMarkedCount
    ) {}
}
