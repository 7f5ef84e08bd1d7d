package com.omrchecker.orchestrator.parsing.service;

import com.omrchecker.orchestrator.parsing.model.Operator;
import com.omrchecker.orchestrator.parsing.persistence.OperatorRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Service
public class OperatorService {
    private static final Logger log = LoggerFactory.getLogger(OperatorService.class);

    private final OperatorRepository operators;

    public OperatorService(OperatorRepository operators) {
        this.operators = operators;
    }

    /**
     * Creates an operator; a random UUID token is generated when none is given.
     *
     * @throws IllegalArgumentException when the callback URL is not an absolute http(s) URL
     */
    public Operator register(String callbackUrl, String token) {
        String url = requireCallbackUrl(callbackUrl);
        String safeToken = token == null || token.isBlank() ? UUID.randomUUID().toString() : token.trim();
        Operator created = operators.create(new Operator(UUID.randomUUID().toString(), safeToken, url, Instant.now()));
        log.info("Registered operator {} with callback {}", created.id(), url);
        return created;
    }

    public Optional<Operator> findById(String operatorId) {
        return operators.findById(operatorId);
    }

    public Optional<Operator> findByToken(String token) {
        return operators.findByToken(token == null ? null : token.trim());
    }

    public List<Operator> list() {
        return operators.findAll();
    }

    public boolean updateCallbackUrl(String operatorId, String callbackUrl) {
        String url = requireCallbackUrl(callbackUrl);
        boolean updated = operators.updateCallbackUrl(operatorId, url);
        if (updated) {
            log.info("Operator {} callback updated to {}", operatorId, url);
        }
        return updated;
    }

    /**
     * Deletes the operator together with its jobs and their sheets.
     */
    public boolean delete(String operatorId) {
        boolean deleted = operators.delete(operatorId);
        if (deleted) {
            log.info("Deleted operator {}", operatorId);
        }
        return deleted;
    }

    static String requireCallbackUrl(String callbackUrl) {
        if (callbackUrl == null || callbackUrl.isBlank()) {
            throw new IllegalArgumentException("callbackUrl is required");
        }
        String trimmed = callbackUrl.trim();
        URI uri;
        try {
            uri = new URI(trimmed);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("callbackUrl is malformed: " + trimmed, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!uri.isAbsolute() || uri.getHost() == null || !(scheme.equals("http") || scheme.equals("https"))) {
            throw new IllegalArgumentException("callbackUrl must be an absolute http(s) URL: " + trimmed);
        }
        return trimmed;
    }
}
