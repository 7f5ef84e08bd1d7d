package com.omrchecker.orchestrator.parsing.api;

import com.omrchecker.orchestrator.parsing.model.Operator;
import com.omrchecker.orchestrator.parsing.service.OperatorAuthenticationException;
import com.omrchecker.orchestrator.parsing.service.OperatorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Locale;

/**
 * Resolves the calling operator from an HTTP Basic header. The operator token is the password; the user
 * name is ignored. A bare {@code Basic <token>} without base64 encoding is accepted too.
 */
@Component
public class OperatorAuthenticator {
    private static final Logger log = LoggerFactory.getLogger(OperatorAuthenticator.class);
    private static final String BASIC_PREFIX = "basic ";

    private final OperatorService operatorService;

    public OperatorAuthenticator(OperatorService operatorService) {
        this.operatorService = operatorService;
    }

    public Operator authenticate(String authorizationHeader) {
        String token = extractToken(authorizationHeader);
        if (token == null) {
            throw new OperatorAuthenticationException("Missing authentication credentials");
        }
        return operatorService.findByToken(token).orElseThrow(() -> {
            log.warn("Authentication failed: unknown operator token");
            return new OperatorAuthenticationException("Invalid authentication credentials");
        });
    }

    static String extractToken(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        String trimmed = header.trim();
        if (!trimmed.toLowerCase(Locale.ROOT).startsWith(BASIC_PREFIX)) {
            return null;
        }
        String credentials = trimmed.substring(BASIC_PREFIX.length()).trim();
        if (credentials.isEmpty()) {
            return null;
        }
        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(credentials), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return credentials;
        }
        int colon = decoded.indexOf(':');
        if (colon < 0) {
            return credentials;
        }
        String password = decoded.substring(colon + 1).trim();
        return password.isEmpty() ? null : password;
    }
}
