package com.omrchecker.orchestrator.parsing.http;

import com.omrchecker.orchestrator.config.OmrProperties;
import com.omrchecker.orchestrator.parsing.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.concurrent.ExecutorService;

/**
 * Single shared {@link HttpClient} for image downloads, engine calls and webhooks. Every request carries
 * its own timeout. Transport problems come back as an {@link HttpFetchResult} with an error code
 * ({@code invalid_url}, {@code timeout}, {@code io_error}, {@code interrupted}, {@code http_error},
 * {@code body_too_large}), never as an exception.
 */
@Service
public class OutboundHttpClient {
    private static final Logger log = LoggerFactory.getLogger(OutboundHttpClient.class);

    private final OmrProperties properties;
    private final HttpClient client;

    public OutboundHttpClient(OmrProperties properties, @Qualifier("httpExecutor") ExecutorService httpExecutor) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getHttp().getConnectTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public HttpFetchResult get(String url, String acceptHeader) {
        return get(url, acceptHeader, Duration.ofSeconds(properties.getHttp().getRequestTimeoutSeconds()));
    }

    public HttpFetchResult get(String url, String acceptHeader, Duration timeout) {
        return send(url, "GET", acceptHeader, null, timeout, Long.MAX_VALUE);
    }

    /**
     * GET whose body may not exceed {@code maxBytes}. A larger declared Content-Length is refused before
     * reading; an undeclared body is cut off once it passes the limit. Both give {@code body_too_large}.
     */
    public HttpFetchResult get(String url, String acceptHeader, long maxBytes) {
        return send(
            url,
            "GET",
            acceptHeader,
            null,
            Duration.ofSeconds(properties.getHttp().getRequestTimeoutSeconds()),
            maxBytes
        );
    }

    public HttpFetchResult postJson(String url, String jsonBody, Duration timeout) {
        return send(url, "POST", "application/json", jsonBody == null ? "" : jsonBody, timeout, Long.MAX_VALUE);
    }

    private HttpFetchResult send(
        String url,
        String method,
        String acceptHeader,
        String body,
        Duration timeout,
        long maxBytes
    ) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "URL missing host or malformed");
        }

        String safeAccept = (acceptHeader == null || acceptHeader.isBlank()) ? "*/*" : acceptHeader;
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(timeout == null ? Duration.ofSeconds(properties.getHttp().getRequestTimeoutSeconds()) : timeout)
            .header("User-Agent", properties.getUserAgent())
            .header("Accept", safeAccept);
        HttpRequest request;
        if ("POST".equalsIgnoreCase(method)) {
            request = builder
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body == null ? "" : body, StandardCharsets.UTF_8))
                .build();
        } else {
            request = builder.GET().build();
        }

        try {
            HttpResponse<LimitedBodySubscriber.Body> response = client.send(request, LimitedBodySubscriber.handler(maxBytes));
            if (response.body().tooLarge()) {
                log.debug("{} {} refused, body larger than {} bytes", method, url, maxBytes);
                return errorResult(url, startedAt, "body_too_large", "Response body exceeds " + maxBytes + " bytes");
            }
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                response.body().bytes(),
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            log.debug("{} {} timed out after {}", method, url, Duration.between(startedAt, Instant.now()));
            return errorResult(url, startedAt, "timeout", e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, "http_error", e.getMessage());
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    static URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        String lower = value.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            return null;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
