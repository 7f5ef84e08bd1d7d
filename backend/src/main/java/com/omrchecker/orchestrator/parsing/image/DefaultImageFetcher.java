package com.omrchecker.orchestrator.parsing.image;

import com.omrchecker.orchestrator.config.OmrProperties;
import com.omrchecker.orchestrator.parsing.http.OutboundHttpClient;
import com.omrchecker.orchestrator.parsing.model.HttpFetchResult;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * http(s) locators are downloaded to a temp file whose extension follows the content type; any other
 * locator must be a readable local path and is used in place.
 */
@Service
public class DefaultImageFetcher implements ImageFetcher {
    private static final String IMAGE_ACCEPT = "image/jpeg,image/png,image/*;q=0.8,*/*;q=0.5";

    private final OmrProperties properties;
    private final OutboundHttpClient httpClient;

    public DefaultImageFetcher(OmrProperties properties, OutboundHttpClient httpClient) {
        this.properties = properties;
        this.httpClient = httpClient;
    }

    @Override
    public LocalImage fetch(String locator) throws ImageFetchException {
        if (locator == null || locator.isBlank()) {
            throw new ImageFetchException("Image locator is blank");
        }
        String trimmed = locator.trim();
        if (isRemote(trimmed)) {
            return download(trimmed);
        }
        return openLocal(trimmed);
    }

    private LocalImage download(String url) throws ImageFetchException {
        long maxBytes = properties.getImages().getMaxBytes();
        HttpFetchResult result = httpClient.get(url, IMAGE_ACCEPT, maxBytes);
        if ("body_too_large".equals(result.errorCode())) {
            throw new ImageFetchException("Downloaded image exceeds " + maxBytes + " bytes");
        }
        if (!result.isSuccessful()) {
            throw new ImageFetchException("Failed to download image from URL: " + result.describeFailure());
        }
        byte[] body = result.bodyBytes();
        if (body == null || body.length == 0) {
            throw new ImageFetchException("Downloaded image is empty");
        }
        Path temp = null;
        try {
            temp = Files.createTempFile(properties.getImages().getTempFilePrefix(), extensionFor(result.contentType()));
            Files.write(temp, body);
            return LocalImage.temporary(temp);
        } catch (IOException e) {
            if (temp != null) {
                LocalImage.temporary(temp).close();
            }
            throw new ImageFetchException("Error storing downloaded image", e);
        }
    }

    private LocalImage openLocal(String locator) throws ImageFetchException {
        Path path;
        try {
            path = Path.of(locator);
        } catch (InvalidPathException e) {
            throw new ImageFetchException("Invalid image path: " + locator, e);
        }
        if (!Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new ImageFetchException("Image file not readable: " + locator);
        }
        return LocalImage.existing(path);
    }

    static boolean isRemote(String locator) {
        String lower = locator.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    static String extensionFor(String contentType) {
        if (contentType == null) {
            return ".jpg";
        }
        String lower = contentType.toLowerCase(Locale.ROOT);
        if (lower.contains("png")) {
            return ".png";
        }
        return ".jpg";
    }
}
