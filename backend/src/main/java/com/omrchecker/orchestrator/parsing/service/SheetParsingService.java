package com.omrchecker.orchestrator.parsing.service;

import com.omrchecker.orchestrator.config.OmrProperties;
import com.omrchecker.orchestrator.parsing.engine.OmrEngine;
import com.omrchecker.orchestrator.parsing.engine.RecognitionException;
import com.omrchecker.orchestrator.parsing.image.ImageFetchException;
import com.omrchecker.orchestrator.parsing.image.ImageFetcher;
import com.omrchecker.orchestrator.parsing.image.LocalImage;
import com.omrchecker.orchestrator.parsing.model.RecognitionResult;
import com.omrchecker.orchestrator.parsing.model.ScanConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Recognizes a single sheet inline, outside the job lifecycle. Nothing is persisted.
 */
@Service
public class SheetParsingService {
    private static final Logger log = LoggerFactory.getLogger(SheetParsingService.class);
    private static final Pattern EXTENSION = Pattern.compile("\\.[A-Za-z0-9]{1,5}");

    private final ImageFetcher imageFetcher;
    private final OmrEngine engine;
    private final OmrProperties properties;

    public SheetParsingService(ImageFetcher imageFetcher, OmrEngine engine, OmrProperties properties) {
        this.imageFetcher = imageFetcher;
        this.engine = engine;
        this.properties = properties;
    }

    public RecognitionResult parseUpload(String operatorId, String itemId, byte[] content, String fileName, ScanConfig scanConfig) {
        if (content == null || content.length == 0) {
            throw new JobValidationException("Uploaded image is empty");
        }
        if (content.length > properties.getImages().getMaxBytes()) {
            throw new JobValidationException("Uploaded image exceeds " + properties.getImages().getMaxBytes() + " bytes");
        }
        log.info("Processing OMR upload for operator {}, item {}", operatorId, itemId);
        Path temp;
        try {
            temp = Files.createTempFile(properties.getImages().getTempFilePrefix(), extensionOf(fileName));
            Files.write(temp, content);
        } catch (IOException e) {
            throw new SheetParsingException("Error storing uploaded image", e);
        }
        try (LocalImage image = LocalImage.temporary(temp)) {
            return recognize(itemId, image, scanConfig);
        }
    }

    public RecognitionResult parseRemote(String operatorId, String itemId, String imageUrl, ScanConfig scanConfig) {
        String url = imageUrl == null ? "" : imageUrl.trim();
        String lower = url.toLowerCase(Locale.ROOT);
        if (!lower.startsWith("http://") && !lower.startsWith("https://")) {
            throw new JobValidationException("image_url must be an http(s) URL");
        }
        log.info("Processing OMR from URL for operator {}, item {}", operatorId, itemId);
        try (LocalImage image = imageFetcher.fetch(url)) {
            return recognize(itemId, image, scanConfig);
        } catch (ImageFetchException e) {
            throw new SheetParsingException("Error processing OMR image: " + e.getMessage(), e);
        }
    }

    private RecognitionResult recognize(String itemId, LocalImage image, ScanConfig scanConfig) {
        try {
            RecognitionResult result = engine.recognize(image.path(), scanConfig);
            log.info("Recognized item {} with {} answers", itemId, result.answers().size());
            return result;
        } catch (RecognitionException e) {
            log.warn("Recognition failed for item {}: {}", itemId, e.getMessage());
            throw new SheetParsingException("Error processing OMR image: " + e.getMessage(), e);
        }
    }

    static String extensionOf(String fileName) {
        if (fileName == null) {
            return ".jpg";
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return ".jpg";
        }
        String extension = fileName.substring(dot);
        return EXTENSION.matcher(extension).matches() ? extension.toLowerCase(Locale.ROOT) : ".jpg";
    }
}
