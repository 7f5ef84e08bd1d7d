package com.omrchecker.orchestrator.parsing.api;

import com.omrchecker.orchestrator.parsing.model.Operator;
import com.omrchecker.orchestrator.parsing.model.RecognitionResult;
import com.omrchecker.orchestrator.parsing.model.ScanConfig;
import com.omrchecker.orchestrator.parsing.service.JobValidationException;
import com.omrchecker.orchestrator.parsing.service.SheetParsingException;
import com.omrchecker.orchestrator.parsing.service.SheetParsingService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;

/**
 * Synchronous recognition of one sheet, given either as an uploaded file or as an image URL.
 */
@RestController
@RequestMapping("/api/omr")
public class SheetParsingController {
    private final SheetParsingService parsingService;
    private final OperatorAuthenticator authenticator;

    public SheetParsingController(SheetParsingService parsingService, OperatorAuthenticator authenticator) {
        this.parsingService = parsingService;
        this.authenticator = authenticator;
    }

    @PostMapping(value = "/parse-sheet", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public SheetParseResponse parseSheet(
        @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
        @RequestParam(name = "userId") String userId,
        @RequestParam(name = "image", required = false) MultipartFile image,
        @RequestParam(name = "image_url", required = false) String imageUrl,
        @RequestParam(name = "config_json", required = false) String configJson,
        @RequestParam(name = "template_json", required = false) String templateJson
    ) {
        Operator operator = authenticator.authenticate(authorization);
        boolean hasImage = image != null && !image.isEmpty();
        boolean hasUrl = imageUrl != null && !imageUrl.isBlank();
        if (!hasImage && !hasUrl) {
            throw new JobValidationException("Either 'image' file or 'image_url' must be provided");
        }
        if (hasImage && hasUrl) {
            throw new JobValidationException("Provide either 'image' file or 'image_url', not both");
        }
        ScanConfig scanConfig = new ScanConfig(templateJson, configJson);

        RecognitionResult result;
        if (hasImage) {
            String contentType = image.getContentType();
            if (contentType != null && !contentType.startsWith("image/")) {
                throw new JobValidationException("Invalid file type: " + contentType + ". Please upload an image file.");
            }
            byte[] content;
            try {
                content = image.getBytes();
            } catch (IOException e) {
                throw new SheetParsingException("Error reading uploaded image", e);
            }
            result = parsingService.parseUpload(operator.id(), userId, content, image.getOriginalFilename(), scanConfig);
        } else {
            result = parsingService.parseRemote(operator.id(), userId, imageUrl, scanConfig);
        }
        return new SheetParseResponse(userId, result.answers(), result.ambiguityCount());
    }
}
