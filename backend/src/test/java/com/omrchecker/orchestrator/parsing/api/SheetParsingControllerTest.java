package com.omrchecker.orchestrator.parsing.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.omrchecker.orchestrator.parsing.engine.OmrEngine;
import com.omrchecker.orchestrator.parsing.engine.RecognitionException;
import com.omrchecker.orchestrator.parsing.image.ImageFetcher;
import com.omrchecker.orchestrator.parsing.image.LocalImage;
import com.omrchecker.orchestrator.parsing.model.Operator;
import com.omrchecker.orchestrator.parsing.model.RecognitionResult;
import com.omrchecker.orchestrator.parsing.model.ScanConfig;
import com.omrchecker.orchestrator.parsing.persistence.ParsingUnitOfWork;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.WebApplicationContext;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class SheetParsingControllerTest {

  @Autowired private WebApplicationContext context;

  @Autowired private ParsingUnitOfWork unitOfWork;

  @MockBean private OmrEngine engine;

  @MockBean private ImageFetcher imageFetcher;

  @TempDir Path tempDir;

  private MockMvc mockMvc;
  private Operator operator;

  @BeforeEach
  void setUp() {
    this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    operator =
        unitOfWork
            .operators()
            .create(
                new Operator(
                    UUID.randomUUID().toString(),
                    UUID.randomUUID().toString(),
                    "https://example.com/hook",
                    null));
  }

  @Test
  void uploadedImageIsRecognizedInlineAndRemovedAfterwards() throws Exception {
    AtomicReference<Path> seen = new AtomicReference<>();
    when(engine.recognize(any(Path.class), any()))
        .thenAnswer(
            invocation -> {
              Path path = invocation.getArgument(0);
              seen.set(path);
              assertThat(Files.readAllBytes(path)).containsExactly(1, 2, 3);
              return new RecognitionResult(Map.of("q1", "A", "q2", ""), 1);
            });
    MockMultipartFile image =
        new MockMultipartFile("image", "scan.png", "image/png", new byte[] {1, 2, 3});

    mockMvc
        .perform(
            multipart("/api/omr/parse-sheet")
                .file(image)
                .param("userId", "student-7")
                .param("template_json", "{\"bubbleDimensions\":[20,20]}")
                .header(HttpHeaders.AUTHORIZATION, basic(operator)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value("student-7"))
        .andExpect(jsonPath("$.answers.q1").value("A"))
        .andExpect(jsonPath("$.answers.q2").value(""))
        .andExpect(jsonPath("$.multiMarkedCount").value(1));

    assertThat(seen.get().getFileName().toString()).endsWith(".png");
    assertThat(Files.exists(seen.get())).isFalse();
    ArgumentCaptor<ScanConfig> config = ArgumentCaptor.forClass(ScanConfig.class);
    verify(engine).recognize(any(Path.class), config.capture());
    assertThat(config.getValue().templateJson()).contains("bubbleDimensions");
    verify(imageFetcher, never()).fetch(anyString());
  }

  @Test
  void imageUrlIsFetchedThenRecognized() throws Exception {
    Path local = Files.write(tempDir.resolve("remote.jpg"), new byte[] {9});
    when(imageFetcher.fetch("https://example.com/sheet.jpg")).thenReturn(LocalImage.existing(local));
    when(engine.recognize(any(Path.class), any())).thenReturn(new RecognitionResult(Map.of("q1", "C"), 0));

    mockMvc
        .perform(
            multipart("/api/omr/parse-sheet")
                .param("userId", "student-8")
                .param("image_url", "https://example.com/sheet.jpg")
                .header(HttpHeaders.AUTHORIZATION, basic(operator)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.answers.q1").value("C"))
        .andExpect(jsonPath("$.multiMarkedCount").value(0));
  }

  @Test
  void imageAndUrlAreMutuallyExclusive() throws Exception {
    MockMultipartFile image = new MockMultipartFile("image", "scan.jpg", "image/jpeg", new byte[] {1});

    mockMvc
        .perform(
            multipart("/api/omr/parse-sheet")
                .param("userId", "u")
                .header(HttpHeaders.AUTHORIZATION, basic(operator)))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("invalid_request"));

    mockMvc
        .perform(
            multipart("/api/omr/parse-sheet")
                .file(image)
                .param("userId", "u")
                .param("image_url", "https://example.com/sheet.jpg")
                .header(HttpHeaders.AUTHORIZATION, basic(operator)))
        .andExpect(status().isBadRequest());

    mockMvc
        .perform(
            multipart("/api/omr/parse-sheet")
                .param("userId", "u")
                .param("image_url", "/etc/passwd")
                .header(HttpHeaders.AUTHORIZATION, basic(operator)))
        .andExpect(status().isBadRequest());

    verify(engine, never()).recognize(any(Path.class), any());
  }

  @Test
  void nonImageUploadIsRejected() throws Exception {
    MockMultipartFile text = new MockMultipartFile("image", "notes.txt", "text/plain", new byte[] {1});

    mockMvc
        .perform(
            multipart("/api/omr/parse-sheet")
                .file(text)
                .param("userId", "u")
                .header(HttpHeaders.AUTHORIZATION, basic(operator)))
        .andExpect(status().isBadRequest());
  }

  @Test
  void recognitionFailureIsReportedAsProcessingError() throws Exception {
    when(engine.recognize(any(Path.class), any()))
        .thenThrow(new RecognitionException("Image preprocessing failed - markers not detected"));
    MockMultipartFile image = new MockMultipartFile("image", "scan.jpg", "image/jpeg", new byte[] {1});

    mockMvc
        .perform(
            multipart("/api/omr/parse-sheet")
                .file(image)
                .param("userId", "u")
                .header(HttpHeaders.AUTHORIZATION, basic(operator)))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value("processing_failed"))
        .andExpect(
            jsonPath("$.message")
                .value("Error processing OMR image: Image preprocessing failed - markers not detected"));
  }

  @Test
  void callerMustBeAnOperator() throws Exception {
    MockMultipartFile image = new MockMultipartFile("image", "scan.jpg", "image/jpeg", new byte[] {1});

    mockMvc
        .perform(multipart("/api/omr/parse-sheet").file(image).param("userId", "u"))
        .andExpect(status().isUnauthorized());
  }

  private static String basic(Operator operator) {
    String credentials = "operator:" + operator.token();
    return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
  }
}
