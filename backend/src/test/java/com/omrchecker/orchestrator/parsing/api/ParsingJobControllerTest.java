package com.omrchecker.orchestrator.parsing.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.omrchecker.orchestrator.parsing.model.OmrSheet;
import com.omrchecker.orchestrator.parsing.model.Operator;
import com.omrchecker.orchestrator.parsing.model.ParsingJob;
import com.omrchecker.orchestrator.parsing.model.SheetItem;
import com.omrchecker.orchestrator.parsing.persistence.ParsingUnitOfWork;
import com.omrchecker.orchestrator.parsing.service.BackgroundProcessor;
import com.omrchecker.orchestrator.parsing.service.ParsingJobService;
import com.omrchecker.orchestrator.parsing.service.WebhookService;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.WebApplicationContext;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class ParsingJobControllerTest {

  @Autowired private WebApplicationContext context;

  @Autowired private ParsingUnitOfWork unitOfWork;

  @Autowired private ParsingJobService jobService;

  @MockBean private BackgroundProcessor backgroundProcessor;

  @MockBean private WebhookService webhookService;

  private MockMvc mockMvc;
  private Operator operator;

  @BeforeEach
  void setUp() {
    this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    operator = operator();
  }

  @Test
  void createJobReturnsAcceptedAndSubmitsTheJob() throws Exception {
    String body =
        """
        {
          "items": [
            {"id": "student-1", "image_url": "https://example.com/1.jpg"},
            {"id": "student-2", "image_url": "https://example.com/2.jpg"}
          ],
          "template_json": "{\\"bubbleDimensions\\":[20,20]}"
        }
        """;

    mockMvc
        .perform(
            post("/api/jobs")
                .header(HttpHeaders.AUTHORIZATION, basic(operator))
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").isString())
        .andExpect(jsonPath("$.status").value("PENDING"));

    List<ParsingJob> jobs = unitOfWork.jobs().findByOperator(operator.id());
    assertThat(jobs).hasSize(1);
    assertThat(jobs.get(0).totalSheets()).isEqualTo(2);
    assertThat(jobs.get(0).scanConfig().templateJson()).contains("bubbleDimensions");
    verify(backgroundProcessor).submit(any(ParsingJob.class));
  }

  @Test
  void missingOrUnknownCredentialsAreUnauthorized() throws Exception {
    mockMvc
        .perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content("{\"items\":[]}"))
        .andExpect(status().isUnauthorized())
        .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Basic"))
        .andExpect(jsonPath("$.error").value("unauthorized"));

    mockMvc
        .perform(get("/api/jobs").header(HttpHeaders.AUTHORIZATION, "Basic not-a-token"))
        .andExpect(status().isUnauthorized());

    verify(backgroundProcessor, never()).submit(any(ParsingJob.class));
  }

  @Test
  void emptyItemListIsABadRequest() throws Exception {
    mockMvc
        .perform(
            post("/api/jobs")
                .header(HttpHeaders.AUTHORIZATION, basic(operator))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"items\":[]}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("invalid_request"));

    mockMvc
        .perform(
            post("/api/jobs")
                .header(HttpHeaders.AUTHORIZATION, basic(operator))
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void jobDetailIncludesCountsAndOptionallySheets() throws Exception {
    ParsingJob job = jobService.createJob(operator.id(), items(2), null);
    jobService.startProcessing(job.id());
    OmrSheet first = jobService.getPendingSheets(job.id()).get(0);
    jobService.recordSheetSuccess(first.id(), Map.of("q1", "A"), 0);
    jobService.incrementProgress(job.id());

    mockMvc
        .perform(get("/api/jobs/" + job.id()).header(HttpHeaders.AUTHORIZATION, basic(operator)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.jobId").value(job.id()))
        .andExpect(jsonPath("$.status").value("PROCESSING"))
        .andExpect(jsonPath("$.totalSheets").value(2))
        .andExpect(jsonPath("$.processedSheets").value(1))
        .andExpect(jsonPath("$.successfulSheets").value(1))
        .andExpect(jsonPath("$.pendingSheets").value(1))
        .andExpect(jsonPath("$.sheets").doesNotExist());

    mockMvc
        .perform(
            get("/api/jobs/" + job.id())
                .param("includeSheets", "true")
                .header(HttpHeaders.AUTHORIZATION, basic(operator)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.sheets.length()").value(2));
  }

  @Test
  void jobOfAnotherOperatorIsForbiddenAndUnknownJobIsNotFound() throws Exception {
    Operator other = operator();
    ParsingJob job = jobService.createJob(operator.id(), items(1), null);

    mockMvc
        .perform(get("/api/jobs/" + job.id()).header(HttpHeaders.AUTHORIZATION, basic(other)))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.error").value("access_denied"));

    mockMvc
        .perform(get("/api/jobs/job_000000000000").header(HttpHeaders.AUTHORIZATION, basic(operator)))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.error").value("job_not_found"));
  }

  @Test
  void listFiltersByStatusAndRejectsUnknownStatus() throws Exception {
    ParsingJob pending = jobService.createJob(operator.id(), items(1), null);
    ParsingJob processing = jobService.createJob(operator.id(), items(1), null);
    jobService.startProcessing(processing.id());

    mockMvc
        .perform(
            get("/api/jobs")
                .param("status", "pending")
                .header(HttpHeaders.AUTHORIZATION, basic(operator)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(1))
        .andExpect(jsonPath("$.jobs[0].jobId").value(pending.id()));

    mockMvc
        .perform(get("/api/jobs").header(HttpHeaders.AUTHORIZATION, basic(operator)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(2));

    mockMvc
        .perform(
            get("/api/jobs").param("status", "DONE").header(HttpHeaders.AUTHORIZATION, basic(operator)))
        .andExpect(status().isBadRequest());
  }

  @Test
  void redriveAndCallbackRetryDelegate() throws Exception {
    ParsingJob job = jobService.createJob(operator.id(), items(1), null);
    when(webhookService.retryFailedCallbacks(anyInt())).thenReturn(2);

    mockMvc
        .perform(post("/api/jobs/" + job.id() + "/redrive").header(HttpHeaders.AUTHORIZATION, basic(operator)))
        .andExpect(status().isAccepted())
        .andExpect(jsonPath("$.jobId").value(job.id()));
    verify(backgroundProcessor).redrive(job.id());

    mockMvc
        .perform(
            post("/api/callbacks/retry")
                .param("maxAttempts", "5")
                .header(HttpHeaders.AUTHORIZATION, basic(operator)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.delivered").value(2))
        .andExpect(jsonPath("$.maxAttempts").value(5));
    verify(webhookService).retryFailedCallbacks(5);
  }

  @Test
  void healthNeedsNoCredentials() throws Exception {
    mockMvc
        .perform(get("/api/health"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("healthy"));
  }

  private Operator operator() {
    return unitOfWork
        .operators()
        .create(
            new Operator(
                UUID.randomUUID().toString(),
                UUID.randomUUID().toString(),
                "https://example.com/hook",
                null));
  }

  private static String basic(Operator operator) {
    String credentials = "operator:" + operator.token();
    return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
  }

  private static List<SheetItem> items(int count) {
    return IntStream.range(0, count)
        .mapToObj(i -> new SheetItem("item-" + i, "https://example.com/sheet-" + i + ".jpg"))
        .toList();
  }
}
