package com.omrchecker.orchestrator.parsing.api;

import com.omrchecker.orchestrator.config.OmrProperties;
import com.omrchecker.orchestrator.parsing.model.JobStatistics;
import com.omrchecker.orchestrator.parsing.model.JobStatus;
import com.omrchecker.orchestrator.parsing.model.Operator;
import com.omrchecker.orchestrator.parsing.model.ParsingJob;
import com.omrchecker.orchestrator.parsing.model.SheetResultView;
import com.omrchecker.orchestrator.parsing.service.BackgroundProcessor;
import com.omrchecker.orchestrator.parsing.service.JobNotFoundException;
import com.omrchecker.orchestrator.parsing.service.ParsingJobService;
import com.omrchecker.orchestrator.parsing.service.WebhookService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.springframework.http.HttpStatus.BAD_REQUEST;

@RestController
@RequestMapping("/api")
public class ParsingJobController {
    private final ParsingJobService jobService;
    private final BackgroundProcessor backgroundProcessor;
    private final WebhookService webhookService;
    private final OperatorAuthenticator authenticator;
    private final OmrProperties properties;

    public ParsingJobController(
        ParsingJobService jobService,
        BackgroundProcessor backgroundProcessor,
        WebhookService webhookService,
        OperatorAuthenticator authenticator,
        OmrProperties properties
    ) {
        this.jobService = jobService;
        this.backgroundProcessor = backgroundProcessor;
        this.webhookService = webhookService;
        this.authenticator = authenticator;
        this.properties = properties;
    }

    @PostMapping("/jobs")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public JobCreatedResponse createJob(
        @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
        @RequestBody CreateJobRequest request
    ) {
        Operator operator = authenticator.authenticate(authorization);
        ParsingJob job = jobService.createJob(operator.id(), request.items(), request.scanConfig());
        backgroundProcessor.submit(job);
        return new JobCreatedResponse(job.id(), job.status());
    }

    @GetMapping("/jobs/{jobId}")
    public JobDetailResponse getJob(
        @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
        @PathVariable("jobId") String jobId,
        @RequestParam(name = "includeSheets", required = false, defaultValue = "false") boolean includeSheets
    ) {
        Operator operator = authenticator.authenticate(authorization);
        jobService.requireJobForOperator(jobId, operator.id());
        JobStatistics stats = jobService.statistics(jobId)
            .orElseThrow(() -> new JobNotFoundException("Job not found: " + jobId));
        List<SheetResultView> sheets = includeSheets
            ? jobService.getSheets(jobId).stream().map(SheetResultView::from).toList()
            : null;
        return JobDetailResponse.from(stats, sheets);
    }

    @GetMapping("/jobs")
    public JobListResponse listJobs(
        @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
        @RequestParam(name = "status", required = false) String status,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        Operator operator = authenticator.authenticate(authorization);
        JobStatus statusFilter = null;
        if (status != null && !status.isBlank()) {
            try {
                statusFilter = JobStatus.fromValue(status.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                throw new ResponseStatusException(
                    BAD_REQUEST,
                    "Invalid status: " + status + ". Must be one of: PENDING, PROCESSING, COMPLETED, FAILED"
                );
            }
        }
        int requested = limit == null ? properties.getApi().getDefaultListLimit() : limit;
        int safeLimit = Math.max(1, Math.min(properties.getApi().getMaxListLimit(), requested));
        List<JobSummaryView> jobs = jobService.listJobs(operator.id(), statusFilter, safeLimit).stream()
            .map(JobSummaryView::from)
            .toList();
        return new JobListResponse(jobs.size(), jobs);
    }

    @PostMapping("/jobs/{jobId}/redrive")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public JobCreatedResponse redriveJob(
        @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
        @PathVariable("jobId") String jobId
    ) {
        Operator operator = authenticator.authenticate(authorization);
        ParsingJob job = jobService.requireJobForOperator(jobId, operator.id());
        backgroundProcessor.redrive(jobId);
        return new JobCreatedResponse(job.id(), job.status());
    }

    @PostMapping("/callbacks/retry")
    public CallbackRetryResponse retryCallbacks(
        @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
        @RequestParam(name = "maxAttempts", required = false) Integer maxAttempts
    ) {
        authenticator.authenticate(authorization);
        int attempts = maxAttempts == null ? properties.getCallbacks().getMaxAttempts() : Math.max(1, maxAttempts);
        int delivered = webhookService.retryFailedCallbacks(attempts);
        return new CallbackRetryResponse(delivered, attempts);
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "healthy");
    }
}
