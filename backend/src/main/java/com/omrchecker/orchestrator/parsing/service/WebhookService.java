package com.omrchecker.orchestrator.parsing.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.omrchecker.orchestrator.config.OmrProperties;
import com.omrchecker.orchestrator.parsing.http.OutboundHttpClient;
import com.omrchecker.orchestrator.parsing.model.CallbackStatus;
import com.omrchecker.orchestrator.parsing.model.CompletionPayload;
import com.omrchecker.orchestrator.parsing.model.HttpFetchResult;
import com.omrchecker.orchestrator.parsing.model.OmrSheet;
import com.omrchecker.orchestrator.parsing.model.Operator;
import com.omrchecker.orchestrator.parsing.model.ParsingJob;
import com.omrchecker.orchestrator.parsing.model.SheetResultView;
import com.omrchecker.orchestrator.parsing.model.SheetStatus;
import com.omrchecker.orchestrator.parsing.model.WebhookDeliveryResult;
import com.omrchecker.orchestrator.parsing.persistence.ParsingUnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Completion callbacks to the operator's URL. Delivery never throws: every outcome is reported as a
 * {@link WebhookDeliveryResult} and, once a send was attempted, recorded as the job's callback status.
 */
@Service
public class WebhookService {
    private static final Logger log = LoggerFactory.getLogger(WebhookService.class);

    private final ParsingJobService jobService;
    private final ParsingUnitOfWork unitOfWork;
    private final OutboundHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final OmrProperties properties;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean retryPassRunning = new AtomicBoolean(false);

    public WebhookService(
        ParsingJobService jobService,
        ParsingUnitOfWork unitOfWork,
        OutboundHttpClient httpClient,
        ObjectMapper objectMapper,
        OmrProperties properties
    ) {
        this.jobService = jobService;
        this.unitOfWork = unitOfWork;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * POSTs the completion payload of a terminal job once. A 2xx answer marks the callback SENT, anything
     * else FAILED. A second call for a job whose send is still in progress is skipped.
     */
    public WebhookDeliveryResult sendCompletion(String jobId) {
        return send(jobId, false);
    }

    /**
     * One pass over terminal jobs whose callback FAILED, oldest first, with a single send per job. At most
     * {@code maxAttempts} sends are made in the pass; the rest wait for the next one. Returns the number of
     * jobs delivered, or 0 at once when another pass is running.
     */
    public int retryFailedCallbacks(int maxAttempts) {
        if (!retryPassRunning.compareAndSet(false, true)) {
            log.info("Callback retry pass already running, skipping");
            return 0;
        }
        try {
            List<ParsingJob> candidates = unitOfWork.jobs().findByCallbackStatus(CallbackStatus.FAILED).stream()
                .filter(ParsingJob::isTerminal)
                .sorted(Comparator.comparing(ParsingJob::completedAt).thenComparing(ParsingJob::id))
                .limit(Math.max(1, maxAttempts))
                .toList();
            int delivered = 0;
            for (ParsingJob job : candidates) {
                WebhookDeliveryResult result = send(job.id(), true);
                if (result.delivered()) {
                    delivered++;
                } else {
                    log.debug("Retry for job {} not delivered: {}", job.id(), result.errorCode());
                }
            }
            log.info("Retried {}/{} failed webhooks", delivered, candidates.size());
            return delivered;
        } finally {
            retryPassRunning.set(false);
        }
    }

    /**
     * Sends callbacks for completed jobs that were never attempted, oldest completion first.
     */
    public int deliverPendingCallbacks() {
        List<ParsingJob> pending = unitOfWork.jobs().findPendingCallbacks();
        int delivered = 0;
        for (ParsingJob job : pending) {
            if (send(job.id(), true).delivered()) {
                delivered++;
            }
        }
        if (!pending.isEmpty()) {
            log.info("Delivered {}/{} pending webhooks", delivered, pending.size());
        }
        return delivered;
    }

    // Sweeps work from a snapshot; skipIfSent re-checks the stored status under the in-flight guard so a
    // callback delivered since the snapshot is not posted again.
    private WebhookDeliveryResult send(String jobId, boolean skipIfSent) {
        if (jobId == null || !inFlight.add(jobId)) {
            log.info("Webhook for job {} already in flight, skipping", jobId);
            return WebhookDeliveryResult.failed(jobId, 0, "in_flight", "Delivery already in progress");
        }
        try {
            return deliver(jobId, skipIfSent);
        } catch (Exception e) {
            log.error("Error sending webhook for job {}", jobId, e);
            markCallback(jobId, CallbackStatus.FAILED);
            return WebhookDeliveryResult.failed(jobId, 0, "internal_error", e.getMessage());
        } finally {
            inFlight.remove(jobId);
        }
    }

    public boolean isRetryPassRunning() {
        return retryPassRunning.get();
    }

    public CompletionPayload buildPayload(ParsingJob job, List<OmrSheet> sheets) {
        int successful = (int) sheets.stream().filter(sheet -> sheet.status() == SheetStatus.PARSED).count();
        int failed = (int) sheets.stream().filter(sheet -> sheet.status() == SheetStatus.FAILED).count();
        return new CompletionPayload(
            job.id(),
            job.status(),
            job.totalSheets(),
            job.processedSheets(),
            successful,
            failed,
            job.createdAt(),
            job.completedAt(),
            sheets.stream().map(SheetResultView::from).toList()
        );
    }

    private WebhookDeliveryResult deliver(String jobId, boolean skipIfSent) throws JsonProcessingException {
        Optional<ParsingJob> found = jobService.getJob(jobId);
        if (found.isEmpty()) {
            log.error("Job {} not found for webhook", jobId);
            return WebhookDeliveryResult.failed(jobId, 0, "job_not_found", "Job not found");
        }
        ParsingJob job = found.get();
        if (!job.isTerminal()) {
            log.warn("Job {} is {}, webhook not sent", jobId, job.status());
            return WebhookDeliveryResult.failed(jobId, 0, "job_not_terminal", "Job status is " + job.status());
        }
        if (skipIfSent && job.callbackStatus() == CallbackStatus.SENT) {
            log.debug("Webhook for job {} was already delivered, skipping", jobId);
            return WebhookDeliveryResult.failed(jobId, 0, "already_sent", "Callback already delivered");
        }
        Optional<Operator> operator = unitOfWork.operators().findById(job.operatorId());
        if (operator.isEmpty()) {
            log.error("Operator {} not found for webhook of job {}", job.operatorId(), jobId);
            markCallback(jobId, CallbackStatus.FAILED);
            return WebhookDeliveryResult.failed(jobId, 0, "operator_not_found", "Operator not found");
        }

        String body = objectMapper.writeValueAsString(buildPayload(job, jobService.getSheets(jobId)));
        String callbackUrl = operator.get().callbackUrl();
        HttpFetchResult response = httpClient.postJson(
            callbackUrl,
            body,
            Duration.ofSeconds(properties.getWebhook().getTimeoutSeconds())
        );
        if (response.isSuccessful()) {
            markCallback(jobId, CallbackStatus.SENT);
            log.info("Webhook sent successfully for job {} to {}", jobId, callbackUrl);
            return WebhookDeliveryResult.delivered(jobId, response.statusCode());
        }
        markCallback(jobId, CallbackStatus.FAILED);
        log.warn("Webhook for job {} to {} failed: {}", jobId, callbackUrl, response.describeFailure());
        String errorCode = response.errorCode() == null ? "http_status" : response.errorCode();
        return WebhookDeliveryResult.failed(jobId, response.statusCode(), errorCode, response.describeFailure());
    }

    private void markCallback(String jobId, CallbackStatus status) {
        try {
            jobService.updateCallbackStatus(jobId, status);
        } catch (RuntimeException e) {
            log.error("Failed to record callback status {} for job {}", status, jobId, e);
        }
    }
}
