package com.omrchecker.orchestrator.parsing.service;

import com.omrchecker.orchestrator.parsing.model.CallbackStatus;
import com.omrchecker.orchestrator.parsing.model.JobStatistics;
import com.omrchecker.orchestrator.parsing.model.JobStatus;
import com.omrchecker.orchestrator.parsing.model.OmrSheet;
import com.omrchecker.orchestrator.parsing.model.ParsingJob;
import com.omrchecker.orchestrator.parsing.model.ScanConfig;
import com.omrchecker.orchestrator.parsing.model.SheetItem;
import com.omrchecker.orchestrator.parsing.model.SheetOutcome;
import com.omrchecker.orchestrator.parsing.model.SheetStatus;
import com.omrchecker.orchestrator.parsing.persistence.ParsingUnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Job and sheet lifecycle. A job moves PENDING, PROCESSING, then COMPLETED or FAILED; a sheet moves from
 * PENDING to PARSED or FAILED exactly once. A job finalizes as FAILED only when every sheet failed.
 */
@Service
public class ParsingJobService {
    private static final Logger log = LoggerFactory.getLogger(ParsingJobService.class);
    private static final int MAX_LIST_LIMIT = 200;

    private final ParsingUnitOfWork unitOfWork;

    public ParsingJobService(ParsingUnitOfWork unitOfWork) {
        this.unitOfWork = unitOfWork;
    }

    /**
     * Validates the request, then inserts the job and all of its sheets in one transaction.
     *
     * @throws JobValidationException when nothing was written because the request is invalid
     */
    public ParsingJob createJob(String operatorId, List<SheetItem> items, ScanConfig scanConfig) {
        List<SheetItem> validated = validateItems(items);
        if (operatorId == null || operatorId.isBlank()) {
            throw new JobValidationException("operatorId is required");
        }
        if (!unitOfWork.operators().exists(operatorId)) {
            throw new JobValidationException("Unknown operator: " + operatorId);
        }

        Instant now = Instant.now();
        String jobId = newJobId();
        ParsingJob pending = ParsingJob.pending(
            jobId,
            operatorId,
            validated.size(),
            scanConfig == null ? ScanConfig.defaults() : scanConfig,
            now
        );
        List<OmrSheet> sheets = new ArrayList<>(validated.size());
        for (int i = 0; i < validated.size(); i++) {
            SheetItem item = validated.get(i);
            sheets.add(OmrSheet.pending(newSheetId(), jobId, item.normalizedId(), i, item.normalizedLocator(), now));
        }

        ParsingJob created = unitOfWork.inTransaction(uow -> {
            ParsingJob job = uow.jobs().create(pending);
            uow.sheets().createAll(sheets);
            return job;
        });
        log.info("Created parsing job {} with {} sheets for operator {}", jobId, sheets.size(), operatorId);
        return created;
    }

    public Optional<ParsingJob> getJob(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            return Optional.empty();
        }
        return unitOfWork.jobs().findById(jobId);
    }

    public ParsingJob requireJob(String jobId) {
        return getJob(jobId).orElseThrow(() -> new JobNotFoundException("Job not found: " + jobId));
    }

    /**
     * Loads a job on behalf of an operator; a job owned by someone else is reported as access denied.
     */
    public ParsingJob requireJobForOperator(String jobId, String operatorId) {
        ParsingJob job = requireJob(jobId);
        if (!job.operatorId().equals(operatorId)) {
            throw new JobAccessDeniedException("Job " + jobId + " belongs to another operator");
        }
        return job;
    }

    public List<OmrSheet> getSheets(String jobId) {
        return unitOfWork.sheets().findByJob(jobId);
    }

    public List<OmrSheet> getPendingSheets(String jobId) {
        return unitOfWork.sheets().findByJobAndStatus(jobId, SheetStatus.PENDING);
    }

    public List<ParsingJob> listJobs(String operatorId, JobStatus status, int limit) {
        int safeLimit = Math.max(1, Math.min(MAX_LIST_LIMIT, limit));
        return unitOfWork.jobs().findByOperatorAndStatus(operatorId, status, safeLimit);
    }

    /**
     * Idempotent. Returns whether the job is now PROCESSING; false for missing or terminal jobs.
     */
    public boolean startProcessing(String jobId) {
        boolean started = unitOfWork.jobs().markProcessing(jobId);
        if (started) {
            log.info("Job {} status updated to PROCESSING", jobId);
        } else {
            log.warn("Job {} not started: missing or already terminal", jobId);
        }
        return started;
    }

    public boolean recordSheetSuccess(String sheetId, Map<String, String> answers, int ambiguityCount) {
        boolean updated = unitOfWork.sheets().updateParsed(
            sheetId,
            new SheetOutcome.Success(answers, ambiguityCount),
            Instant.now()
        );
        if (updated) {
            log.info("Sheet {} parsed successfully", sheetId);
        } else {
            log.warn("Sheet {} not recorded as parsed: missing or already resolved", sheetId);
        }
        return updated;
    }

    public boolean recordSheetFailure(String sheetId, String errorMessage) {
        SheetOutcome.Failure failure = new SheetOutcome.Failure(errorMessage);
        boolean updated = unitOfWork.sheets().updateFailed(sheetId, failure, Instant.now());
        if (updated) {
            log.warn("Sheet {} failed: {}", sheetId, failure.reason());
        } else {
            log.warn("Sheet {} not recorded as failed: missing or already resolved", sheetId);
        }
        return updated;
    }

    public int incrementProgress(String jobId) {
        return unitOfWork.jobs().incrementProcessed(jobId);
    }

    /**
     * Writes the terminal status once every sheet is resolved. While any sheet is pending nothing changes
     * and the result is empty; a job that is already terminal reports its existing status.
     */
    public Optional<JobStatus> finalizeJob(String jobId) {
        Optional<ParsingJob> found = getJob(jobId);
        if (found.isEmpty()) {
            log.error("Job {} not found for finalization", jobId);
            return Optional.empty();
        }
        ParsingJob job = found.get();
        if (job.isTerminal()) {
            return Optional.of(job.status());
        }

        Map<SheetStatus, Integer> counts = unitOfWork.sheets().countByJobGroupedByStatus(jobId);
        int pending = counts.get(SheetStatus.PENDING);
        if (pending > 0) {
            log.warn("Job {} completion attempted but {} sheets are still pending", jobId, pending);
            return Optional.empty();
        }
        int failed = counts.get(SheetStatus.FAILED);
        int total = failed + counts.get(SheetStatus.PARSED);
        JobStatus finalStatus = total > 0 && failed == total ? JobStatus.FAILED : JobStatus.COMPLETED;

        if (unitOfWork.jobs().markTerminal(jobId, finalStatus, Instant.now())) {
            log.info("Job {} completed with status {}", jobId, finalStatus);
            return Optional.of(finalStatus);
        }
        return getJob(jobId).map(ParsingJob::status).filter(JobStatus::isTerminal);
    }

    public boolean updateCallbackStatus(String jobId, CallbackStatus callbackStatus) {
        boolean updated = unitOfWork.jobs().updateCallbackStatus(jobId, callbackStatus);
        if (updated) {
            log.info("Job {} callback status updated to {}", jobId, callbackStatus);
        }
        return updated;
    }

    public Optional<JobStatistics> statistics(String jobId) {
        return getJob(jobId).map(job -> {
            Map<SheetStatus, Integer> counts = unitOfWork.sheets().countByJobGroupedByStatus(jobId);
            return new JobStatistics(
                job.id(),
                job.status(),
                job.totalSheets(),
                job.processedSheets(),
                counts.get(SheetStatus.PARSED),
                counts.get(SheetStatus.FAILED),
                counts.get(SheetStatus.PENDING),
                job.callbackStatus(),
                job.createdAt(),
                job.completedAt()
            );
        });
    }

    private static List<SheetItem> validateItems(List<SheetItem> items) {
        if (items == null || items.isEmpty()) {
            throw new JobValidationException("At least one item is required");
        }
        for (int i = 0; i < items.size(); i++) {
            SheetItem item = items.get(i);
            if (item == null) {
                throw new JobValidationException("Item " + i + " is missing");
            }
            if (item.normalizedId() == null || item.normalizedId().isEmpty()) {
                throw new JobValidationException("Item " + i + " has no id");
            }
            if (item.normalizedLocator() == null || item.normalizedLocator().isEmpty()) {
                throw new JobValidationException("Item " + item.normalizedId() + " has no image_url");
            }
        }
        return items;
    }

    static String newJobId() {
        return "job_" + shortHex();
    }

    static String newSheetId() {
        return "sheet_" + shortHex();
    }

    private static String shortHex() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
