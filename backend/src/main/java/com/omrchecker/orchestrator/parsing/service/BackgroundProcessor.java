package com.omrchecker.orchestrator.parsing.service;

import com.omrchecker.orchestrator.parsing.engine.OmrEngine;
import com.omrchecker.orchestrator.parsing.engine.RecognitionException;
import com.omrchecker.orchestrator.parsing.image.ImageFetchException;
import com.omrchecker.orchestrator.parsing.image.ImageFetcher;
import com.omrchecker.orchestrator.parsing.image.LocalImage;
import com.omrchecker.orchestrator.parsing.model.JobStatus;
import com.omrchecker.orchestrator.parsing.model.OmrSheet;
import com.omrchecker.orchestrator.parsing.model.ParsingJob;
import com.omrchecker.orchestrator.parsing.model.RecognitionResult;
import com.omrchecker.orchestrator.parsing.model.ScanConfig;
import com.omrchecker.orchestrator.parsing.model.SheetOutcome;
import com.omrchecker.orchestrator.parsing.model.WebhookDeliveryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Drives one job per task: sheets of a job run one after another, jobs run concurrently on the executor.
 * A sheet that cannot be fetched or recognized is recorded as failed and the loop moves on.
 */
@Service
public class BackgroundProcessor {
    private static final Logger log = LoggerFactory.getLogger(BackgroundProcessor.class);

    private final ParsingJobService jobService;
    private final WebhookService webhookService;
    private final ImageFetcher imageFetcher;
    private final OmrEngine engine;
    private final Executor executor;
    private final Set<String> activeJobs = ConcurrentHashMap.newKeySet();

    public BackgroundProcessor(
        ParsingJobService jobService,
        WebhookService webhookService,
        ImageFetcher imageFetcher,
        OmrEngine engine,
        @Qualifier("jobExecutor") Executor executor
    ) {
        this.jobService = jobService;
        this.webhookService = webhookService;
        this.imageFetcher = imageFetcher;
        this.engine = engine;
        this.executor = executor;
    }

    /**
     * Schedules the job and returns at once. The handle completes exceptionally when the run aborted,
     * in which case the job stays PROCESSING until {@link #redrive(String)}.
     */
    public CompletableFuture<Void> submit(ParsingJob job) {
        String jobId = job.id();
        if (!activeJobs.add(jobId)) {
            log.warn("Job {} is already being processed, submit ignored", jobId);
            return CompletableFuture.completedFuture(null);
        }
        try {
            return CompletableFuture.runAsync(() -> {
                try {
                    processJob(jobId, job.scanConfig());
                } finally {
                    activeJobs.remove(jobId);
                }
            }, executor);
        } catch (RuntimeException e) {
            activeJobs.remove(jobId);
            log.error("Failed to schedule job {}", jobId, e);
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Resubmits a job that never reached a terminal status, e.g. one left in PROCESSING by an aborted run.
     * Terminal jobs are left alone.
     */
    public CompletableFuture<Void> redrive(String jobId) {
        ParsingJob job = jobService.requireJob(jobId);
        if (job.isTerminal()) {
            log.info("Job {} is already {}, not redriven", jobId, job.status());
            return CompletableFuture.completedFuture(null);
        }
        log.info("Redriving job {} from {}", jobId, job.status());
        return submit(job);
    }

    public boolean isActive(String jobId) {
        return activeJobs.contains(jobId);
    }

    void processJob(String jobId, ScanConfig scanConfig) {
        log.info("Starting background processing for job {}", jobId);
        try {
            if (!jobService.startProcessing(jobId)) {
                return;
            }
            List<OmrSheet> sheets = jobService.getPendingSheets(jobId);
            log.info("Processing {} sheets for job {}", sheets.size(), jobId);
            for (OmrSheet sheet : sheets) {
                SheetOutcome outcome = attempt(sheet, scanConfig);
                record(sheet, outcome);
                try {
                    jobService.incrementProgress(jobId);
                } catch (RuntimeException e) {
                    log.error("Failed to increment progress of job {} after sheet {}", jobId, sheet.id(), e);
                }
            }

            Optional<JobStatus> finalStatus = jobService.finalizeJob(jobId);
            if (finalStatus.isEmpty()) {
                log.warn("Job {} could not be finalized and remains PROCESSING", jobId);
                return;
            }
            WebhookDeliveryResult delivery = webhookService.sendCompletion(jobId);
            log.info(
                "Completed background processing for job {} with status {} (callback delivered: {})",
                jobId,
                finalStatus.get(),
                delivery.delivered()
            );
        } catch (RuntimeException e) {
            log.error("Error in background processing for job {}; job left in PROCESSING", jobId, e);
            throw e;
        }
    }

    private SheetOutcome attempt(OmrSheet sheet, ScanConfig scanConfig) {
        try (LocalImage image = imageFetcher.fetch(sheet.imageLocator())) {
            RecognitionResult result = engine.recognize(image.path(), scanConfig);
            return result.toOutcome();
        } catch (ImageFetchException | RecognitionException e) {
            return new SheetOutcome.Failure(e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Unexpected error processing sheet {}", sheet.id(), e);
            return new SheetOutcome.Failure(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    // A failed write is logged and the sheet stays PENDING; the loop continues.
    private void record(OmrSheet sheet, SheetOutcome outcome) {
        try {
            if (outcome instanceof SheetOutcome.Success success) {
                jobService.recordSheetSuccess(sheet.id(), success.answers(), success.ambiguityCount());
            } else if (outcome instanceof SheetOutcome.Failure failure) {
                jobService.recordSheetFailure(sheet.id(), failure.reason());
            }
        } catch (RuntimeException e) {
            log.error("Failed to record outcome of sheet {} in job {}", sheet.id(), sheet.jobId(), e);
        }
    }
}
