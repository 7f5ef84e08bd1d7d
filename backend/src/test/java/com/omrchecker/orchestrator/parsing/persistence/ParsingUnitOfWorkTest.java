package com.omrchecker.orchestrator.parsing.persistence;

import com.omrchecker.orchestrator.parsing.model.OmrSheet;
import com.omrchecker.orchestrator.parsing.model.Operator;
import com.omrchecker.orchestrator.parsing.model.ParsingJob;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

// Not @Transactional: rollback and cross-thread visibility must be observed for real.
@SpringBootTest
@ActiveProfiles("test")
class ParsingUnitOfWorkTest {

    @Autowired
    private ParsingUnitOfWork unitOfWork;

    private Operator operator;

    @BeforeEach
    void setUp() {
        operator = unitOfWork.operators().create(new Operator(
            UUID.randomUUID().toString(),
            UUID.randomUUID().toString(),
            "https://example.com/hook",
            null
        ));
    }

    @AfterEach
    void tearDown() {
        unitOfWork.operators().delete(operator.id());
    }

    @Test
    void inTransactionCommitsOnNormalReturn() {
        String jobId = id("job_");

        unitOfWork.inTransaction(uow -> {
            uow.jobs().create(ParsingJob.pending(jobId, operator.id(), 1, null, null));
            uow.sheets().create(OmrSheet.pending(id("sheet_"), jobId, "a", 0, "/tmp/a.jpg", null));
            return null;
        });

        assertThat(unitOfWork.jobs().findById(jobId)).isPresent();
        assertThat(unitOfWork.sheets().findByJob(jobId)).hasSize(1);
    }

    @Test
    void inTransactionRollsBackEverythingOnException() {
        String jobId = id("job_");

        assertThatThrownBy(() -> unitOfWork.inTransaction(uow -> {
            uow.jobs().create(ParsingJob.pending(jobId, operator.id(), 2, null, null));
            uow.sheets().create(OmrSheet.pending(id("sheet_"), jobId, "a", 0, "/tmp/a.jpg", null));
            throw new IllegalStateException("induced");
        })).isInstanceOf(IllegalStateException.class).hasMessage("induced");

        assertThat(unitOfWork.jobs().findById(jobId)).isEmpty();
        assertThat(unitOfWork.sheets().findByJob(jobId)).isEmpty();
    }

    @Test
    void scopeClosedWithoutCommitRollsBack() {
        String jobId = id("job_");

        try (ParsingUnitOfWork.TransactionScope scope = unitOfWork.beginTransaction()) {
            unitOfWork.jobs().create(ParsingJob.pending(jobId, operator.id(), 1, null, null));
            assertThat(scope.isFinished()).isFalse();
        }

        assertThat(unitOfWork.jobs().findById(jobId)).isEmpty();
    }

    @Test
    void committedScopePersists() {
        String jobId = id("job_");

        try (ParsingUnitOfWork.TransactionScope scope = unitOfWork.beginTransaction()) {
            unitOfWork.jobs().create(ParsingJob.pending(jobId, operator.id(), 1, null, null));
            scope.commit();
            assertThatThrownBy(scope::commit).isInstanceOf(IllegalStateException.class);
        }

        assertThat(unitOfWork.jobs().findById(jobId)).isPresent();
    }

    @Test
    void deletingOperatorCascadesToJobsAndSheets() {
        String jobId = id("job_");
        unitOfWork.jobs().create(ParsingJob.pending(jobId, operator.id(), 1, null, null));
        String sheetId = id("sheet_");
        unitOfWork.sheets().create(OmrSheet.pending(sheetId, jobId, "a", 0, "/tmp/a.jpg", null));

        assertThat(unitOfWork.operators().delete(operator.id())).isTrue();

        assertThat(unitOfWork.jobs().findById(jobId)).isEmpty();
        assertThat(unitOfWork.sheets().findById(sheetId)).isEmpty();
    }

    @Test
    void concurrentIncrementsAreNotLost() throws Exception {
        int total = 40;
        String jobId = id("job_");
        unitOfWork.jobs().create(ParsingJob.pending(jobId, operator.id(), total, null, null));

        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<Integer>> futures = new ArrayList<>();
            for (int i = 0; i < total + 10; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return unitOfWork.jobs().incrementProcessed(jobId);
                }));
            }
            start.countDown();
            for (Future<Integer> future : futures) {
                assertThat(future.get(30, TimeUnit.SECONDS)).isBetween(1, total);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(unitOfWork.jobs().findById(jobId).orElseThrow().processedSheets()).isEqualTo(total);
    }

    private static String id(String prefix) {
        return prefix + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
