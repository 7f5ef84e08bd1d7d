package com.omrchecker.orchestrator.parsing.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Function;

/**
 * The three parsing repositories behind one transaction boundary. Repository calls made inside
 * {@link #inTransaction(Function)} or an open {@link TransactionScope} share one connection and
 * commit or roll back together; calls made outside auto-commit individually.
 */
@Component
public class ParsingUnitOfWork {
    private static final Logger log = LoggerFactory.getLogger(ParsingUnitOfWork.class);

    private final OperatorRepository operators;
    private final ParsingJobRepository jobs;
    private final OmrSheetRepository sheets;
    private final PlatformTransactionManager transactionManager;
    private final TransactionTemplate transactionTemplate;

    public ParsingUnitOfWork(
        OperatorRepository operators,
        ParsingJobRepository jobs,
        OmrSheetRepository sheets,
        PlatformTransactionManager transactionManager
    ) {
        this.operators = operators;
        this.jobs = jobs;
        this.sheets = sheets;
        this.transactionManager = transactionManager;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public OperatorRepository operators() {
        return operators;
    }

    public ParsingJobRepository jobs() {
        return jobs;
    }

    public OmrSheetRepository sheets() {
        return sheets;
    }

    /**
     * Runs {@code work} in a transaction. Commits on normal return; any exception rolls back and is rethrown.
     */
    public <T> T inTransaction(Function<ParsingUnitOfWork, T> work) {
        return transactionTemplate.execute(status -> work.apply(this));
    }

    /**
     * Opens a transaction bound to the calling thread. Must be closed on the same thread, normally
     * with try-with-resources; closing without {@link TransactionScope#commit()} rolls back.
     */
    public TransactionScope beginTransaction() {
        DefaultTransactionDefinition definition = new DefaultTransactionDefinition();
        definition.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        return new TransactionScope(transactionManager, transactionManager.getTransaction(definition));
    }

    public static final class TransactionScope implements AutoCloseable {
        private final PlatformTransactionManager transactionManager;
        private final TransactionStatus status;
        private boolean finished;

        private TransactionScope(PlatformTransactionManager transactionManager, TransactionStatus status) {
            this.transactionManager = transactionManager;
            this.status = status;
        }

        public void commit() {
            if (finished) {
                throw new IllegalStateException("Transaction already finished");
            }
            finished = true;
            transactionManager.commit(status);
        }

        public void rollback() {
            if (finished) {
                return;
            }
            finished = true;
            transactionManager.rollback(status);
        }

        public boolean isFinished() {
            return finished;
        }

        @Override
        public void close() {
            if (!finished) {
                log.debug("Rolling back uncommitted transaction scope");
                rollback();
            }
        }
    }
}
