package com.openforge.kairn.store;

import com.openforge.kairn.error.KairnException;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Transaction boundary for every core operation.
 *
 * Call graph:
 *
 *   write(work)
 *     └─ workspaceWrites bulkhead (1 permit, bounded wait)
 *           └─ TransactionTemplate (read-write, bounded timeout)
 *                 └─ work
 *
 *   read(work)
 *     └─ TransactionTemplate (read-only, bounded timeout)
 *           └─ work
 *
 * A write issued while a write transaction is already open on this thread
 * joins it instead of asking for a second permit, so composite operations
 * (learn, promotion) commit or roll back as one unit.
 *
 * Fully programmatic — no AOP proxies, no annotations.
 */
@Slf4j
@Component
public class WorkspaceTransactions {

    private final Bulkhead            writeBulkhead;
    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readTemplate;

    public WorkspaceTransactions(PlatformTransactionManager transactionManager,
                                 Bulkhead workspaceWriteBulkhead,
                                 StoreProperties storeProperties) {
        int timeoutSeconds = (int) Math.max(1, storeProperties.timeout().toSeconds());

        this.writeBulkhead = workspaceWriteBulkhead;

        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.writeTemplate.setTimeout(timeoutSeconds);

        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setReadOnly(true);
        this.readTemplate.setTimeout(timeoutSeconds);
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public <T> T write(Supplier<T> work) {
        if (inWriteTransaction()) {
            return work.get();
        }
        Supplier<T> decorated = Bulkhead.decorateSupplier(writeBulkhead,
                () -> writeTemplate.execute(status -> work.get()));
        try {
            return decorated.get();
        } catch (BulkheadFullException e) {
            throw KairnException.storeFailure(
                    "Workspace is busy: another write did not finish in time", e);
        } catch (DataAccessException | TransactionException e) {
            throw KairnException.storeFailure("Store rejected the write: " + e.getMessage(), e);
        }
    }

    public void write(Runnable work) {
        write(() -> {
            work.run();
            return null;
        });
    }

    public <T> T read(Supplier<T> work) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            return work.get();
        }
        try {
            return readTemplate.execute(status -> work.get());
        } catch (DataAccessException | TransactionException e) {
            throw KairnException.storeFailure("Store rejected the read: " + e.getMessage(), e);
        }
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private static boolean inWriteTransaction() {
        return TransactionSynchronizationManager.isActualTransactionActive()
                && !TransactionSynchronizationManager.isCurrentTransactionReadOnly();
    }
}
