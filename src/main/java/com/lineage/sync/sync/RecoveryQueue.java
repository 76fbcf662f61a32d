package com.lineage.sync.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/**
 * Failed units recorded during the main pass, drained exactly once afterwards.
 *
 * <p>Recording is safe from any worker thread. Once drained, the queue accepts
 * no more operations and cannot be drained again.</p>
 */
public class RecoveryQueue {
    private static final Logger log = LoggerFactory.getLogger(RecoveryQueue.class);

    static final int MAX_LISTED_FAILURES = 5;

    private final ConcurrentLinkedQueue<PendingOperation> pending = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean drained = new AtomicBoolean(false);

    /**
     * @throws IllegalStateException if the queue has already been drained
     */
    public void record(PendingOperation operation) {
        if (drained.get()) {
            throw new IllegalStateException("Recovery queue has already been drained");
        }
        pending.add(operation);
        log.debug("Recorded pending operation: {}", operation.describe());
    }

    /**
     * Replays every recorded operation once. Operations for which
     * {@code replay} returns true are removed; the rest are returned as
     * unresolved. A replay that throws counts as unresolved.
     *
     * @throws IllegalStateException on a second call
     */
    public RecoveryResult drain(Predicate<PendingOperation> replay) {
        if (!drained.compareAndSet(false, true)) {
            throw new IllegalStateException("Recovery queue has already been drained");
        }

        List<PendingOperation> items = new ArrayList<>(pending);
        pending.clear();
        if (items.isEmpty()) {
            log.info("recovery.skipped reason=no_failures");
            return new RecoveryResult(0, 0, List.of());
        }

        log.info("recovery.started pending={}", items.size());
        List<PendingOperation> unresolved = new ArrayList<>();
        int recovered = 0;
        for (PendingOperation op : items) {
            boolean ok;
            try {
                ok = replay.test(op);
            } catch (RuntimeException e) {
                log.warn("Replay of {} failed unexpectedly", op.describe(), e);
                ok = false;
            }
            if (ok) {
                recovered++;
            } else {
                unresolved.add(op);
            }
        }

        log.info("recovery.completed attempted={} recovered={} unresolved={}",
                items.size(), recovered, unresolved.size());
        if (!unresolved.isEmpty()) {
            unresolved.stream().limit(MAX_LISTED_FAILURES)
                    .forEach(op -> log.warn("Unresolved after recovery: {}", op.describe()));
            if (unresolved.size() > MAX_LISTED_FAILURES) {
                log.warn("... and {} more unresolved operations", unresolved.size() - MAX_LISTED_FAILURES);
            }
        }
        return new RecoveryResult(items.size(), recovered, unresolved);
    }

    public boolean isDrained() {
        return drained.get();
    }

    public int size() {
        return pending.size();
    }

    /**
     * Operations recorded and not yet drained.
     */
    public List<PendingOperation> snapshot() {
        return List.copyOf(pending);
    }
}
