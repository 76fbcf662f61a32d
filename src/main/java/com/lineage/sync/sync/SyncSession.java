package com.lineage.sync.sync;

import com.lineage.sync.core.model.LineageEdge;
import com.lineage.sync.logging.LogContext;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * State of one synchronization run: the vertex, edge, column and column edge
 * ledgers, the recovery queue, the current phase and the run counters.
 *
 * <p>Created per run and shared by all worker threads of that run. Ledger
 * rules:</p>
 * <ul>
 *   <li>a {@code SUCCEEDED} entity is never sent again;</li>
 *   <li>a {@code STILL_FAILED} entity is never sent again;</li>
 *   <li>a {@code FAILED} entity is sent again only in the recovery phase;</li>
 *   <li>a failure never replaces {@code SUCCEEDED};</li>
 *   <li>a failure in the recovery phase is final ({@code STILL_FAILED});</li>
 *   <li>a rejection is final in any phase ({@code STILL_FAILED}), since the
 *       store refused the query itself.</li>
 * </ul>
 */
public class SyncSession {

    public enum Phase { MAIN, RECOVERY }

    /**
     * What a writer should do with an entity.
     */
    public enum Admission {
        /** Send the upsert; the entity is now in flight. */
        SEND,
        /** Already written in this run. */
        ALREADY_SUCCEEDED,
        /** Failed earlier and not eligible for another attempt now. */
        KNOWN_FAILED
    }

    private final String runId;
    private final Map<String, EntityState> vertexLedger = new ConcurrentHashMap<>();
    private final Map<String, EntityState> edgeLedger = new ConcurrentHashMap<>();
    private final Map<String, EntityState> columnLedger = new ConcurrentHashMap<>();
    private final Map<String, EntityState> columnEdgeLedger = new ConcurrentHashMap<>();
    private final RecoveryQueue recoveryQueue = new RecoveryQueue();
    private volatile Phase phase = Phase.MAIN;

    private final AtomicLong verticesUpserted = new AtomicLong();
    private final AtomicLong edgesUpserted = new AtomicLong();
    private final AtomicLong columnsUpserted = new AtomicLong();
    private final AtomicLong columnEdgesUpserted = new AtomicLong();
    private final AtomicLong conflictRetries = new AtomicLong();

    public SyncSession() {
        this(LogContext.generateRunId());
    }

    public SyncSession(String runId) {
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }

    public Phase getPhase() {
        return phase;
    }

    public void enterRecoveryPhase() {
        phase = Phase.RECOVERY;
    }

    public RecoveryQueue getRecoveryQueue() {
        return recoveryQueue;
    }

    // ========== Vertex ledger ==========

    public Admission admitVertex(String nodeId) {
        return admit(vertexLedger, nodeId);
    }

    public void vertexSucceeded(String nodeId) {
        // two workers may both send a vertex that was in flight; count it once
        if (vertexLedger.put(nodeId, EntityState.SUCCEEDED) != EntityState.SUCCEEDED) {
            verticesUpserted.incrementAndGet();
        }
    }

    public void vertexFailed(String nodeId) {
        fail(vertexLedger, nodeId);
    }

    public void vertexRejected(String nodeId) {
        reject(vertexLedger, nodeId);
    }

    public EntityState vertexState(String nodeId) {
        return vertexLedger.getOrDefault(nodeId, EntityState.NOT_ATTEMPTED);
    }

    // ========== Edge ledger ==========

    public Admission admitEdge(String parent, String child) {
        return admit(edgeLedger, LineageEdge.keyOf(parent, child));
    }

    public void edgeSucceeded(String parent, String child) {
        if (edgeLedger.put(LineageEdge.keyOf(parent, child), EntityState.SUCCEEDED) != EntityState.SUCCEEDED) {
            edgesUpserted.incrementAndGet();
        }
    }

    public void edgeFailed(String parent, String child) {
        fail(edgeLedger, LineageEdge.keyOf(parent, child));
    }

    public void edgeRejected(String parent, String child) {
        reject(edgeLedger, LineageEdge.keyOf(parent, child));
    }

    public EntityState edgeState(String parent, String child) {
        return edgeLedger.getOrDefault(LineageEdge.keyOf(parent, child), EntityState.NOT_ATTEMPTED);
    }

    // ========== Column ledger ==========

    /**
     * Column vertices are keyed by their column id.
     */
    public Admission admitColumn(String columnId) {
        return admit(columnLedger, columnId);
    }

    public void columnSucceeded(String columnId) {
        if (columnLedger.put(columnId, EntityState.SUCCEEDED) != EntityState.SUCCEEDED) {
            columnsUpserted.incrementAndGet();
        }
    }

    public void columnFailed(String columnId) {
        fail(columnLedger, columnId);
    }

    public void columnRejected(String columnId) {
        reject(columnLedger, columnId);
    }

    public EntityState columnState(String columnId) {
        return columnLedger.getOrDefault(columnId, EntityState.NOT_ATTEMPTED);
    }

    // ========== Column edge ledger ==========

    /**
     * Membership and column lineage edges, keyed by the caller.
     */
    public Admission admitColumnEdge(String key) {
        return admit(columnEdgeLedger, key);
    }

    public void columnEdgeSucceeded(String key) {
        if (columnEdgeLedger.put(key, EntityState.SUCCEEDED) != EntityState.SUCCEEDED) {
            columnEdgesUpserted.incrementAndGet();
        }
    }

    public void columnEdgeFailed(String key) {
        fail(columnEdgeLedger, key);
    }

    public void columnEdgeRejected(String key) {
        reject(columnEdgeLedger, key);
    }

    public EntityState columnEdgeState(String key) {
        return columnEdgeLedger.getOrDefault(key, EntityState.NOT_ATTEMPTED);
    }

    // ========== Counters ==========

    public void addConflictRetries(int retries) {
        if (retries > 0) {
            conflictRetries.addAndGet(retries);
        }
    }

    public long getVerticesUpserted() {
        return verticesUpserted.get();
    }

    public long getEdgesUpserted() {
        return edgesUpserted.get();
    }

    public long getColumnsUpserted() {
        return columnsUpserted.get();
    }

    public long getColumnEdgesUpserted() {
        return columnEdgesUpserted.get();
    }

    public long getConflictRetries() {
        return conflictRetries.get();
    }

    // ========== State machine ==========

    private Admission admit(Map<String, EntityState> ledger, String key) {
        Admission[] admission = new Admission[1];
        ledger.compute(key, (k, state) -> {
            if (state == null || state == EntityState.NOT_ATTEMPTED) {
                admission[0] = Admission.SEND;
                return EntityState.IN_FLIGHT;
            }
            switch (state) {
                case SUCCEEDED:
                    admission[0] = Admission.ALREADY_SUCCEEDED;
                    return state;
                case STILL_FAILED:
                    admission[0] = Admission.KNOWN_FAILED;
                    return state;
                case FAILED:
                    if (phase == Phase.RECOVERY) {
                        admission[0] = Admission.SEND;
                        return EntityState.IN_FLIGHT;
                    }
                    admission[0] = Admission.KNOWN_FAILED;
                    return state;
                default:
                    // in flight on another worker; the upsert is idempotent
                    admission[0] = Admission.SEND;
                    return state;
            }
        });
        return admission[0];
    }

    private void fail(Map<String, EntityState> ledger, String key) {
        EntityState failed = phase == Phase.RECOVERY ? EntityState.STILL_FAILED : EntityState.FAILED;
        ledger.compute(key, (k, state) -> state == EntityState.SUCCEEDED ? state : failed);
    }

    private void reject(Map<String, EntityState> ledger, String key) {
        ledger.compute(key, (k, state) -> state == EntityState.SUCCEEDED ? state : EntityState.STILL_FAILED);
    }
}
