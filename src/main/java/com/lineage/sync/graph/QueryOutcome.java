package com.lineage.sync.graph;

/**
 * Result of one logical query, after any inline conflict retries.
 *
 * @param status          how the query ended
 * @param conflictRetries number of retries caused by conflicts
 * @param body            raw response body on success, null otherwise
 * @param error           last failure, null on success
 */
public record QueryOutcome(
        Status status,
        int conflictRetries,
        String body,
        GraphQueryException error
) {

    public enum Status {
        SUCCEEDED,
        /** Every attempt hit a concurrent modification conflict. */
        CONFLICT_EXHAUSTED,
        TRANSIENT_FAILURE,
        REJECTED
    }

    public static QueryOutcome succeeded(String body, int conflictRetries) {
        return new QueryOutcome(Status.SUCCEEDED, conflictRetries, body, null);
    }

    public static QueryOutcome failed(GraphQueryException error, int conflictRetries) {
        Status status;
        if (error instanceof ConcurrentModificationConflictException) {
            status = Status.CONFLICT_EXHAUSTED;
        } else if (error instanceof QueryRejectedException) {
            status = Status.REJECTED;
        } else {
            status = Status.TRANSIENT_FAILURE;
        }
        return new QueryOutcome(status, conflictRetries, null, error);
    }

    public boolean isSuccess() {
        return status == Status.SUCCEEDED;
    }

    /**
     * Short description of the failure for logs, or {@code "ok"}.
     */
    public String describe() {
        return error == null ? "ok" : status + ": " + error.getMessage();
    }
}
