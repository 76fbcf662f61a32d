package com.lineage.sync.graph;

/**
 * Sends one query to the graph store and returns the raw response body.
 * Abstracts the wire protocol so the endpoint client can be tested without a
 * remote store.
 */
public interface QueryTransport extends AutoCloseable {

    /**
     * Submits a query.
     *
     * @param query the query to send
     * @return the raw response body
     * @throws ConcurrentModificationConflictException if the store reports a concurrent modification
     * @throws QueryRejectedException                  if the store rejects the query
     * @throws TransientQueryException                 on network failure, timeout or server error
     */
    String submit(GraphQuery query);

    /**
     * Human-readable description of the target, for logging.
     */
    String describe();

    @Override
    default void close() {
    }
}
