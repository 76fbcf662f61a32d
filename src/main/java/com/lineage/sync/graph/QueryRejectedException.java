package com.lineage.sync.graph;

/**
 * The store rejected the query for a reason other than a concurrency conflict.
 */
public class QueryRejectedException extends GraphQueryException {

    private final int statusCode;

    public QueryRejectedException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
