package com.lineage.sync.graph;

import com.lineage.sync.core.LineageSyncException;

/**
 * Thrown when the graph endpoint is invalid or uses a scheme other than HTTPS.
 */
public class EndpointConfigurationException extends LineageSyncException {

    public EndpointConfigurationException(String message) {
        super(message);
    }

    public EndpointConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
