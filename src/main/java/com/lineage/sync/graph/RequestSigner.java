package com.lineage.sync.graph;

import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * Produces the headers of an outgoing request, including any authentication
 * headers.
 */
@FunctionalInterface
public interface RequestSigner {

    /**
     * Signs a request.
     *
     * @param method  HTTP method
     * @param uri     target URI
     * @param headers headers already set on the request
     * @param body    request body
     * @return the complete header set to send
     */
    Map<String, List<String>> sign(String method, URI uri, Map<String, List<String>> headers, String body);

    /**
     * Sends the headers unchanged, for stores that do not use IAM authentication.
     */
    RequestSigner UNSIGNED = (method, uri, headers, body) -> headers;
}
