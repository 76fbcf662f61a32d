package com.lineage.sync.graph;

import java.net.URI;
import java.time.Duration;

/**
 * Connection settings for the remote graph endpoint.
 * Use {@link #builder()} to create instances.
 */
public class EndpointOptions {

    private final URI endpoint;
    private final String region;
    private final String serviceName;
    private final Duration requestTimeout;
    private final Duration connectTimeout;

    private EndpointOptions(Builder builder) {
        this.endpoint = EndpointValidator.resolve(builder.endpoint);
        this.region = builder.region;
        this.serviceName = builder.serviceName;
        this.requestTimeout = builder.requestTimeout;
        this.connectTimeout = builder.connectTimeout;
    }

    public URI getEndpoint() {
        return endpoint;
    }

    public String getRegion() {
        return region;
    }

    public String getServiceName() {
        return serviceName;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "EndpointOptions{" +
                "endpoint=" + endpoint +
                ", region='" + region + '\'' +
                ", requestTimeout=" + requestTimeout +
                '}';
    }

    public static class Builder {
        private String endpoint;
        private String region;
        private String serviceName = SigV4RequestSigner.NEPTUNE_SERVICE;
        private Duration requestTimeout = Duration.ofSeconds(30);
        private Duration connectTimeout = Duration.ofSeconds(10);

        /**
         * Bare host name or full {@code https://} URL.
         */
        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder region(String region) {
            this.region = region;
            return this;
        }

        public Builder serviceName(String serviceName) {
            if (serviceName == null || serviceName.isBlank()) {
                throw new IllegalArgumentException("serviceName must not be blank");
            }
            this.serviceName = serviceName;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
                throw new IllegalArgumentException("requestTimeout must be positive");
            }
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
                throw new IllegalArgumentException("connectTimeout must be positive");
            }
            this.connectTimeout = connectTimeout;
            return this;
        }

        /**
         * @throws EndpointConfigurationException if the endpoint is missing or not HTTPS
         */
        public EndpointOptions build() {
            return new EndpointOptions(this);
        }
    }
}
