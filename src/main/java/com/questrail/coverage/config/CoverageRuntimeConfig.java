package com.questrail.coverage.config;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for the coverage production runtime.
 *
 * @param controlServerUri base URI the {@code coverageRequest} and {@code coverageResult} paths are resolved against
 * @param jdbcUrl          URL of the embedded H2 database holding unsent fences
 */
public record CoverageRuntimeConfig(
        URI controlServerUri,
        Duration httpRequestTimeout,
        String jdbcUrl,
        CoverageTimingPolicy timingPolicy
) {
    public CoverageRuntimeConfig {
        Objects.requireNonNull(controlServerUri, "controlServerUri");
        Objects.requireNonNull(httpRequestTimeout, "httpRequestTimeout");
        Objects.requireNonNull(jdbcUrl, "jdbcUrl");
        Objects.requireNonNull(timingPolicy, "timingPolicy");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private URI controlServerUri;
        private Duration httpRequestTimeout = Duration.ofSeconds(10);
        private String jdbcUrl = "jdbc:h2:./coverage-store";
        private CoverageTimingPolicy timingPolicy = CoverageTimingPolicy.defaults();

        public Builder withControlServerUri(URI uri) {
            this.controlServerUri = uri;
            return this;
        }

        public Builder withHttpRequestTimeout(Duration timeout) {
            this.httpRequestTimeout = timeout;
            return this;
        }

        public Builder withJdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
            return this;
        }

        public Builder withTimingPolicy(CoverageTimingPolicy timingPolicy) {
            this.timingPolicy = timingPolicy;
            return this;
        }

        public CoverageRuntimeConfig build() {
            return new CoverageRuntimeConfig(controlServerUri, httpRequestTimeout, jdbcUrl, timingPolicy);
        }
    }
}
