package com.questrail.coverage.controlserver;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * HttpControlServerClient
 * =============================================================================
 * {@link ControlServerApi} over {@link HttpClient} with Jackson JSON bodies.
 *
 * <p>Both calls block the calling thread; callers run them on a background
 * executor. A response counts as success iff its status is in {@code [200, 300)}.</p>
 */
public final class HttpControlServerClient implements ControlServerApi {

    private static final Logger log = LoggerFactory.getLogger(HttpControlServerClient.class);

    static final String COVERAGE_REQUEST_PATH = "coverageRequest";
    static final String COVERAGE_RESULT_PATH = "coverageResult";

    private final URI baseUri;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    public HttpControlServerClient(URI baseUri, HttpClient httpClient, ObjectMapper objectMapper, Duration requestTimeout) {
        Objects.requireNonNull(baseUri, "baseUri");
        String base = baseUri.toString();
        this.baseUri = base.endsWith("/") ? baseUri : URI.create(base + "/");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    }

    @Override
    public CoverageSessionResponse requestCoverageSession(CoverageSessionRequest request) throws ControlServerException {
        Objects.requireNonNull(request, "request");

        HttpResponse<String> response;
        try {
            response = post(COVERAGE_REQUEST_PATH, objectMapper.writeValueAsString(request));
        } catch (IOException e) {
            throw new ControlServerException("coverage session request failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ControlServerException("coverage session request interrupted", e);
        }

        if (!isSuccess(response.statusCode())) {
            throw new ControlServerException(
                    "coverage session request rejected with HTTP " + response.statusCode(), response.statusCode(), null);
        }

        try {
            return objectMapper.readValue(response.body(), CoverageSessionResponse.class);
        } catch (JsonProcessingException e) {
            throw new ControlServerException("coverage session response is not valid JSON", response.statusCode(), e);
        }
    }

    @Override
    public void submitCoverageResult(CoverageResultRequest request) throws CoverageSubmissionException {
        Objects.requireNonNull(request, "request");

        HttpResponse<String> response;
        try {
            response = post(COVERAGE_RESULT_PATH, objectMapper.writeValueAsString(request));
        } catch (IOException e) {
            throw new CoverageSubmissionException("coverage result submission failed", -1, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CoverageSubmissionException("coverage result submission interrupted", -1, e);
        }

        if (!isSuccess(response.statusCode())) {
            throw new CoverageSubmissionException(
                    "coverage result for " + request.testUuid() + " rejected with HTTP " + response.statusCode(),
                    response.statusCode(), null);
        }
        log.debug("Coverage result for {} accepted with HTTP {}", request.testUuid(), response.statusCode());
    }

    static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }

    private HttpResponse<String> post(String path, String json) throws IOException, InterruptedException {
        HttpRequest httpRequest = HttpRequest.newBuilder(baseUri.resolve(path))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                .build();
        return httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }
}
