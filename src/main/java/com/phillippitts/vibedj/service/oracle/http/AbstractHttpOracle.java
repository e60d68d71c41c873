package com.phillippitts.vibedj.service.oracle.http;

import com.phillippitts.vibedj.exception.OracleException;
import com.phillippitts.vibedj.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Shared JSON-over-HTTP plumbing for the oracles.
 *
 * <p>Subclasses build the request body and parse the response; this class owns the POST,
 * the timeout and the translation of transport failures into {@link OracleException}.
 */
public abstract class AbstractHttpOracle {

    private static final Logger LOG = LogManager.getLogger(AbstractHttpOracle.class);

    private final HttpClient httpClient;
    private final URI endpoint;
    private final Duration timeout;

    protected AbstractHttpOracle(HttpClient httpClient, String endpoint, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.endpoint = URI.create(Objects.requireNonNull(endpoint, "endpoint must not be null"));
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
    }

    /** Oracle name used in logs, metrics and exceptions. */
    public abstract String oracleName();

    /**
     * POSTs a JSON body and returns the response body.
     *
     * @throws OracleException on transport errors, interruption or a non-2xx status
     */
    protected String postJson(String body) {
        HttpRequest request = HttpRequest.newBuilder(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
        long t0 = System.nanoTime();
        try {
            HttpResponse<String> response = httpClient.send(request,
                    HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            LOG.debug("{} oracle answered status={} in {} ms", oracleName(), response.statusCode(),
                    TimeUtils.elapsedMillis(t0));
            if (response.statusCode() / 100 != 2) {
                throw new OracleException("Unexpected HTTP status " + response.statusCode(), oracleName());
            }
            return response.body();
        } catch (IOException e) {
            throw new OracleException("Request to " + endpoint + " failed: " + e.getMessage(), oracleName(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleException("Interrupted while waiting for oracle", oracleName(), e);
        }
    }
}
