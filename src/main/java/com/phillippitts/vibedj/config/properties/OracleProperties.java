package com.phillippitts.vibedj.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * HTTP endpoints of the vibe and recommender oracles.
 */
@Validated
@ConfigurationProperties(prefix = "dj.oracle")
public class OracleProperties {

    @NotBlank
    private final String vibeUrl;

    @NotBlank
    private final String recommenderUrl;

    @Positive
    private final long requestTimeoutMs;

    @ConstructorBinding
    public OracleProperties(String vibeUrl, String recommenderUrl, Long requestTimeoutMs) {
        this.vibeUrl = vibeUrl == null ? "http://localhost:8090/vibe" : vibeUrl;
        this.recommenderUrl = recommenderUrl == null ? "http://localhost:8090/recommend" : recommenderUrl;
        this.requestTimeoutMs = requestTimeoutMs == null ? 60_000L : requestTimeoutMs;
    }

    public String getVibeUrl() {
        return vibeUrl;
    }

    public String getRecommenderUrl() {
        return recommenderUrl;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }
}
