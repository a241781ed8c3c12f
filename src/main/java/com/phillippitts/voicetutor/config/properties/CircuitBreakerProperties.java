package com.phillippitts.voicetutor.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Thresholds for the generation-backend circuit breaker.
 */
@ConfigurationProperties(prefix = "circuit")
@Validated
public class CircuitBreakerProperties {

    /** Name used in logs, events and metrics tags. */
    private String name = "generation";

    /** Failure rate (percent) that opens the circuit once {@link #minimumRequests} were observed. */
    @Min(1)
    @Max(100)
    private int failureRateThreshold = 50;

    /** Requests observed before the failure rate is considered. */
    @Positive
    private int minimumRequests = 5;

    /** Cumulative 429/5xx/quota failures that open the circuit regardless of rate. */
    @Positive
    private int distressFailureThreshold = 3;

    /** Per-attempt timeout for batch callers. */
    @Positive(message = "Timeout must be positive")
    private long timeoutMs = 30_000;

    /** Per-attempt timeout for interactive (voice) turns. */
    @Positive(message = "Interactive timeout must be positive")
    private long interactiveTimeoutMs = 3_000;

    /** Delay before an OPEN circuit moves to HALF_OPEN. */
    @Positive(message = "Cooldown must be positive")
    private long cooldownMs = 45_000;

    /** Total attempts per call, first attempt included. */
    @Min(1)
    private int maxAttempts = 4;

    /** Sleep after failed attempt i (0-based); the last entry repeats if attempts outnumber entries. */
    @NotEmpty
    private List<Long> retryDelaysMs = new ArrayList<>(List.of(250L, 500L, 1000L, 2000L));

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getFailureRateThreshold() {
        return failureRateThreshold;
    }

    public void setFailureRateThreshold(int failureRateThreshold) {
        this.failureRateThreshold = failureRateThreshold;
    }

    public int getMinimumRequests() {
        return minimumRequests;
    }

    public void setMinimumRequests(int minimumRequests) {
        this.minimumRequests = minimumRequests;
    }

    public int getDistressFailureThreshold() {
        return distressFailureThreshold;
    }

    public void setDistressFailureThreshold(int distressFailureThreshold) {
        this.distressFailureThreshold = distressFailureThreshold;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public void setTimeoutMs(long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public long getInteractiveTimeoutMs() {
        return interactiveTimeoutMs;
    }

    public void setInteractiveTimeoutMs(long interactiveTimeoutMs) {
        this.interactiveTimeoutMs = interactiveTimeoutMs;
    }

    public long getCooldownMs() {
        return cooldownMs;
    }

    public void setCooldownMs(long cooldownMs) {
        this.cooldownMs = cooldownMs;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public List<Long> getRetryDelaysMs() {
        return retryDelaysMs;
    }

    public void setRetryDelaysMs(List<Long> retryDelaysMs) {
        this.retryDelaysMs = retryDelaysMs;
    }
}
