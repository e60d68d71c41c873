package com.phillippitts.vibedj.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Vibe planner recheck cadence and chat signature window.
 */
@Validated
@ConfigurationProperties(prefix = "dj.vibe")
public class VibeProperties {

    @Positive
    private final int recheckIntervalMinutes;

    @Min(0)
    private final int failureBackoffSeconds;

    /** Used when the oracle omits or mangles the plan duration. */
    @Min(15)
    @Max(60)
    private final int defaultPlanDurationMinutes;

    @Positive
    private final int signatureMessages;

    @Positive
    private final int signatureChars;

    @Positive
    private final int planningLookbackHours;

    @ConstructorBinding
    public VibeProperties(Integer recheckIntervalMinutes,
                          Integer failureBackoffSeconds,
                          Integer defaultPlanDurationMinutes,
                          Integer signatureMessages,
                          Integer signatureChars,
                          Integer planningLookbackHours) {
        this.recheckIntervalMinutes = recheckIntervalMinutes == null ? 30 : recheckIntervalMinutes;
        this.failureBackoffSeconds = failureBackoffSeconds == null ? 60 : failureBackoffSeconds;
        this.defaultPlanDurationMinutes = defaultPlanDurationMinutes == null ? 60 : defaultPlanDurationMinutes;
        this.signatureMessages = signatureMessages == null ? 5 : signatureMessages;
        this.signatureChars = signatureChars == null ? 200 : signatureChars;
        this.planningLookbackHours = planningLookbackHours == null ? 3 : planningLookbackHours;
    }

    public static VibeProperties defaults() {
        return new VibeProperties(null, null, null, null, null, null);
    }

    public int getRecheckIntervalMinutes() {
        return recheckIntervalMinutes;
    }

    public int getFailureBackoffSeconds() {
        return failureBackoffSeconds;
    }

    public int getDefaultPlanDurationMinutes() {
        return defaultPlanDurationMinutes;
    }

    public int getSignatureMessages() {
        return signatureMessages;
    }

    public int getSignatureChars() {
        return signatureChars;
    }

    public int getPlanningLookbackHours() {
        return planningLookbackHours;
    }
}
