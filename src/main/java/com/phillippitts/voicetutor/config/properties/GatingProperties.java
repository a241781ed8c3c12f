package com.phillippitts.voicetutor.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Admission-control thresholds for incoming turns.
 *
 * <p>{@code minDurationMs} and {@code minConfidence} are optional overrides; when unset the values
 * of the selected {@link Profile} apply. Environment variables {@code ASR_PROFILE}, {@code ASR_MIN_MS},
 * {@code ASR_MIN_CONFIDENCE}, {@code VAD_SILENCE_MS} and {@code MAX_UTTERANCE_MS} are mapped in
 * application.properties.
 */
@ConfigurationProperties(prefix = "gating")
@Validated
public class GatingProperties {

    /** Named speech-quality profiles. */
    public enum Profile {
        STRICT(300, 0.6),
        BALANCED(250, 0.5),
        AGGRESSIVE(150, 0.3);

        private final int minDurationMs;
        private final double minConfidence;

        Profile(int minDurationMs, double minConfidence) {
            this.minDurationMs = minDurationMs;
            this.minConfidence = minConfidence;
        }

        public int getMinDurationMs() {
            return minDurationMs;
        }

        public double getMinConfidence() {
            return minConfidence;
        }
    }

    @NotNull
    private Profile profile = Profile.BALANCED;

    /** Overrides the profile's minimum speech duration when set. */
    @Min(0)
    private Integer minDurationMs;

    /** Overrides the profile's minimum recognizer confidence when set. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private Double minConfidence;

    /** Silence gap after the last detected speech that finalizes a partial utterance. */
    @Positive(message = "VAD silence must be positive")
    private int vadSilenceMs = 250;

    /** Utterances longer than this are rejected regardless of quality. */
    @Positive(message = "Maximum utterance duration must be positive")
    private int maxUtteranceMs = 6000;

    /** Number of recent normalized inputs per session checked for repetition. */
    @Positive(message = "Repetition window must be positive")
    private int repetitionWindow = 5;

    public Profile getProfile() {
        return profile;
    }

    public void setProfile(Profile profile) {
        this.profile = profile == null ? Profile.BALANCED : profile;
    }

    public Integer getMinDurationMs() {
        return minDurationMs;
    }

    public void setMinDurationMs(Integer minDurationMs) {
        this.minDurationMs = minDurationMs;
    }

    public Double getMinConfidence() {
        return minConfidence;
    }

    public void setMinConfidence(Double minConfidence) {
        this.minConfidence = minConfidence;
    }

    public int getVadSilenceMs() {
        return vadSilenceMs;
    }

    public void setVadSilenceMs(int vadSilenceMs) {
        this.vadSilenceMs = vadSilenceMs;
    }

    public int getMaxUtteranceMs() {
        return maxUtteranceMs;
    }

    public void setMaxUtteranceMs(int maxUtteranceMs) {
        this.maxUtteranceMs = maxUtteranceMs;
    }

    public int getRepetitionWindow() {
        return repetitionWindow;
    }

    public void setRepetitionWindow(int repetitionWindow) {
        this.repetitionWindow = repetitionWindow;
    }

    /** Minimum duration after applying the optional override. */
    public int effectiveMinDurationMs() {
        return minDurationMs != null ? minDurationMs : profile.getMinDurationMs();
    }

    /** Minimum confidence after applying the optional override. */
    public double effectiveMinConfidence() {
        return minConfidence != null ? minConfidence : profile.getMinConfidence();
    }
}
