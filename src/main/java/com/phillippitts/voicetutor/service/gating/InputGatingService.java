package com.phillippitts.voicetutor.service.gating;

import com.phillippitts.voicetutor.config.properties.GatingProperties;
import com.phillippitts.voicetutor.domain.SpeechMetadata;
import com.phillippitts.voicetutor.domain.Turn;
import com.phillippitts.voicetutor.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * Admission control for incoming turns.
 *
 * <p>A turn with non-empty normalized text is admitted unless that text is gibberish or a repeat of
 * the session's recent inputs; speech metadata does not override either check. A turn without text
 * is admitted when its speech metadata meets the duration and confidence thresholds of the active
 * profile. Partial turns are held back until end-of-speech is signalled or
 * the gap since the session's last partial exceeds {@code vadSilenceMs}. Utterances longer than
 * {@code maxUtteranceMs} are always rejected.
 *
 * <p>Side effects are limited to counters, the per-session VAD timestamp and the per-session
 * repetition window. All state is guarded by one lock; decisions are cheap so contention is not a
 * concern.
 */
@Service
public class InputGatingService {

    private static final Logger LOG = LogManager.getLogger(InputGatingService.class);

    private static final Set<String> VALID_SHORT_INPUTS = Set.of(
            "no", "yes", "ok", "hi", "bye", "one", "two", "three", "four", "five",
            "six", "seven", "eight", "nine", "ten", "a", "i", "me", "my", "we", "you");

    private static final Pattern ONE_OR_TWO_LETTERS = Pattern.compile("^[a-z]{1,2}$");
    private static final Pattern REPEATED_CHAR = Pattern.compile("(.)\\1{4,}");
    private static final Pattern NO_VOWEL_WORD = Pattern.compile("^[^aeiouy\\s]+$");
    private static final Pattern HAS_LETTER = Pattern.compile("[a-z]");
    private static final String NUMERIC_CHARS = "[\\d\\s.,+\\-*/x×÷=()]*";
    private static final Pattern NUMERIC_EXPRESSION =
            Pattern.compile("^" + NUMERIC_CHARS + "\\d" + NUMERIC_CHARS + "$");

    private static final Pattern MULTI_EXCLAMATION = Pattern.compile("!{2,}");
    private static final Pattern MULTI_QUESTION = Pattern.compile("\\?{2,}");
    private static final Pattern MULTI_PERIOD = Pattern.compile("\\.{2,}");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[!?.]+$");

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, SessionGate> sessions = new HashMap<>();
    private final Map<String, Long> reasonCounts = new LinkedHashMap<>();
    private final int vadSilenceMs;
    private final int maxUtteranceMs;
    private final int repetitionWindow;

    private String profileName;
    private int minDurationMs;
    private double minConfidence;
    private long totalInputs;
    private long gatedInputs;
    private long validInputs;

    public InputGatingService(GatingProperties properties) {
        Objects.requireNonNull(properties, "properties must not be null");
        this.vadSilenceMs = properties.getVadSilenceMs();
        this.maxUtteranceMs = properties.getMaxUtteranceMs();
        this.repetitionWindow = properties.getRepetitionWindow();
        this.profileName = profileCode(properties.getProfile());
        this.minDurationMs = properties.effectiveMinDurationMs();
        this.minConfidence = properties.effectiveMinConfidence();
        LOG.info("Input gating initialized: profile={}, minDurationMs={}, minConfidence={}, vadSilenceMs={}, "
                + "maxUtteranceMs={}", profileName, minDurationMs, minConfidence, vadSilenceMs, maxUtteranceMs);
    }

    /**
     * Classifies a turn as admissible or not.
     *
     * @param turn turn to classify (non-null)
     * @return admission decision; never null
     */
    public GatingResult validate(Turn turn) {
        Objects.requireNonNull(turn, "turn must not be null");
        lock.lock();
        try {
            totalInputs++;
            SessionGate gate = sessions.computeIfAbsent(turn.sessionId(), id -> new SessionGate());

            if (!resolveEndOfSpeech(gate, turn)) {
                return gate(GateReason.AWAITING_END_OF_SPEECH,
                        "Waiting for end-of-speech or VAD silence detection", false);
            }

            SpeechMetadata speech = turn.speech();
            if (speech != null && speech.durationMs() > maxUtteranceMs) {
                return gate(GateReason.UTTERANCE_TOO_LONG,
                        "Utterance too long: " + speech.durationMs() + "ms > " + maxUtteranceMs + "ms", true);
            }

            String normalized = normalizeInput(turn.text());
            if (!normalized.isEmpty()) {
                if (isGibberish(normalized)) {
                    return gate(GateReason.GIBBERISH, "Input appears to be gibberish or non-meaningful", true);
                }
                if (isRepetitive(gate, normalized)) {
                    return gate(GateReason.REPETITIVE, "Input is repetitive or identical to recent input", true);
                }
                return admit(turn, normalized);
            }

            if (meetsSpeechThresholds(speech)) {
                return admit(turn, "[speech:" + speech.durationMs() + "ms,conf:" + speech.confidence() + "]");
            }
            if (speech != null && speech.durationMs() < minDurationMs) {
                return gate(GateReason.SPEECH_TOO_SHORT,
                        "Speech too short: " + speech.durationMs() + "ms < " + minDurationMs + "ms", true);
            }
            if (speech != null) {
                return gate(GateReason.LOW_CONFIDENCE,
                        "Low confidence: " + speech.confidence() + " < " + minConfidence, true);
            }
            return gate(GateReason.EMPTY_TEXT, "Empty text input", true);
        } finally {
            lock.unlock();
        }
    }

    public GatingMetrics getMetrics() {
        lock.lock();
        try {
            return new GatingMetrics(totalInputs, gatedInputs, validInputs, gatingRate(), reasonCounts);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resets counters and every session's repetition window. VAD timestamps are kept so that an
     * utterance in progress is not finalized early.
     */
    public void resetMetrics() {
        lock.lock();
        try {
            totalInputs = 0;
            gatedInputs = 0;
            validInputs = 0;
            reasonCounts.clear();
            sessions.values().forEach(gate -> gate.recentInputs.clear());
        } finally {
            lock.unlock();
        }
        LOG.info("Input gating metrics reset");
    }

    public GatingProfile getCurrentProfile() {
        lock.lock();
        try {
            return currentProfile();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Overrides the active thresholds. {@code null} leaves the corresponding value unchanged.
     */
    public void adjustThresholds(Integer newMinDurationMs, Double newMinConfidence) {
        if (newMinDurationMs != null && newMinDurationMs < 0) {
            throw new IllegalArgumentException("minDurationMs must be >= 0");
        }
        if (newMinConfidence != null && (newMinConfidence < 0.0 || newMinConfidence > 1.0)) {
            throw new IllegalArgumentException("minConfidence must be within [0, 1]");
        }
        lock.lock();
        try {
            if (newMinDurationMs != null) {
                minDurationMs = newMinDurationMs;
            }
            if (newMinConfidence != null) {
                minConfidence = newMinConfidence;
            }
            LOG.info("Gating thresholds adjusted: minDurationMs={}, minConfidence={}", minDurationMs, minConfidence);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Switches to a named profile and applies its thresholds.
     *
     * @param name {@code strict}, {@code balanced} or {@code aggressive} (case-insensitive)
     * @throws IllegalArgumentException for an unknown profile name
     */
    public void switchProfile(String name) {
        Objects.requireNonNull(name, "name must not be null");
        GatingProperties.Profile profile;
        try {
            profile = GatingProperties.Profile.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown gating profile: " + name, e);
        }
        lock.lock();
        try {
            profileName = profileCode(profile);
            minDurationMs = profile.getMinDurationMs();
            minConfidence = profile.getMinConfidence();
            LOG.info("Gating profile switched to {} (minDurationMs={}, minConfidence={})",
                    profileName, minDurationMs, minConfidence);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops VAD and repetition state for a session.
     */
    public void clearSession(String sessionId) {
        lock.lock();
        try {
            sessions.remove(sessionId);
        } finally {
            lock.unlock();
        }
    }

    public GatingDebugInfo getDebugInfo(String sessionId) {
        lock.lock();
        try {
            SessionGate gate = sessions.get(sessionId);
            if (gate == null) {
                return new GatingDebugInfo(sessionId, null, List.of(), currentProfile());
            }
            return new GatingDebugInfo(sessionId, gate.lastSpeechAt, List.copyOf(gate.recentInputs), currentProfile());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Lowercases, collapses repeated {@code ! ? .} and whitespace, and strips trailing punctuation.
     */
    static String normalizeInput(String input) {
        if (input == null) {
            return "";
        }
        String s = input.toLowerCase(Locale.ROOT).trim();
        s = MULTI_EXCLAMATION.matcher(s).replaceAll("!");
        s = MULTI_QUESTION.matcher(s).replaceAll("?");
        s = MULTI_PERIOD.matcher(s).replaceAll(".");
        s = WHITESPACE.matcher(s).replaceAll(" ");
        s = TRAILING_PUNCTUATION.matcher(s).replaceAll("");
        return s.trim();
    }

    /**
     * Heuristic check on normalized input. Whitelisted short words and numeric answers pass.
     */
    static boolean isGibberish(String normalized) {
        if (VALID_SHORT_INPUTS.contains(normalized)) {
            return false;
        }
        if (NUMERIC_EXPRESSION.matcher(normalized).matches()) {
            return false;
        }
        return ONE_OR_TWO_LETTERS.matcher(normalized).matches()
                || REPEATED_CHAR.matcher(normalized).find()
                || NO_VOWEL_WORD.matcher(normalized).matches()
                || !HAS_LETTER.matcher(normalized).find();
    }

    // Must be called with lock held
    private boolean resolveEndOfSpeech(SessionGate gate, Turn turn) {
        if (turn.endOfSpeech()) {
            gate.lastSpeechAt = null;
            return true;
        }
        Instant previous = gate.lastSpeechAt;
        gate.lastSpeechAt = turn.submittedAt();
        if (previous != null && Duration.between(previous, turn.submittedAt()).toMillis() >= vadSilenceMs) {
            gate.lastSpeechAt = null;
            return true;
        }
        return false;
    }

    // Must be called with lock held; records the input in the window
    private boolean isRepetitive(SessionGate gate, String normalized) {
        boolean repeat = gate.recentInputs.contains(normalized);
        gate.recentInputs.addLast(normalized);
        while (gate.recentInputs.size() > repetitionWindow) {
            gate.recentInputs.removeFirst();
        }
        return repeat;
    }

    private boolean meetsSpeechThresholds(SpeechMetadata speech) {
        return speech != null
                && speech.durationMs() >= minDurationMs
                && speech.confidence() >= minConfidence;
    }

    private GatingResult admit(Turn turn, String normalizedInput) {
        validInputs++;
        if (LOG.isDebugEnabled()) {
            LOG.debug("Input admitted: session={}, input=\"{}\"",
                    turn.sessionId(), LogSanitizer.preview(normalizedInput));
        }
        return GatingResult.admitted(normalizedInput, profileName);
    }

    private GatingResult gate(GateReason reason, String detail, boolean vadSilenceDetected) {
        gatedInputs++;
        reasonCounts.merge(reason.code(), 1L, Long::sum);
        if (reason == GateReason.AWAITING_END_OF_SPEECH) {
            LOG.trace("Input held until end of speech");
        } else {
            LOG.debug("Input gated: reason={}, totalGated={}", reason.code(), gatedInputs);
        }
        return GatingResult.gated(reason, detail, vadSilenceDetected, profileName);
    }

    private double gatingRate() {
        return totalInputs > 0 ? (gatedInputs * 100.0) / totalInputs : 0.0;
    }

    private GatingProfile currentProfile() {
        return new GatingProfile(profileName, minDurationMs, minConfidence, vadSilenceMs, maxUtteranceMs);
    }

    private static String profileCode(GatingProperties.Profile profile) {
        return profile.name().toLowerCase(Locale.ROOT);
    }

    private static final class SessionGate {
        private Instant lastSpeechAt;
        private final Deque<String> recentInputs = new ArrayDeque<>();
    }
}
