package com.phillippitts.voicetutor.service.conversation;

import com.phillippitts.voicetutor.config.properties.ConversationProperties;
import com.phillippitts.voicetutor.domain.DialogState;
import com.phillippitts.voicetutor.domain.PendingQuestion;
import com.phillippitts.voicetutor.domain.TutorPlan;
import com.phillippitts.voicetutor.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of per-session dialog contexts.
 *
 * <p>Each context runs a small state machine ({@link DialogState}); disallowed transitions are logged
 * and ignored. A context also holds at most one pending question so the next learner turn can be
 * resolved as an answer check instead of a fresh generation.
 *
 * <p>Contexts live until cleared, replaced by {@link #initializeContext}, or swept by
 * {@link #cleanup()} after {@code contextIdleTtlMinutes} without activity. The sweep also trims the
 * least recently active contexts once more than {@code maxContexts} are held.
 */
@Service
public class ConversationManager {

    private static final Logger LOG = LogManager.getLogger(ConversationManager.class);

    private final Map<String, ConversationContext> contexts = new ConcurrentHashMap<>();
    private final Duration idleTtl;
    private final int maxContexts;
    private final Clock clock;

    @Autowired
    public ConversationManager(ConversationProperties properties) {
        this(properties, Clock.systemUTC());
    }

    ConversationManager(ConversationProperties properties, Clock clock) {
        Objects.requireNonNull(properties, "properties");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.idleTtl = Duration.ofMinutes(properties.getContextIdleTtlMinutes());
        this.maxContexts = properties.getMaxContexts();
    }

    /**
     * Creates a fresh context in {@link DialogState#GREET}, discarding any previous context for the
     * same session.
     */
    public ConversationSnapshot initializeContext(String sessionId, String userId) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        ConversationContext context = new ConversationContext(sessionId, userId, clock.instant());
        if (contexts.put(sessionId, context) != null) {
            LOG.info("Replaced existing conversation context for session {}", sessionId);
        } else {
            LOG.debug("Initialized conversation context for session {}", sessionId);
        }
        return context.snapshot();
    }

    public void clearContext(String sessionId) {
        if (contexts.remove(sessionId) != null) {
            LOG.debug("Cleared conversation context for session {}", sessionId);
        }
    }

    public Optional<ConversationSnapshot> getContext(String sessionId) {
        ConversationContext context = contexts.get(sessionId);
        return context == null ? Optional.empty() : Optional.of(context.snapshot());
    }

    public Optional<DialogState> getState(String sessionId) {
        ConversationContext context = contexts.get(sessionId);
        return context == null ? Optional.empty() : Optional.of(context.state());
    }

    /**
     * Moves a session to {@code next} if the transition table allows it.
     *
     * @return true when the state changed; false for an unknown session or a disallowed transition
     */
    public boolean updateState(String sessionId, DialogState next) {
        Objects.requireNonNull(next, "next must not be null");
        ConversationContext context = contexts.get(sessionId);
        if (context == null) {
            return false;
        }
        synchronized (context) {
            DialogState current = context.state();
            if (!current.canTransitionTo(next)) {
                LOG.warn("Invalid dialog transition {} -> {} for session {}",
                        current.wireName(), next.wireName(), sessionId);
                return false;
            }
            context.state(next, clock.instant());
            LOG.debug("Dialog transition {} -> {} for session {}", current.wireName(), next.wireName(), sessionId);
            return true;
        }
    }

    /**
     * Records a plan and advances the dialog when the plan signals progress: greet to understand when
     * the goal is about understanding, understand to plan once the plan has steps, plan to teach when
     * the next prompt is a question.
     */
    public void addPlan(String sessionId, TutorPlan plan) {
        Objects.requireNonNull(plan, "plan must not be null");
        ConversationContext context = contexts.get(sessionId);
        if (context == null) {
            return;
        }
        synchronized (context) {
            context.addPlan(plan, clock.instant());
            DialogState current = context.state();
            if (current == DialogState.GREET && plan.goal().toLowerCase(Locale.ROOT).contains("understand")) {
                updateState(sessionId, DialogState.UNDERSTAND);
            } else if (current == DialogState.UNDERSTAND && !plan.steps().isEmpty()) {
                updateState(sessionId, DialogState.PLAN);
            } else if (current == DialogState.PLAN && plan.nextPrompt().contains("?")) {
                updateState(sessionId, DialogState.TEACH);
            }
        }
        LOG.debug("Plan added for session {}", sessionId);
    }

    public void setTopic(String sessionId, String topic) {
        ConversationContext context = contexts.get(sessionId);
        if (context != null) {
            context.topic(topic, clock.instant());
            LOG.debug("Topic set to {} for session {}", topic, sessionId);
        }
    }

    /**
     * Stores the single outstanding question, replacing any previous one.
     */
    public void setQuestionState(String sessionId, PendingQuestion question) {
        Objects.requireNonNull(question, "question must not be null");
        ConversationContext context = contexts.get(sessionId);
        if (context != null) {
            context.pendingQuestion(question, clock.instant());
            LOG.debug("Pending {} question set for session {}", question.questionType(), sessionId);
        }
    }

    public void clearQuestionState(String sessionId) {
        ConversationContext context = contexts.get(sessionId);
        if (context != null) {
            context.pendingQuestion(null, clock.instant());
        }
    }

    public Optional<PendingQuestion> getQuestionState(String sessionId) {
        ConversationContext context = contexts.get(sessionId);
        return context == null ? Optional.empty() : Optional.ofNullable(context.pendingQuestion());
    }

    public int activeContexts() {
        return contexts.size();
    }

    /**
     * Drops idle contexts, then the least recently active ones beyond the cap.
     *
     * @return number of contexts removed
     */
    public int cleanup() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, ConversationContext> entry : contexts.entrySet()) {
            if (TimeUtils.isOlderThan(entry.getValue().lastActivity(), idleTtl, now)
                    && contexts.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }

        int excess = contexts.size() - maxContexts;
        if (excess > 0) {
            List<Map.Entry<String, ConversationContext>> oldest = new ArrayList<>(contexts.entrySet());
            oldest.sort(Comparator.comparing(e -> e.getValue().lastActivity()));
            for (int i = 0; i < excess && i < oldest.size(); i++) {
                Map.Entry<String, ConversationContext> entry = oldest.get(i);
                if (contexts.remove(entry.getKey(), entry.getValue())) {
                    removed++;
                }
            }
        }

        if (removed > 0) {
            LOG.info("Conversation cleanup removed {} contexts ({} remaining)", removed, contexts.size());
        }
        return removed;
    }

    @Scheduled(fixedDelayString = "${conversation.cleanup-interval-ms:300000}")
    void scheduledCleanup() {
        cleanup();
    }
}
