package com.phillippitts.voicetutor.service.orchestration;

import com.phillippitts.voicetutor.config.properties.CircuitBreakerProperties;
import com.phillippitts.voicetutor.domain.DialogState;
import com.phillippitts.voicetutor.domain.PendingQuestion;
import com.phillippitts.voicetutor.domain.Turn;
import com.phillippitts.voicetutor.domain.TurnOutcome;
import com.phillippitts.voicetutor.domain.TurnResponse;
import com.phillippitts.voicetutor.exception.CircuitOpenException;
import com.phillippitts.voicetutor.exception.TurnCancelledException;
import com.phillippitts.voicetutor.service.cache.CacheEntry;
import com.phillippitts.voicetutor.service.cache.SemanticCache;
import com.phillippitts.voicetutor.service.conversation.AnswerCheckResult;
import com.phillippitts.voicetutor.service.conversation.AnswerChecker;
import com.phillippitts.voicetutor.service.conversation.ConversationManager;
import com.phillippitts.voicetutor.service.conversation.ConversationSnapshot;
import com.phillippitts.voicetutor.service.gating.GateReason;
import com.phillippitts.voicetutor.service.gating.GatingResult;
import com.phillippitts.voicetutor.service.gating.InputGatingService;
import com.phillippitts.voicetutor.service.metrics.TurnMetrics;
import com.phillippitts.voicetutor.service.orchestration.event.TurnCompletedEvent;
import com.phillippitts.voicetutor.service.queue.UserQueue;
import com.phillippitts.voicetutor.service.queue.UserQueueManager;
import com.phillippitts.voicetutor.service.resilience.CircuitBreaker;
import com.phillippitts.voicetutor.util.LogSanitizer;
import com.phillippitts.voicetutor.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Supplier;

/**
 * Default {@link TurnOrchestrator}.
 *
 * <p>Turns resolved without the queue (answer check, cache hit, open circuit) still cancel the
 * session's pending backlog, so the newest turn always supersedes older queued ones.
 */
@Service
public class DefaultTurnOrchestrator implements TurnOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultTurnOrchestrator.class);

    static final String MDC_SESSION_ID = "sessionId";
    static final String DEFAULT_TOPIC = "general";
    static final String REPROMPT = "I didn't catch that clearly. Could you please try again?";
    static final String BANNER_ANSWER_CORRECT = "Correct answer acknowledged";
    static final String BANNER_ANSWER_INCORRECT = "Incorrect answer corrected";

    private final InputGatingService gatingService;
    private final ConversationManager conversationManager;
    private final AnswerChecker answerChecker;
    private final SemanticCache cache;
    private final UserQueueManager queueManager;
    private final CircuitBreaker circuitBreaker;
    private final GenerationBackend backend;
    private final FallbackResponder fallbackResponder;
    private final TurnMetrics turnMetrics;
    private final ApplicationEventPublisher publisher;
    private final Duration interactiveTimeout;

    public DefaultTurnOrchestrator(InputGatingService gatingService,
                                   ConversationManager conversationManager,
                                   AnswerChecker answerChecker,
                                   SemanticCache cache,
                                   UserQueueManager queueManager,
                                   CircuitBreaker circuitBreaker,
                                   GenerationBackend backend,
                                   FallbackResponder fallbackResponder,
                                   TurnMetrics turnMetrics,
                                   CircuitBreakerProperties circuitProperties,
                                   ApplicationEventPublisher publisher) {
        this.gatingService = Objects.requireNonNull(gatingService, "gatingService");
        this.conversationManager = Objects.requireNonNull(conversationManager, "conversationManager");
        this.answerChecker = Objects.requireNonNull(answerChecker, "answerChecker");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.queueManager = Objects.requireNonNull(queueManager, "queueManager");
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "circuitBreaker");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.fallbackResponder = Objects.requireNonNull(fallbackResponder, "fallbackResponder");
        this.turnMetrics = Objects.requireNonNull(turnMetrics, "turnMetrics");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.interactiveTimeout = Duration.ofMillis(circuitProperties.getInteractiveTimeoutMs());
        LOG.info("Turn orchestrator ready: backend={}, interactiveTimeout={}ms",
                backend.getName(), interactiveTimeout.toMillis());
    }

    @Override
    public ConversationSnapshot startSession(String sessionId, String userId, String topic) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        queueManager.cancelInFlightForSession(sessionId);
        gatingService.clearSession(sessionId);
        conversationManager.initializeContext(sessionId, userId);
        conversationManager.setTopic(sessionId, topicOrDefault(topic));
        queueManager.getQueue(sessionId);
        LOG.info("Session started: session={}, topic={}", sessionId, topicOrDefault(topic));
        return conversationManager.getContext(sessionId).orElseThrow();
    }

    @Override
    public ConversationSnapshot changeTopic(String sessionId, String topic) {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        String userId = conversationManager.getContext(sessionId)
                .map(ConversationSnapshot::userId)
                .orElse(null);
        queueManager.cancelInFlightForSession(sessionId);
        conversationManager.clearContext(sessionId);
        conversationManager.initializeContext(sessionId, userId);
        conversationManager.setTopic(sessionId, topicOrDefault(topic));
        LOG.info("Topic changed: session={}, topic={}", sessionId, topicOrDefault(topic));
        return conversationManager.getContext(sessionId).orElseThrow();
    }

    @Override
    public CompletableFuture<TurnResponse> handleTurn(Turn turn) {
        Objects.requireNonNull(turn, "turn must not be null");
        long start = System.nanoTime();
        String sessionId = turn.sessionId();
        ThreadContext.put(MDC_SESSION_ID, sessionId);
        try {
            GatingResult gating = gatingService.validate(turn);
            if (!gating.valid()) {
                return CompletableFuture.completedFuture(gated(sessionId, gating, start));
            }

            ConversationSnapshot context = ensureContext(sessionId);
            String topic = topicOrDefault(context.topic());
            String subject = subjectOf(topic);

            PendingQuestion pending = context.pendingQuestion();
            if (pending != null && !turn.text().isBlank()) {
                queueManager.cancelInFlightForSession(sessionId);
                return CompletableFuture.completedFuture(answerCheck(sessionId, pending, turn.text(), start));
            }

            String input = gating.normalizedInput();
            // Speech-only turns carry a metadata placeholder, not a question; never cache them.
            boolean cacheable = !turn.text().isBlank();
            CacheEntry cached = cacheable ? cache.get(topic, input) : null;
            if (cached != null) {
                queueManager.cancelInFlightForSession(sessionId);
                return CompletableFuture.completedFuture(finish(new TurnResponse(sessionId, TurnOutcome.CACHED,
                        cached.content(), null, null, circuitBreaker.isOpen(), depthOf(sessionId),
                        cached.citations(), TimeUtils.elapsedMillis(start)), start));
            }

            if (circuitBreaker.isOpen()) {
                queueManager.cancelInFlightForSession(sessionId);
                LOG.info("Circuit open - answering locally");
                return CompletableFuture.completedFuture(fallback(sessionId, subject, true, start));
            }

            GenerationRequest request = new GenerationRequest(sessionId, topic, subject, context.state(), input);
            UserQueue queue = queueManager.getQueue(sessionId);
            return queue.enqueue(
                            () -> circuitBreaker.execute(() -> backend.generate(request), interactiveTimeout), true)
                    .handle((result, error) ->
                            withSession(sessionId, () -> resolve(request, cacheable, result, error, start)));
        } catch (RuntimeException e) {
            LOG.error("Unexpected failure while handling turn; answering locally", e);
            return CompletableFuture.completedFuture(
                    fallback(sessionId, DEFAULT_TOPIC, circuitBreaker.isOpen(), start));
        } finally {
            ThreadContext.remove(MDC_SESSION_ID);
        }
    }

    @Override
    public int interrupt(String sessionId) {
        int cancelled = queueManager.cancelInFlightForSession(sessionId);
        LOG.debug("Interrupt for session {} cancelled {} pending operations", sessionId, cancelled);
        return cancelled;
    }

    @Override
    public void endSession(String sessionId) {
        queueManager.removeQueue(sessionId);
        conversationManager.clearContext(sessionId);
        gatingService.clearSession(sessionId);
        fallbackResponder.clearSession(sessionId);
        LOG.info("Session ended: session={}", sessionId);
    }

    @Override
    public OrchestratorMetrics getMetrics() {
        return new OrchestratorMetrics(gatingService.getMetrics(), circuitBreaker.getMetrics(),
                cache.getMetrics(), queueManager.getGlobalMetrics(), conversationManager.activeContexts());
    }

    static String subjectOf(String topic) {
        if (topic == null || topic.isBlank()) {
            return DEFAULT_TOPIC;
        }
        String subject = topic.split("-")[0];
        return subject.isBlank() ? DEFAULT_TOPIC : subject;
    }

    private ConversationSnapshot ensureContext(String sessionId) {
        Optional<ConversationSnapshot> existing = conversationManager.getContext(sessionId);
        if (existing.isPresent()) {
            return existing.get();
        }
        LOG.debug("No context for session {}; starting one with the default topic", sessionId);
        conversationManager.initializeContext(sessionId, null);
        conversationManager.setTopic(sessionId, DEFAULT_TOPIC);
        return conversationManager.getContext(sessionId).orElseThrow();
    }

    private TurnResponse gated(String sessionId, GatingResult gating, long start) {
        String reason = gating.reasonCode();
        turnMetrics.incrementGated(reason);
        String content = gating.reason() == GateReason.AWAITING_END_OF_SPEECH ? null : REPROMPT;
        return finish(new TurnResponse(sessionId, TurnOutcome.GATED, content, reason, null,
                circuitBreaker.isOpen(), depthOf(sessionId), List.of(), TimeUtils.elapsedMillis(start)), start);
    }

    private TurnResponse answerCheck(String sessionId, PendingQuestion pending, String answer, long start) {
        AnswerCheckResult check = answerChecker.check(pending.expectedAnswer(), answer, pending.questionType());
        conversationManager.clearQuestionState(sessionId);
        conversationManager.updateState(sessionId, check.correct() ? DialogState.ADVANCE : DialogState.REMEDIATE);
        LOG.debug("Answer check: correct={}, mode={}, answer=\"{}\"",
                check.correct(), check.checkedAs(), LogSanitizer.preview(answer));
        return finish(new TurnResponse(sessionId, TurnOutcome.ANSWER_CHECK, check.feedback(), null,
                check.correct() ? BANNER_ANSWER_CORRECT : BANNER_ANSWER_INCORRECT,
                false, depthOf(sessionId), List.of(), TimeUtils.elapsedMillis(start)), start);
    }

    private TurnResponse resolve(GenerationRequest request, boolean cacheable, GenerationResult result,
                                 Throwable error, long start) {
        try {
            return error == null
                    ? generated(request, cacheable, result, start)
                    : generationFailed(request, error, start);
        } catch (RuntimeException e) {
            LOG.error("Failed to finalize generated turn; answering locally", e);
            return fallback(request.sessionId(), request.subject(), circuitBreaker.isOpen(), start);
        }
    }

    private TurnResponse generated(GenerationRequest request, boolean cacheable, GenerationResult result,
                                   long start) {
        String sessionId = request.sessionId();
        if (cacheable) {
            cache.set(request.topic(), request.input(), result.content(), request.subject());
        }
        if (result.plan() != null) {
            conversationManager.addPlan(sessionId, result.plan());
        }
        if (result.question() != null) {
            conversationManager.setQuestionState(sessionId, result.question());
            conversationManager.getState(sessionId)
                    .filter(state -> state == DialogState.TEACH)
                    .ifPresent(state -> conversationManager.updateState(sessionId, DialogState.CHECK));
        }
        return finish(new TurnResponse(sessionId, TurnOutcome.GENERATED, result.content(), null, null,
                false, depthOf(sessionId), List.of(), TimeUtils.elapsedMillis(start)), start);
    }

    private TurnResponse generationFailed(GenerationRequest request, Throwable error, long start) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        String sessionId = request.sessionId();
        if (cause instanceof TurnCancelledException) {
            LOG.debug("Turn superseded by a newer turn");
            return finish(new TurnResponse(sessionId, TurnOutcome.SUPERSEDED, null, null, null,
                    circuitBreaker.isOpen(), depthOf(sessionId), List.of(), TimeUtils.elapsedMillis(start)), start);
        }
        if (cause instanceof CircuitOpenException) {
            LOG.info("Circuit opened before generation - answering locally");
            return fallback(sessionId, request.subject(), true, start);
        }
        LOG.warn("Generation failed after retries: {}", cause.toString());
        return fallback(sessionId, request.subject(), circuitBreaker.isOpen(), start);
    }

    private TurnResponse fallback(String sessionId, String subject, boolean circuitOpen, long start) {
        FallbackResponse fallback = fallbackResponder.respond(sessionId, subject, circuitOpen);
        return finish(new TurnResponse(sessionId, TurnOutcome.FALLBACK, fallback.content(), null,
                fallback.banner(), circuitOpen, depthOf(sessionId), List.of(), TimeUtils.elapsedMillis(start)), start);
    }

    private TurnResponse finish(TurnResponse response, long start) {
        long durationNanos = System.nanoTime() - start;
        turnMetrics.recordTurn(response.outcome(), durationNanos);
        publisher.publishEvent(new TurnCompletedEvent(response.sessionId(), response.outcome(),
                response.gateReason(), response.latencyMs(), Instant.now()));
        return response;
    }

    private int depthOf(String sessionId) {
        return queueManager.getQueueDepth(sessionId);
    }

    private static String topicOrDefault(String topic) {
        return topic == null || topic.isBlank() ? DEFAULT_TOPIC : topic;
    }

    private static <T> T withSession(String sessionId, Supplier<T> body) {
        ThreadContext.put(MDC_SESSION_ID, sessionId);
        try {
            return body.get();
        } finally {
            ThreadContext.remove(MDC_SESSION_ID);
        }
    }
}
