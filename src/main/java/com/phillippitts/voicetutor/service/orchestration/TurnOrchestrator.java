package com.phillippitts.voicetutor.service.orchestration;

import com.phillippitts.voicetutor.domain.Turn;
import com.phillippitts.voicetutor.domain.TurnResponse;
import com.phillippitts.voicetutor.service.conversation.ConversationSnapshot;

import java.util.concurrent.CompletableFuture;

/**
 * Entry point for request handlers: resolves learner turns against gating, the pending question,
 * the response cache and finally the generation backend.
 *
 * <p><b>Pipeline per turn:</b>
 * <ol>
 *   <li>Input gating; inadmissible turns end here</li>
 *   <li>Answer check when the session has a pending question</li>
 *   <li>Semantic cache lookup</li>
 *   <li>Generation through the session queue (barge-in enabled) and the circuit breaker</li>
 *   <li>Cache and dialog state updates on success</li>
 * </ol>
 *
 * <p><b>Error Handling:</b> the returned future never completes exceptionally. Backend failures and an
 * open circuit yield a local fallback response; superseded turns yield
 * {@link com.phillippitts.voicetutor.domain.TurnOutcome#SUPERSEDED} without content.
 *
 * @see DefaultTurnOrchestrator
 * @see com.phillippitts.voicetutor.service.orchestration.event.TurnCompletedEvent
 */
public interface TurnOrchestrator {

    /**
     * Starts (or restarts) a session. Any previous dialog context for the id is discarded.
     *
     * @param sessionId session key
     * @param userId    learner id
     * @param topic     lesson topic; {@code null} means general
     * @return the fresh dialog context
     */
    ConversationSnapshot startSession(String sessionId, String userId, String topic);

    /**
     * Switches the lesson topic. The dialog context is reset and pending work is cancelled.
     */
    ConversationSnapshot changeTopic(String sessionId, String topic);

    /**
     * Resolves one turn.
     *
     * @param turn learner turn
     * @return future completed with the response; never completes exceptionally
     */
    CompletableFuture<TurnResponse> handleTurn(Turn turn);

    /**
     * Cancels queued (not yet started) work of a session, e.g. when the learner starts speaking.
     *
     * @return number of cancelled operations
     */
    int interrupt(String sessionId);

    /**
     * Releases all per-session state.
     */
    void endSession(String sessionId);

    OrchestratorMetrics getMetrics();
}
