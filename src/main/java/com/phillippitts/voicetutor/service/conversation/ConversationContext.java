package com.phillippitts.voicetutor.service.conversation;

import com.phillippitts.voicetutor.domain.DialogState;
import com.phillippitts.voicetutor.domain.PendingQuestion;
import com.phillippitts.voicetutor.domain.TutorPlan;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable per-session dialog state. Owned by {@link ConversationManager}; every access goes through
 * the instance monitor.
 */
final class ConversationContext {

    private final String sessionId;
    private final String userId;
    private final Instant createdAt;
    private final List<TutorPlan> previousPlans = new ArrayList<>();

    private DialogState state = DialogState.GREET;
    private String topic;
    private TutorPlan currentPlan;
    private PendingQuestion pendingQuestion;
    private Instant lastActivity;

    ConversationContext(String sessionId, String userId, Instant now) {
        this.sessionId = sessionId;
        this.userId = userId;
        this.createdAt = now;
        this.lastActivity = now;
    }

    synchronized DialogState state() {
        return state;
    }

    synchronized void state(DialogState next, Instant now) {
        this.state = next;
        this.lastActivity = now;
    }

    synchronized void topic(String topic, Instant now) {
        this.topic = topic;
        this.lastActivity = now;
    }

    synchronized void addPlan(TutorPlan plan, Instant now) {
        this.currentPlan = plan;
        this.previousPlans.add(plan);
        this.lastActivity = now;
    }

    synchronized PendingQuestion pendingQuestion() {
        return pendingQuestion;
    }

    synchronized void pendingQuestion(PendingQuestion question, Instant now) {
        this.pendingQuestion = question;
        this.lastActivity = now;
    }

    synchronized Instant lastActivity() {
        return lastActivity;
    }

    synchronized ConversationSnapshot snapshot() {
        return new ConversationSnapshot(sessionId, userId, state, topic, currentPlan,
                List.copyOf(previousPlans), pendingQuestion, createdAt, lastActivity);
    }
}
