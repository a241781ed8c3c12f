package com.phillippitts.voicetutor.service.conversation;

import com.phillippitts.voicetutor.domain.DialogState;
import com.phillippitts.voicetutor.domain.PendingQuestion;
import com.phillippitts.voicetutor.domain.TutorPlan;

import java.time.Instant;
import java.util.List;

/**
 * Read-only copy of a session's dialog context.
 *
 * @param sessionId       session key
 * @param userId          learner the session belongs to
 * @param state           current dialog state
 * @param topic           current topic, {@code null} until set
 * @param currentPlan     most recent plan, {@code null} until one is added
 * @param previousPlans   every plan added so far, oldest first
 * @param pendingQuestion outstanding question, {@code null} when none
 * @param createdAt       when the context was initialized
 * @param lastActivity    last mutation
 */
public record ConversationSnapshot(
        String sessionId,
        String userId,
        DialogState state,
        String topic,
        TutorPlan currentPlan,
        List<TutorPlan> previousPlans,
        PendingQuestion pendingQuestion,
        Instant createdAt,
        Instant lastActivity
) {
}
