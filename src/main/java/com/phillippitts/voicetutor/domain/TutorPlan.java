package com.phillippitts.voicetutor.domain;

import java.util.List;
import java.util.Objects;

/**
 * Structured plan returned by the generation backend alongside a response.
 *
 * @param goal            learning goal for this interaction
 * @param steps           step-by-step plan
 * @param nextPrompt      the prompt to speak next
 * @param followupOptions optional follow-ups keyed to likely learner answers
 */
public record TutorPlan(
        String goal,
        List<String> steps,
        String nextPrompt,
        List<String> followupOptions
) {

    public TutorPlan {
        Objects.requireNonNull(goal, "goal must not be null");
        steps = steps == null ? List.of() : List.copyOf(steps);
        nextPrompt = nextPrompt == null ? "" : nextPrompt;
        followupOptions = followupOptions == null ? List.of() : List.copyOf(followupOptions);
    }
}
