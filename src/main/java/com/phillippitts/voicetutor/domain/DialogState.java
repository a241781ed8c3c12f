package com.phillippitts.voicetutor.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Tutoring dialog phases and the transitions allowed out of each one.
 */
public enum DialogState {
    GREET,
    UNDERSTAND,
    PLAN,
    TEACH,
    CHECK,
    REMEDIATE,
    ADVANCE,
    CLOSE;

    private static final Map<DialogState, Set<DialogState>> TRANSITIONS = new EnumMap<>(DialogState.class);

    static {
        TRANSITIONS.put(GREET, EnumSet.of(UNDERSTAND));
        TRANSITIONS.put(UNDERSTAND, EnumSet.of(PLAN, GREET));
        TRANSITIONS.put(PLAN, EnumSet.of(TEACH, UNDERSTAND));
        TRANSITIONS.put(TEACH, EnumSet.of(CHECK, PLAN));
        TRANSITIONS.put(CHECK, EnumSet.of(REMEDIATE, ADVANCE, TEACH));
        TRANSITIONS.put(REMEDIATE, EnumSet.of(TEACH, CHECK));
        TRANSITIONS.put(ADVANCE, EnumSet.of(PLAN, TEACH, CLOSE));
        TRANSITIONS.put(CLOSE, EnumSet.of(GREET));
    }

    /**
     * @return unmodifiable allow-list of states reachable from this one
     */
    public Set<DialogState> allowedNext() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean canTransitionTo(DialogState next) {
        return next != null && TRANSITIONS.get(this).contains(next);
    }

    /** Lower-case wire name ("greet", "check", ...). */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
