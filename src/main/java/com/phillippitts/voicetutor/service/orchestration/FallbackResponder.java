package com.phillippitts.voicetutor.service.orchestration;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Local, subject-specific responses for turns the backend could not answer.
 *
 * <p>Responses rotate per session and subject, so a learner never hears the same fallback twice in a
 * row. Selection is deterministic.
 */
@Component
public class FallbackResponder {

    static final String BANNER_CIRCUIT_OPEN = "High traffic - using quick tips";
    static final String BANNER_BACKEND_FAILED = "Using local responses during high traffic";

    private static final Map<String, List<String>> RESPONSES = Map.of(
            "math", List.of(
                    "Let's work through this step by step. What number comes after 2?",
                    "When we add 2 + 3, we count: 2, then 3 more makes 5. What's 4 + 2?",
                    "If you have 8 cookies and eat 3, you have 5 left. What's 7 - 2?",
                    "Multiplication is repeated addition! 3 × 2 means 3 + 3, which equals 6. Can you try 2 × 4?",
                    "Fractions show parts of a whole. Half of a pizza is written as 1/2. What's half of 8?"),
            "english", List.of(
                    "Nouns name people, places, or things. 'Dog' and 'school' are nouns. Can you give me another noun?",
                    "Verbs show action! Words like 'run' and 'smile' are verbs. What verb describes what birds do?",
                    "Adjectives describe nouns. 'Blue sky' uses 'blue' as an adjective. How would you describe a tree?",
                    "Rhyming words sound alike at the end: cat, bat, hat. What rhymes with 'sun'?",
                    "Plural means more than one: one cat, two cats. What's the plural of 'book'?"),
            "spanish", List.of(
                    "'Hola' means hello and 'Adiós' means goodbye. How do you say 'please' in Spanish?",
                    "Spanish colors: rojo is red, azul is blue, verde is green. What color is 'blanco'?",
                    "Count in Spanish: uno, dos, tres, cuatro, cinco. What number comes after 'cinco'?",
                    "Family words: madre is mother, padre is father. How do you say 'sister'?"),
            "science", List.of(
                    "Plants need sunlight, water and air to grow. "
                            + "What do you think happens to a plant kept in the dark?",
                    "Water can be solid, liquid or gas. What do we call water when it freezes?",
                    "Magnets attract some metals. Can you think of something a magnet would stick to?"),
            "general", List.of(
                    "Let's focus on your current lesson topic. What specific concept would you like me to explain?",
                    "Let's start with the basics and build up. What's the first thing you need to understand?",
                    "Let's work through an example together. What problem are you trying to solve?",
                    "Understanding comes from connecting ideas. How does this relate to what you already know?"));

    private static final Map<String, String> SUBJECT_ALIASES = Map.of(
            "grammar", "english",
            "reading", "english",
            "writing", "english",
            "ela", "english");

    private final Map<String, AtomicInteger> rotation = new ConcurrentHashMap<>();

    /**
     * Picks the next canned response for a session.
     *
     * @param sessionId   session the response is for
     * @param subject     subject area; unknown subjects use the general pool
     * @param circuitOpen selects the banner shown with the response
     */
    public FallbackResponse respond(String sessionId, String subject, boolean circuitOpen) {
        String pool = poolFor(subject);
        List<String> responses = RESPONSES.get(pool);
        int index = rotation.computeIfAbsent(sessionId + ':' + pool, k -> new AtomicInteger())
                .getAndIncrement();
        String content = responses.get(Math.floorMod(index, responses.size()));
        return new FallbackResponse(content, circuitOpen ? BANNER_CIRCUIT_OPEN : BANNER_BACKEND_FAILED);
    }

    public void clearSession(String sessionId) {
        String prefix = sessionId + ':';
        rotation.keySet().removeIf(key -> key.startsWith(prefix));
    }

    static String poolFor(String subject) {
        if (subject == null) {
            return "general";
        }
        String key = subject.toLowerCase(Locale.ROOT);
        key = SUBJECT_ALIASES.getOrDefault(key, key);
        return RESPONSES.containsKey(key) ? key : "general";
    }
}
