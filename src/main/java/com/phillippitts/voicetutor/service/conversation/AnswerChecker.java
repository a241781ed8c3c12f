package com.phillippitts.voicetutor.service.conversation;

import com.phillippitts.voicetutor.domain.QuestionType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves a learner answer against the expected answer of a pending question.
 *
 * <ul>
 *   <li>MATH: numeric comparison within 0.01; simple binary expressions ({@code 3 + 4}) are evaluated</li>
 *   <li>MCQ: accepts the letter, "option x", "answer x" or the 1-based option number</li>
 *   <li>SHORT: exact match, small edit distance, or containment</li>
 *   <li>OPEN: the mode is inferred from the expected answer</li>
 * </ul>
 * Number words ("seven", "twenty") are converted to digits before comparing.
 */
@Component
public class AnswerChecker {

    private static final Map<String, String> NUMBER_WORDS = new LinkedHashMap<>();

    static {
        String[] words = {"zero", "one", "two", "three", "four", "five", "six", "seven", "eight", "nine", "ten",
                "eleven", "twelve", "thirteen", "fourteen", "fifteen", "sixteen", "seventeen", "eighteen",
                "nineteen"};
        for (int i = 0; i < words.length; i++) {
            NUMBER_WORDS.put(words[i], String.valueOf(i));
        }
        NUMBER_WORDS.put("twenty", "20");
        NUMBER_WORDS.put("thirty", "30");
        NUMBER_WORDS.put("forty", "40");
        NUMBER_WORDS.put("fifty", "50");
        NUMBER_WORDS.put("sixty", "60");
        NUMBER_WORDS.put("seventy", "70");
        NUMBER_WORDS.put("eighty", "80");
        NUMBER_WORDS.put("ninety", "90");
        NUMBER_WORDS.put("hundred", "100");
        NUMBER_WORDS.put("thousand", "1000");
    }

    private static final Pattern DISALLOWED = Pattern.compile("[^a-z0-9\\s+\\-*/()=.]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern BINARY_EXPRESSION =
            Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*([+\\-*/])\\s*(\\d+(?:\\.\\d+)?)$");
    private static final Pattern MCQ_EXPECTED = Pattern.compile("^[a-d]$|option [a-d]");
    private static final Pattern MCQ_LETTER = Pattern.compile("\\b([a-d])\\b");
    private static final Pattern MATH_EXPECTED = Pattern.compile("^[\\d\\s+\\-*/()=.]+$");
    private static final double TOLERANCE = 1e-2;

    public AnswerCheckResult check(String expected, String answer, QuestionType type) {
        Objects.requireNonNull(expected, "expected must not be null");
        String e = normalize(expected);
        String u = normalize(answer == null ? "" : answer);
        QuestionType mode = type == null || type == QuestionType.OPEN ? detect(e) : type;

        return switch (mode) {
            case MATH -> checkMath(expected, e, u);
            case MCQ -> checkMultipleChoice(e, u);
            default -> checkShort(expected, e, u);
        };
    }

    static String normalize(String s) {
        String t = s.toLowerCase(Locale.ROOT).trim();
        for (Map.Entry<String, String> word : NUMBER_WORDS.entrySet()) {
            t = t.replaceAll("\\b" + word.getKey() + "\\b", word.getValue());
        }
        t = DISALLOWED.matcher(t).replaceAll("");
        return WHITESPACE.matcher(t).replaceAll(" ").trim();
    }

    static QuestionType detect(String normalizedExpected) {
        if (MCQ_EXPECTED.matcher(normalizedExpected).find()) {
            return QuestionType.MCQ;
        }
        if (MATH_EXPECTED.matcher(normalizedExpected).matches()) {
            return QuestionType.MATH;
        }
        return QuestionType.SHORT;
    }

    /** Evaluates {@code a op b}; returns null when the input is not a simple binary expression. */
    static Double evaluate(String normalized) {
        Matcher m = BINARY_EXPRESSION.matcher(normalized);
        if (!m.matches()) {
            return null;
        }
        double a = Double.parseDouble(m.group(1));
        double b = Double.parseDouble(m.group(3));
        return switch (m.group(2)) {
            case "+" -> a + b;
            case "-" -> a - b;
            case "*" -> a * b;
            default -> b != 0 ? a / b : null;
        };
    }

    static int levenshtein(String a, String b) {
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            prev[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            curr[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                curr[j] = Math.min(Math.min(curr[j - 1] + 1, prev[j] + 1), prev[j - 1] + cost);
            }
            int[] swap = prev;
            prev = curr;
            curr = swap;
        }
        return prev[b.length()];
    }

    private AnswerCheckResult checkMath(String expected, String e, String u) {
        if (u.equals(e)) {
            return new AnswerCheckResult(true, "Excellent! That's correct.", QuestionType.MATH);
        }
        Double given = numericValue(u);
        Double wanted = numericValue(e);
        if (given != null && wanted != null && Math.abs(given - wanted) <= TOLERANCE) {
            return new AnswerCheckResult(true, "Perfect! You got it right.", QuestionType.MATH);
        }
        return new AnswerCheckResult(false,
                "Not quite. The answer is " + expected + ". Let me show you how to solve it.", QuestionType.MATH);
    }

    private AnswerCheckResult checkMultipleChoice(String e, String u) {
        Matcher letterMatch = MCQ_LETTER.matcher(e);
        if (!letterMatch.find()) {
            return new AnswerCheckResult(false, "I couldn't read that answer.", QuestionType.MCQ);
        }
        String letter = letterMatch.group(1);
        String index = String.valueOf(letter.charAt(0) - 'a' + 1);
        List<String> tokens = List.of(u.split(" "));
        boolean ok = u.equals(letter)
                || u.contains("option " + letter)
                || u.contains("answer " + letter)
                || tokens.contains(letter)
                || tokens.contains(index);
        if (ok) {
            return new AnswerCheckResult(true, "Great job! That's the right answer.", QuestionType.MCQ);
        }
        return new AnswerCheckResult(false,
                "Actually, the correct answer is " + letter.toUpperCase(Locale.ROOT) + ". Let's review why.",
                QuestionType.MCQ);
    }

    private AnswerCheckResult checkShort(String expected, String e, String u) {
        if (u.equals(e)) {
            return new AnswerCheckResult(true, "Exactly right! Well done.", QuestionType.SHORT);
        }
        if (!u.isEmpty()) {
            int maxDistance = e.length() <= 5 ? 1 : 2;
            if (levenshtein(u, e) <= maxDistance) {
                return new AnswerCheckResult(true, "Good! That's correct.", QuestionType.SHORT);
            }
            if (u.contains(e) || e.contains(u)) {
                return new AnswerCheckResult(true, "Yes, that's right!", QuestionType.SHORT);
            }
        }
        return new AnswerCheckResult(false,
                "Close try! The answer we're looking for is \"" + expected + "\".", QuestionType.SHORT);
    }

    private static Double numericValue(String normalized) {
        Double evaluated = evaluate(normalized);
        if (evaluated != null) {
            return evaluated;
        }
        try {
            return Double.parseDouble(normalized);
        } catch (NumberFormatException ex) {
            return null;
        }
    }
}
