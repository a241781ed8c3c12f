package com.phillippitts.voicetutor.service.cache;

import com.github.benmanes.caffeine.cache.Ticker;
import com.phillippitts.voicetutor.config.properties.SemanticCacheProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

class SemanticCacheTest {

    private final AtomicLong nanos = new AtomicLong();
    private final Ticker ticker = nanos::get;
    private SemanticCacheProperties props;
    private SemanticCache cache;

    @BeforeEach
    void setUp() {
        props = new SemanticCacheProperties();
        cache = new SemanticCache(props, ticker);
    }

    @Test
    void returnsStoredEntryWithHitCountAndCitations() {
        cache.set("math-fractions", "What is a fraction?", "A fraction is a part of a whole.", "math");

        CacheEntry entry = cache.get("math-fractions", "What is a fraction?");

        assertThat(entry).isNotNull();
        assertThat(entry.content()).isEqualTo("A fraction is a part of a whole.");
        assertThat(entry.hits()).isEqualTo(1);
        assertThat(entry.citations()).hasSize(3);
        assertThat(entry.citations().get(0)).isEqualTo("Lesson: math-fractions");
        assertThat(entry.citations().get(1)).isEqualTo("Subject: Math");
        assertThat(entry.citations().get(2)).startsWith("Cached: ");
    }

    @Test
    void hitCountGrowsWithEveryLookup() {
        cache.set("math", "what is a fraction", "content", "math");

        cache.get("math", "what is a fraction");
        CacheEntry second = cache.get("math", "what is a fraction");

        assertThat(second.hits()).isEqualTo(2);
    }

    @Test
    void matchesQuestionsThatNormalizeToTheSameText() {
        cache.set("math", "What is a fraction?", "content", "math");

        assertThat(cache.get("math", "Um, what is a fraction?")).isNotNull();
        assertThat(cache.get("math", "  WHAT is a   fraction?  ")).isNotNull();
    }

    @Test
    void entriesAreScopedByTopic() {
        cache.set("math", "what is a fraction", "content", "math");

        assertThat(cache.get("english", "what is a fraction")).isNull();
    }

    @Test
    void findsRephrasedQuestionBySimilarity() {
        cache.set("math", "what is a fraction in math", "content", "math");

        CacheEntry similar = cache.get("math", "what is a fraction in maths");

        assertThat(similar).isNotNull();
        assertThat(similar.content()).isEqualTo("content");
    }

    @Test
    void skipsSimilarityScanAboveLimit() {
        props.setSimilarityScanLimit(1);
        cache = new SemanticCache(props, ticker);
        cache.set("math", "what is a fraction in math", "content", "math");

        assertThat(cache.get("math", "what is a fraction in maths")).isNull();
    }

    @Test
    void generalTopicAndSubjectProduceOnlyTimestampCitation() {
        cache.set(null, "how do I study", "content", null);

        CacheEntry entry = cache.get("general", "how do I study");

        assertThat(entry.citations()).hasSize(1);
        assertThat(entry.citations().get(0)).startsWith("Cached: ");
    }

    @Test
    void expiresEntriesAfterIdleTtl() {
        cache.set("math", "what is a fraction", "content", "math");

        nanos.addAndGet(Duration.ofMinutes(1441).toNanos());

        assertThat(cache.get("math", "what is a fraction")).isNull();
    }

    @Test
    void accessRestartsExpiryClock() {
        cache.set("math", "what is a fraction", "content", "math");

        nanos.addAndGet(Duration.ofMinutes(1000).toNanos());
        assertThat(cache.get("math", "what is a fraction")).isNotNull();
        nanos.addAndGet(Duration.ofMinutes(1000).toNanos());

        assertThat(cache.get("math", "what is a fraction")).isNotNull();
    }

    @Test
    void boundsNumberOfEntries() {
        props.setMaxEntries(2);
        cache = new SemanticCache(props, ticker);

        cache.set("math", "question one", "a", "math");
        cache.set("math", "question two", "b", "math");
        cache.set("math", "question three", "c", "math");

        assertThat(cache.getMetrics().totalEntries()).isLessThanOrEqualTo(2);
        assertThat(cache.getStatus().maxSize()).isEqualTo(2);
    }

    @Test
    void tracksHitsAndMisses() {
        cache.set("math", "what is a fraction", "content", "math");

        cache.get("math", "what is a fraction");
        cache.get("math", "something entirely different");

        CacheMetrics metrics = cache.getMetrics();
        assertThat(metrics.hits()).isEqualTo(1);
        assertThat(metrics.misses()).isEqualTo(1);
        assertThat(metrics.hitRate()).isEqualTo(50.0);
        assertThat(metrics.totalEntries()).isEqualTo(1);
        assertThat(metrics.memoryUsageKb()).isEqualTo(0.5);
    }

    @Test
    void warmUpPopulatesEntries() {
        cache.warmUp("spanish", List.of(
                new WarmUpEntry("how do you say hello", "Hola!", "spanish"),
                new WarmUpEntry("how do you say goodbye", "Adiós!", "spanish")));

        assertThat(cache.get("spanish", "How do you say hello").content()).isEqualTo("Hola!");
        assertThat(cache.getStatus().size()).isEqualTo(2);
    }

    @Test
    void clearDropsEntriesAndCounters() {
        cache.set("math", "what is a fraction", "content", "math");
        cache.get("math", "what is a fraction");

        cache.clear();

        assertThat(cache.getMetrics().totalEntries()).isZero();
        assertThat(cache.getMetrics().hits()).isZero();
        assertThat(cache.get("math", "what is a fraction")).isNull();
    }

    @Test
    void disabledCacheNeverStoresOrReturns() {
        props.setEnabled(false);
        cache = new SemanticCache(props, ticker);

        cache.set("math", "what is a fraction", "content", "math");

        assertThat(cache.get("math", "what is a fraction")).isNull();
        assertThat(cache.getStatus().enabled()).isFalse();
        assertThat(cache.getStatus().size()).isZero();
    }

    @Test
    void cacheKeyCombinesTopicWithHashPrefix() {
        String key = SemanticCache.cacheKey("math", "what is a fraction");

        assertThat(key).matches("math:[0-9a-f]{16}");
        assertThat(SemanticCache.cacheKey("math", "what is a fraction")).isEqualTo(key);
    }

    @Test
    void jaccardOfTokenSets() {
        assertThat(SemanticCache.jaccard("a b c", "a b c")).isEqualTo(1.0);
        assertThat(SemanticCache.jaccard("a b", "c d")).isZero();
        assertThat(SemanticCache.jaccard("a b c", "a b d")).isEqualTo(0.5);
        assertThat(SemanticCache.jaccard("", "")).isZero();
    }

    @Test
    void normalizeQuestionRemovesFillersAndPunctuation() {
        assertThat(SemanticCache.normalizeQuestion("Well, um, like... what's 2+2?"))
                .isEqualTo("whats 22?");
    }
}
