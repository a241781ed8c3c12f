package com.phillippitts.voicetutor.service.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;
import com.phillippitts.voicetutor.config.properties.SemanticCacheProperties;
import com.phillippitts.voicetutor.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Response cache keyed by topic and normalized question.
 *
 * <p>Keys have the form {@code topic:hash} where {@code hash} is the first 16 hex characters of the
 * SHA-256 of the normalized question. Entries are bounded by size (least recently used first) and
 * expire after {@code ttlMinutes} without access; every hit restarts the expiry clock.
 *
 * <p>When the exact key misses and the cache holds fewer than {@code similarityScanLimit} entries, a
 * linear scan compares the question's token set with every same-topic entry (Jaccard similarity) to
 * catch rephrasings. Above the limit the scan is skipped to keep lookups constant-time.
 */
@Service
public class SemanticCache {

    private static final Logger LOG = LogManager.getLogger(SemanticCache.class);

    static final String GENERAL = "general";
    private static final double KB_PER_ENTRY = 0.5;

    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s?]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern FILLERS = Pattern.compile(
            "\\b(um|uh|like|you know|i mean|well|so|okay|alright)\\b", Pattern.CASE_INSENSITIVE);

    private final Cache<String, StoredEntry> cache;
    private final boolean enabled;
    private final long maxEntries;
    private final int similarityScanLimit;
    private final double similarityThreshold;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    @Autowired
    public SemanticCache(SemanticCacheProperties properties) {
        this(properties, Ticker.systemTicker());
    }

    SemanticCache(SemanticCacheProperties properties, Ticker ticker) {
        Objects.requireNonNull(properties, "properties");
        this.enabled = properties.isEnabled();
        this.maxEntries = properties.getMaxEntries();
        this.similarityScanLimit = properties.getSimilarityScanLimit();
        this.similarityThreshold = properties.getSimilarityThreshold();
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfterAccess(Duration.ofMinutes(properties.getTtlMinutes()))
                .ticker(ticker)
                .executor(Runnable::run)
                .removalListener((String key, StoredEntry value, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        LOG.debug("Evicted cache entry: key={}, cause={}", key, cause);
                    }
                })
                .build();
        LOG.info("Semantic cache initialized: enabled={}, maxEntries={}, ttl={}min",
                enabled, maxEntries, properties.getTtlMinutes());
    }

    /**
     * Looks up a cached response.
     *
     * @param topic    topic the question belongs to ({@code null} means general)
     * @param question learner question as received
     * @return entry snapshot with its hit count already incremented, or {@code null} on a miss
     */
    public CacheEntry get(String topic, String question) {
        if (!enabled) {
            return null;
        }
        String safeTopic = topicOrGeneral(topic);
        String normalized = normalizeQuestion(question);
        StoredEntry entry = cache.getIfPresent(cacheKey(safeTopic, normalized));
        if (entry != null) {
            hits.incrementAndGet();
            LOG.debug("Cache HIT: topic={}, question=\"{}\", citations={}",
                    safeTopic, LogSanitizer.preview(question), entry.citations.size());
            return entry.recordHit();
        }

        if (cache.estimatedSize() < similarityScanLimit) {
            CacheEntry similar = findSimilar(safeTopic, normalized);
            if (similar != null) {
                return similar;
            }
        }

        misses.incrementAndGet();
        LOG.debug("Cache MISS: topic={}, question=\"{}\"", safeTopic, LogSanitizer.preview(question));
        return null;
    }

    /**
     * Caches a response, replacing any entry under the same key.
     */
    public void set(String topic, String question, String content, String subject) {
        if (!enabled) {
            return;
        }
        Objects.requireNonNull(content, "content must not be null");
        String safeTopic = topicOrGeneral(topic);
        String safeSubject = subject == null || subject.isBlank() ? GENERAL : subject;
        String normalized = normalizeQuestion(question);
        Instant now = Instant.now();
        List<String> citations = citationsFor(safeTopic, safeSubject, now);
        cache.put(cacheKey(safeTopic, normalized),
                new StoredEntry(content, safeTopic, safeSubject, now, citations, normalized));
        LOG.debug("Cached response: topic={}, question=\"{}\", citations={}",
                safeTopic, LogSanitizer.preview(question), citations.size());
    }

    public void warmUp(String topic, List<WarmUpEntry> entries) {
        Objects.requireNonNull(entries, "entries must not be null");
        for (WarmUpEntry entry : entries) {
            set(topic, entry.question(), entry.response(), entry.subject());
        }
        LOG.info("Cache warmed up with {} entries for topic={}", entries.size(), topicOrGeneral(topic));
    }

    /**
     * Drops all entries and zeroes the hit/miss counters.
     */
    public void clear() {
        cache.invalidateAll();
        cache.cleanUp();
        hits.set(0);
        misses.set(0);
        LOG.info("Semantic cache cleared");
    }

    public CacheMetrics getMetrics() {
        cache.cleanUp();
        long h = hits.get();
        long m = misses.get();
        long total = h + m;
        long size = cache.estimatedSize();
        double hitRate = total > 0 ? (h * 100.0) / total : 0.0;
        return new CacheMetrics(h, m, hitRate, size, size * KB_PER_ENTRY);
    }

    public CacheStatus getStatus() {
        CacheMetrics metrics = getMetrics();
        return new CacheStatus(metrics.totalEntries(), maxEntries, metrics, enabled);
    }

    /**
     * Lowercases, removes punctuation other than {@code ?}, drops filler words and collapses whitespace.
     */
    static String normalizeQuestion(String question) {
        if (question == null) {
            return "";
        }
        String s = question.toLowerCase(Locale.ROOT).trim();
        s = NON_WORD.matcher(s).replaceAll("");
        s = WHITESPACE.matcher(s).replaceAll(" ");
        s = FILLERS.matcher(s).replaceAll("");
        s = WHITESPACE.matcher(s).replaceAll(" ");
        return s.trim();
    }

    static String cacheKey(String topic, String normalizedQuestion) {
        return topic + ':' + sha256Prefix(normalizedQuestion);
    }

    /** Jaccard similarity of whitespace-separated token sets; 0 when both are empty. */
    static double jaccard(String a, String b) {
        Set<String> left = tokens(a);
        Set<String> right = tokens(b);
        if (left.isEmpty() && right.isEmpty()) {
            return 0.0;
        }
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        left.retainAll(right);
        return (double) left.size() / union.size();
    }

    static List<String> citationsFor(String topic, String subject, Instant cachedAt) {
        List<String> citations = new ArrayList<>(3);
        if (!GENERAL.equals(topic)) {
            citations.add("Lesson: " + topic);
        }
        if (!GENERAL.equals(subject)) {
            citations.add("Subject: " + Character.toUpperCase(subject.charAt(0)) + subject.substring(1));
        }
        citations.add("Cached: " + cachedAt);
        return citations;
    }

    private CacheEntry findSimilar(String topic, String normalized) {
        for (Map.Entry<String, StoredEntry> candidate : cache.asMap().entrySet()) {
            StoredEntry stored = candidate.getValue();
            if (!stored.topic.equals(topic)) {
                continue;
            }
            double similarity = jaccard(normalized, stored.normalizedQuestion);
            if (similarity >= similarityThreshold) {
                // Touch the entry so the similarity hit also refreshes recency and expiry
                StoredEntry touched = cache.getIfPresent(candidate.getKey());
                if (touched == null) {
                    continue;
                }
                hits.incrementAndGet();
                LOG.debug("Semantic HIT ({}% similar) for topic={}",
                        String.format(Locale.ROOT, "%.1f", similarity * 100), topic);
                return touched.recordHit();
            }
        }
        return null;
    }

    private static Set<String> tokens(String s) {
        Set<String> result = new HashSet<>();
        if (s == null || s.isBlank()) {
            return result;
        }
        result.addAll(Arrays.asList(WHITESPACE.split(s.trim())));
        return result;
    }

    private static String topicOrGeneral(String topic) {
        return topic == null || topic.isBlank() ? GENERAL : topic;
    }

    private static String sha256Prefix(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(16);
            for (int i = 0; i < 8; i++) {
                hex.append(String.format("%02x", hash[i]));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static final class StoredEntry {
        private final String content;
        private final String topic;
        private final String subject;
        private final Instant createdAt;
        private final List<String> citations;
        private final String normalizedQuestion;
        private final AtomicInteger hitCount = new AtomicInteger();

        private StoredEntry(String content, String topic, String subject, Instant createdAt,
                            List<String> citations, String normalizedQuestion) {
            this.content = content;
            this.topic = topic;
            this.subject = subject;
            this.createdAt = createdAt;
            this.citations = List.copyOf(citations);
            this.normalizedQuestion = normalizedQuestion;
        }

        private CacheEntry recordHit() {
            return new CacheEntry(content, topic, subject, createdAt, hitCount.incrementAndGet(), citations);
        }
    }
}
