package com.singkhmer.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.singkhmer.data.RomanizationTrie;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point for the HTTP layer: suggestions (cached), the raw search modes and learning.
 */
@Slf4j
@Service
public class TransliterationService {

    public static final int MAX_FUZZY_DISTANCE = 3;

    private final RomanizationTrie trie;
    private final SuggestionComposer composer;
    private final Cache<String, List<String>> suggestionCache;
    // bumped after every learned choice; a ranking computed across a bump is not kept
    private final AtomicLong generation = new AtomicLong();

    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final Counter learned;
    private final Counter ignored;
    private final Timer latency;

    public TransliterationService(RomanizationTrie trie,
                                  SuggestionComposer composer,
                                  @Qualifier("suggestionCache") Cache<String, List<String>> suggestionCache,
                                  MeterRegistry meterRegistry) {
        this.trie = trie;
        this.composer = composer;
        this.suggestionCache = suggestionCache;
        this.cacheHits = meterRegistry.counter("transliterator.suggest.requests", "result", "cache-hit");
        this.cacheMisses = meterRegistry.counter("transliterator.suggest.requests", "result", "cache-miss");
        this.learned = meterRegistry.counter("transliterator.accept", "result", "learned");
        this.ignored = meterRegistry.counter("transliterator.accept", "result", "ignored");
        this.latency = meterRegistry.timer("transliterator.suggest.latency");
    }

    public Suggestions suggest(String input) {
        long start = System.nanoTime();
        if (input == null || input.isBlank()) {
            return new Suggestions(Collections.emptyList(), false, 0L);
        }
        String cacheKey = RomanizationTrie.normalize(input);
        List<String> cached = suggestionCache.getIfPresent(cacheKey);
        if (cached != null) {
            cacheHits.increment();
            return new Suggestions(cached, true, elapsedMillis(start));
        }
        cacheMisses.increment();
        long seen = generation.get();
        List<String> words = List.copyOf(composer.suggest(input));
        suggestionCache.put(cacheKey, words);
        if (generation.get() != seen) {
            suggestionCache.invalidate(cacheKey);
        }
        long took = elapsedMillis(start);
        latency.record(took, TimeUnit.MILLISECONDS);
        log.debug("suggest '{}' -> {} ({} ms)", input, words, took);
        return new Suggestions(words, false, took);
    }

    public List<String> searchExact(String input) {
        return trie.searchExact(input);
    }

    /**
     * @param limit maximum number of results, or all of them when not positive
     */
    public List<String> searchPrefix(String input, int limit) {
        List<String> results = trie.searchPrefix(input);
        if (limit > 0 && results.size() > limit) {
            return results.subList(0, limit);
        }
        return results;
    }

    public List<String> searchFuzzy(String input, int maxDistance) {
        return trie.searchFuzzy(input, Math.min(maxDistance, MAX_FUZZY_DISTANCE));
    }

    /**
     * Records that the user picked {@code word} for {@code romanization}.
     * Only pairs already in the index are strengthened.
     *
     * @return true when the index changed
     */
    public boolean accept(String romanization, String word) {
        boolean changed = trie.incrementFrequency(romanization, word);
        if (changed) {
            learned.increment();
            generation.incrementAndGet();
            suggestionCache.invalidateAll();
            log.debug("learned {} -> {}", romanization, word);
        } else {
            ignored.increment();
            log.debug("ignored unknown pair {} -> {}", romanization, word);
        }
        return changed;
    }

    public Stats stats() {
        return new Stats(trie.keyCount(), trie.pairCount(),
                (long) cacheHits.count(), (long) cacheMisses.count(),
                (long) learned.count(), (long) ignored.count());
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    public record Suggestions(List<String> words, boolean fromCache, long tookMs) {}

    public record Stats(int keys, int pairs, long cacheHits, long cacheMisses, long accepted, long ignored) {}
}
