package com.singkhmer.data;

import com.singkhmer.service.EditDistance;

import java.util.*;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Romanization -> Khmer word index with per-pair frequency counters.
 * <p>
 * Keys are lower-cased before every operation. Blank keys and words are ignored by
 * mutations and never match. Reads share a read lock; {@link #insert} and
 * {@link #incrementFrequency} take the write lock.
 * <p>
 * Results with equal frequency are ordered lexicographically by word.
 */
public class RomanizationTrie {

    public static final int DEFAULT_MAX_DISTANCE = 1;

    private static final Comparator<Map.Entry<String, Integer>> BY_FREQUENCY =
            Map.Entry.<String, Integer>comparingByValue().reversed()
                    .thenComparing(Map.Entry.comparingByKey());

    private record FuzzyCandidate(String word, int frequency, int distance) {}

    private static final Comparator<FuzzyCandidate> BY_DISTANCE =
            Comparator.comparingInt(FuzzyCandidate::distance)
                    .thenComparing(Comparator.comparingInt(FuzzyCandidate::frequency).reversed())
                    .thenComparing(FuzzyCandidate::word);

    private final TrieNode root = new TrieNode();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    // maintained by insert under the write lock
    private volatile int keyCount;
    private volatile int pairCount;

    public void insert(String romanization, String word) {
        insert(romanization, word, 1);
    }

    public void insert(String romanization, String word, int frequency) {
        if (isBlank(romanization) || isBlank(word) || frequency <= 0) return;
        String key = normalize(romanization);
        lock.writeLock().lock();
        try {
            TrieNode cur = root;
            for (char ch : key.toCharArray()) {
                cur = cur.getChildren().computeIfAbsent(ch, k -> new TrieNode());
            }
            if (!cur.isTerminal()) keyCount++;
            if (!cur.getWords().containsKey(word)) pairCount++;
            cur.addFrequency(word, frequency);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<String> searchExact(String romanization) {
        if (isBlank(romanization)) return Collections.emptyList();
        lock.readLock().lock();
        try {
            TrieNode node = findNode(normalize(romanization));
            if (node == null || !node.isTerminal()) return Collections.emptyList();
            return rank(node.getWords());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * All words under the prefix. A word reachable through several romanizations
     * has their frequencies summed.
     */
    public List<String> searchPrefix(String prefix) {
        if (isBlank(prefix)) return Collections.emptyList();
        lock.readLock().lock();
        try {
            TrieNode node = findNode(normalize(prefix));
            if (node == null) return Collections.emptyList();
            Map<String, Integer> totals = new HashMap<>();
            collectWords(node, totals);
            return rank(totals);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> searchFuzzy(String input) {
        return searchFuzzy(input, DEFAULT_MAX_DISTANCE);
    }

    /**
     * Typo-tolerant lookup over every stored romanization.
     * Ordered by distance, then frequency; each word appears once, at its best rank.
     */
    public List<String> searchFuzzy(String input, int maxDistance) {
        if (isBlank(input) || maxDistance < 0) return Collections.emptyList();
        String token = normalize(input);
        List<FuzzyCandidate> matches = new ArrayList<>();
        lock.readLock().lock();
        try {
            Map<String, TrieNode> keys = new LinkedHashMap<>();
            collectKeys(root, new StringBuilder(), keys);
            for (Map.Entry<String, TrieNode> e : keys.entrySet()) {
                int d = EditDistance.within(token, e.getKey(), maxDistance);
                if (d == -1) continue;
                e.getValue().getWords().forEach((word, freq) -> matches.add(new FuzzyCandidate(word, freq, d)));
            }
        } finally {
            lock.readLock().unlock();
        }
        matches.sort(BY_DISTANCE);
        Set<String> distinct = new LinkedHashSet<>();
        for (FuzzyCandidate c : matches) {
            distinct.add(c.word());
        }
        return new ArrayList<>(distinct);
    }

    /**
     * Strengthens an existing pair by one. Unknown romanizations or words are ignored.
     *
     * @return true when a stored frequency was changed
     */
    public boolean incrementFrequency(String romanization, String word) {
        if (isBlank(romanization) || isBlank(word)) return false;
        String key = normalize(romanization);
        lock.writeLock().lock();
        try {
            TrieNode node = findNode(key);
            if (node == null || !node.getWords().containsKey(word)) return false;
            node.addFrequency(word, 1);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int frequencyOf(String romanization, String word) {
        if (isBlank(romanization) || isBlank(word)) return 0;
        lock.readLock().lock();
        try {
            TrieNode node = findNode(normalize(romanization));
            return node == null ? 0 : node.getWords().getOrDefault(word, 0);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Number of distinct romanizations stored. */
    public int keyCount() {
        return keyCount;
    }

    /** Number of distinct (romanization, word) pairs stored. */
    public int pairCount() {
        return pairCount;
    }

    public static String normalize(String romanization) {
        return romanization.toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static List<String> rank(Map<String, Integer> frequencies) {
        return frequencies.entrySet().stream()
                .sorted(BY_FREQUENCY)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    private TrieNode findNode(String key) {
        TrieNode cur = root;
        for (char ch : key.toCharArray()) {
            cur = cur.getChildren().get(ch);
            if (cur == null) return null;
        }
        return cur;
    }

    // sums frequencies per word over the whole subtree
    private void collectWords(TrieNode node, Map<String, Integer> out) {
        node.getWords().forEach((word, freq) -> out.merge(word, freq, TrieNode::saturatedAdd));
        for (TrieNode child : node.getChildren().values()) {
            collectWords(child, out);
        }
    }

    private void collectKeys(TrieNode node, StringBuilder cur, Map<String, TrieNode> out) {
        if (node.isTerminal()) {
            out.put(cur.toString(), node);
        }
        for (Map.Entry<Character, TrieNode> e : node.getChildren().entrySet()) {
            cur.append(e.getKey());
            collectKeys(e.getValue(), cur, out);
            cur.deleteCharAt(cur.length() - 1);
        }
    }
}
