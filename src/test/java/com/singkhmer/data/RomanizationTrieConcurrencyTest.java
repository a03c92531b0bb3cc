package com.singkhmer.data;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

import static org.junit.jupiter.api.Assertions.*;

class RomanizationTrieConcurrencyTest {

    @Test
    void concurrentIncrementsAreNotLost() throws Exception {
        RomanizationTrie trie = new RomanizationTrie();
        trie.insert("jg", "ជាង");
        trie.insert("jg", "ចង់");

        int writers = 8;
        int perWriter = 500;
        ExecutorService pool = Executors.newFixedThreadPool(writers + 2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < writers; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int j = 0; j < perWriter; j++) {
                        trie.incrementFrequency("jg", "ចង់");
                    }
                    return null;
                }));
            }
            // readers and a concurrent inserter running alongside the writers
            futures.add(pool.submit(() -> {
                start.await();
                for (int j = 0; j < perWriter; j++) {
                    List<String> exact = trie.searchExact("jg");
                    assertEquals(2, exact.size());
                    assertTrue(trie.searchPrefix("j").containsAll(exact));
                    trie.searchFuzzy("jk", 1);
                }
                return null;
            }));
            futures.add(pool.submit(() -> {
                start.await();
                for (int j = 0; j < perWriter; j++) {
                    trie.insert("k" + j, "w" + j);
                }
                return null;
            }));

            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1 + writers * perWriter, trie.frequencyOf("jg", "ចង់"));
        assertEquals(1, trie.frequencyOf("jg", "ជាង"));
        assertEquals(1 + perWriter, trie.keyCount());
    }
}
