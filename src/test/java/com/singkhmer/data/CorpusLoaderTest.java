package com.singkhmer.data;

import com.singkhmer.config.TransliteratorProperties;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CorpusLoaderTest {

    private static CorpusLoader loader(String dataset, String priors) {
        TransliteratorProperties properties = new TransliteratorProperties();
        properties.setDatasetLocation(dataset);
        properties.setPriorsLocation(priors);
        return new CorpusLoader(new DefaultResourceLoader(), properties);
    }

    @Test
    void parsesEveryRomanizationOfAWord() throws IOException {
        List<RomanizationPair> pairs = CorpusLoader.parse(new StringReader("ជាង: cheang, jeang, jg\nចង់: chong, jong, jg\n"));

        assertEquals(List.of(
                new RomanizationPair("cheang", "ជាង"),
                new RomanizationPair("jeang", "ជាង"),
                new RomanizationPair("jg", "ជាង"),
                new RomanizationPair("chong", "ចង់"),
                new RomanizationPair("jong", "ចង់"),
                new RomanizationPair("jg", "ចង់")), pairs);
    }

    @Test
    void skipsMalformedLinesAndEmptyTokens() throws IOException {
        try (Reader reader = new InputStreamReader(
                getClass().getResourceAsStream("/corpus-malformed.txt"), StandardCharsets.UTF_8)) {
            List<RomanizationPair> pairs = CorpusLoader.parse(reader);

            assertEquals(List.of(
                    new RomanizationPair("ban", "បាន"),
                    new RomanizationPair("cheang", "ជាង"),
                    new RomanizationPair("jg", "ជាង"),
                    new RomanizationPair("jg: extra", "ចង់"),
                    new RomanizationPair("tae", "តែ")), pairs);
        }
    }

    @Test
    void groupsWordsByLowerCasedRomanization() throws IOException {
        Map<String, List<String>> grouped = CorpusLoader.parseGrouped(
                new StringReader("ជាង: CheAng, JG\nចង់: jg\nជាង: jg\n"));

        assertEquals(List.of("ជាង", "ចង់", "ជាង"), grouped.get("jg"));
        assertEquals(List.of("ជាង"), grouped.get("cheang"));
        assertTrue(grouped.keySet().stream().allMatch(k -> k.equals(k.toLowerCase())));
    }

    @Test
    void loadsBundledDataset() {
        RomanizationTrie trie = loader("classpath:dataset.txt", "").load();

        assertTrue(trie.keyCount() > 0);
        assertTrue(trie.searchExact("ban").contains("បាន"));
        assertTrue(trie.searchExact("jg").containsAll(List.of("ជាង", "ចង់")));
        assertTrue(trie.searchExact("cheang").contains("ជាង"));
        assertTrue(trie.searchExact("jeang").contains("ជាង"));
        assertTrue(trie.searchPrefix("jong").contains("ចុង"));
    }

    @Test
    void repeatedPairsAccumulateAcrossLines() {
        RomanizationTrie trie = loader("classpath:corpus-repeated.txt", "").load();

        assertEquals(2, trie.frequencyOf("jg", "ជាង"));
        assertEquals(1, trie.frequencyOf("jg", "ចង់"));
        assertEquals(3, trie.frequencyOf("jong", "ចង់"));
        assertEquals(List.of("ជាង", "ចង់"), trie.searchExact("jg"));
    }

    @Test
    void malformedCorpusLoadsOnlyValidPairs() {
        RomanizationTrie trie = loader("classpath:corpus-malformed.txt", "").load();

        assertEquals(1, trie.frequencyOf("jg", "ជាង"));
        assertEquals(List.of("ចង់"), trie.searchExact("jg: extra"));
        assertEquals(5, trie.pairCount());
    }

    @Test
    void missingDatasetYieldsEmptyIndex() {
        RomanizationTrie trie = loader("classpath:does-not-exist.txt", "").load();

        assertEquals(0, trie.keyCount());
        assertTrue(trie.searchExact("jg").isEmpty());
    }

    @Test
    void priorsAddToDatasetFrequencies() {
        RomanizationTrie trie = loader("classpath:dataset.txt", "classpath:priors.csv").load();

        assertEquals(6, trie.frequencyOf("jg", "ចង់"));
        assertEquals(1, trie.frequencyOf("jg", "ជាង"));
        assertEquals(List.of("ចង់", "ជាង"), trie.searchExact("jg"));
        assertEquals(3, trie.frequencyOf("te", "តែ"));
        // unparsable and non-positive rows are skipped
        assertEquals(1, trie.frequencyOf("ban", "បាន"));
        assertEquals(1, trie.frequencyOf("tov", "ទៅ"));
    }

    @Test
    void applyPriorsCountsOnlyValidRecords() {
        RomanizationTrie trie = new RomanizationTrie();
        int applied = loader("classpath:dataset.txt", "").applyPriors("classpath:priors.csv", trie);

        assertEquals(2, applied);
        assertEquals(5, trie.frequencyOf("jg", "ចង់"));
        assertEquals(List.of("តែ"), trie.searchExact("TE"));
    }

    @Test
    void missingPriorsKeepDataset() {
        RomanizationTrie trie = loader("classpath:dataset.txt", "classpath:no-priors.csv").load();

        assertEquals(1, trie.frequencyOf("jg", "ចង់"));
    }
}
