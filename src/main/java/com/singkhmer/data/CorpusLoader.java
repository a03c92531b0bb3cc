package com.singkhmer.data;

import com.singkhmer.config.TransliteratorProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Builds a {@link RomanizationTrie} from the dataset corpus and, when configured,
 * a CSV of frequency priors.
 * <p>
 * The trie is filled before it is returned, so callers never see a half-loaded index.
 * A missing or unreadable dataset yields an empty trie.
 */
@Slf4j
@Component
public class CorpusLoader {

    private static final String[] PRIOR_HEADER = {"romanization", "word", "frequency"};

    private final ResourceLoader resourceLoader;
    private final TransliteratorProperties properties;

    public CorpusLoader(ResourceLoader resourceLoader, TransliteratorProperties properties) {
        this.resourceLoader = resourceLoader;
        this.properties = properties;
    }

    public RomanizationTrie load() {
        RomanizationTrie trie = new RomanizationTrie();
        List<RomanizationPair> pairs = readDataset(properties.getDatasetLocation());
        for (RomanizationPair pair : pairs) {
            trie.insert(pair.romanization(), pair.word());
        }
        log.info("Loaded {} romanization pairs ({} distinct keys)", pairs.size(), trie.keyCount());

        String priors = properties.getPriorsLocation();
        if (priors != null && !priors.isBlank()) {
            int applied = applyPriors(priors, trie);
            log.info("Applied {} frequency priors from {}", applied, priors);
        }
        return trie;
    }

    private List<RomanizationPair> readDataset(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.error("Dataset {} not found, starting with an empty index", location);
            return Collections.emptyList();
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            return parse(reader);
        } catch (IOException | UncheckedIOException e) {
            log.error("Could not read dataset {}, starting with an empty index", location, e);
            return Collections.emptyList();
        }
    }

    /**
     * Parses "khmer word: romanization1, romanization2" lines.
     * Lines without ':' and lines with an empty side are skipped, as are empty romanizations.
     */
    public static List<RomanizationPair> parse(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader ? (BufferedReader) source : new BufferedReader(source);
        List<RomanizationPair> pairs = new ArrayList<>();
        int skipped = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) continue;
            int sep = line.indexOf(':');
            if (sep < 0) {
                skipped++;
                continue;
            }
            String word = line.substring(0, sep).trim();
            String romanizations = line.substring(sep + 1).trim();
            if (word.isEmpty() || romanizations.isEmpty()) {
                skipped++;
                continue;
            }
            for (String token : romanizations.split(",")) {
                String key = RomanizationTrie.normalize(token.trim());
                if (key.isEmpty()) continue;
                pairs.add(new RomanizationPair(key, word));
            }
        }
        log.debug("Parsed {} pairs, skipped {} malformed lines", pairs.size(), skipped);
        return pairs;
    }

    /**
     * Same corpus grouped by romanization, words in file order.
     */
    public static Map<String, List<String>> parseGrouped(Reader source) throws IOException {
        Map<String, List<String>> grouped = new LinkedHashMap<>();
        for (RomanizationPair pair : parse(source)) {
            grouped.computeIfAbsent(pair.romanization(), k -> new ArrayList<>()).add(pair.word());
        }
        return grouped;
    }

    int applyPriors(String location, RomanizationTrie trie) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.info("Frequency priors {} not found, skipping", location);
            return 0;
        }
        List<CSVRecord> records;
        CSVFormat csvFormat = CSVFormat.DEFAULT.builder()
                .setHeader(PRIOR_HEADER)
                .setSkipHeaderRecord(true)
                .setTrim(true)
                .setIgnoreEmptyLines(true)
                .build();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8));
             CSVParser csvParser = new CSVParser(reader, csvFormat)) {
            records = csvParser.getRecords();
        } catch (IOException | UncheckedIOException e) {
            log.warn("Could not read frequency priors {}, ignoring them", location, e);
            return 0;
        }

        int applied = 0;
        for (CSVRecord csvRecord : records) {
            if (!csvRecord.isSet("frequency")) {
                log.warn("Skipping prior record {}: missing columns", csvRecord.getRecordNumber());
                continue;
            }
            String romanization = csvRecord.get("romanization");
            String word = csvRecord.get("word");
            int frequency;
            try {
                frequency = Integer.parseInt(csvRecord.get("frequency"));
            } catch (NumberFormatException e) {
                log.warn("Could not parse frequency for {} -> {}", romanization, word);
                continue;
            }
            if (frequency <= 0 || romanization.isBlank() || word.isBlank()) {
                log.warn("Skipping prior {} -> {} with frequency {}", romanization, word, frequency);
                continue;
            }
            trie.insert(romanization, word, frequency);
            applied++;
        }
        return applied;
    }
}
