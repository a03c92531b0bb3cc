package com.singkhmer.service;

import com.singkhmer.data.RomanizationTrie;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds the top suggestions for a romanized token.
 * Exact matches come first, then prefix matches, then fuzzy matches at distance 1.
 * Later stages only run while there are free slots.
 */
public class SuggestionComposer {

    public static final int SUGGESTION_LIMIT = 3;
    public static final int FUZZY_MAX_DISTANCE = 1;

    private final RomanizationTrie trie;

    public SuggestionComposer(RomanizationTrie trie) {
        this.trie = trie;
    }

    public List<String> suggest(String input) {
        if (input == null || input.isBlank()) return Collections.emptyList();

        List<String> exact = trie.searchExact(input);
        if (exact.size() >= SUGGESTION_LIMIT) {
            return new ArrayList<>(exact.subList(0, SUGGESTION_LIMIT));
        }

        List<String> out = new ArrayList<>(exact);
        fill(out, trie.searchPrefix(input));
        if (out.size() < SUGGESTION_LIMIT) {
            fill(out, trie.searchFuzzy(input, FUZZY_MAX_DISTANCE));
        }
        return out;
    }

    private static void fill(List<String> out, List<String> candidates) {
        for (String word : candidates) {
            if (out.size() >= SUGGESTION_LIMIT) return;
            if (!out.contains(word)) out.add(word);
        }
    }
}
