package com.singkhmer.data;

import java.util.HashMap;
import java.util.Map;

public class TrieNode {

    // Each child node is mapped by one character of a romanization.
    // e.g., for "jg", the 'j' node will have a 'g' node in its children map.
    private final Map<Character, TrieNode> children = new HashMap<>();

    // Khmer word -> frequency. Only non-empty on nodes where a romanization ends.
    private final Map<String, Integer> words = new HashMap<>();

    public Map<Character, TrieNode> getChildren() {
        return children;
    }

    public Map<String, Integer> getWords() {
        return words;
    }

    public boolean isTerminal() {
        return !words.isEmpty();
    }

    public void addFrequency(String word, int delta) {
        words.merge(word, delta, TrieNode::saturatedAdd);
    }

    // frequencies stop at Integer.MAX_VALUE instead of wrapping
    static int saturatedAdd(int a, int b) {
        long sum = (long) a + b;
        return sum > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) sum;
    }
}
