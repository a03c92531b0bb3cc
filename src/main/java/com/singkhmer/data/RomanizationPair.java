package com.singkhmer.data;

/**
 * One corpus mapping: a lower-cased romanization and the Khmer word it spells.
 */
public record RomanizationPair(String romanization, String word) {}
