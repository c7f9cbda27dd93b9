package com.cfgval.service;

import java.util.List;

/**
 * Result of validating one word against one grammar. {@code words} is the bounded sample the
 * membership answer was computed from; {@code truncated} tells whether a bound cut the search.
 */
public record ValidationReport(
        String id,
        String startSymbol,
        int generatedCount,
        List<String> words,
        String testWord,
        boolean belongs,
        boolean truncated) {

    public ValidationReport {
        words = List.copyOf(words);
    }
}
