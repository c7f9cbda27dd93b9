package com.cfgval.generator.enumerate;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Outcome of one enumeration run. {@code words} has set semantics; its iteration order is the
 * discovery order, which is deterministic for a given grammar and bounds. {@code truncated} is
 * set when some branch was cut by a bound, in which case the sample may miss words of the
 * language that a looser bound would have found.
 */
public record EnumerationResult(Set<String> words, boolean truncated) {

    public EnumerationResult {
        words = Collections.unmodifiableSet(new LinkedHashSet<>(words));
    }

    public int size() {
        return words.size();
    }

    public boolean contains(String word) {
        return words.contains(word);
    }
}
