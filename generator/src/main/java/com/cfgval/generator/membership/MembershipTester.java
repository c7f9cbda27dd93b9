package com.cfgval.generator.membership;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Checks a candidate word against a previously enumerated word set.
 *
 * <p>This is not a membership oracle for the grammar. A word belongs only if it is in the bounded
 * sample, so words of the language whose derivation needs more expansion steps, longer
 * intermediate forms or a larger sample than the bounds used to build the set are reported as not
 * belonging.
 */
public final class MembershipTester {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private MembershipTester() {}

    /** Trims the word and collapses every whitespace run to a single space. */
    public static String normalize(String word) {
        if (word == null) {
            return "";
        }
        String trimmed = word.strip();
        if (trimmed.isEmpty()) {
            return "";
        }
        return String.join(" ", WHITESPACE.split(trimmed));
    }

    /**
     * Whether the normalised {@code candidate} is one of {@code words}. A null, empty or blank
     * candidate never belongs, even when the set holds the empty word.
     */
    public static boolean belongs(String candidate, Set<String> words) {
        if (candidate == null || candidate.isBlank()) {
            return false;
        }
        return words.contains(normalize(candidate));
    }
}
