package com.cfgval.generator.grammar;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Best-effort lexical scan of one production alternative.
 *
 * <p>Recognises identifier runs (a letter or underscore followed by letters, digits or
 * underscores) and the single-character symbols {@code ( ) { } + - = ; |}. Whitespace only
 * separates tokens. Any other character is dropped without error, so malformed text degrades to
 * fewer tokens instead of failing.
 *
 * <p>An alternative that yields no tokens, or that consists solely of an epsilon marker
 * ({@code ε} or {@code epsilon}), is the empty sequence.
 */
public final class Tokenizer {

    static final String EPSILON = "ε";
    static final String EPSILON_WORD = "epsilon";

    private static final String PUNCTUATION = "(){}+-=;|";

    private Tokenizer() {}

    public static List<String> tokenize(String alternative) {
        if (alternative == null || isEpsilonMarker(alternative.trim())) {
            return List.of();
        }
        List<String> tokens = new ArrayList<>();
        int length = alternative.length();
        int pos = 0;
        while (pos < length) {
            char c = alternative.charAt(pos);
            if (isIdentifierStart(c)) {
                int end = pos + 1;
                while (end < length && isIdentifierPart(alternative.charAt(end))) {
                    end++;
                }
                tokens.add(alternative.substring(pos, end));
                pos = end;
            } else {
                if (PUNCTUATION.indexOf(c) >= 0) {
                    tokens.add(String.valueOf(c));
                }
                pos++;
            }
        }
        return List.copyOf(tokens);
    }

    static boolean isEpsilonMarker(String text) {
        return EPSILON.equals(text) || EPSILON_WORD.equals(text.toLowerCase(Locale.ROOT));
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c);
    }
}
