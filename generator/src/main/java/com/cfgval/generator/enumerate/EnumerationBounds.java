package com.cfgval.generator.enumerate;

/**
 * The three independent limits of one enumeration run.
 *
 * <ul>
 *   <li>{@code maxDepth}: entries whose depth is strictly greater are discarded, so words reached
 *       in exactly {@code maxDepth} expansion steps are still produced.
 *   <li>{@code maxWords}: the search stops once this many distinct words are collected.
 *   <li>{@code maxTokens}: rewrites producing a form longer than this are never enqueued.
 * </ul>
 */
public record EnumerationBounds(int maxDepth, int maxWords, int maxTokens) {

    public static final int DEFAULT_MAX_DEPTH = 10;
    public static final int DEFAULT_MAX_WORDS = 1000;
    public static final int DEFAULT_MAX_TOKENS = 30;

    public EnumerationBounds {
        requireNonNegative(maxDepth, "maxDepth");
        requireNonNegative(maxWords, "maxWords");
        requireNonNegative(maxTokens, "maxTokens");
    }

    public static EnumerationBounds defaults() {
        return new EnumerationBounds(DEFAULT_MAX_DEPTH, DEFAULT_MAX_WORDS, DEFAULT_MAX_TOKENS);
    }

    public EnumerationBounds withMaxDepth(int depth) {
        return new EnumerationBounds(depth, maxWords, maxTokens);
    }

    public EnumerationBounds withMaxWords(int words) {
        return new EnumerationBounds(maxDepth, words, maxTokens);
    }

    public EnumerationBounds withMaxTokens(int tokens) {
        return new EnumerationBounds(maxDepth, maxWords, tokens);
    }

    private static void requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be >= 0, was " + value);
        }
    }
}
