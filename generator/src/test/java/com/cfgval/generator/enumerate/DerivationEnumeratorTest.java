package com.cfgval.generator.enumerate;

import static org.junit.jupiter.api.Assertions.*;

import com.cfgval.generator.grammar.Grammar;
import com.cfgval.generator.grammar.ProductionRule;
import com.cfgval.generator.grammar.ProductionTable;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import org.junit.jupiter.api.Test;

final class DerivationEnumeratorTest {

    private static EnumerationResult run(Grammar grammar, int maxDepth, int maxWords, int maxTokens) {
        DerivationEnumerator enumerator = new DerivationEnumerator(ProductionTable.build(grammar));
        return enumerator.enumerate(
                SententialForm.start(grammar.startSymbol()),
                new EnumerationBounds(maxDepth, maxWords, maxTokens));
    }

    private static Grammar balanced() {
        return Grammar.of("balanced", "S", ProductionRule.of("S", "a S b | c"));
    }

    @Test
    void balancedGrammarAtDepthThree() {
        EnumerationResult result = run(balanced(), 3, 10, 10);

        assertEquals(Set.of("c", "a c b", "a a c b b"), result.words());
        assertFalse(result.contains("a a a c b b b"));
        assertTrue(result.truncated());
    }

    @Test
    void depthBoundIsInclusiveOfTheLimit() {
        // "a a a c b b b" takes exactly four rewrites
        assertTrue(run(balanced(), 4, 10, 10).contains("a a a c b b b"));
        assertFalse(run(balanced(), 3, 10, 10).contains("a a a c b b b"));
    }

    @Test
    void zeroDepthAllowsNoRewrites() {
        Grammar grammar = Grammar.of("g", "S", ProductionRule.of("S", "a"));

        assertEquals(Set.of(), run(grammar, 0, 10, 10).words());
        assertEquals(Set.of("a"), run(grammar, 1, 10, 10).words());
        assertEquals(Set.of("X"), run(Grammar.of("g", "X"), 0, 10, 10).words());
    }

    @Test
    void undeclaredStartSymbolIsItsOwnWord() {
        Grammar grammar = Grammar.of("g", "X", ProductionRule.of("S", "a"));

        EnumerationResult result = run(grammar, 10, 1000, 30);

        assertEquals(Set.of("X"), result.words());
        assertFalse(result.truncated());
    }

    @Test
    void leftRecursionTerminates() {
        Grammar grammar = Grammar.of("left", "A", ProductionRule.of("A", "A a | a"));

        EnumerationResult result = run(grammar, 10, 1000, 30);

        assertFalse(result.words().isEmpty());
        assertTrue(result.contains("a"));
        assertTrue(result.contains("a a a"));
    }

    @Test
    void cyclicNonTerminalsTerminate() {
        Grammar grammar =
                Grammar.of(
                        "cycle",
                        "S",
                        ProductionRule.of("S", "T | s"),
                        ProductionRule.of("T", "S | t"));

        assertEquals(Set.of("s", "t"), run(grammar, 50, 1000, 30).words());
    }

    @Test
    void epsilonProductionYieldsEmptyWord() {
        Grammar grammar = Grammar.of("eps", "S", ProductionRule.of("S", "a S | ε"));

        EnumerationResult result = run(grammar, 3, 100, 10);

        assertTrue(result.words().containsAll(List.of("", "a", "a a")));
    }

    @Test
    void wordCountBoundCapsOutput() {
        Grammar grammar = Grammar.of("left", "A", ProductionRule.of("A", "A a | a"));

        EnumerationResult result = run(grammar, 100, 3, 100);

        assertEquals(3, result.size());
        assertTrue(result.truncated());
        assertEquals(0, run(grammar, 100, 0, 100).size());
    }

    @Test
    void tokenBoundPrunesLongForms() {
        // "a a a S b b b" has seven symbols and is never enqueued
        EnumerationResult result = run(balanced(), 20, 1000, 5);

        assertEquals(Set.of("c", "a c b", "a a c b b"), result.words());
        for (String word : result.words()) {
            assertTrue(word.split(" ").length <= 5, word);
        }
    }

    @Test
    void tokenBoundAppliesToIntermediateForms() {
        // the six-symbol form would only ever erase down to the empty word
        Grammar grammar =
                Grammar.of(
                        "wide",
                        "S",
                        ProductionRule.of("S", "A A A A A A | x"),
                        ProductionRule.of("A", "ε"));

        EnumerationResult result = run(grammar, 20, 100, 5);

        assertEquals(Set.of("x"), result.words());
        assertFalse(result.contains(""));
        assertTrue(result.truncated());
        assertTrue(run(grammar, 20, 100, 6).contains(""));
    }

    @Test
    void deadEndNonTerminalContributesNothing() {
        Grammar grammar =
                Grammar.of(
                        "dead",
                        "S",
                        ProductionRule.of("S", "D x | y"),
                        ProductionRule.of("D", ""));

        assertEquals(Set.of("y"), run(grammar, 10, 100, 10).words());
    }

    @Test
    void undeclaredReferenceIsKeptAsTerminal() {
        Grammar grammar = Grammar.of("g", "S", ProductionRule.of("S", "Missing ;"));

        assertEquals(Set.of("Missing ;"), run(grammar, 10, 100, 10).words());
    }

    @Test
    void alternativesAreExpandedInDeclarationOrder() {
        Grammar grammar = Grammar.of("g", "S", ProductionRule.of("S", "z | y | x"));

        assertEquals(List.of("z", "y", "x"), List.copyOf(run(grammar, 5, 10, 10).words()));
    }

    @Test
    void repeatedRunsAreIdentical() {
        Grammar grammar =
                Grammar.of(
                        "expr",
                        "E",
                        ProductionRule.of("E", "E + T | T"),
                        ProductionRule.of("T", "( E ) | id"));

        EnumerationResult first = run(grammar, 6, 50, 12);
        EnumerationResult second = run(grammar, 6, 50, 12);

        assertEquals(List.copyOf(first.words()), List.copyOf(second.words()));
        assertTrue(first.size() <= 50);
    }

    @Test
    void interruptedThreadCancelsEnumeration() {
        DerivationEnumerator enumerator = new DerivationEnumerator(ProductionTable.build(balanced()));
        Thread.currentThread().interrupt();
        try {
            assertThrows(
                    CancellationException.class,
                    () -> enumerator.enumerate(SententialForm.start("S"), EnumerationBounds.defaults()));
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void negativeBoundsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new EnumerationBounds(-1, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> new EnumerationBounds(1, -1, 1));
        assertThrows(IllegalArgumentException.class, () -> new EnumerationBounds(1, 1, -1));
    }
}
