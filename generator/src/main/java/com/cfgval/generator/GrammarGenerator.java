package com.cfgval.generator;

import com.cfgval.generator.enumerate.DerivationEnumerator;
import com.cfgval.generator.enumerate.EnumerationBounds;
import com.cfgval.generator.enumerate.EnumerationResult;
import com.cfgval.generator.enumerate.SententialForm;
import com.cfgval.generator.grammar.Grammar;
import com.cfgval.generator.grammar.ProductionTable;
import com.cfgval.generator.membership.MembershipTester;
import java.util.Objects;

/**
 * Entry point tying one grammar to word generation and membership checks. The production table is
 * built once; every call then runs its own bounded enumeration.
 */
public final class GrammarGenerator {

    private final Grammar grammar;
    private final ProductionTable table;
    private final DerivationEnumerator enumerator;

    public GrammarGenerator(Grammar grammar) {
        this.grammar = Objects.requireNonNull(grammar, "grammar");
        this.table = ProductionTable.build(grammar);
        this.enumerator = new DerivationEnumerator(table);
    }

    public Grammar grammar() {
        return grammar;
    }

    public ProductionTable table() {
        return table;
    }

    public EnumerationResult generateWords(EnumerationBounds bounds) {
        return enumerator.enumerate(SententialForm.start(grammar.startSymbol()), bounds);
    }

    /**
     * Regenerates the word set for {@code bounds} and tests {@code word} against it. The answer is
     * only as good as the sample: see {@link MembershipTester}.
     */
    public boolean wordBelongs(String word, EnumerationBounds bounds) {
        if (word == null || word.isBlank()) {
            return false;
        }
        return MembershipTester.belongs(word, generateWords(bounds).words());
    }
}
