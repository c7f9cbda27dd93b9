package com.cfgval.generator.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Normalised view of a {@link Grammar}: every non-terminal mapped to its ordered list of
 * alternatives, each alternative an ordered symbol sequence (empty for an epsilon production).
 *
 * <p>A symbol is a non-terminal exactly when the table holds an entry for it. Symbols referenced
 * on a right side but never declared are therefore terminals, which turns undefined references
 * into dead ends rather than errors. The table is immutable once built and may be shared between
 * threads.
 */
public final class ProductionTable {

    private final Map<String, List<List<String>>> alternatives;

    private ProductionTable(Map<String, List<List<String>>> alternatives) {
        this.alternatives = alternatives;
    }

    public static ProductionTable build(Grammar grammar) {
        Objects.requireNonNull(grammar, "grammar");
        Map<String, List<List<String>>> table = new LinkedHashMap<>();
        for (ProductionRule rule : grammar.productions()) {
            if (rule == null || rule.nonTerminal() == null) {
                continue;
            }
            List<List<String>> alts =
                    table.computeIfAbsent(rule.nonTerminal().trim(), key -> new ArrayList<>());
            if (rule.rightSide() == null) {
                continue;
            }
            // split with a negative limit keeps trailing empty pieces; they are dropped below
            for (String piece : rule.rightSide().split("\\|", -1)) {
                String alternative = piece.trim();
                if (!alternative.isEmpty()) {
                    alts.add(Tokenizer.tokenize(alternative));
                }
            }
        }

        Map<String, List<List<String>>> frozen = new LinkedHashMap<>();
        table.forEach((nt, alts) -> frozen.put(nt, List.copyOf(alts)));
        return new ProductionTable(Collections.unmodifiableMap(frozen));
    }

    public boolean isNonTerminal(String symbol) {
        return alternatives.containsKey(symbol);
    }

    /** Alternatives of {@code nonTerminal} in declaration order; empty when it has none. */
    public List<List<String>> alternatives(String nonTerminal) {
        return alternatives.getOrDefault(nonTerminal, List.of());
    }

    public Set<String> nonTerminals() {
        return alternatives.keySet();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        alternatives.forEach(
                (nt, alts) -> {
                    sb.append(nt).append(" ->");
                    for (int i = 0; i < alts.size(); i++) {
                        sb.append(i == 0 ? " " : " | ");
                        sb.append(alts.get(i).isEmpty() ? Tokenizer.EPSILON : String.join(" ", alts.get(i)));
                    }
                    sb.append('\n');
                });
        return sb.toString();
    }
}
