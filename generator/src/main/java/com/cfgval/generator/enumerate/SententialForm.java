package com.cfgval.generator.enumerate;

import com.cfgval.generator.grammar.ProductionTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Immutable sequence of symbols reached from the start symbol by zero or more rewrites. */
public final class SententialForm {

    private final List<String> symbols;

    private SententialForm(List<String> symbols) {
        this.symbols = symbols;
    }

    public static SententialForm of(List<String> symbols) {
        return new SententialForm(List.copyOf(Objects.requireNonNull(symbols, "symbols")));
    }

    public static SententialForm start(String startSymbol) {
        return new SententialForm(List.of(Objects.requireNonNull(startSymbol, "startSymbol")));
    }

    public List<String> symbols() {
        return symbols;
    }

    public int size() {
        return symbols.size();
    }

    /** Index of the leftmost non-terminal, or {@code -1} when the form is fully terminal. */
    public int leftmostNonTerminal(ProductionTable table) {
        for (int i = 0; i < symbols.size(); i++) {
            if (table.isNonTerminal(symbols.get(i))) {
                return i;
            }
        }
        return -1;
    }

    /** Copy of this form with the symbol at {@code index} rewritten to {@code replacement}. */
    public SententialForm replace(int index, List<String> replacement) {
        List<String> rewritten = new ArrayList<>(symbols.size() - 1 + replacement.size());
        rewritten.addAll(symbols.subList(0, index));
        rewritten.addAll(replacement);
        rewritten.addAll(symbols.subList(index + 1, symbols.size()));
        return new SententialForm(List.copyOf(rewritten));
    }

    /** Symbols joined by single spaces; doubles as the visited-state key and the word text. */
    public String serialize() {
        return String.join(" ", symbols).trim();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SententialForm other && symbols.equals(other.symbols);
    }

    @Override
    public int hashCode() {
        return symbols.hashCode();
    }

    @Override
    public String toString() {
        return "[" + serialize() + "]";
    }
}
