package com.cfgval.generator.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw grammar definition as delivered by a grammar source: an identifier, the start symbol and the
 * productions in declaration order.
 *
 * <p>The production list is copied on construction and exposed read-only. Declaration order
 * matters, since it governs the order in which alternatives are expanded.
 */
public record Grammar(String id, String startSymbol, List<ProductionRule> productions) {

    public Grammar {
        // List.copyOf would reject null entries, which the table builder tolerates.
        productions =
                productions == null
                        ? List.of()
                        : Collections.unmodifiableList(new ArrayList<>(productions));
    }

    public static Grammar of(String id, String startSymbol, ProductionRule... productions) {
        return new Grammar(id, startSymbol, List.of(productions));
    }
}
