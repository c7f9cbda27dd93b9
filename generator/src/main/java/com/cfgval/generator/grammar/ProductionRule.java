package com.cfgval.generator.grammar;

/**
 * A single {@code nonTerminal -> rightSide} line. The right side is raw text holding one or more
 * {@code |}-separated alternatives; several rules may share the same non-terminal.
 */
public record ProductionRule(String nonTerminal, String rightSide) {

    public static ProductionRule of(String nonTerminal, String rightSide) {
        return new ProductionRule(nonTerminal, rightSide);
    }
}
