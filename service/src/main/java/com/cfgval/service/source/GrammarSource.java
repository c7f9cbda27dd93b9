package com.cfgval.service.source;

import com.cfgval.generator.grammar.Grammar;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Looks grammars up by identifier. Implementations complete with {@link Optional#empty()} on any
 * failure (unknown id, transport error, bad status, malformed payload) and do not distinguish
 * between the causes.
 */
public interface GrammarSource {
    CompletableFuture<Optional<Grammar>> fetch(String id);
}
