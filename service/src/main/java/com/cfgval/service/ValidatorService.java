package com.cfgval.service;

import com.cfgval.generator.GrammarGenerator;
import com.cfgval.generator.enumerate.EnumerationBounds;
import com.cfgval.generator.enumerate.EnumerationResult;
import com.cfgval.generator.grammar.Grammar;
import com.cfgval.service.source.GrammarSource;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/** Resolves grammars through the {@link GrammarSource} and runs the bounded validation. */
@Service
public class ValidatorService {

    private static final Logger log = LoggerFactory.getLogger(ValidatorService.class);

    static final String MESSAGE = "Hello World";

    private final GrammarSource grammarSource;
    private final Duration fetchTimeout;

    @Autowired
    public ValidatorService(GrammarSource grammarSource, ValidatorProperties properties) {
        this(
                grammarSource,
                properties
                        .grammarSource()
                        .connectTimeout()
                        .plus(properties.grammarSource().requestTimeout()));
    }

    ValidatorService(GrammarSource grammarSource, Duration fetchTimeout) {
        this.grammarSource = Objects.requireNonNull(grammarSource, "grammarSource");
        this.fetchTimeout = Objects.requireNonNull(fetchTimeout, "fetchTimeout");
    }

    public String message() {
        return MESSAGE;
    }

    /**
     * Validates {@code word} against the grammar {@code id}. Empty when the grammar cannot be
     * resolved, whatever the reason.
     */
    public Optional<ValidationReport> validate(String id, String word, EnumerationBounds bounds) {
        Optional<Grammar> grammar = fetchGrammar(id);
        if (grammar.isEmpty()) {
            log.info("Grammar {} not found", id);
            return Optional.empty();
        }

        GrammarGenerator generator = new GrammarGenerator(grammar.get());
        EnumerationResult result = generator.generateWords(bounds);
        boolean belongs = generator.wordBelongs(word, bounds);

        log.info(
                "Validated grammar {} with {}: {} words (truncated={}), belongs={}",
                id,
                bounds,
                result.size(),
                result.truncated(),
                belongs);
        return Optional.of(
                new ValidationReport(
                        grammar.get().id(),
                        grammar.get().startSymbol(),
                        result.size(),
                        List.copyOf(result.words()),
                        word,
                        belongs,
                        result.truncated()));
    }

    private Optional<Grammar> fetchGrammar(String id) {
        CompletableFuture<Optional<Grammar>> future = grammarSource.fetch(id);
        try {
            Optional<Grammar> grammar = future.get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return grammar != null ? grammar : Optional.empty();
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Timed out after {} fetching grammar {}", fetchTimeout, id);
            return Optional.empty();
        } catch (ExecutionException e) {
            log.warn("Fetching grammar {} failed", id, e.getCause());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("Interrupted while fetching grammar {}", id);
            return Optional.empty();
        }
    }
}
