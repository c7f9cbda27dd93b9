package com.cfgval.generator.enumerate;

import com.cfgval.generator.grammar.ProductionTable;
import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CancellationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded breadth-first enumeration of the words derivable from a sentential form.
 *
 * <p>Always rewrites the leftmost non-terminal. Each run keeps its own work queue and a set of
 * already seen forms; together with the three bounds of {@link EnumerationBounds} this
 * guarantees termination on recursive and cyclic grammars. Branches exceeding a bound, and
 * non-terminals with no alternatives, are pruned without error.
 *
 * <p>The enumerator only reads its {@link ProductionTable}, so a single instance can serve
 * concurrent callers.
 */
public final class DerivationEnumerator {

    private static final Logger log = LoggerFactory.getLogger(DerivationEnumerator.class);

    private final ProductionTable table;

    public DerivationEnumerator(ProductionTable table) {
        this.table = Objects.requireNonNull(table, "table");
    }

    private record Entry(SententialForm form, int depth) {}

    public EnumerationResult enumerate(SententialForm start, EnumerationBounds bounds) {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(bounds, "bounds");

        Queue<Entry> queue = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        Set<String> words = new LinkedHashSet<>();
        boolean truncated = false;
        int dequeued = 0;

        queue.add(new Entry(start, 0));
        visited.add(start.serialize());

        while (!queue.isEmpty() && words.size() < bounds.maxWords()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("enumeration interrupted after " + dequeued + " forms");
            }
            Entry entry = queue.remove();
            dequeued++;

            if (entry.depth() > bounds.maxDepth()) {
                truncated = true;
                continue;
            }

            SententialForm form = entry.form();
            int index = form.leftmostNonTerminal(table);
            if (index < 0) {
                words.add(form.serialize());
                continue;
            }

            // an empty list here is a dead end
            List<List<String>> alternatives = table.alternatives(form.symbols().get(index));
            for (List<String> alternative : alternatives) {
                SententialForm candidate = form.replace(index, alternative);
                if (candidate.size() > bounds.maxTokens()) {
                    truncated = true;
                    continue;
                }
                if (visited.add(candidate.serialize())) {
                    queue.add(new Entry(candidate, entry.depth() + 1));
                }
            }
        }

        if (!queue.isEmpty()) {
            truncated = true;
        }
        if (log.isDebugEnabled()) {
            log.debug(
                    "Enumerated {} words from {} ({} forms dequeued, {} visited, truncated={})",
                    words.size(),
                    start,
                    dequeued,
                    visited.size(),
                    truncated);
        }
        return new EnumerationResult(words, truncated);
    }
}
