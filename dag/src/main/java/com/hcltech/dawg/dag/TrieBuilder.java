package com.hcltech.dawg.dag;

import com.hcltech.dawg.common.errorsor.ErrorsOr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Inserts words into the {@link WordGraph} as a plain prefix trie. No merging happens here.
 */
public final class TrieBuilder {
    private static final Logger log = LoggerFactory.getLogger(TrieBuilder.class);

    private final WordGraph graph;

    public TrieBuilder(WordGraph graph) {
        this.graph = Objects.requireNonNull(graph, "graph");
    }

    /**
     * Inserts one word. Inserting a word that is already present walks the existing path and
     * changes nothing.
     *
     * @return true if the word was not already a member
     * @throws IllegalArgumentException if the word is null, empty or blank
     * @throws IllegalStateException    if the graph has already been canonicalized
     */
    public boolean insert(String word) {
        String normalised = WordNormaliser.normalise(word)
                .fold(w -> w, errors -> { throw new IllegalArgumentException(String.join("; ", errors)); });
        return insertNormalised(normalised);
    }

    public InsertSummary insertAll(Iterable<String> words) {
        return insertAll(words, 0);
    }

    /**
     * Inserts a batch. Malformed words are skipped and reported; the rest of the batch continues.
     *
     * @param progressEvery log progress every this many words; 0 or less disables progress logging
     */
    public InsertSummary insertAll(Iterable<String> words, int progressEvery) {
        Objects.requireNonNull(words, "words");
        int accepted = 0;
        int duplicates = 0;
        int position = 0;
        List<String> rejected = new ArrayList<>();
        for (String raw : words) {
            position++;
            ErrorsOr<String> word = WordNormaliser.normalise(raw).addPrefixIfError("word " + position + ": ");
            if (word.isError()) {
                log.warn("Rejected {}", word.getErrors());
                rejected.addAll(word.getErrors());
            } else if (insertNormalised(word.valueOrThrow())) {
                accepted++;
            } else {
                duplicates++;
            }
            if (progressEvery > 0 && position % progressEvery == 0)
                log.info("Inserted {} words, {} nodes so far", position, graph.liveCount());
        }
        InsertSummary summary = new InsertSummary(accepted, duplicates, rejected);
        log.debug("Batch done: {} (live nodes={})", summary, graph.liveCount());
        return summary;
    }

    private boolean insertNormalised(String word) {
        if (graph.isSealed())
            throw new IllegalStateException("Cannot insert '" + word + "': graph has already been canonicalized");
        int current = graph.root();
        int depth = 0;
        for (int codePoint : word.codePoints().toArray()) {
            depth++;
            Integer next = graph.node(current).child(codePoint);
            current = next != null ? next : graph.addChild(current, codePoint, depth);
        }
        return graph.linkTerminator(current);
    }
}
