package com.hcltech.dawg.dag;

import java.util.List;
import java.util.Set;

/**
 * Builds a minimal directed acyclic word graph.
 * <pre>
 *   Dawg dawg = new Dawg();
 *   dawg.insertAll(words);
 *   dawg.canonicalize();
 *   dawg.assignLevels();
 *   GraphExport export = dawg.export(5000);
 * </pre>
 * Insertion must finish before {@link #canonicalize()}; afterwards the graph is sealed.
 * Single threaded.
 */
public final class Dawg {
    private final WordGraph graph = new WordGraph();
    private final TrieBuilder builder = new TrieBuilder(graph);
    private final DagMinimizer minimizer = new DagMinimizer(graph);
    private final LevelAssigner levels = new LevelAssigner(graph);
    private final IntegrityValidator validator = new IntegrityValidator(graph);
    private final GraphExporter exporter = new GraphExporter(graph);
    private final WordEnumerator enumerator = new WordEnumerator(graph);

    public WordGraph graph() { return graph; }

    public boolean insert(String word) { return builder.insert(word); }

    public InsertSummary insertAll(Iterable<String> words) { return builder.insertAll(words); }

    public InsertSummary insertAll(Iterable<String> words, int progressEvery) { return builder.insertAll(words, progressEvery); }

    public MinimizationResult canonicalize() { return minimizer.canonicalize(); }

    public void assignLevels() { levels.assignLevels(); }

    public List<Set<Integer>> nodesByLevel() { return levels.nodesByLevel(); }

    public ValidationResult validate() { return validator.validate(); }

    public GraphExport export() { return exporter.export(); }

    public GraphExport export(int maxNodes) { return exporter.export(maxNodes); }

    public boolean contains(String word) { return enumerator.contains(word); }

    public List<String> words() { return enumerator.words(); }

    public List<String> wordsThrough(int node) { return enumerator.wordsThrough(node); }

    public GraphStats stats() {
        return new GraphStats(graph.liveCount(), graph.edgeCount(), enumerator.wordCount());
    }
}
