package com.hcltech.dawg.tools;

import com.hcltech.dawg.common.errorsor.ErrorsOr;
import com.hcltech.dawg.dag.Dawg;
import com.hcltech.dawg.dag.GraphExport;
import com.hcltech.dawg.dag.InsertSummary;
import com.hcltech.dawg.dag.MinimizationResult;
import com.hcltech.dawg.dag.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Loads words, builds the minimal graph and writes it as visualizer JSON.
 * Exit code 0 on success, 1 if the words cannot be loaded, the graph fails validation or the
 * JSON cannot be written.
 */
public class DawgApp {
    private static final Logger log = LoggerFactory.getLogger(DawgApp.class);

    public static void main(String[] args) {
        System.exit(run(DawgAppConfig.load()));
    }

    public static int run(DawgAppConfig config) {
        ErrorsOr<Path> written = config.wordSource().lines()
                .addPrefixIfError("Loading words: ")
                .flatMap(words -> build(words, config))
                .flatMap(export -> new GraphJsonCodec(config.prettyJson()).write(export, config.outputFile()));
        return written.fold(path -> {
            log.info("Graph written to {}", path.toAbsolutePath());
            return 0;
        }, errors -> {
            errors.forEach(e -> log.error("{}", e));
            return 1;
        });
    }

    static ErrorsOr<GraphExport> build(List<String> words, DawgAppConfig config) {
        long startMs = System.currentTimeMillis();
        Dawg dawg = new Dawg();

        InsertSummary inserted = dawg.insertAll(words, config.progressEvery());
        log.info("Inserted {} words ({} new, {} duplicates, {} rejected)",
                inserted.total(), inserted.accepted(), inserted.duplicates(), inserted.rejected().size());

        MinimizationResult minimized = dawg.canonicalize();
        dawg.assignLevels();

        ValidationResult validation = dawg.validate();
        if (!validation.ok())
            return ErrorsOr.error("Graph failed validation: sinkReachable=" + validation.sinkReachable()
                    + " deadEnds=" + validation.deadEndCount() + " danglingEdges=" + validation.danglingEdges());

        GraphExport export = dawg.export(config.maxExportNodes());
        log.info("Built graph in {} ms: {} trie nodes -> {} nodes, {} exported",
                System.currentTimeMillis() - startMs, minimized.nodesBefore(), minimized.nodesAfter(), export.nodes().size());
        return ErrorsOr.lift(export);
    }
}
