package org.pathviz.app;

import org.pathviz.routing.core.ShortestPathAlgorithm;
import org.pathviz.routing.core.ShortestPathEngine;
import org.pathviz.routing.core.ShortestPathException;
import org.pathviz.routing.core.ShortestPathResult;
import org.pathviz.routing.graph.SampleGraphs;
import org.pathviz.routing.graph.WeightedGraph;
import org.pathviz.routing.report.ResultFormatter;

import java.io.PrintStream;
import java.util.List;

/**
 * Command-line smoke run over the sample graph.
 *
 * <p>Usage: {@code Main [start] [end] [dijkstra|bellman-ford|both]}, defaults {@code A C both}.</p>
 */
public class Main {
    static final String ALL_ALGORITHMS = "both";

    /**
     * Runs the query and exits non-zero on bad arguments.
     *
     * @param args command-line arguments.
     */
    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Runs the query and prints one report block per algorithm.
     *
     * @return process exit status: 0 on success, 2 on invalid arguments.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        String start = args.length > 0 ? args[0] : SampleGraphs.DEFAULT_START;
        String end = args.length > 1 ? args[1] : SampleGraphs.DEFAULT_END;
        String algorithmArg = args.length > 2 ? args[2] : ALL_ALGORITHMS;

        final List<ShortestPathAlgorithm> algorithms;
        try {
            algorithms = ALL_ALGORITHMS.equalsIgnoreCase(algorithmArg)
                    ? List.of(ShortestPathAlgorithm.values())
                    : List.of(ShortestPathAlgorithm.fromName(algorithmArg));
        } catch (IllegalArgumentException ex) {
            err.println("error: " + ex.getMessage());
            return 2;
        }

        WeightedGraph graph = SampleGraphs.visualizerDefault();
        ShortestPathEngine engine = new ShortestPathEngine();
        out.println("Shortest Path Visualizer");
        out.println("Start: " + start);
        out.println("End: " + end);
        try {
            for (ShortestPathAlgorithm algorithm : algorithms) {
                ShortestPathResult result = engine.compute(graph, start, end, algorithm);
                out.println();
                out.println(ResultFormatter.render(result));
            }
        } catch (ShortestPathException ex) {
            err.println("error: " + ex.getMessage());
            return 2;
        }
        return 0;
    }
}
