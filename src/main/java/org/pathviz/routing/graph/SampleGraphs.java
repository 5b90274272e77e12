package org.pathviz.routing.graph;

import lombok.experimental.UtilityClass;

/**
 * Ready-made graphs for demos and smoke runs.
 */
@UtilityClass
public final class SampleGraphs {

    /** Default start node of {@link #visualizerDefault()}. */
    public static final String DEFAULT_START = "A";
    /** Default end node of {@link #visualizerDefault()}. */
    public static final String DEFAULT_END = "C";

    /**
     * Five-node graph shown by the path visualizer on startup.
     */
    public static WeightedGraph visualizerDefault() {
        return WeightedGraph.builder()
                .nodes("A", "B", "C", "D", "E")
                .edge("A", "B", 4)
                .edge("A", "E", 2)
                .edge("B", "C", 3)
                .edge("B", "D", 1)
                .edge("C", "D", 2)
                .edge("D", "E", 3)
                .edge("E", "B", 7)
                .build();
    }
}
