package org.pathviz.routing.core;

import lombok.Builder;
import lombok.Value;
import org.pathviz.routing.graph.WeightedGraph;

/**
 * One shortest-path query: graph snapshot, endpoints by node name, and algorithm.
 */
@Value
@Builder
public class ShortestPathRequest {
    /** Graph to search; not modified by the query. */
    WeightedGraph graph;
    /** Start node name. */
    String startNodeId;
    /** End node name. */
    String endNodeId;
    /** Algorithm to run. */
    ShortestPathAlgorithm algorithm;
}
