package org.pathviz.routing.core;

import org.pathviz.routing.graph.WeightedGraph;

/**
 * Planner seam behind {@link ShortestPathEngine}.
 */
interface ShortestPathPlanner {
    /**
     * Runs one single-source search until its stop condition.
     *
     * @param graph read-only graph snapshot.
     * @param startNodeId validated internal start node id.
     * @param endNodeId validated internal end node id.
     * @return planner outcome in internal node-id space; never shares state with other calls.
     */
    InternalSearchPlan compute(WeightedGraph graph, int startNodeId, int endNodeId);
}
