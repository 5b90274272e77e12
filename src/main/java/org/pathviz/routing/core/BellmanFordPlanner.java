package org.pathviz.routing.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.pathviz.routing.graph.WeightedGraph;
import org.pathviz.routing.search.VisitedSet;

import java.util.Arrays;

/**
 * Edge-relaxation shortest-path planner with negative-cycle detection.
 *
 * <p>Runs at most {@code |V| - 1} passes over every edge in insertion order and stops early after a
 * pass that improves nothing. A final scan that still finds a relaxable edge from a reached node
 * reports a negative cycle reachable from the start; no path data is produced in that case.</p>
 */
final class BellmanFordPlanner implements ShortestPathPlanner {
    private static final double INF = Double.POSITIVE_INFINITY;

    @Override
    public InternalSearchPlan compute(WeightedGraph graph, int startNodeId, int endNodeId) {
        int nodeCount = graph.nodeCount();
        int edgeCount = graph.edgeCount();
        double[] distance = new double[nodeCount];
        int[] predecessor = new int[nodeCount];
        Arrays.fill(distance, INF);
        Arrays.fill(predecessor, InternalSearchPlan.NO_NODE);
        distance[startNodeId] = 0.0d;

        VisitedSet improved = new VisitedSet(nodeCount);
        IntArrayList visitedOrder = new IntArrayList();

        int passes = 0;
        for (int pass = 0; pass < nodeCount - 1; pass++) {
            passes++;
            boolean progressed = false;
            for (int edgeId = 0; edgeId < edgeCount; edgeId++) {
                int origin = graph.getEdgeOrigin(edgeId);
                if (distance[origin] == INF) {
                    continue;
                }
                int target = graph.getEdgeDestination(edgeId);
                double candidate = distance[origin] + graph.getEdgeWeight(edgeId);
                if (candidate < distance[target]) {
                    distance[target] = candidate;
                    predecessor[target] = origin;
                    progressed = true;
                    if (target != startNodeId && improved.markVisited(target)) {
                        visitedOrder.add(target);
                    }
                }
            }
            if (!progressed) {
                break;
            }
        }

        for (int edgeId = 0; edgeId < edgeCount; edgeId++) {
            int origin = graph.getEdgeOrigin(edgeId);
            if (distance[origin] == INF) {
                continue;
            }
            int target = graph.getEdgeDestination(edgeId);
            if (distance[origin] + graph.getEdgeWeight(edgeId) < distance[target]) {
                return InternalSearchPlan.negativeCycle(passes);
            }
        }

        return InternalSearchPlan.completed(
                distance[endNodeId],
                predecessor,
                visitedOrder.toIntArray(),
                passes
        );
    }
}
