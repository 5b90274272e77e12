package org.pathviz.routing.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.pathviz.routing.graph.WeightedGraph;
import org.pathviz.routing.search.SearchQueue;
import org.pathviz.routing.search.SearchState;
import org.pathviz.routing.search.VisitedSet;

import java.util.Arrays;

/**
 * Priority-selection shortest-path planner.
 *
 * <p>Each round settles the unsettled node with the smallest tentative distance (ties go to the
 * smallest node id) and relaxes its outgoing edges. The search stops once the end node is settled
 * or no unsettled node has a finite distance. Only finite-distance unsettled nodes are queued, so
 * an empty {@link SearchQueue} is the "nothing left reachable" exit.</p>
 *
 * <p>Settled nodes are never relaxed again, so every predecessor is settled before the node that
 * points at it and the predecessor chain always leads back to the start.</p>
 *
 * <p>Weights are assumed non-negative. Negative weights do not fail the query, but the result is
 * not guaranteed to be a shortest path.</p>
 */
final class DijkstraPlanner implements ShortestPathPlanner {
    private static final double INF = Double.POSITIVE_INFINITY;

    @Override
    public InternalSearchPlan compute(WeightedGraph graph, int startNodeId, int endNodeId) {
        int nodeCount = graph.nodeCount();
        double[] distance = new double[nodeCount];
        int[] predecessor = new int[nodeCount];
        Arrays.fill(distance, INF);
        Arrays.fill(predecessor, InternalSearchPlan.NO_NODE);
        distance[startNodeId] = 0.0d;

        VisitedSet settled = new VisitedSet(nodeCount);
        IntArrayList visitedOrder = new IntArrayList();
        SearchQueue frontier = new SearchQueue(nodeCount - 1, nodeCount);
        WeightedGraph.EdgeIterator iterator = graph.iterator();

        frontier.insert(startNodeId, 0.0d);
        while (!frontier.isEmpty()) {
            SearchState state = frontier.extractMin();
            int current = state.nodeId;
            frontier.recycle(state);

            settled.markVisited(current);
            if (current != startNodeId) {
                visitedOrder.add(current);
            }
            if (current == endNodeId) {
                break;
            }

            double currentDistance = distance[current];
            iterator.resetForNode(current);
            while (iterator.hasNext()) {
                int edgeId = iterator.next();
                int neighbor = graph.getEdgeDestination(edgeId);
                if (settled.isVisited(neighbor)) {
                    continue;
                }
                double candidate = currentDistance + graph.getEdgeWeight(edgeId);
                if (candidate < distance[neighbor]) {
                    distance[neighbor] = candidate;
                    predecessor[neighbor] = current;
                    frontier.insert(neighbor, candidate);
                }
            }
        }
        frontier.clear();

        return InternalSearchPlan.completed(
                distance[endNodeId],
                predecessor,
                visitedOrder.toIntArray(),
                settled.size()
        );
    }
}
