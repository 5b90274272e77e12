package org.pathviz.routing.core;

import lombok.extern.slf4j.Slf4j;
import org.pathviz.core.id.IDMapper;
import org.pathviz.routing.graph.WeightedGraph;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Entry point for shortest-path queries over a {@link WeightedGraph} snapshot.
 *
 * <p>Execution flow for every query:</p>
 * <ul>
 * <li>Validate the graph and resolve both endpoint names to internal node ids.</li>
 * <li>Run the selected planner on fresh per-call working state.</li>
 * <li>Rebuild the path from predecessors unless the search ended unreachable or on a negative cycle.</li>
 * <li>Map node ids back to names and wrap everything into one immutable {@link ShortestPathResult}.</li>
 * </ul>
 *
 * <p>The engine holds no mutable state, so one instance may serve any number of callers. The graph
 * is only read.</p>
 */
@Slf4j
public final class ShortestPathEngine {
    public static final String REASON_REQUEST_REQUIRED = "SP_REQUEST_REQUIRED";
    public static final String REASON_GRAPH_REQUIRED = "SP_GRAPH_REQUIRED";
    public static final String REASON_ALGORITHM_REQUIRED = "SP_ALGORITHM_REQUIRED";
    public static final String REASON_START_NODE_REQUIRED = "SP_START_NODE_REQUIRED";
    public static final String REASON_END_NODE_REQUIRED = "SP_END_NODE_REQUIRED";
    public static final String REASON_UNKNOWN_START_NODE = "SP_UNKNOWN_START_NODE";
    public static final String REASON_UNKNOWN_END_NODE = "SP_UNKNOWN_END_NODE";
    public static final String REASON_PATH_RECONSTRUCTION_FAILED = "SP_PATH_RECONSTRUCTION_FAILED";

    private final ShortestPathEngineConfig config;
    private final ShortestPathPlanner dijkstraPlanner;
    private final ShortestPathPlanner bellmanFordPlanner;
    private final PathReconstructor pathReconstructor = new PathReconstructor();

    /**
     * Creates an engine with {@link ShortestPathEngineConfig#defaults()}.
     */
    public ShortestPathEngine() {
        this(ShortestPathEngineConfig.defaults());
    }

    public ShortestPathEngine(ShortestPathEngineConfig config) {
        this(config, new DijkstraPlanner(), new BellmanFordPlanner());
    }

    ShortestPathEngine(
            ShortestPathEngineConfig config,
            ShortestPathPlanner dijkstraPlanner,
            ShortestPathPlanner bellmanFordPlanner
    ) {
        this.config = Objects.requireNonNull(config, "config");
        Objects.requireNonNull(config.getSlowQueryThreshold(), "config.slowQueryThreshold");
        Objects.requireNonNull(config.getNanoClock(), "config.nanoClock");
        this.dijkstraPlanner = Objects.requireNonNull(dijkstraPlanner, "dijkstraPlanner");
        this.bellmanFordPlanner = Objects.requireNonNull(bellmanFordPlanner, "bellmanFordPlanner");
    }

    /**
     * Runs the priority-selection algorithm.
     *
     * @return {@link ShortestPathResult.Found} or {@link ShortestPathResult.Unreachable}.
     * @throws ShortestPathException when the graph is missing or an endpoint is not in the graph.
     */
    public ShortestPathResult computeDijkstra(WeightedGraph graph, String startNodeId, String endNodeId) {
        return compute(graph, startNodeId, endNodeId, ShortestPathAlgorithm.DIJKSTRA);
    }

    /**
     * Runs the edge-relaxation algorithm.
     *
     * @return {@link ShortestPathResult.Found}, {@link ShortestPathResult.Unreachable} or
     * {@link ShortestPathResult.NegativeCycle}.
     * @throws ShortestPathException when the graph is missing or an endpoint is not in the graph.
     */
    public ShortestPathResult computeBellmanFord(WeightedGraph graph, String startNodeId, String endNodeId) {
        return compute(graph, startNodeId, endNodeId, ShortestPathAlgorithm.BELLMAN_FORD);
    }

    /**
     * Executes a request object.
     *
     * @throws ShortestPathException when the request or any of its fields violates the query contract.
     */
    public ShortestPathResult route(ShortestPathRequest request) {
        if (request == null) {
            throw new ShortestPathException(REASON_REQUEST_REQUIRED, "shortest-path request must be provided");
        }
        return compute(request.getGraph(), request.getStartNodeId(), request.getEndNodeId(), request.getAlgorithm());
    }

    /**
     * Runs the selected algorithm from {@code startNodeId} to {@code endNodeId}.
     *
     * @throws ShortestPathException when the graph or algorithm is missing or an endpoint is not in the graph.
     */
    public ShortestPathResult compute(
            WeightedGraph graph,
            String startNodeId,
            String endNodeId,
            ShortestPathAlgorithm algorithm
    ) {
        if (graph == null) {
            throw new ShortestPathException(REASON_GRAPH_REQUIRED, "graph must be provided");
        }
        if (algorithm == null) {
            throw new ShortestPathException(REASON_ALGORITHM_REQUIRED, "algorithm must be specified");
        }
        IDMapper ids = graph.idMapper();
        int start = toInternalNodeId(ids, startNodeId, REASON_START_NODE_REQUIRED, REASON_UNKNOWN_START_NODE, "start");
        int end = toInternalNodeId(ids, endNodeId, REASON_END_NODE_REQUIRED, REASON_UNKNOWN_END_NODE, "end");

        ShortestPathPlanner planner = switch (algorithm) {
            case DIJKSTRA -> dijkstraPlanner;
            case BELLMAN_FORD -> bellmanFordPlanner;
        };

        long startedAt = config.getNanoClock().getAsLong();
        InternalSearchPlan plan = planner.compute(graph, start, end);
        int[] path = plan.outcome() == InternalSearchPlan.Outcome.REACHED ? reconstruct(plan, start, end) : null;
        Duration elapsed = elapsedSince(startedAt);

        ShortestPathResult result = switch (plan.outcome()) {
            case NEGATIVE_CYCLE -> new ShortestPathResult.NegativeCycle(algorithm, elapsed);
            case UNREACHABLE -> new ShortestPathResult.Unreachable(
                    algorithm,
                    toNodeNames(ids, plan.visitedOrder()),
                    elapsed
            );
            case REACHED -> new ShortestPathResult.Found(
                    algorithm,
                    plan.endDistance(),
                    toNodeNames(ids, path),
                    toNodeNames(ids, plan.visitedOrder()),
                    elapsed
            );
        };

        report(result, startNodeId, endNodeId, plan.iterations());
        return result;
    }

    /**
     * Returns whether {@code from -> to} is a consecutive step of a found path.
     *
     * <p>Always {@code false} for unreachable and negative-cycle results.</p>
     */
    public static boolean pathContainsEdge(ShortestPathResult result, String fromNodeId, String toNodeId) {
        if (!(result instanceof ShortestPathResult.Found found) || fromNodeId == null || toNodeId == null) {
            return false;
        }
        List<String> path = found.path();
        for (int i = 0; i + 1 < path.size(); i++) {
            if (path.get(i).equals(fromNodeId) && path.get(i + 1).equals(toNodeId)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns whether a node lies on a found path.
     *
     * <p>Always {@code false} for unreachable and negative-cycle results.</p>
     */
    public static boolean pathContainsNode(ShortestPathResult result, String nodeId) {
        if (!(result instanceof ShortestPathResult.Found found) || nodeId == null) {
            return false;
        }
        return found.path().contains(nodeId);
    }

    private int[] reconstruct(InternalSearchPlan plan, int start, int end) {
        try {
            return pathReconstructor.reconstruct(plan.predecessors(), start, end);
        } catch (PathReconstructor.PathReconstructionException ex) {
            throw new ShortestPathException(
                    REASON_PATH_RECONSTRUCTION_FAILED,
                    ex.reasonCode() + ": " + ex.getMessage(),
                    ex
            );
        }
    }

    private Duration elapsedSince(long startedAt) {
        long nanos = config.getNanoClock().getAsLong() - startedAt;
        return Duration.ofNanos(Math.max(0L, nanos));
    }

    private void report(ShortestPathResult result, String startNodeId, String endNodeId, int iterations) {
        if (log.isDebugEnabled()) {
            log.debug("{} {} -> {}: {} after {} iterations in {} us",
                    result.algorithmName(),
                    startNodeId,
                    endNodeId,
                    result.status(),
                    iterations,
                    result.elapsed().toNanos() / 1_000L);
        }
        if (result.elapsed().compareTo(config.getSlowQueryThreshold()) > 0) {
            log.warn("Slow {} query {} -> {}: {} ms exceeds threshold {} ms",
                    result.algorithmName(),
                    startNodeId,
                    endNodeId,
                    result.elapsed().toMillis(),
                    config.getSlowQueryThreshold().toMillis());
        }
    }

    private static int toInternalNodeId(
            IDMapper ids,
            String nodeId,
            String requiredReasonCode,
            String unknownReasonCode,
            String fieldName
    ) {
        if (nodeId == null || nodeId.isBlank()) {
            throw new ShortestPathException(requiredReasonCode, fieldName + " node id must be non-blank");
        }
        try {
            return ids.toInternal(nodeId);
        } catch (IDMapper.UnknownIDException ex) {
            throw new ShortestPathException(
                    unknownReasonCode,
                    fieldName + " node " + nodeId + " is not part of the graph",
                    ex
            );
        }
    }

    private static List<String> toNodeNames(IDMapper ids, int[] nodeIds) {
        List<String> names = new ArrayList<>(nodeIds.length);
        for (int nodeId : nodeIds) {
            names.add(ids.toExternal(nodeId));
        }
        return names;
    }
}
