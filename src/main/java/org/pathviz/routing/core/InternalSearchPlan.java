package org.pathviz.routing.core;

/**
 * Planner output before path reconstruction and name mapping.
 *
 * @param outcome how the search ended.
 * @param endDistance tentative distance of the end node ({@code +INF} when unreachable, {@code NaN} on negative cycle).
 * @param predecessors predecessor node id per node, {@link #NO_NODE} when unset.
 * @param visitedOrder settled (priority selection) or first-improved (relaxation) nodes, start excluded.
 * @param iterations settled nodes or relaxation passes performed.
 */
record InternalSearchPlan(
        Outcome outcome,
        double endDistance,
        int[] predecessors,
        int[] visitedOrder,
        int iterations
) {
    static final int NO_NODE = -1;

    enum Outcome {
        REACHED,
        UNREACHABLE,
        NEGATIVE_CYCLE
    }

    /**
     * Classifies a finished search by the end node's distance.
     */
    static InternalSearchPlan completed(double endDistance, int[] predecessors, int[] visitedOrder, int iterations) {
        Outcome outcome = Double.isFinite(endDistance) ? Outcome.REACHED : Outcome.UNREACHABLE;
        return new InternalSearchPlan(outcome, endDistance, predecessors, visitedOrder, iterations);
    }

    /**
     * Canonical negative-cycle plan; carries no path data.
     */
    static InternalSearchPlan negativeCycle(int iterations) {
        return new InternalSearchPlan(Outcome.NEGATIVE_CYCLE, Double.NaN, new int[0], new int[0], iterations);
    }
}
