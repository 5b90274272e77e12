package org.pathviz.routing.core;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Immutable outcome of one shortest-path query.
 *
 * <p>Exactly one of {@link Found}, {@link Unreachable} or {@link NegativeCycle}. Only {@link Found}
 * carries a finite distance and a path.</p>
 */
public sealed interface ShortestPathResult
        permits ShortestPathResult.Found, ShortestPathResult.Unreachable, ShortestPathResult.NegativeCycle {

    /**
     * Variant tag for switch-based callers.
     */
    enum Status {
        FOUND,
        UNREACHABLE,
        NEGATIVE_CYCLE
    }

    Status status();

    /** Algorithm that produced this result. */
    ShortestPathAlgorithm algorithm();

    /** Wall-clock time spent in the search and path reconstruction. */
    Duration elapsed();

    /**
     * Display name of {@link #algorithm()}, for example {@code Bellman-Ford}.
     */
    default String algorithmName() {
        return algorithm().displayName();
    }

    /**
     * A finite-distance path from start to end.
     *
     * @param algorithm producing algorithm.
     * @param distance total path weight.
     * @param path node names from start to end, both inclusive.
     * @param visitedOrder nodes in settlement or first-improvement order, start excluded.
     * @param elapsed search time.
     */
    record Found(
            ShortestPathAlgorithm algorithm,
            double distance,
            List<String> path,
            List<String> visitedOrder,
            Duration elapsed
    ) implements ShortestPathResult {
        public Found {
            Objects.requireNonNull(algorithm, "algorithm");
            Objects.requireNonNull(elapsed, "elapsed");
            path = List.copyOf(path);
            visitedOrder = List.copyOf(visitedOrder);
            if (path.isEmpty()) {
                throw new IllegalArgumentException("found path must contain at least the start node");
            }
        }

        @Override
        public Status status() {
            return Status.FOUND;
        }

        public String startNodeId() {
            return path.get(0);
        }

        public String endNodeId() {
            return path.get(path.size() - 1);
        }
    }

    /**
     * The end node has no finite-distance path from the start.
     *
     * @param algorithm producing algorithm.
     * @param visitedOrder nodes reached before the search gave up, start excluded.
     * @param elapsed search time.
     */
    record Unreachable(
            ShortestPathAlgorithm algorithm,
            List<String> visitedOrder,
            Duration elapsed
    ) implements ShortestPathResult {
        public Unreachable {
            Objects.requireNonNull(algorithm, "algorithm");
            Objects.requireNonNull(elapsed, "elapsed");
            visitedOrder = List.copyOf(visitedOrder);
        }

        @Override
        public Status status() {
            return Status.UNREACHABLE;
        }

        /**
         * Always {@code +INF}.
         */
        public double distance() {
            return Double.POSITIVE_INFINITY;
        }

        /**
         * Always empty.
         */
        public List<String> path() {
            return List.of();
        }
    }

    /**
     * A negative-weight cycle is reachable from the start, so no shortest path exists.
     *
     * @param algorithm producing algorithm; always {@link ShortestPathAlgorithm#BELLMAN_FORD}.
     * @param elapsed search time.
     */
    record NegativeCycle(ShortestPathAlgorithm algorithm, Duration elapsed) implements ShortestPathResult {
        public NegativeCycle {
            Objects.requireNonNull(algorithm, "algorithm");
            Objects.requireNonNull(elapsed, "elapsed");
        }

        @Override
        public Status status() {
            return Status.NEGATIVE_CYCLE;
        }
    }
}
