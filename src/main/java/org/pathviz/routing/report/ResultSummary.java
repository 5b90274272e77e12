package org.pathviz.routing.report;

import lombok.Builder;
import lombok.Value;
import org.pathviz.routing.core.ShortestPathResult;

/**
 * Display-ready values of one result, as shown in the results panel.
 */
@Value
@Builder
public class ResultSummary {
    /** Algorithm display name. */
    String algorithmName;
    /** Result variant. */
    ShortestPathResult.Status status;
    /** Distance text; {@code ∞} when unreachable, {@code null} on negative cycle. */
    String distanceText;
    /** Arrow-joined path or {@code None}; {@code null} on negative cycle. */
    String pathText;
    /** Elapsed time in milliseconds. */
    double elapsedMillis;
    /** Number of visited nodes; 0 on negative cycle. */
    int visitedCount;
    /** Error line for negative-cycle results, otherwise {@code null}. */
    String errorText;

    public boolean isError() {
        return errorText != null;
    }
}
