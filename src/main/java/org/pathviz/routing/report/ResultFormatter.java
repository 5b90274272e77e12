package org.pathviz.routing.report;

import lombok.experimental.UtilityClass;
import org.pathviz.routing.core.ShortestPathResult;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Turns results into the text lines of the visualizer's results panel.
 */
@UtilityClass
public final class ResultFormatter {
    public static final String INFINITY_SYMBOL = "∞";
    public static final String PATH_SEPARATOR = " → ";
    public static final String NO_PATH = "None";
    public static final String NEGATIVE_CYCLE_MESSAGE = "Negative cycle detected";

    /**
     * Extracts display values from a result.
     */
    public static ResultSummary summarize(ShortestPathResult result) {
        Objects.requireNonNull(result, "result");
        ResultSummary.ResultSummaryBuilder builder = ResultSummary.builder()
                .algorithmName(result.algorithmName())
                .status(result.status())
                .elapsedMillis(result.elapsed().toNanos() / 1_000_000.0d);

        if (result instanceof ShortestPathResult.Found found) {
            builder.distanceText(formatDistance(found.distance()))
                    .pathText(formatPath(found.path()))
                    .visitedCount(found.visitedOrder().size());
        } else if (result instanceof ShortestPathResult.Unreachable unreachable) {
            builder.distanceText(formatDistance(unreachable.distance()))
                    .pathText(formatPath(unreachable.path()))
                    .visitedCount(unreachable.visitedOrder().size());
        } else {
            builder.errorText(NEGATIVE_CYCLE_MESSAGE);
        }
        return builder.build();
    }

    /**
     * Renders the panel lines for a result.
     *
     * <p>Negative cycles render as the error line alone.</p>
     */
    public static List<String> format(ShortestPathResult result) {
        ResultSummary summary = summarize(result);
        if (summary.isError()) {
            return List.of(summary.getErrorText());
        }
        List<String> lines = new ArrayList<>(5);
        lines.add("Algorithm: " + summary.getAlgorithmName());
        lines.add("Distance: " + summary.getDistanceText());
        lines.add("Path: " + summary.getPathText());
        lines.add("Time: " + formatMillis(summary.getElapsedMillis()));
        lines.add("Visited: " + summary.getVisitedCount() + " nodes");
        return List.copyOf(lines);
    }

    /**
     * Renders the panel as one newline-separated block.
     */
    public static String render(ShortestPathResult result) {
        return String.join(System.lineSeparator(), format(result));
    }

    /**
     * Prints {@code +INF} as {@code ∞} and finite values in plain decimal form without trailing zeros.
     */
    public static String formatDistance(double distance) {
        if (distance == Double.POSITIVE_INFINITY) {
            return INFINITY_SYMBOL;
        }
        if (!Double.isFinite(distance)) {
            return String.valueOf(distance);
        }
        if (distance == 0.0d) {
            return "0";
        }
        return BigDecimal.valueOf(distance).stripTrailingZeros().toPlainString();
    }

    public static String formatPath(List<String> path) {
        if (path == null || path.isEmpty()) {
            return NO_PATH;
        }
        return String.join(PATH_SEPARATOR, path);
    }

    public static String formatMillis(double millis) {
        return String.format(Locale.ROOT, "%.4f ms", millis);
    }
}
