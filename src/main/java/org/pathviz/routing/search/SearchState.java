package org.pathviz.routing.search;

/**
 * Mutable frontier entry of the priority-selection search.
 * <p>
 * Instances are pooled by {@link SearchQueue} and re-initialised through {@link #set(int, double)}.
 */
public class SearchState implements Comparable<SearchState> {

    /** Internal id of the node this entry ranks. */
    public int nodeId;

    /** Tentative distance from the start node. */
    public double distance;

    /**
     * Pool constructor.
     */
    public SearchState() {
        // filled in by set()
    }

    public void set(int nodeId, double distance) {
        this.nodeId = nodeId;
        this.distance = distance;
    }

    /**
     * Orders by distance, then by node id.
     * <p>
     * Node ids follow node-name order, so equal distances settle the alphabetically smallest node first.
     */
    @Override
    public int compareTo(SearchState other) {
        int byDistance = Double.compare(this.distance, other.distance);
        if (byDistance != 0) {
            return byDistance;
        }
        return Integer.compare(this.nodeId, other.nodeId);
    }

    @Override
    public String toString() {
        return "SearchState{" +
                "node=" + nodeId +
                ", distance=" + distance +
                '}';
    }
}
