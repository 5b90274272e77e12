package org.pathviz.routing.graph;

import it.unimi.dsi.fastutil.doubles.DoubleArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;
import org.pathviz.core.id.IDMapper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable weighted directed graph used as the read-only snapshot for shortest-path queries.
 * <p>
 * Layout:
 * <ul>
 * <li>Edges keep their insertion order; an edge id is its insertion index.</li>
 * <li>Edge properties are stored as parallel arrays (origin, target, weight).</li>
 * <li>Outgoing adjacency is a CSR index: {@code firstEdge[node]..firstEdge[node + 1]} is a slice
 * of {@code adjacency} holding edge ids in insertion order.</li>
 * <li>Node names are numbered in natural string order through {@link IDMapper}, so planner
 * tie-breaks on internal ids follow node-name order.</li>
 * </ul>
 * Parallel edges between the same pair are kept as separate entries.
 */
public final class WeightedGraph {

    private final IDMapper nodeIds;

    // CSR index over adjacency
    private final int[] firstEdge;
    private final int[] adjacency;

    // Edge properties in insertion order
    private final int[] edgeOrigin;
    private final int[] edgeTarget;
    private final double[] edgeWeight;

    @Getter
    @Accessors(fluent = true)
    private final int nodeCount;
    @Getter
    @Accessors(fluent = true)
    private final int edgeCount;

    private WeightedGraph(IDMapper nodeIds, int[] edgeOrigin, int[] edgeTarget, double[] edgeWeight) {
        this.nodeIds = nodeIds;
        this.nodeCount = nodeIds.size();
        this.edgeCount = edgeOrigin.length;
        this.edgeOrigin = edgeOrigin;
        this.edgeTarget = edgeTarget;
        this.edgeWeight = edgeWeight;

        this.firstEdge = new int[nodeCount + 1];
        for (int origin : edgeOrigin) {
            firstEdge[origin + 1]++;
        }
        for (int node = 0; node < nodeCount; node++) {
            firstEdge[node + 1] += firstEdge[node];
        }
        this.adjacency = new int[edgeCount];
        int[] cursor = firstEdge.clone();
        for (int edgeId = 0; edgeId < edgeCount; edgeId++) {
            adjacency[cursor[edgeOrigin[edgeId]]++] = edgeId;
        }
    }

    /**
     * Creates a new graph builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a graph from a node collection and an ordered edge list.
     *
     * @throws InvalidEdgeException when an edge names an unknown node or has a non-finite weight.
     */
    public static WeightedGraph of(Collection<String> nodes, List<Edge> edges) {
        Objects.requireNonNull(nodes, "nodes");
        Objects.requireNonNull(edges, "edges");
        Builder builder = builder();
        nodes.forEach(builder::node);
        edges.forEach(builder::edge);
        return builder.build();
    }

    // ========================================================================
    // NAME-SPACE VIEW
    // ========================================================================

    /**
     * Returns node names in natural order.
     */
    public Set<String> nodeIds() {
        Set<String> names = new LinkedHashSet<>(nodeCount);
        for (int node = 0; node < nodeCount; node++) {
            names.add(nodeIds.toExternal(node));
        }
        return Collections.unmodifiableSet(names);
    }

    public boolean containsNode(String nodeId) {
        return nodeIds.containsExternal(nodeId);
    }

    /**
     * Returns outgoing neighbors of a node in edge-insertion order.
     *
     * @throws IDMapper.UnknownIDException if the node is not part of this graph.
     */
    public List<Neighbor> outgoing(String nodeId) {
        int node = nodeIds.toInternal(nodeId);
        List<Neighbor> neighbors = new ArrayList<>(getNodeDegree(node));
        for (int i = firstEdge[node]; i < firstEdge[node + 1]; i++) {
            int edgeId = adjacency[i];
            neighbors.add(new Neighbor(nodeIds.toExternal(edgeTarget[edgeId]), edgeWeight[edgeId]));
        }
        return Collections.unmodifiableList(neighbors);
    }

    /**
     * Returns all edges in insertion order.
     */
    public List<Edge> edges() {
        List<Edge> edges = new ArrayList<>(edgeCount);
        for (int edgeId = 0; edgeId < edgeCount; edgeId++) {
            edges.add(new Edge(
                    nodeIds.toExternal(edgeOrigin[edgeId]),
                    nodeIds.toExternal(edgeTarget[edgeId]),
                    edgeWeight[edgeId]
            ));
        }
        return Collections.unmodifiableList(edges);
    }

    // ========================================================================
    // INTERNAL-ID VIEW (used by planners)
    // ========================================================================

    /**
     * Returns the node-name mapper backing this graph.
     */
    public IDMapper idMapper() {
        return nodeIds;
    }

    public int getEdgeOrigin(int edgeId) {
        checkEdge(edgeId);
        return edgeOrigin[edgeId];
    }

    public int getEdgeDestination(int edgeId) {
        checkEdge(edgeId);
        return edgeTarget[edgeId];
    }

    public double getEdgeWeight(int edgeId) {
        checkEdge(edgeId);
        return edgeWeight[edgeId];
    }

    public int getNodeDegree(int nodeId) {
        if (nodeId < 0 || nodeId >= nodeCount) {
            throw new IndexOutOfBoundsException("Node " + nodeId + " out of bounds");
        }
        return firstEdge[nodeId + 1] - firstEdge[nodeId];
    }

    /**
     * Returns a reusable iterator over outgoing edge ids.
     */
    public EdgeIterator iterator() {
        return new EdgeIterator(this);
    }

    private void checkEdge(int edgeId) {
        if (edgeId < 0 || edgeId >= edgeCount) {
            throw new IndexOutOfBoundsException("Edge " + edgeId + " out of bounds [0, " + edgeCount + ")");
        }
    }

    @Override
    public String toString() {
        return "WeightedGraph{nodes=" + nodeCount + ", edges=" + edgeCount + '}';
    }

    /**
     * Iterates outgoing edge ids of one node without allocating per step.
     */
    public static final class EdgeIterator {
        private final WeightedGraph graph;
        private int current;
        private int end;

        EdgeIterator(WeightedGraph graph) {
            this.graph = graph;
        }

        /**
         * Positions the iterator on the outgoing slice of {@code nodeId}.
         */
        public EdgeIterator resetForNode(int nodeId) {
            if (nodeId < 0 || nodeId >= graph.nodeCount) {
                throw new IndexOutOfBoundsException("Node " + nodeId + " out of bounds");
            }
            this.current = graph.firstEdge[nodeId];
            this.end = graph.firstEdge[nodeId + 1];
            return this;
        }

        public boolean hasNext() {
            return current < end;
        }

        public int next() {
            if (current >= end) {
                throw new NoSuchElementException();
            }
            return graph.adjacency[current++];
        }
    }

    /**
     * Collects nodes and edges, then freezes them into a {@link WeightedGraph}.
     * <p>
     * Endpoint validation happens in {@link #build()}, so nodes may be declared after the edges
     * that use them.
     */
    public static final class Builder {
        private final Set<String> nodes = new TreeSet<>();
        private final List<Edge> edges = new ArrayList<>();

        private Builder() {
        }

        public Builder node(String nodeId) {
            if (nodeId == null || nodeId.isBlank()) {
                throw new IllegalArgumentException("node id must be non-blank");
            }
            nodes.add(nodeId);
            return this;
        }

        public Builder nodes(String... nodeIds) {
            for (String nodeId : nodeIds) {
                node(nodeId);
            }
            return this;
        }

        public Builder edge(String from, String to, double weight) {
            edges.add(new Edge(from, to, weight));
            return this;
        }

        public Builder edge(Edge edge) {
            edges.add(Objects.requireNonNull(edge, "edge"));
            return this;
        }

        /**
         * Validates every edge and builds the immutable graph.
         *
         * @throws InvalidEdgeException on the first edge with an unknown endpoint or non-finite weight.
         */
        public WeightedGraph build() {
            IDMapper mapper = IDMapper.createSorted(nodes);
            IntArrayList origins = new IntArrayList(edges.size());
            IntArrayList targets = new IntArrayList(edges.size());
            DoubleArrayList weights = new DoubleArrayList(edges.size());

            for (int i = 0; i < edges.size(); i++) {
                Edge edge = edges.get(i);
                if (!mapper.containsExternal(edge.from())) {
                    throw new InvalidEdgeException(
                            "edge[" + i + "] " + edge.from() + "->" + edge.to() + " references unknown node " + edge.from()
                    );
                }
                if (!mapper.containsExternal(edge.to())) {
                    throw new InvalidEdgeException(
                            "edge[" + i + "] " + edge.from() + "->" + edge.to() + " references unknown node " + edge.to()
                    );
                }
                if (!Double.isFinite(edge.weight())) {
                    throw new InvalidEdgeException(
                            "edge[" + i + "] " + edge.from() + "->" + edge.to() + " has non-finite weight " + edge.weight()
                    );
                }
                origins.add(mapper.toInternal(edge.from()));
                targets.add(mapper.toInternal(edge.to()));
                weights.add(edge.weight());
            }
            return new WeightedGraph(mapper, origins.toIntArray(), targets.toIntArray(), weights.toDoubleArray());
        }
    }
}
