package org.pathviz.routing.graph;

import lombok.experimental.StandardException;

/**
 * Thrown while building a {@link WeightedGraph} when an edge names a node outside the node set
 * or carries a non-finite weight.
 */
@StandardException
public class InvalidEdgeException extends IllegalArgumentException {
}
