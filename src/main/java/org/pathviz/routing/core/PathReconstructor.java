package org.pathviz.routing.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Rebuilds a node path from a predecessor table.
 */
final class PathReconstructor {
    static final String REASON_BROKEN_CHAIN = "SP_PATH_BROKEN_PREDECESSOR_CHAIN";
    static final String REASON_CHAIN_TOO_LONG = "SP_PATH_PREDECESSOR_CHAIN_TOO_LONG";

    /**
     * Walks predecessors back from {@code endNodeId} until {@code startNodeId}.
     *
     * <p>The start node anchors the walk: any predecessor recorded on it is ignored.</p>
     *
     * @return node ids from start to end, both inclusive.
     * @throws PathReconstructionException when the chain stops short of the start or loops.
     */
    int[] reconstruct(int[] predecessors, int startNodeId, int endNodeId) {
        IntArrayList reversed = new IntArrayList();
        int cursor = endNodeId;
        while (true) {
            reversed.add(cursor);
            if (cursor == startNodeId) {
                break;
            }
            if (reversed.size() > predecessors.length) {
                throw new PathReconstructionException(
                        REASON_CHAIN_TOO_LONG,
                        "predecessor chain from node " + endNodeId + " exceeds node count " + predecessors.length
                );
            }
            int previous = predecessors[cursor];
            if (previous == InternalSearchPlan.NO_NODE) {
                throw new PathReconstructionException(
                        REASON_BROKEN_CHAIN,
                        "node " + cursor + " has no predecessor and is not start node " + startNodeId
                );
            }
            cursor = previous;
        }

        int[] path = new int[reversed.size()];
        for (int i = 0; i < path.length; i++) {
            path[i] = reversed.getInt(path.length - 1 - i);
        }
        return path;
    }

    /**
     * Reason-coded reconstruction failure.
     */
    @Getter
    @Accessors(fluent = true)
    static final class PathReconstructionException extends RuntimeException {
        private final String reasonCode;

        PathReconstructionException(String reasonCode, String message) {
            super(message);
            this.reasonCode = reasonCode;
        }
    }
}
