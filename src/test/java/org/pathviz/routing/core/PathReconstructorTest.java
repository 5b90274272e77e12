package org.pathviz.routing.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("PathReconstructor Tests")
class PathReconstructorTest {
    private static final int NONE = InternalSearchPlan.NO_NODE;

    private final PathReconstructor reconstructor = new PathReconstructor();

    @Test
    @DisplayName("Walks predecessors back to the start")
    void testChain() {
        int[] predecessors = {NONE, 0, 1, 2};
        assertArrayEquals(new int[]{0, 1, 2, 3}, reconstructor.reconstruct(predecessors, 0, 3));
        assertArrayEquals(new int[]{0, 1, 2}, reconstructor.reconstruct(predecessors, 0, 2));
    }

    @Test
    @DisplayName("Start equal to end yields a single-node path")
    void testStartEqualsEnd() {
        assertArrayEquals(new int[]{2}, reconstructor.reconstruct(new int[]{NONE, NONE, NONE}, 2, 2));
    }

    @Test
    @DisplayName("Predecessor recorded on the start is ignored")
    void testStartAnchorsWalk() {
        int[] predecessors = {1, 0};
        assertArrayEquals(new int[]{0, 1}, reconstructor.reconstruct(predecessors, 0, 1));
    }

    @Test
    @DisplayName("Chain ending away from the start fails")
    void testBrokenChain() {
        int[] predecessors = {NONE, NONE, 1};
        PathReconstructor.PathReconstructionException ex = assertThrows(
                PathReconstructor.PathReconstructionException.class,
                () -> reconstructor.reconstruct(predecessors, 0, 2)
        );
        assertEquals(PathReconstructor.REASON_BROKEN_CHAIN, ex.reasonCode());
    }

    @Test
    @DisplayName("Looping chain fails instead of spinning")
    void testLoopingChain() {
        int[] predecessors = {NONE, 2, 1};
        PathReconstructor.PathReconstructionException ex = assertThrows(
                PathReconstructor.PathReconstructionException.class,
                () -> reconstructor.reconstruct(predecessors, 0, 1)
        );
        assertEquals(PathReconstructor.REASON_CHAIN_TOO_LONG, ex.reasonCode());
    }
}
