package org.pathviz.routing.core;

import org.pathviz.routing.graph.WeightedGraph;
import org.pathviz.routing.testutil.GraphFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.pathviz.routing.core.PlannerTestSupport.names;
import static org.pathviz.routing.core.PlannerTestSupport.predecessorOf;
import static org.pathviz.routing.core.PlannerTestSupport.run;

@DisplayName("DijkstraPlanner Tests")
class DijkstraPlannerTest {

    private final DijkstraPlanner planner = new DijkstraPlanner();

    @Test
    @DisplayName("Sample graph A->C settles E, B, D, C in order")
    void testSampleSettlementOrder() {
        WeightedGraph graph = GraphFixtures.sample();
        InternalSearchPlan plan = run(planner, graph, "A", "C");

        assertEquals(InternalSearchPlan.Outcome.REACHED, plan.outcome());
        assertEquals(7.0d, plan.endDistance());
        assertEquals(List.of("E", "B", "D", "C"), names(graph, plan.visitedOrder()));
        assertEquals("B", predecessorOf(graph, plan, "C"));
        assertEquals("A", predecessorOf(graph, plan, "B"));
        assertEquals(5, plan.iterations());
    }

    @Test
    @DisplayName("Search stops as soon as the end node is settled")
    void testEarlyExitOnEnd() {
        WeightedGraph graph = GraphFixtures.sample();
        InternalSearchPlan plan = run(planner, graph, "A", "E");

        assertEquals(2.0d, plan.endDistance());
        assertEquals(List.of("E"), names(graph, plan.visitedOrder()));
        assertNull(predecessorOf(graph, plan, "C"), "B was never settled, so C was never relaxed");
    }

    @Test
    @DisplayName("Unreachable end exhausts the frontier")
    void testUnreachable() {
        WeightedGraph graph = GraphFixtures.oneWayPair();
        InternalSearchPlan plan = run(planner, graph, "Y", "X");

        assertEquals(InternalSearchPlan.Outcome.UNREACHABLE, plan.outcome());
        assertEquals(Double.POSITIVE_INFINITY, plan.endDistance());
        assertArrayEquals(new int[0], plan.visitedOrder());
        assertEquals(1, plan.iterations());
    }

    @Test
    @DisplayName("Equal tentative distances settle the smallest node id first")
    void testTieBreakBySmallestNodeId() {
        WeightedGraph graph = GraphFixtures.tiedDiamond();
        InternalSearchPlan plan = run(planner, graph, "S", "T");

        assertEquals(List.of("M1", "M2", "T"), names(graph, plan.visitedOrder()));
        assertEquals("M1", predecessorOf(graph, plan, "T"));
        assertEquals(2.0d, plan.endDistance());
    }

    @Test
    @DisplayName("Start equal to end settles only the start")
    void testStartEqualsEnd() {
        WeightedGraph graph = GraphFixtures.sample();
        InternalSearchPlan plan = run(planner, graph, "D", "D");

        assertEquals(InternalSearchPlan.Outcome.REACHED, plan.outcome());
        assertEquals(0.0d, plan.endDistance());
        assertArrayEquals(new int[0], plan.visitedOrder());
    }

    @Test
    @DisplayName("Negative weights are tolerated without failing")
    void testNegativeWeightsDoNotFail() {
        WeightedGraph graph = GraphFixtures.negativeEdgeNoCycle();
        InternalSearchPlan plan = assertDoesNotThrow(() -> run(planner, graph, "S", "T"));
        assertEquals(InternalSearchPlan.Outcome.REACHED, plan.outcome());
    }

    @Test
    @DisplayName("Settled nodes keep their predecessor when a negative edge points back at them")
    void testSettledNodesAreNotRelaxed() {
        WeightedGraph graph = GraphFixtures.negativeBackEdge();
        InternalSearchPlan plan = run(planner, graph, "S", "E");

        assertEquals(InternalSearchPlan.Outcome.REACHED, plan.outcome());
        assertEquals(2.5d, plan.endDistance());
        assertEquals("S", predecessorOf(graph, plan, "B"));
        assertEquals("B", predecessorOf(graph, plan, "C"));
        assertEquals("C", predecessorOf(graph, plan, "E"));
        assertEquals(List.of("B", "C", "E"), names(graph, plan.visitedOrder()));
    }

    @Test
    @DisplayName("Parallel edges use the cheapest one")
    void testParallelEdges() {
        WeightedGraph graph = WeightedGraph.builder()
                .nodes("A", "B")
                .edge("A", "B", 9)
                .edge("A", "B", 4)
                .edge("A", "B", 6)
                .build();
        InternalSearchPlan plan = run(planner, graph, "A", "B");
        assertEquals(4.0d, plan.endDistance());
    }
}
