package com.flow.x.validation;

import com.flow.x.exceptions.InvariantViolationException;
import com.flow.x.models.FlowNetwork;
import com.flow.x.models.Graph;
import com.flow.x.models.Vertex;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Debug-time check that the four graphs of a {@link FlowNetwork} agree with each other.
 * <p>
 * For every ordered pair (u, v) the expected residual capacity is the spare capacity of (u, v) plus
 * the flow on (v, u) that can be cancelled, and the residual edge is present exactly when that amount
 * is positive. Without antiparallel edges this is the same as: a saturated edge has no forward residual
 * and a reverse residual equal to its flow, a partially used edge has both, an unused edge has no
 * reverse residual.
 * </p>
 */
@Slf4j
public final class FlowNetworkValidator {

    private FlowNetworkValidator() {
        throw new UnsupportedOperationException("Not supported");
    }

    /**
     * @throws InvariantViolationException describing the first disagreement found
     */
    public static <T extends Comparable<? super T>> void verify(FlowNetwork<T> network) {
        Graph<T> capacity = network.getCapacityGraph();
        Graph<T> flow = network.getFlowGraph();
        Graph<T> residual = network.getResidualGraph();
        Graph<T> costs = network.getCostGraph();

        verifyFlowWithinCapacity(capacity, flow);
        verifyResidual(capacity, flow, residual);
        verifyConservation(network, flow);
        verifyCosts(network, capacity, flow, residual, costs);
    }

    private static <T extends Comparable<? super T>> void verifyFlowWithinCapacity(Graph<T> capacity, Graph<T> flow) {
        capacity.getEdges().forEach((u, adjacent) -> adjacent.forEach((v, cap) -> {
            if (cap < 0) {
                fail("Negative capacity " + cap + " on " + u + " -> " + v);
            }
            if (!flow.hasEdge(u, v)) {
                fail("Capacity edge " + u + " -> " + v + " has no flow entry");
            }
            int f = flow.getWeight(u, v);
            if (f < 0 || f > cap) {
                fail("Flow " + f + " on " + u + " -> " + v + " is outside [0, " + cap + "]");
            }
        }));
        flow.getEdges().forEach((u, adjacent) -> adjacent.keySet().forEach(v -> {
            if (!capacity.hasEdge(u, v)) {
                fail("Flow edge " + u + " -> " + v + " has no capacity");
            }
        }));
    }

    private static <T extends Comparable<? super T>> void verifyResidual(Graph<T> capacity, Graph<T> flow, Graph<T> residual) {
        Set<Pair<T>> pairs = new LinkedHashSet<>();
        capacity.getEdges().forEach((u, adjacent) -> adjacent.keySet().forEach(v -> {
            pairs.add(new Pair<>(u, v));
            pairs.add(new Pair<>(v, u));
        }));
        residual.getEdges().forEach((u, adjacent) -> adjacent.keySet().forEach(v -> {
            if (!pairs.contains(new Pair<>(u, v))) {
                fail("Residual edge " + u + " -> " + v + " has no capacity edge in either direction");
            }
        }));

        for (Pair<T> pair : pairs) {
            Vertex<T> u = pair.u();
            Vertex<T> v = pair.v();
            int spare = capacity.hasEdge(u, v) ? capacity.getWeight(u, v) - flow.getWeight(u, v) : 0;
            int cancelable = capacity.hasEdge(v, u) ? flow.getWeight(v, u) : 0;
            long expected = (long) spare + cancelable;
            if (expected == 0 && residual.hasEdge(u, v)) {
                fail("Residual edge " + u + " -> " + v + " should be absent but has weight " + residual.getWeight(u, v));
            }
            if (expected > 0 && !residual.hasEdge(u, v)) {
                fail("Residual edge " + u + " -> " + v + " is missing, expected " + expected);
            }
            if (expected > 0 && residual.getWeight(u, v) != expected) {
                fail("Residual edge " + u + " -> " + v + " has weight " + residual.getWeight(u, v) + ", expected " + expected);
            }
        }
    }

    private static <T extends Comparable<? super T>> void verifyConservation(FlowNetwork<T> network, Graph<T> flow) {
        if (!flow.containsVertex(network.getSource()) || !flow.containsVertex(network.getSink())) {
            fail("Source and sink must be present in the flow graph");
        }
        Map<Vertex<T>, Long> balance = new HashMap<>();
        flow.getEdges().forEach((u, adjacent) -> adjacent.forEach((v, f) -> {
            balance.merge(u, (long) f, Long::sum);
            balance.merge(v, (long) -f, Long::sum);
        }));

        long leavingSource = balance.getOrDefault(network.getSource(), 0L);
        long enteringSink = -balance.getOrDefault(network.getSink(), 0L);
        if (leavingSource != enteringSink) {
            fail("Flow leaving the source (" + leavingSource + ") differs from flow entering the sink (" + enteringSink + ")");
        }
        balance.forEach((v, net) -> {
            if (net != 0 && !v.equals(network.getSource()) && !v.equals(network.getSink())) {
                fail("Flow is not conserved at " + v + ": net outflow " + net);
            }
        });
    }

    private static <T extends Comparable<? super T>> void verifyCosts(FlowNetwork<T> network, Graph<T> capacity,
                                                                     Graph<T> flow, Graph<T> residual, Graph<T> costs) {
        costs.getEdges().forEach((u, adjacent) -> adjacent.forEach((v, c) -> {
            if (!residual.hasEdge(u, v)) {
                fail("Cost edge " + u + " -> " + v + " is not in the residual graph");
            }
            boolean forwardOpen = network.hasOriginalCost(u, v)
                    && capacity.hasEdge(u, v) && capacity.getWeight(u, v) > flow.getWeight(u, v);
            boolean backwardOpen = network.hasOriginalCost(v, u)
                    && capacity.hasEdge(v, u) && flow.getWeight(v, u) > 0;
            boolean forward = forwardOpen && network.getOriginalCost(u, v) == c;
            boolean backward = backwardOpen && -network.getOriginalCost(v, u) == c;
            if (!forward && !backward) {
                fail("Cost " + c + " on residual edge " + u + " -> " + v + " is not derived from the original costs");
            }
            if (forwardOpen && backwardOpen
                    && c != Math.min(network.getOriginalCost(u, v), -network.getOriginalCost(v, u))) {
                fail("Cost " + c + " on residual edge " + u + " -> " + v + " is not its cheapest open arc");
            }
        }));
    }

    private static void fail(String message) {
        log.error("Flow network invariant violated: {}", message);
        throw new InvariantViolationException(message);
    }

    private record Pair<T extends Comparable<? super T>>(Vertex<T> u, Vertex<T> v) {
    }
}
