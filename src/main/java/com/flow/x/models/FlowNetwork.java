package com.flow.x.models;

import com.flow.x.dto.BellmanFordResult;
import com.flow.x.dto.MinCostFlowResult;
import com.flow.x.exceptions.EdgeNotFoundException;
import com.flow.x.exceptions.InvariantViolationException;
import com.flow.x.exceptions.NegativeCapacityException;
import com.flow.x.utils.graph.FlowNetworkSerializer;
import com.flow.x.validation.FlowNetworkValidator;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.*;

/**
 * Integer-capacity flow network computing maximum flow (Edmonds-Karp) and minimum-cost maximum flow
 * (cycle canceling).
 * <p>
 * The network owns four graphs over the same vertex set:
 * <ul>
 *   <li>capacity: topology and capacities, only grown by {@link #addEdge};</li>
 *   <li>flow: current flow on every capacity edge, zero flow is kept as an explicit entry;</li>
 *   <li>residual: remaining pushable amount in both directions, an edge is present iff that amount is positive;</li>
 *   <li>cost: one entry per residual edge that has a cost, derived from the original cost mapping.</li>
 * </ul>
 * The original cost mapping is written by {@link #addEdge} only. The four graphs form a single unit of
 * mutation: the class is not thread-safe, and a caller sharing a network must hold one lock across
 * construction and every query.
 * </p>
 *
 * @param <T> type of the vertex values
 */
@Slf4j
public class FlowNetwork<T extends Comparable<? super T>> {

    @Getter
    private final Vertex<T> source;
    @Getter
    private final Vertex<T> sink;
    private final Graph<T> capacityGraph = new Graph<>();
    private final Graph<T> flowGraph = new Graph<>();
    private final Graph<T> residualGraph = new Graph<>();
    private final Graph<T> costGraph = new Graph<>();
    private final Map<Vertex<T>, Map<Vertex<T>, Integer>> cost = new LinkedHashMap<>();

    /** Runs {@link FlowNetworkValidator} around every mutation when set. */
    @Getter
    @Setter
    private boolean invariantChecksEnabled;
    @Getter
    private int augmentationCount;
    @Getter
    private int cancelledCycleCount;
    private boolean flowPresent;

    public FlowNetwork(Vertex<T> source, Vertex<T> sink) {
        this.source = Objects.requireNonNull(source, "Source cannot be null");
        this.sink = Objects.requireNonNull(sink, "Sink cannot be null");
        if (source.equals(sink)) {
            throw new IllegalArgumentException("Source and sink must differ: " + source);
        }
        addVertexEverywhere(source);
        addVertexEverywhere(sink);
    }

    /**
     * Rebuilds a network from persisted state. Flow, residual and cost graphs are taken as given and
     * not re-derived from the capacities, so a partially solved network resumes where it stopped.
     */
    public static <T extends Comparable<? super T>> FlowNetwork<T> restore(
            Vertex<T> source, Vertex<T> sink, Collection<Vertex<T>> vertices,
            Graph<T> capacities, Map<Vertex<T>, Map<Vertex<T>, Integer>> originalCost,
            Graph<T> flow, Graph<T> residual, Graph<T> residualCost) {
        FlowNetwork<T> network = new FlowNetwork<>(source, sink);
        vertices.forEach(network::addVertexEverywhere);
        copyEdges(capacities, network.capacityGraph, network);
        copyEdges(flow, network.flowGraph, network);
        copyEdges(residual, network.residualGraph, network);
        copyEdges(residualCost, network.costGraph, network);
        originalCost.forEach((u, adjacent) -> network.cost.put(u, new LinkedHashMap<>(adjacent)));
        network.flowPresent = network.scanForFlow();
        return network;
    }

    private static <T extends Comparable<? super T>> void copyEdges(Graph<T> from, Graph<T> to, FlowNetwork<T> network) {
        from.getVertices().forEach(network::addVertexEverywhere);
        from.getEdges().forEach((u, adjacent) -> adjacent.forEach((v, w) -> {
            network.addVertexEverywhere(v);
            to.addEdge(u, v, w);
        }));
    }

    public static FlowNetwork<String> deserialize(Path path) {
        return FlowNetworkSerializer.read(path);
    }

    public void serializeToJSON(Path path) {
        FlowNetworkSerializer.write(this, path);
    }

    private void addVertexEverywhere(Vertex<T> v) {
        capacityGraph.addVertex(v);
        flowGraph.addVertex(v);
        residualGraph.addVertex(v);
        costGraph.addVertex(v);
    }

    public void addEdge(Vertex<T> u, Vertex<T> v, int capacity) {
        addEdge(u, v, capacity, null);
    }

    /**
     * Adds edge (u, v), or replaces its capacity and cost; a null cost drops any earlier one. Flow starts at zero and the residual
     * capacity equals the capacity; a zero-capacity edge never enters the residual graph.
     *
     * @param edgeCost cost per unit of flow, or null to leave the edge without a cost
     * @throws NegativeCapacityException if {@code capacity < 0}
     * @throws IllegalArgumentException  for a self-loop, an edge into the source or out of the sink, or
     *                                   when {@code capacity(u, v) + capacity(v, u)} overflows an int
     * @throws IllegalStateException     while any edge carries flow; call {@link #resetFlow()} first
     */
    public void addEdge(Vertex<T> u, Vertex<T> v, int capacity, Integer edgeCost) {
        Objects.requireNonNull(u, "Edge tail cannot be null");
        Objects.requireNonNull(v, "Edge head cannot be null");
        if (capacity < 0) {
            throw new NegativeCapacityException(capacity, u + " -> " + v);
        }
        if (u.equals(v)) {
            throw new IllegalArgumentException("Self-loops are not supported: " + u);
        }
        if (v.equals(source) || u.equals(sink)) {
            throw new IllegalArgumentException("Edges into the source or out of the sink are not supported: "
                    + u + " -> " + v);
        }
        if (flowPresent) {
            throw new IllegalStateException("Network already carries flow; call resetFlow() before adding " + u + " -> " + v);
        }
        try {
            Math.addExact(capacity, capacityGraph.getWeightOrDefault(v, u, 0));
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Capacities of " + u + " <-> " + v + " together exceed " + Integer.MAX_VALUE, e);
        }

        addVertexEverywhere(u);
        addVertexEverywhere(v);
        capacityGraph.addEdge(u, v, capacity);
        flowGraph.addEdge(u, v, 0);
        if (capacity > 0) {
            residualGraph.addEdge(u, v, capacity);
        } else {
            residualGraph.removeEdge(u, v);
        }
        if (edgeCost != null) {
            cost.computeIfAbsent(u, k -> new LinkedHashMap<>()).put(v, edgeCost);
        } else if (cost.containsKey(u)) {
            cost.get(u).remove(v);
            if (cost.get(u).isEmpty()) {
                cost.remove(u);
            }
        }
        syncCostOnResidualChange(u, v);
        syncCostOnResidualChange(v, u);
        checkRep();
    }

    /**
     * Sets every flow back to zero and rebuilds the residual and cost graphs from the capacities and
     * the original costs.
     */
    public void resetFlow() {
        flowGraph.clearEdges();
        residualGraph.clearEdges();
        costGraph.clearEdges();
        capacityGraph.getEdges().forEach((u, adjacent) -> adjacent.forEach((v, capacity) -> {
            flowGraph.addEdge(u, v, 0);
            if (capacity > 0) {
                residualGraph.addEdge(u, v, capacity);
            }
        }));
        residualGraph.getEdges().forEach((u, adjacent) -> adjacent.keySet().forEach(v -> syncCostOnResidualChange(u, v)));
        flowPresent = false;
        checkRep();
    }

    public int getCapacity(Vertex<T> u, Vertex<T> v) {
        return capacityGraph.getWeight(u, v);
    }

    public int getFlow(Vertex<T> u, Vertex<T> v) {
        return flowGraph.getWeight(u, v);
    }

    /**
     * @return the remaining pushable amount on (u, v), zero when the residual edge is absent
     */
    public int getResidualCapacity(Vertex<T> u, Vertex<T> v) {
        return residualGraph.getWeightOrDefault(u, v, 0);
    }

    public boolean hasOriginalCost(Vertex<T> u, Vertex<T> v) {
        Map<Vertex<T>, Integer> adjacent = cost.get(u);
        return adjacent != null && adjacent.containsKey(v);
    }

    public int getOriginalCost(Vertex<T> u, Vertex<T> v) {
        if (!hasOriginalCost(u, v)) {
            throw new EdgeNotFoundException(u, v);
        }
        return cost.get(u).get(v);
    }

    /** Copy of the original cost mapping. */
    public Map<Vertex<T>, Map<Vertex<T>, Integer>> getCost() {
        Map<Vertex<T>, Map<Vertex<T>, Integer>> copy = new LinkedHashMap<>();
        cost.forEach((u, adjacent) -> copy.put(u, Collections.unmodifiableMap(new LinkedHashMap<>(adjacent))));
        return Collections.unmodifiableMap(copy);
    }

    /** Copy of the capacity graph. */
    public Graph<T> getCapacityGraph() {
        return new Graph<>(capacityGraph);
    }

    /** Copy of the flow graph, used to read a solved assignment back. */
    public Graph<T> getFlowGraph() {
        return new Graph<>(flowGraph);
    }

    /** Copy of the residual graph. */
    public Graph<T> getResidualGraph() {
        return new Graph<>(residualGraph);
    }

    /** Copy of the residual cost graph. */
    public Graph<T> getCostGraph() {
        return new Graph<>(costGraph);
    }

    /**
     * Children of {@code u} in the flow graph that currently carry positive flow.
     */
    public List<Vertex<T>> getFlowingChildren(Vertex<T> u) {
        List<Vertex<T>> children = new ArrayList<>();
        for (Vertex<T> v : flowGraph.getChildren(u)) {
            if (flowGraph.getWeight(u, v) > 0) {
                children.add(v);
            }
        }
        return children;
    }

    /**
     * Shortest augmenting path (by edge count) from source to sink in the residual graph. Using BFS
     * bounds the number of augmentations to O(V·E²).
     *
     * @return the path, or an empty list when the current flow is maximal
     */
    public List<Vertex<T>> getAugmentingPath() {
        return residualGraph.bfs(source, sink);
    }

    /**
     * Largest amount that can be pushed along {@code augPath}: per edge, the spare capacity plus the
     * opposing flow that can be cancelled. An edge with no capacity counterpart is bounded by the flow
     * it cancels.
     */
    public int getMinCapAlongAugPath(List<Vertex<T>> augPath) {
        requirePath(augPath);
        int bottleneck = Integer.MAX_VALUE;
        for (int i = 0; i < augPath.size() - 1; i++) {
            bottleneck = Math.min(bottleneck, pushableAmount(augPath.get(i), augPath.get(i + 1), false));
        }
        return bottleneck;
    }

    /**
     * Largest amount that can be redirected around a closed residual cycle at the costs the cost graph
     * currently shows.
     */
    public int getMinCapAlongResCycle(List<Vertex<T>> negCycle) {
        requirePath(negCycle);
        if (!negCycle.get(0).equals(negCycle.get(negCycle.size() - 1))) {
            throw new IllegalArgumentException("Expected a closed cycle, got " + negCycle);
        }
        int bottleneck = Integer.MAX_VALUE;
        for (int i = 0; i < negCycle.size() - 1; i++) {
            bottleneck = Math.min(bottleneck, pushableAmount(negCycle.get(i), negCycle.get(i + 1), true));
        }
        return bottleneck;
    }

    /**
     * Amount that can go along residual edge (u, v). With {@code atCurrentCost} only the part priced by
     * the current cost graph entry counts: spare capacity, or the opposing flow it cancels.
     */
    private int pushableAmount(Vertex<T> u, Vertex<T> v, boolean atCurrentCost) {
        if (!residualGraph.hasEdge(u, v)) {
            throw new InvariantViolationException("Edge " + u + " -> " + v + " is not in the residual graph");
        }
        int residual = residualGraph.getWeight(u, v);
        int available;
        if (atCurrentCost) {
            available = cancelsFirst(u, v) ? cancelableFlow(u, v) : spareCapacity(u, v);
        } else {
            available = spareCapacity(u, v) + cancelableFlow(u, v);
        }
        if (available <= 0) {
            throw new InvariantViolationException("Residual edge " + u + " -> " + v
                    + " has neither spare capacity nor flow to cancel");
        }
        return Math.min(residual, available);
    }

    /**
     * Pushes the bottleneck amount along an augmenting path, or around a negative cycle when
     * {@code costsPresent} is set, and keeps the flow, residual and cost graphs in step.
     *
     * @param augPath      source-to-sink path, or a closed cycle of the residual graph
     * @param costsPresent true when {@code augPath} is a cycle taken from the cost graph
     * @return the amount pushed
     */
    public int pushAugmentingFlow(List<Vertex<T>> augPath, boolean costsPresent) {
        int amount;
        if (costsPresent) {
            if (costGraph.hasNoEdges()) {
                throw new IllegalStateException("No residual costs are tracked for this network");
            }
            amount = getMinCapAlongResCycle(augPath);
        } else {
            amount = getMinCapAlongAugPath(augPath);
        }

        if (amount <= 0) {
            throw new InvariantViolationException("Path " + augPath + " has no residual capacity");
        }
        for (int i = 0; i < augPath.size() - 1; i++) {
            pushAlongEdge(augPath.get(i), augPath.get(i + 1), amount);
        }
        flowPresent = true;
        checkRep();
        return amount;
    }

    private void pushAlongEdge(Vertex<T> u, Vertex<T> v, int amount) {
        int residual = residualGraph.getWeightOrDefault(u, v, 0);
        if (amount > residual) {
            throw new InvariantViolationException("Pushing " + amount + " along " + u + " -> " + v
                    + " exceeds its residual capacity " + residual);
        }
        int spare = spareCapacity(u, v);
        int cancelable = cancelableFlow(u, v);
        int cancelled = cancelsFirst(u, v) ? Math.min(amount, cancelable) : Math.max(0, amount - spare);
        int forward = amount - cancelled;
        if (forward > spare || cancelled > cancelable) {
            throw new InvariantViolationException("Residual capacity of " + u + " -> " + v
                    + " disagrees with capacity " + spare + " and cancelable flow " + cancelable);
        }

        if (cancelled > 0) {
            flowGraph.addEdge(v, u, flowGraph.getWeight(v, u) - cancelled);
        }
        if (forward > 0) {
            flowGraph.addEdge(u, v, flowGraph.getWeight(u, v) + forward);
        }
        syncResidualOnFlowChange(u, v, amount);
        syncCostOnResidualChange(u, v);
        syncCostOnResidualChange(v, u);
    }

    private void syncResidualOnFlowChange(Vertex<T> u, Vertex<T> v, int amount) {
        int remaining = residualGraph.getWeight(u, v) - amount;
        if (remaining == 0) {
            residualGraph.removeEdge(u, v);
        } else {
            residualGraph.addEdge(u, v, remaining);
        }
        residualGraph.addEdge(v, u, residualGraph.getWeightOrDefault(v, u, 0) + amount);
    }

    /**
     * Mirrors residual edge (u, v) into the cost graph at the price of the arc a push would use first:
     * {@code cost(u, v)} for spare forward capacity, {@code -cost(v, u)} for cancelling flow on (v, u).
     * Residual edges without either cost, and absent residual edges, have no cost entry.
     */
    private void syncCostOnResidualChange(Vertex<T> u, Vertex<T> v) {
        if (!residualGraph.hasEdge(u, v)) {
            costGraph.removeEdge(u, v);
            return;
        }
        if (!cancelsFirst(u, v) && hasOriginalCost(u, v)) {
            costGraph.addEdge(u, v, getOriginalCost(u, v));
        } else if (cancelableFlow(u, v) > 0 && hasOriginalCost(v, u)) {
            costGraph.addEdge(u, v, -getOriginalCost(v, u));
        } else {
            costGraph.removeEdge(u, v);
        }
    }

    /**
     * Whether a push along (u, v) first cancels opposing flow rather than using spare capacity. With
     * both arcs open, the cheaper one goes first and ties go to spare capacity; an arc without a cost
     * goes last.
     */
    private boolean cancelsFirst(Vertex<T> u, Vertex<T> v) {
        if (cancelableFlow(u, v) == 0) {
            return false;
        }
        if (spareCapacity(u, v) == 0 || !hasOriginalCost(u, v)) {
            return true;
        }
        return hasOriginalCost(v, u) && -getOriginalCost(v, u) < getOriginalCost(u, v);
    }

    private int spareCapacity(Vertex<T> u, Vertex<T> v) {
        return capacityGraph.hasEdge(u, v) ? capacityGraph.getWeight(u, v) - flowGraph.getWeightOrDefault(u, v, 0) : 0;
    }

    private int cancelableFlow(Vertex<T> u, Vertex<T> v) {
        return capacityGraph.hasEdge(v, u) ? flowGraph.getWeightOrDefault(v, u, 0) : 0;
    }

    /**
     * Ford-Fulkerson with shortest augmenting paths (Edmonds-Karp). Mutates the flow, residual and cost
     * graphs. Calling it again on a maximal network finds no path and changes nothing.
     *
     * @return total flow leaving the source
     */
    public long getMaxFlow() {
        checkRep();
        int augmentations = 0;
        List<Vertex<T>> path = getAugmentingPath();
        while (!path.isEmpty()) {
            int pushed = pushAugmentingFlow(path, false);
            log.debug("Pushed {} unit(s) along {}", pushed, path);
            augmentations++;
            path = getAugmentingPath();
        }
        augmentationCount += augmentations;

        long maxFlow = getFlowValue();
        log.info("Max flow from {} to {} is {} after {} augmentation(s)", source, sink, maxFlow, augmentations);
        return maxFlow;
    }

    /**
     * Negative-cost cycle of the residual graph. Bellman-Ford runs from the sink first; if nothing is
     * reachable from there, the whole cost graph is searched.
     *
     * @return a closed cycle, or an empty list when none exists
     */
    public List<Vertex<T>> getNegCostResidualCycle() {
        BellmanFordResult<T> fromSink = costGraph.bellmanFordSssp(sink);
        if (fromSink.hasNegativeCycle()) {
            return fromSink.getCycle();
        }
        return costGraph.findNegativeCycle();
    }

    /**
     * Cycle canceling: a feasible maximum flow is found first, then every negative-cost residual cycle
     * is cancelled until none remains. Each cancellation keeps the flow value and lowers the cost.
     *
     * @return the minimum cost and the maximum flow value
     * @throws IllegalStateException if the network has no costs, or an edge carrying flow has none
     */
    public MinCostFlowResult getMinCostMaxFlow() {
        if (cost.isEmpty()) {
            throw new IllegalStateException("Min-cost max flow needs edge costs, none were given");
        }
        getMaxFlow();

        int cancelled = 0;
        List<Vertex<T>> cycle = getNegCostResidualCycle();
        while (!cycle.isEmpty()) {
            int redirected = pushAugmentingFlow(cycle, true);
            log.debug("Cancelled negative cycle {} redirecting {} unit(s)", cycle, redirected);
            cancelled++;
            cycle = getNegCostResidualCycle();
        }
        cancelledCycleCount += cancelled;

        MinCostFlowResult result = new MinCostFlowResult(getTotalCost(), getFlowValue());
        log.info("Min-cost max flow: cost={}, flow={} after cancelling {} cycle(s)",
                result.getCost(), result.getFlow(), cancelled);
        return result;
    }

    /**
     * @return total flow leaving the source
     */
    public long getFlowValue() {
        long total = 0;
        for (Vertex<T> v : flowGraph.getChildren(source)) {
            total += flowGraph.getWeight(source, v);
        }
        return total;
    }

    /**
     * Cost of the current flow, {@code Σ flow(u, v) · cost(u, v)} over edges carrying flow.
     *
     * @throws IllegalStateException if an edge carrying flow has no cost
     */
    public long getTotalCost() {
        long total = 0;
        for (Map.Entry<Vertex<T>, Map<Vertex<T>, Integer>> entry : flowGraph.getEdges().entrySet()) {
            Vertex<T> u = entry.getKey();
            for (Map.Entry<Vertex<T>, Integer> flow : entry.getValue().entrySet()) {
                if (flow.getValue() == 0) {
                    continue;
                }
                if (!hasOriginalCost(u, flow.getKey())) {
                    throw new IllegalStateException("Edge " + u + " -> " + flow.getKey() + " carries flow but has no cost");
                }
                total += (long) flow.getValue() * getOriginalCost(u, flow.getKey());
            }
        }
        return total;
    }

    /**
     * Runs the invariant validator when checks are enabled.
     *
     * @throws InvariantViolationException if the graphs disagree
     */
    public void checkRep() {
        if (invariantChecksEnabled) {
            FlowNetworkValidator.verify(this);
        }
    }

    private boolean scanForFlow() {
        return flowGraph.getEdges().values().stream()
                .flatMap(adjacent -> adjacent.values().stream())
                .anyMatch(f -> f != 0);
    }

    private void requirePath(List<Vertex<T>> path) {
        if (path == null || path.size() < 2) {
            throw new IllegalArgumentException("Expected at least one edge, got " + path);
        }
    }

    @Override
    public String toString() {
        return "FlowNetwork(source=" + source + ", sink=" + sink + ", vertices=" + capacityGraph.getVertices().size()
                + ", edges=" + capacityGraph.edgeCount() + ")";
    }
}
