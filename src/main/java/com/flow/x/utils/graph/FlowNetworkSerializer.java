package com.flow.x.utils.graph;

import com.flow.x.dto.FlowNetworkSnapshot;
import com.flow.x.exceptions.BadRequestException;
import com.flow.x.models.FlowNetwork;
import com.flow.x.models.Graph;
import com.flow.x.models.Vertex;
import com.flow.x.utils.basic.BasicUtility;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;


/**
 * Converts a {@link FlowNetwork} to and from its flat JSON snapshot. Vertices are written as the
 * string form of their values, so a network read back always has {@code String} vertices.
 */
@Slf4j
public final class FlowNetworkSerializer {

    private FlowNetworkSerializer() {
        throw new UnsupportedOperationException("Not supported");
    }

    public static <T extends Comparable<? super T>> FlowNetworkSnapshot toSnapshot(FlowNetwork<T> network) {
        List<String> vertices = new ArrayList<>();
        network.getCapacityGraph().getVertices().forEach(v -> vertices.add(v.serialize()));

        Map<String, Map<String, Integer>> cost = new LinkedHashMap<>();
        network.getCost().forEach((u, adjacent) -> {
            Map<String, Integer> row = new LinkedHashMap<>();
            adjacent.forEach((v, c) -> row.put(v.serialize(), c));
            cost.put(u.serialize(), row);
        });

        return FlowNetworkSnapshot.builder()
                .source(network.getSource().serialize())
                .sink(network.getSink().serialize())
                .vertices(vertices)
                .capacities(network.getCapacityGraph().serialize())
                .flow(network.getFlowGraph().serialize())
                .residual(network.getResidualGraph().serialize())
                .cost(cost)
                .residualCost(network.getCostGraph().serialize())
                .build();
    }

    /**
     * Rebuilds a network exactly as persisted. Flow, residual and cost graphs are not re-derived.
     *
     * @throws BadRequestException if the snapshot names no source or sink
     */
    public static FlowNetwork<String> fromSnapshot(FlowNetworkSnapshot snapshot) {
        if (snapshot == null || StringUtils.isBlank(snapshot.getSource()) || StringUtils.isBlank(snapshot.getSink())) {
            throw new BadRequestException("Flow network snapshot must name a source and a sink");
        }

        List<Vertex<String>> vertices = new ArrayList<>();
        if (snapshot.getVertices() != null) {
            snapshot.getVertices().forEach(v -> vertices.add(Vertex.deserialize(v)));
        }

        Map<Vertex<String>, Map<Vertex<String>, Integer>> cost = new LinkedHashMap<>();
        if (snapshot.getCost() != null) {
            snapshot.getCost().forEach((u, adjacent) -> {
                Map<Vertex<String>, Integer> row = new LinkedHashMap<>();
                adjacent.forEach((v, c) -> row.put(Vertex.deserialize(v), c));
                cost.put(Vertex.deserialize(u), row);
            });
        }

        return FlowNetwork.restore(
                Vertex.deserialize(snapshot.getSource()),
                Vertex.deserialize(snapshot.getSink()),
                vertices,
                Graph.deserialize(snapshot.getCapacities()),
                cost,
                Graph.deserialize(snapshot.getFlow()),
                Graph.deserialize(snapshot.getResidual()),
                Graph.deserialize(snapshot.getResidualCost()));
    }

    public static <T extends Comparable<? super T>> void write(FlowNetwork<T> network, Path path) {
        BasicUtility.writeJson(path, toSnapshot(network));
        log.info("Flow network {} written to {}", network, path);
    }

    public static FlowNetwork<String> read(Path path) {
        FlowNetwork<String> network = fromSnapshot(BasicUtility.readJson(path, FlowNetworkSnapshot.class));
        log.info("Flow network {} read from {}", network, path);
        return network;
    }
}
