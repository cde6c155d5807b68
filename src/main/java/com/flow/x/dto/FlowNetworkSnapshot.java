package com.flow.x.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Flat JSON form of a flow network. Every vertex appears as the string form of its value and every
 * graph as an edge map {@code {u: {v: weight}}}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"source", "sink", "vertices", "capacities", "flow", "residual", "cost", "residualCost"})
public class FlowNetworkSnapshot {
    private String source;
    private String sink;
    private List<String> vertices;
    private Map<String, Map<String, Integer>> capacities;
    private Map<String, Map<String, Integer>> flow;
    private Map<String, Map<String, Integer>> residual;
    private Map<String, Map<String, Integer>> cost;
    private Map<String, Map<String, Integer>> residualCost;
}
