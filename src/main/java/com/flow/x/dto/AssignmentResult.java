package com.flow.x.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"cost", "maxFlow", "dayAssignments", "pointsGained"})
public class AssignmentResult {
    private long cost;
    private long maxFlow;
    /** Day to person to the tasks that person does that day. */
    private Map<String, Map<String, List<String>>> dayAssignments;
    private Map<String, Double> pointsGained;
}
