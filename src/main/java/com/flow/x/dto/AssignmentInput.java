package com.flow.x.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Weekly task assignment problem: which tasks are needed on which day, what each is worth, who is
 * available and what they prefer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"dayToTasks", "taskPointValues", "tasksToNumRequired", "people",
        "dayPreferences", "taskPreferences", "progress"})
public class AssignmentInput {
    /** Day name to the tasks needed that day, in order. */
    private Map<String, List<String>> dayToTasks;
    private Map<String, Double> taskPointValues;
    /** Task name to the number of people it needs each time it appears. */
    private Map<String, Integer> tasksToNumRequired;
    private List<String> people;
    private Map<String, List<String>> dayPreferences;
    private Map<String, List<String>> taskPreferences;
    /** Points each person has collected so far. */
    private Map<String, Double> progress;
}
