package com.flow.x.service;

import com.flow.x.dto.AssignmentInput;
import com.flow.x.dto.AssignmentResult;
import com.flow.x.dto.MinCostFlowResult;
import com.flow.x.exceptions.InvariantViolationException;
import com.flow.x.metrics.FlowSolverMetrics;
import com.flow.x.models.FlowNetwork;
import com.flow.x.models.Vertex;
import com.flow.x.utils.basic.BasicUtility;
import com.flow.x.utils.basic.Constant;
import com.flow.x.utils.media.csv.AssignmentCsvParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

@Slf4j
@Service
public class AssignmentServiceImpl implements AssignmentService {
    private static final Pattern SEPARATOR = Pattern.compile(Pattern.quote(Constant.SEPARATOR));

    private final AssignmentNetworkBuilder networkBuilder;
    private final FlowSolverMetrics metrics;

    public AssignmentServiceImpl(AssignmentNetworkBuilder networkBuilder, FlowSolverMetrics metrics) {
        this.networkBuilder = networkBuilder;
        this.metrics = metrics;
    }

    @Override
    public AssignmentResult solve(AssignmentInput input) {
        return solveNetwork(input).result();
    }

    @Override
    public AssignmentResult solveFile(Path inputPath, Path outputPath, Path networkOutPath) {
        AssignmentInput input = BasicUtility.readJson(inputPath, AssignmentInput.class);
        log.info("Assignment input read from {}", inputPath);

        Solved solved = solveNetwork(input);
        BasicUtility.writeJson(outputPath, solved.result());
        log.info("Assignments written to {}", outputPath);
        if (networkOutPath != null) {
            solved.network().serializeToJSON(networkOutPath);
        }
        return solved.result();
    }

    @Override
    public AssignmentInput convertCsv(Path preferencesPath, Path weekPath, Path pointsPath, Path outputPath) {
        AssignmentInput input = AssignmentCsvParser.toAssignmentInput(preferencesPath, weekPath, pointsPath);
        BasicUtility.writeJson(outputPath, input);
        log.info("Assignment input for {} people written to {}", input.getPeople().size(), outputPath);
        return input;
    }

    private Solved solveNetwork(AssignmentInput input) {
        long startTime = System.nanoTime();
        try {
            FlowNetwork<String> network = networkBuilder.build(input);
            MinCostFlowResult flow = network.getMinCostMaxFlow();

            Map<String, List<String>> personSlots = extractPersonSlots(network, input.getPeople());
            Map<String, Map<String, List<String>>> dayAssignments = groupByDay(personSlots, input);
            Map<String, Double> pointsGained = pointsGained(dayAssignments, input.getTaskPointValues());

            metrics.incrementAugmentations(network.getAugmentationCount());
            metrics.incrementCancelledCycles(network.getCancelledCycleCount());
            metrics.recordSolutionCost(flow.getCost());
            long durationMs = (System.nanoTime() - startTime) / 1_000_000;
            metrics.recordSolveDuration(durationMs, Constant.MODE_MIN_COST);
            log.info("Assigned {} task slot(s) at cost {} in {} ms", flow.getFlow(), flow.getCost(), durationMs);

            AssignmentResult result = AssignmentResult.builder()
                    .cost(flow.getCost())
                    .maxFlow(flow.getFlow())
                    .dayAssignments(dayAssignments)
                    .pointsGained(pointsGained)
                    .build();
            return new Solved(network, result);
        } catch (RuntimeException e) {
            metrics.recordSolveError(Constant.MODE_MIN_COST);
            log.error("Assignment solve failed: {}", e.getMessage());
            throw e;
        }
    }

    /**
     * Person to the slot vertices ({@code day|task|i}) whose flow runs through that person.
     */
    private Map<String, List<String>> extractPersonSlots(FlowNetwork<String> network, List<String> people) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        for (String person : people) {
            List<String> slots = new ArrayList<>();
            for (Vertex<String> dayVertex : network.getFlowingChildren(Vertex.of(person))) {
                network.getFlowingChildren(dayVertex).forEach(slot -> slots.add(slot.getValue()));
            }
            result.put(person, slots);
        }
        return result;
    }

    private Map<String, Map<String, List<String>>> groupByDay(Map<String, List<String>> personSlots, AssignmentInput input) {
        Map<String, Map<String, List<String>>> result = new LinkedHashMap<>();
        input.getDayToTasks().keySet().forEach(day -> result.put(day, new LinkedHashMap<>()));

        personSlots.forEach((person, slots) -> {
            for (String slot : slots) {
                String[] parts = SEPARATOR.split(slot.strip());
                if (parts.length != 3) {
                    throw new InvariantViolationException("Malformed task slot vertex: " + slot);
                }
                result.computeIfAbsent(parts[0], k -> new LinkedHashMap<>())
                        .computeIfAbsent(person, k -> new ArrayList<>())
                        .add(parts[1]);
            }
        });
        return result;
    }

    private Map<String, Double> pointsGained(Map<String, Map<String, List<String>>> dayAssignments,
                                             Map<String, Double> taskPointValues) {
        Map<String, Double> result = new LinkedHashMap<>();
        dayAssignments.values().forEach(byPerson -> byPerson.forEach((person, tasks) -> {
            double gained = tasks.stream().mapToDouble(taskPointValues::get).sum();
            result.merge(person, gained, Double::sum);
        }));
        return result;
    }

    private record Solved(FlowNetwork<String> network, AssignmentResult result) {
    }
}
