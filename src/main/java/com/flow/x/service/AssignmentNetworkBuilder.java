package com.flow.x.service;

import com.flow.x.config.AssignmentCostConfig;
import com.flow.x.dto.AssignmentInput;
import com.flow.x.exceptions.BadRequestException;
import com.flow.x.models.FlowNetwork;
import com.flow.x.models.Vertex;
import com.flow.x.utils.basic.Constant;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.*;

/**
 * Models a week of task assignments as a min-cost flow network.
 * <p>
 * Layers, from source {@code S} to sink {@code T}:
 * <pre>
 *   S -> person -> day|person -> day|task|i -> T
 * </pre>
 * One unit of flow is one person doing one slot of a task. The source edge caps tasks per week and
 * carries a cost that grows with the person's progress; the day edge caps tasks per day; the slot
 * edge carries the preference and fairness cost of that person doing that task.
 * </p>
 */
@Slf4j
public class AssignmentNetworkBuilder {

    @Getter
    private final AssignmentCostConfig config;
    private final boolean invariantChecks;

    public AssignmentNetworkBuilder(AssignmentCostConfig config, boolean invariantChecks) {
        this.config = Objects.requireNonNull(config, "Assignment config cannot be null");
        this.invariantChecks = invariantChecks;
    }

    /**
     * @throws BadRequestException if the input is incomplete or uses reserved names
     */
    public FlowNetwork<String> build(AssignmentInput input) {
        validate(input);

        Vertex<String> source = Vertex.of(Constant.SOURCE);
        Vertex<String> sink = Vertex.of(Constant.SINK);
        FlowNetwork<String> network = new FlowNetwork<>(source, sink);
        network.setInvariantChecksEnabled(invariantChecks);

        List<String> people = input.getPeople();
        Map<String, Set<String>> taskPrefs = preferenceSets(people, input.getTaskPreferences());
        Map<String, Set<String>> dayPrefs = preferenceSets(people, input.getDayPreferences());
        Map<String, Integer> prefCounts = countPreferences(taskPrefs);

        for (String person : people) {
            network.addEdge(source, Vertex.of(person), config.getTasksPerWeekLimit(),
                    personCost(progressOf(input, person)));
        }

        Set<Vertex<String>> reachableDays = new HashSet<>();
        for (String person : people) {
            for (String day : input.getDayToTasks().keySet()) {
                if (config.isCanAssignNonPreferredDays() || dayPrefs.get(person).contains(day)) {
                    Vertex<String> dayVertex = dayVertex(day, person);
                    network.addEdge(Vertex.of(person), dayVertex, config.getTasksPerDayLimit(), 1);
                    reachableDays.add(dayVertex);
                }
            }
        }

        int slots = 0;
        for (Map.Entry<String, List<String>> entry : input.getDayToTasks().entrySet()) {
            String day = entry.getKey();
            for (String task : entry.getValue()) {
                int required = input.getTasksToNumRequired().get(task);
                double points = input.getTaskPointValues().get(task);
                for (int i = 0; i < required; i++) {
                    Vertex<String> slot = slotVertex(day, task, i);
                    network.addEdge(slot, sink, 1, 1);
                    slots++;
                    for (String person : people) {
                        boolean preferred = taskPrefs.get(person).contains(task);
                        Vertex<String> dayVertex = dayVertex(day, person);
                        if (!reachableDays.contains(dayVertex) || !(preferred || config.isCanAssignNonPreferredTasks())) {
                            continue;
                        }
                        network.addEdge(dayVertex, slot, 1, taskCost(preferred, points, progressOf(input, person),
                                prefCounts.getOrDefault(task, 0), taskPrefs.get(person).size()));
                    }
                }
            }
        }

        log.info("Assignment network built: {} people, {} day(s), {} task slot(s), {}",
                people.size(), input.getDayToTasks().size(), slots, network);
        return network;
    }

    /**
     * {@code round(personBaseCost ^ (1 + progress / pointsRequired))}: people further along cost more.
     */
    public int personCost(double progress) {
        long cost = Math.round(Math.pow(config.getPersonBaseCost(), 1 + progress / config.getPointsRequired()));
        return (int) Math.min(Integer.MAX_VALUE, cost);
    }

    /**
     * Cost of one person doing one slot of a task.
     *
     * @param preferred       whether the person listed the task
     * @param points          points the task is worth
     * @param progress        points the person already has
     * @param preferredBy     how many people listed the task
     * @param personPrefCount how many tasks the person listed
     */
    public int taskCost(boolean preferred, double points, double progress, int preferredBy, int personPrefCount) {
        int preferencePenalty = preferred ? 1 : config.getStronglyAgainstPenalty();
        int neededReward = preferred && preferredBy == 1 ? config.getNeededTaskReward() : 0;
        int limitedOptionsReward = preferred && personPrefCount <= config.getLimitedOptionsTaskCount()
                ? config.getLimitedOptionsReward() : 0;
        int fairnessPenalty = (int) (points * points * progress / config.getPointsRequired()
                * config.getPointFairnessMultiplier());
        return preferencePenalty + neededReward + limitedOptionsReward + fairnessPenalty;
    }

    public static Vertex<String> dayVertex(String day, String person) {
        return Vertex.of(day + Constant.SEPARATOR + person);
    }

    public static Vertex<String> slotVertex(String day, String task, int index) {
        return Vertex.of(day + Constant.SEPARATOR + task + Constant.SEPARATOR + index);
    }

    private static double progressOf(AssignmentInput input, String person) {
        if (input.getProgress() == null) {
            return 0;
        }
        Double progress = input.getProgress().get(person);
        return progress == null ? 0 : progress;
    }

    private static Map<String, Set<String>> preferenceSets(List<String> people, Map<String, List<String>> preferences) {
        Map<String, Set<String>> result = new LinkedHashMap<>();
        for (String person : people) {
            List<String> listed = preferences == null ? null : preferences.get(person);
            result.put(person, listed == null ? Collections.emptySet() : new LinkedHashSet<>(listed));
        }
        return result;
    }

    private static Map<String, Integer> countPreferences(Map<String, Set<String>> taskPrefs) {
        Map<String, Integer> counts = new HashMap<>();
        taskPrefs.values().forEach(tasks -> tasks.forEach(task -> counts.merge(task, 1, Integer::sum)));
        return counts;
    }

    private void validate(AssignmentInput input) {
        if (input == null) {
            throw new BadRequestException("Assignment input cannot be null");
        }
        if (input.getPeople() == null || input.getDayToTasks() == null) {
            throw new BadRequestException("Assignment input needs people and dayToTasks");
        }

        Set<String> seen = new HashSet<>();
        for (String person : input.getPeople()) {
            requireName(person, "Person");
            if (Constant.SOURCE.equals(person) || Constant.SINK.equals(person)) {
                throw new BadRequestException("Person name is reserved: " + person);
            }
            if (!seen.add(person)) {
                throw new BadRequestException("Person listed twice: " + person);
            }
        }

        Map<String, Double> points = input.getTaskPointValues() == null ? Map.of() : input.getTaskPointValues();
        Map<String, Integer> required = input.getTasksToNumRequired() == null ? Map.of() : input.getTasksToNumRequired();
        for (Map.Entry<String, List<String>> entry : input.getDayToTasks().entrySet()) {
            requireName(entry.getKey(), "Day");
            if (entry.getValue() == null) {
                throw new BadRequestException("No task list for day " + entry.getKey());
            }
            Set<String> tasksOfDay = new HashSet<>();
            for (String task : entry.getValue()) {
                requireName(task, "Task");
                if (!tasksOfDay.add(task)) {
                    throw new BadRequestException("Task " + task + " listed twice on " + entry.getKey());
                }
                if (points.get(task) == null) {
                    throw new BadRequestException("Task " + task + " has no point value");
                }
                Integer count = required.get(task);
                if (count == null || count < 0) {
                    throw new BadRequestException("Task " + task + " needs a non-negative number of people");
                }
            }
        }
    }

    private static void requireName(String name, String kind) {
        if (StringUtils.isBlank(name)) {
            throw new BadRequestException(kind + " name cannot be blank");
        }
        if (name.contains(Constant.SEPARATOR)) {
            throw new BadRequestException(kind + " name cannot contain '" + Constant.SEPARATOR + "': " + name);
        }
    }
}
