package com.flow.x.config;

import lombok.Builder;
import lombok.Getter;

/**
 * Constants of the assignment cost model and the per-person limits.
 */
@Getter
@Builder
public class AssignmentCostConfig {
    /** Points a person is expected to reach; progress is measured against it. */
    private final double pointsRequired;
    private final double personBaseCost;
    private final int stronglyAgainstPenalty;
    private final int neededTaskReward;
    private final int limitedOptionsReward;
    /** Largest number of preferred tasks that still counts as having limited options. */
    private final int limitedOptionsTaskCount;
    private final double pointFairnessMultiplier;
    private final int tasksPerDayLimit;
    private final int tasksPerWeekLimit;
    private final boolean canAssignNonPreferredTasks;
    private final boolean canAssignNonPreferredDays;

    public AssignmentCostConfig(double pointsRequired, double personBaseCost, int stronglyAgainstPenalty,
                                int neededTaskReward, int limitedOptionsReward, int limitedOptionsTaskCount,
                                double pointFairnessMultiplier, int tasksPerDayLimit, int tasksPerWeekLimit,
                                boolean canAssignNonPreferredTasks, boolean canAssignNonPreferredDays) {
        if (pointsRequired <= 0) {
            throw new IllegalArgumentException("pointsRequired must be positive: " + pointsRequired);
        }
        if (tasksPerDayLimit < 0 || tasksPerWeekLimit < 0) {
            throw new IllegalArgumentException("Task limits cannot be negative");
        }
        this.pointsRequired = pointsRequired;
        this.personBaseCost = personBaseCost;
        this.stronglyAgainstPenalty = stronglyAgainstPenalty;
        this.neededTaskReward = neededTaskReward;
        this.limitedOptionsReward = limitedOptionsReward;
        this.limitedOptionsTaskCount = limitedOptionsTaskCount;
        this.pointFairnessMultiplier = pointFairnessMultiplier;
        this.tasksPerDayLimit = tasksPerDayLimit;
        this.tasksPerWeekLimit = tasksPerWeekLimit;
        this.canAssignNonPreferredTasks = canAssignNonPreferredTasks;
        this.canAssignNonPreferredDays = canAssignNonPreferredDays;
    }

    public static AssignmentCostConfig defaults() {
        return AssignmentCostConfig.builder()
                .pointsRequired(59).personBaseCost(10)
                .stronglyAgainstPenalty(50).neededTaskReward(-50)
                .limitedOptionsReward(-40).limitedOptionsTaskCount(2)
                .pointFairnessMultiplier(5)
                .tasksPerDayLimit(1).tasksPerWeekLimit(2)
                .canAssignNonPreferredTasks(true).canAssignNonPreferredDays(false)
                .build();
    }
}
