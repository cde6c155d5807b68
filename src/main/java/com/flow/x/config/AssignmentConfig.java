package com.flow.x.config;

import com.flow.x.service.AssignmentNetworkBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class AssignmentConfig {

    @Bean
    public AssignmentCostConfig assignmentCostConfig(
            @Value("${assignment.points-required:59}") double pointsRequired,
            @Value("${assignment.person-base-cost:10}") double personBaseCost,
            @Value("${assignment.strongly-against-penalty:50}") int stronglyAgainstPenalty,
            @Value("${assignment.needed-task-reward:-50}") int neededTaskReward,
            @Value("${assignment.limited-options-reward:-40}") int limitedOptionsReward,
            @Value("${assignment.limited-options-task-count:2}") int limitedOptionsTaskCount,
            @Value("${assignment.point-fairness-multiplier:5}") double pointFairnessMultiplier,
            @Value("${assignment.tasks-per-day-limit:1}") int tasksPerDayLimit,
            @Value("${assignment.tasks-per-week-limit:2}") int tasksPerWeekLimit,
            @Value("${assignment.can-assign-non-preferred-tasks:true}") boolean canAssignNonPreferredTasks,
            @Value("${assignment.can-assign-non-preferred-days:false}") boolean canAssignNonPreferredDays) {
        return AssignmentCostConfig.builder()
                .pointsRequired(pointsRequired).personBaseCost(personBaseCost)
                .stronglyAgainstPenalty(stronglyAgainstPenalty).neededTaskReward(neededTaskReward)
                .limitedOptionsReward(limitedOptionsReward).limitedOptionsTaskCount(limitedOptionsTaskCount)
                .pointFairnessMultiplier(pointFairnessMultiplier)
                .tasksPerDayLimit(tasksPerDayLimit).tasksPerWeekLimit(tasksPerWeekLimit)
                .canAssignNonPreferredTasks(canAssignNonPreferredTasks)
                .canAssignNonPreferredDays(canAssignNonPreferredDays)
                .build();
    }

    @Bean
    public AssignmentNetworkBuilder assignmentNetworkBuilder(
            AssignmentCostConfig assignmentCostConfig,
            @Value("${flow.network.invariant-checks:false}") boolean invariantChecks) {
        if (invariantChecks) {
            log.info("Flow network invariant checks are enabled");
        }
        return new AssignmentNetworkBuilder(assignmentCostConfig, invariantChecks);
    }
}
