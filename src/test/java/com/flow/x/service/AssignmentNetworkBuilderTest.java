package com.flow.x.service;

import com.flow.x.config.AssignmentCostConfig;
import com.flow.x.dto.AssignmentInput;
import com.flow.x.exceptions.BadRequestException;
import com.flow.x.models.FlowNetwork;
import com.flow.x.models.Vertex;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssignmentNetworkBuilderTest {
    private static final Vertex<String> SOURCE = Vertex.of("S");
    private static final Vertex<String> SINK = Vertex.of("T");

    private final AssignmentNetworkBuilder builder = new AssignmentNetworkBuilder(AssignmentCostConfig.defaults(), true);

    @Test
    void personCostGrowsWithProgress() {
        assertThat(builder.personCost(0)).isEqualTo(10);
        assertThat(builder.personCost(29.5)).isEqualTo(32);
        assertThat(builder.personCost(59)).isEqualTo(100);
    }

    @Test
    void taskCostCombinesPreferenceRewardsAndFairness() {
        assertThat(builder.taskCost(true, 1, 0, 1, 1)).isEqualTo(1 - 50 - 40);
        assertThat(builder.taskCost(true, 2, 59, 1, 1)).isEqualTo(1 - 50 - 40 + 20);
        assertThat(builder.taskCost(true, 1, 0, 2, 3)).isEqualTo(1);
        assertThat(builder.taskCost(false, 3, 10, 2, 5)).isEqualTo(50 + 7);
        assertThat(builder.taskCost(false, 1, 0, 1, 1)).isEqualTo(50);
    }

    @Test
    void buildsLayeredNetwork() {
        FlowNetwork<String> network = builder.build(AssignmentFixtures.twoPeople());

        assertThat(network.getSource()).isEqualTo(SOURCE);
        assertThat(network.getSink()).isEqualTo(SINK);
        assertThat(network.isInvariantChecksEnabled()).isTrue();

        assertThat(network.getCapacity(SOURCE, Vertex.of("Alice"))).isEqualTo(2);
        assertThat(network.getOriginalCost(SOURCE, Vertex.of("Alice"))).isEqualTo(10);

        assertThat(network.getCapacity(Vertex.of("Alice"), Vertex.of("Monday|Alice"))).isEqualTo(1);
        assertThat(network.getCapacityGraph().hasEdge(Vertex.of("Alice"), Vertex.of("Tuesday|Alice"))).isFalse();
        assertThat(network.getCapacity(Vertex.of("Bob"), Vertex.of("Tuesday|Bob"))).isEqualTo(1);

        assertThat(network.getCapacity(Vertex.of("Monday|Trash|0"), SINK)).isEqualTo(1);
        assertThat(network.getOriginalCost(Vertex.of("Monday|Trash|0"), SINK)).isEqualTo(1);
        assertThat(network.getOriginalCost(Vertex.of("Monday|Alice"), Vertex.of("Monday|Trash|0"))).isEqualTo(-89);
        assertThat(network.getOriginalCost(Vertex.of("Monday|Alice"), Vertex.of("Monday|Dishes|0"))).isEqualTo(50);
        assertThat(network.getCapacityGraph().getChildren(Vertex.of("Monday|Bob")))
                .containsExactly(Vertex.of("Monday|Dishes|0"), Vertex.of("Monday|Trash|0"));
    }

    @Test
    void nonPreferredTasksCanBeLeftOut() {
        AssignmentNetworkBuilder strict = new AssignmentNetworkBuilder(AssignmentCostConfig.builder()
                .pointsRequired(59).personBaseCost(10)
                .stronglyAgainstPenalty(50).neededTaskReward(-50)
                .limitedOptionsReward(-40).limitedOptionsTaskCount(2)
                .pointFairnessMultiplier(5)
                .tasksPerDayLimit(1).tasksPerWeekLimit(2)
                .canAssignNonPreferredTasks(false).canAssignNonPreferredDays(true)
                .build(), false);

        FlowNetwork<String> network = strict.build(AssignmentFixtures.twoPeople());

        assertThat(network.getCapacityGraph().getChildren(Vertex.of("Monday|Alice")))
                .containsExactly(Vertex.of("Monday|Trash|0"));
        assertThat(network.getCapacity(Vertex.of("Alice"), Vertex.of("Tuesday|Alice"))).isEqualTo(1);
    }

    @Test
    void requiredCountCreatesOneSlotPerPerson() {
        AssignmentInput input = AssignmentFixtures.twoPeople();
        input.getTasksToNumRequired().put("Trash", 2);

        FlowNetwork<String> network = builder.build(input);

        assertThat(network.getCapacity(Vertex.of("Monday|Trash|0"), SINK)).isEqualTo(1);
        assertThat(network.getCapacity(Vertex.of("Monday|Trash|1"), SINK)).isEqualTo(1);
    }

    @Test
    void rejectsReservedDuplicateOrSeparatedNames() {
        AssignmentInput reserved = AssignmentFixtures.twoPeople();
        reserved.setPeople(List.of("Alice", "S"));
        assertThatThrownBy(() -> builder.build(reserved)).isInstanceOf(BadRequestException.class);

        AssignmentInput duplicate = AssignmentFixtures.twoPeople();
        duplicate.setPeople(List.of("Alice", "Alice"));
        assertThatThrownBy(() -> builder.build(duplicate)).isInstanceOf(BadRequestException.class);

        AssignmentInput separated = AssignmentFixtures.twoPeople();
        separated.setPeople(List.of("Alice", "Bob|Jr"));
        assertThatThrownBy(() -> builder.build(separated)).isInstanceOf(BadRequestException.class);

        AssignmentInput blank = AssignmentFixtures.twoPeople();
        blank.setPeople(List.of("Alice", " "));
        assertThatThrownBy(() -> builder.build(blank)).isInstanceOf(BadRequestException.class);
    }

    @Test
    void rejectsTasksWithoutPointsOrRequiredCount() {
        AssignmentInput noPoints = AssignmentFixtures.twoPeople();
        noPoints.getTaskPointValues().remove("Trash");
        assertThatThrownBy(() -> builder.build(noPoints))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("Trash");

        AssignmentInput noCount = AssignmentFixtures.twoPeople();
        noCount.getTasksToNumRequired().remove("Dishes");
        assertThatThrownBy(() -> builder.build(noCount))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("Dishes");
    }

    @Test
    void rejectsMissingSections() {
        AssignmentInput input = AssignmentFixtures.twoPeople();
        input.setDayToTasks(null);
        assertThatThrownBy(() -> builder.build(input)).isInstanceOf(BadRequestException.class);
        assertThatThrownBy(() -> builder.build(null)).isInstanceOf(BadRequestException.class);
    }
}
