package com.flow.x.utils.media.csv;

import com.flow.x.dto.AssignmentInput;
import com.flow.x.exceptions.BadRequestException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssignmentCsvParserTest {

    @TempDir
    Path tempDir;

    private Path csv(String name, String... lines) throws IOException {
        Path path = tempDir.resolve(name);
        Files.writeString(path, String.join("\n", lines) + "\n");
        return path;
    }

    private Path preferences() throws IOException {
        return csv("preferences.csv",
                "Timestamp,Name,Week,Tasks,Days",
                "2024-01-01 10:00,Alice,1,\"Dishes, Trash\",\"Monday, Tuesday\"",
                "2024-01-01 11:00,  Bob ,1,Dishes,Monday",
                "2024-01-01 12:00,,1,Trash,Monday");
    }

    private Path week() throws IOException {
        return csv("week.csv",
                "Day,Task,Points",
                "Monday,Dishes,1",
                ",Trash,2.5",
                ",,",
                "Tuesday,Dishes,1");
    }

    private Path points() throws IOException {
        return csv("points.csv",
                "Name,Week 1,Week 2,Total",
                "Alice,3,4,7",
                "Bob,,,0",
                "Carol,1,1,2");
    }

    @Test
    void parsesPreferenceLists() throws IOException {
        AssignmentCsvParser.Preferences parsed = AssignmentCsvParser.parsePreferences(preferences());

        assertThat(parsed.taskPreferences())
                .containsOnlyKeys("Alice", "Bob")
                .containsEntry("Alice", List.of("Dishes", "Trash"))
                .containsEntry("Bob", List.of("Dishes"));
        assertThat(parsed.dayPreferences()).containsEntry("Alice", List.of("Monday", "Tuesday"));
    }

    @Test
    void weekListsEveryDayAndCarriesTheDayDown() throws IOException {
        AssignmentCsvParser.Week parsed = AssignmentCsvParser.parseWeek(week());

        assertThat(parsed.dayToTasks().keySet())
                .containsExactly("Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday", "Sunday");
        assertThat(parsed.dayToTasks().get("Monday")).containsExactly("Dishes", "Trash");
        assertThat(parsed.dayToTasks().get("Tuesday")).containsExactly("Dishes");
        assertThat(parsed.dayToTasks().get("Sunday")).isEmpty();
        assertThat(parsed.taskPointValues()).isEqualTo(Map.of("Dishes", 1.0, "Trash", 2.5));
    }

    @Test
    void weekRejectsUnknownDay() throws IOException {
        Path path = csv("bad-week.csv", "Day,Task,Points", "Funday,Dishes,1");

        assertThatThrownBy(() -> AssignmentCsvParser.parseWeek(path))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("Funday");
    }

    @Test
    void weekRejectsTaskBeforeAnyDay() throws IOException {
        Path path = csv("orphan-week.csv", "Day,Task,Points", ",Dishes,1");

        assertThatThrownBy(() -> AssignmentCsvParser.parseWeek(path))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("before any day");
    }

    @Test
    void weekRejectsNonNumericPoints() throws IOException {
        Path path = csv("points-week.csv", "Day,Task,Points", "Monday,Dishes,lots");

        assertThatThrownBy(() -> AssignmentCsvParser.parseWeek(path))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("not a number");
    }

    @Test
    void pointsKeepFileOrder() throws IOException {
        Map<String, Double> progress = AssignmentCsvParser.parsePoints(points());

        assertThat(progress.keySet()).containsExactly("Alice", "Bob", "Carol");
        assertThat(progress).containsEntry("Alice", 7.0).containsEntry("Bob", 0.0);
    }

    @Test
    void pointsRejectDuplicateName() throws IOException {
        Path path = csv("dup-points.csv", "Name,a,b,Total", "Alice,,,1", "Alice,,,2");

        assertThatThrownBy(() -> AssignmentCsvParser.parsePoints(path))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("twice");
    }

    @Test
    void combinedInputFillsMissingPreferences() throws IOException {
        AssignmentInput input = AssignmentCsvParser.toAssignmentInput(preferences(), week(), points());

        assertThat(input.getPeople()).containsExactly("Alice", "Bob", "Carol");
        assertThat(input.getTasksToNumRequired()).isEqualTo(Map.of("Dishes", 1, "Trash", 1));
        assertThat(input.getTaskPreferences().get("Carol")).containsExactly("Dishes", "Trash");
        assertThat(input.getDayPreferences().get("Carol")).hasSize(7);
        assertThat(input.getDayPreferences().get("Bob")).containsExactly("Monday");
        assertThat(input.getProgress()).containsEntry("Carol", 2.0);
    }

    @Test
    void missingFileIsRejected() {
        assertThatThrownBy(() -> AssignmentCsvParser.parsePoints(tempDir.resolve("absent.csv")))
                .isInstanceOf(BadRequestException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void cannotBeInstantiated() throws NoSuchMethodException {
        Constructor<AssignmentCsvParser> constructor = AssignmentCsvParser.class.getDeclaredConstructor();
        constructor.setAccessible(true);

        assertThatThrownBy(constructor::newInstance)
                .isInstanceOf(InvocationTargetException.class)
                .cause()
                .isInstanceOf(UnsupportedOperationException.class)
                .hasMessage("Not supported");
    }
}
