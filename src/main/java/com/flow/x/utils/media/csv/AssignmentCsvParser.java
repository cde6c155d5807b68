package com.flow.x.utils.media.csv;

import com.flow.x.dto.AssignmentInput;
import com.flow.x.exceptions.BadRequestException;
import com.flow.x.exceptions.InternalServerErrorException;
import com.flow.x.utils.basic.Constant;
import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Builds an {@link AssignmentInput} from three spreadsheet exports. Each file starts with one header row.
 * <ul>
 *   <li>preferences: {@code timestamp, name, week, "task, task", "day, day"}</li>
 *   <li>week: a block per day; its first row names the day in column 0, the rows after it leave
 *   column 0 empty. Columns 1 and 2 hold the task and its points.</li>
 *   <li>points: {@code name, ..., ..., totalPoints}</li>
 * </ul>
 */
@Slf4j
public final class AssignmentCsvParser {

    private static final int PREF_NAME = 1;
    private static final int PREF_TASKS = 3;
    private static final int PREF_DAYS = 4;
    private static final int WEEK_DAY = 0;
    private static final int WEEK_TASK = 1;
    private static final int WEEK_POINTS = 2;
    private static final int POINTS_NAME = 0;
    private static final int POINTS_TOTAL = 3;

    private AssignmentCsvParser() {
        throw new UnsupportedOperationException("Not supported");
    }

    public record Preferences(Map<String, List<String>> taskPreferences, Map<String, List<String>> dayPreferences) {
    }

    public record Week(Map<String, List<String>> dayToTasks, Map<String, Double> taskPointValues) {
    }

    /**
     * Combines the three files. Every task needs one person, people come from the points file in its
     * order, and a person without a preferences row prefers every task and every day.
     */
    public static AssignmentInput toAssignmentInput(Path preferencesPath, Path weekPath, Path pointsPath) {
        Preferences preferences = parsePreferences(preferencesPath);
        Week week = parseWeek(weekPath);
        Map<String, Double> progress = parsePoints(pointsPath);

        Map<String, Integer> tasksToNumRequired = new LinkedHashMap<>();
        week.taskPointValues().keySet().forEach(task -> tasksToNumRequired.put(task, 1));
        List<String> people = new ArrayList<>(progress.keySet());

        Map<String, List<String>> taskPreferences = new LinkedHashMap<>(preferences.taskPreferences());
        Map<String, List<String>> dayPreferences = new LinkedHashMap<>(preferences.dayPreferences());
        for (String person : people) {
            if (!taskPreferences.containsKey(person)) {
                log.debug("No task preferences for {}, defaulting to every task", person);
                taskPreferences.put(person, new ArrayList<>(week.taskPointValues().keySet()));
            }
            if (!dayPreferences.containsKey(person)) {
                log.debug("No day preferences for {}, defaulting to every day", person);
                dayPreferences.put(person, new ArrayList<>(week.dayToTasks().keySet()));
            }
        }

        return AssignmentInput.builder()
                .dayToTasks(week.dayToTasks())
                .taskPointValues(week.taskPointValues())
                .tasksToNumRequired(tasksToNumRequired)
                .people(people)
                .dayPreferences(dayPreferences)
                .taskPreferences(taskPreferences)
                .progress(progress)
                .build();
    }

    public static Preferences parsePreferences(Path path) {
        Map<String, List<String>> taskPreferences = new LinkedHashMap<>();
        Map<String, List<String>> dayPreferences = new LinkedHashMap<>();
        int[] rowIndex = {1};
        readRows(path, row -> {
            rowIndex[0]++;
            String name = ValueSanitizer.cell(row, PREF_NAME);
            if (StringUtils.isBlank(name)) {
                log.warn("Skipping preferences row {} without a name: {}", rowIndex[0], Arrays.toString(row));
                return;
            }
            taskPreferences.put(name, ValueSanitizer.splitList(ValueSanitizer.cell(row, PREF_TASKS)));
            dayPreferences.put(name, ValueSanitizer.splitList(ValueSanitizer.cell(row, PREF_DAYS)));
        });
        log.info("Read preferences of {} people from {}", taskPreferences.size(), path);
        return new Preferences(taskPreferences, dayPreferences);
    }

    /**
     * @throws BadRequestException if column 0 holds something other than a day name, a task row comes
     *                             before any day, or a points value is not a number
     */
    public static Week parseWeek(Path path) {
        Map<String, List<String>> dayToTasks = new LinkedHashMap<>();
        Constant.DAYS.forEach(day -> dayToTasks.put(day, new ArrayList<>()));
        Map<String, Double> taskPointValues = new LinkedHashMap<>();
        String[] currentDay = {null};
        int[] rowIndex = {1};

        readRows(path, row -> {
            rowIndex[0]++;
            String day = ValueSanitizer.cell(row, WEEK_DAY);
            if (StringUtils.isNotBlank(day)) {
                if (!dayToTasks.containsKey(day)) {
                    throw new BadRequestException("Row " + rowIndex[0] + ": expected a day name in the first column, got '" + day + "'");
                }
                currentDay[0] = day;
            }
            String task = ValueSanitizer.cell(row, WEEK_TASK);
            if (StringUtils.isBlank(task)) {
                return;
            }
            if (currentDay[0] == null) {
                throw new BadRequestException("Row " + rowIndex[0] + ": task '" + task + "' appears before any day");
            }
            dayToTasks.get(currentDay[0]).add(task);
            taskPointValues.put(task, parseNumber(ValueSanitizer.cell(row, WEEK_POINTS), rowIndex[0], path));
        });
        log.info("Read {} distinct task(s) from {}", taskPointValues.size(), path);
        return new Week(dayToTasks, taskPointValues);
    }

    /**
     * @throws BadRequestException on a duplicate name or a missing or non-numeric total
     */
    public static Map<String, Double> parsePoints(Path path) {
        Map<String, Double> progress = new LinkedHashMap<>();
        int[] rowIndex = {1};
        readRows(path, row -> {
            rowIndex[0]++;
            String name = ValueSanitizer.cell(row, POINTS_NAME);
            if (StringUtils.isBlank(name)) {
                log.warn("Skipping points row {} without a name: {}", rowIndex[0], Arrays.toString(row));
                return;
            }
            if (progress.containsKey(name)) {
                throw new BadRequestException("Row " + rowIndex[0] + ": " + name + " appears twice in " + path);
            }
            progress.put(name, parseNumber(ValueSanitizer.cell(row, POINTS_TOTAL), rowIndex[0], path));
        });
        log.info("Read points of {} people from {}", progress.size(), path);
        return progress;
    }

    private static double parseNumber(String value, int rowIndex, Path path) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new BadRequestException("Row " + rowIndex + " of " + path + ": '" + value + "' is not a number");
        }
    }

    private static void readRows(Path path, Consumer<String[]> rowConsumer) {
        if (!Files.isRegularFile(path)) {
            throw new BadRequestException("CSV file not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVReader csvReader = new CSVReaderBuilder(reader)
                     .withSkipLines(1)
                     .withKeepCarriageReturn(false)
                     .build()) {
            String[] row;
            while ((row = csvReader.readNext()) != null) {
                rowConsumer.accept(row);
            }
        } catch (CsvValidationException e) {
            log.error("Malformed CSV {}: {}", path, e.getMessage());
            throw new BadRequestException("Malformed CSV " + path + ": " + e.getMessage());
        } catch (IOException e) {
            log.error("Error reading CSV {}: {}", path, e.getMessage(), e);
            throw new InternalServerErrorException("Error reading CSV " + path, e);
        }
    }
}
