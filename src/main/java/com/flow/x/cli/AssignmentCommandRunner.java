package com.flow.x.cli;

import com.flow.x.exceptions.BadRequestException;
import com.flow.x.service.AssignmentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * Entry point of the command line:
 * <pre>
 *   solve   --input=&lt;json&gt; --output=&lt;json&gt; [--network-out=&lt;json&gt;]
 *   convert --preferences=&lt;csv&gt; --week=&lt;csv&gt; --points=&lt;csv&gt; --output=&lt;json&gt;
 * </pre>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AssignmentCommandRunner implements ApplicationRunner {
    static final String SOLVE = "solve";
    static final String CONVERT = "convert";
    static final String USAGE = "Usage: solve --input=<json> --output=<json> [--network-out=<json>]"
            + " | convert --preferences=<csv> --week=<csv> --points=<csv> --output=<json>";

    private final AssignmentService assignmentService;

    @Override
    public void run(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        if (commands.isEmpty()) {
            log.info(USAGE);
            return;
        }

        String command = commands.get(0);
        switch (command) {
            case SOLVE -> assignmentService.solveFile(
                    requiredPath(args, "input"),
                    requiredPath(args, "output"),
                    optionalPath(args, "network-out"));
            case CONVERT -> assignmentService.convertCsv(
                    requiredPath(args, "preferences"),
                    requiredPath(args, "week"),
                    requiredPath(args, "points"),
                    requiredPath(args, "output"));
            default -> throw new BadRequestException("Unknown command '" + command + "'. " + USAGE);
        }
    }

    private static Path requiredPath(ApplicationArguments args, String name) {
        Path path = optionalPath(args, name);
        if (path == null) {
            throw new BadRequestException("Missing option --" + name + ". " + USAGE);
        }
        return path;
    }

    private static Path optionalPath(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return Path.of(values.get(0));
    }
}
