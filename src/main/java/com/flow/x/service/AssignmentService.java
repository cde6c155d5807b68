package com.flow.x.service;

import com.flow.x.dto.AssignmentInput;
import com.flow.x.dto.AssignmentResult;

import java.nio.file.Path;

public interface AssignmentService {
    AssignmentResult solve(AssignmentInput input);

    /**
     * Reads the input JSON, solves it and writes the result JSON.
     *
     * @param networkOutPath where to write the solved flow network, or null to skip it
     */
    AssignmentResult solveFile(Path inputPath, Path outputPath, Path networkOutPath);

    AssignmentInput convertCsv(Path preferencesPath, Path weekPath, Path pointsPath, Path outputPath);
}
