package com.flow.x.utils.basic;


import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flow.x.exceptions.BadRequestException;
import com.flow.x.exceptions.InternalServerErrorException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;


@Slf4j
public final class BasicUtility {
    private static final ObjectMapper om = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private BasicUtility() {
        throw new UnsupportedOperationException("Not supported");
    }


    public static String stringifyObject(Object o) {
        try {
            return om.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            throw new BadRequestException("Failed stringifying object");
        }
    }

    /**
     * Reads a JSON file into {@code clazz}. Unknown properties are ignored.
     *
     * @throws BadRequestException          if the file is not valid JSON for the type
     * @throws InternalServerErrorException if the file cannot be read
     */
    public static <T> T readJson(Path path, Class<T> clazz) {
        if (!Files.isRegularFile(path)) {
            throw new BadRequestException("File not found: " + path);
        }
        try {
            return om.readValue(path.toFile(), clazz);
        } catch (JsonProcessingException e) {
            log.error("Invalid JSON in {}: {}", path, e.getOriginalMessage());
            throw new BadRequestException("Invalid JSON in " + path + ": " + e.getOriginalMessage());
        } catch (IOException e) {
            log.error("Failed reading {}: {}", path, e.getMessage(), e);
            throw new InternalServerErrorException("Failed reading " + path, e);
        }
    }

    /**
     * Writes {@code value} as indented JSON, creating parent directories and replacing any existing file.
     */
    public static void writeJson(Path path, Object value) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            om.writeValue(path.toFile(), value);
        } catch (IOException e) {
            log.error("Failed writing {}: {}", path, e.getMessage(), e);
            throw new InternalServerErrorException("Failed writing " + path, e);
        }
    }

}
