package com.loopguard.runtime.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class GuardConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes a guard configuration file.
     *
     * @throws GuardConfigReadException if the file is missing, empty or malformed
     */
    public GuardSettings read(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            throw new GuardConfigReadException("Config file not found: " + configPath);
        }
        try (Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8)) {
            GuardSettings settings = GSON.fromJson(reader, GuardSettings.class);
            if (settings == null) {
                throw new GuardConfigReadException("Config file is empty or invalid JSON: " + configPath);
            }
            return settings;
        } catch (JsonParseException e) {
            throw new GuardConfigReadException("Malformed config file: " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new GuardConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    public static class GuardConfigReadException extends RuntimeException {
        public GuardConfigReadException(String message) { super(message); }
        public GuardConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
