package com.codescribe.analyzer.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

public class SettingsReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and validates the settings file at the given path.
     *
     * @throws SettingsReadException if the file is missing, malformed, or holds out-of-range values
     */
    public AnalyzerSettings read(Path settingsPath) {
        if (!Files.exists(settingsPath)) {
            throw new SettingsReadException("Settings file not found: " + settingsPath);
        }
        AnalyzerSettings settings;
        try (Reader reader = Files.newBufferedReader(settingsPath, StandardCharsets.UTF_8)) {
            settings = GSON.fromJson(reader, AnalyzerSettings.class);
        } catch (NoSuchFileException e) {
            throw new SettingsReadException("Settings file not found: " + settingsPath, e);
        } catch (IOException e) {
            throw new SettingsReadException("Failed to read settings: " + settingsPath + ": " + e.getMessage(), e);
        } catch (JsonParseException e) {
            throw new SettingsReadException("Settings file is not valid JSON: " + settingsPath + ": " + e.getMessage(), e);
        }
        if (settings == null) {
            throw new SettingsReadException("Settings file is empty: " + settingsPath);
        }
        try {
            settings.toTracerConfig();
        } catch (IllegalArgumentException e) {
            throw new SettingsReadException("Invalid settings in " + settingsPath + ": " + e.getMessage(), e);
        }
        return settings;
    }

    public static class SettingsReadException extends RuntimeException {
        public SettingsReadException(String message) { super(message); }
        public SettingsReadException(String message, Throwable cause) { super(message, cause); }
    }
}
