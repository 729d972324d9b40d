package com.example.smartcart.storage;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.file.*;

public class SettingsStorage {
    private static final Logger log = LoggerFactory.getLogger(SettingsStorage.class);

    private final ObjectMapper mapper = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .build();

    /** Missing file means defaults; a file that cannot be parsed is an error. */
    public EngineSettings load(Path file) throws IOException {
        if (file == null) return new EngineSettings();
        if (!Files.exists(file)) {
            log.warn("Settings file {} not found, using defaults", file);
            return new EngineSettings();
        }
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        } catch (IOException ex) {
            throw new IOException("Failed to parse settings " + file + ". Expect a JSON object of EngineSettings fields.", ex);
        }
    }

    public EngineSettings load(InputStream in) throws IOException {
        EngineSettings s = mapper.readValue(in, EngineSettings.class);
        return s == null ? new EngineSettings() : s;
    }

    public void save(EngineSettings s, Path file) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        if (dir != null && !Files.exists(dir)) Files.createDirectories(dir);
        try (OutputStream out = Files.newOutputStream(file)) {
            mapper.writeValue(out, s);
        }
    }
}
