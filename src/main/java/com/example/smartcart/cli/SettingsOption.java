package com.example.smartcart.cli;

import com.example.smartcart.storage.EngineSettings;
import com.example.smartcart.storage.SettingsStorage;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;

/** Shared {@code --settings} option. */
public class SettingsOption {

    @Option(names = "--settings", description = "Engine settings JSON (default: built-in defaults)")
    private Path settingsFile;

    public EngineSettings load() throws IOException {
        return new SettingsStorage().load(settingsFile);
    }
}
