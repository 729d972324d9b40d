package com.example.smartcart.cli;

import com.example.smartcart.engine.SmartCartEngine;
import com.example.smartcart.model.MenuSnapshot;
import com.example.smartcart.services.OrderSampler;
import com.example.smartcart.storage.ArtifactStorage;
import com.example.smartcart.storage.CsvTables;
import com.example.smartcart.storage.EngineSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "build", mixinStandardHelpOptions = true,
    description = "Parse orders, tag items, build the co-occurrence matrix and save the artifact.")
public class BuildCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(BuildCommand.class);

    @Mixin
    private SettingsOption settingsOption;

    @Option(names = "--orders", required = true, description = "Orders CSV")
    private Path orders;

    @Option(names = "--out", defaultValue = "artifacts/artifacts.json", description = "Artifact JSON to write (default: ${DEFAULT-VALUE})")
    private Path out;

    @Option(names = "--sample", description = "Use at most N orders for the matrix (speed vs quality)")
    private Integer sample;

    @Option(names = "--strategy", description = "Sampling strategy: ${COMPLETION-CANDIDATES}")
    private OrderSampler.Strategy strategy;

    @Option(names = "--seed", description = "Seed for uniform sampling")
    private Long seed;

    @Option(names = "--parallelism", description = "Worker threads for pair counting")
    private Integer parallelism;

    @Override
    public Integer call() {
        try {
            EngineSettings settings = settingsOption.load();
            if (sample != null) settings.sampleSize = sample;
            if (strategy != null) settings.sampleStrategy = strategy;
            if (seed != null) settings.seed = seed;
            if (parallelism != null) settings.parallelism = parallelism;

            List<String> raw = new CsvTables().readOrders(orders, settings.orderColumn);
            SmartCartEngine engine = new SmartCartEngine(settings);
            MenuSnapshot snapshot = engine.build(raw, orders.getFileName().toString());
            new ArtifactStorage().save(snapshot, out);
            System.out.println(snapshot);
            System.out.println("Artifact saved to " + out);
            return 0;
        } catch (IOException | IllegalArgumentException ex) {
            log.error("Build failed: {}", ex.getMessage(), ex);
            return 1;
        }
    }
}
