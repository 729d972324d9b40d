package com.example.smartcart.cli;

import com.example.smartcart.engine.SmartCartEngine;
import com.example.smartcart.model.EvaluationReport;
import com.example.smartcart.model.MenuSnapshot;
import com.example.smartcart.model.TestRow;
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

@Command(name = "evaluate", mixinStandardHelpOptions = true,
    description = "Score a labeled test CSV, print Recall@3 / Precision@3 / Top-1 and write the per-row table.")
public class EvaluateCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(EvaluateCommand.class);

    @Mixin
    private SettingsOption settingsOption;

    @Option(names = "--artifact", defaultValue = "artifacts/artifacts.json", description = "Artifact JSON (default: ${DEFAULT-VALUE})")
    private Path artifact;

    @Option(names = "--test", required = true, description = "Labeled test CSV")
    private Path test;

    @Option(names = "--out", defaultValue = "artifacts/SmartCart_Recommendation_Output.csv", description = "Output CSV (default: ${DEFAULT-VALUE})")
    private Path out;

    @Option(names = "--baseline", description = "Also score a popularity baseline and report the lift")
    private boolean baseline;

    @Override
    public Integer call() {
        try {
            EngineSettings settings = settingsOption.load();
            MenuSnapshot snapshot = new ArtifactStorage().load(artifact);
            List<TestRow> rows = new CsvTables().readTestRows(test, settings);

            EvaluationReport report = new SmartCartEngine(settings).evaluate(snapshot, rows, baseline);
            new CsvTables().writeEvaluation(report, out);

            System.out.println("SmartCart: " + report.metrics);
            if (report.baseline != null) {
                System.out.println("Baseline:  " + report.baseline);
                System.out.printf("Lift: Recall@3 %+.1f%%, Precision@3 %+.1f%%%n",
                        100 * report.recallLift(), 100 * report.precisionLift());
            }
            System.out.println("Saved: " + out);
            return 0;
        } catch (IOException | IllegalArgumentException ex) {
            log.error("Evaluation failed: {}", ex.getMessage(), ex);
            return 1;
        }
    }
}
