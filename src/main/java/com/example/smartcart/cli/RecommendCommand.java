package com.example.smartcart.cli;

import com.example.smartcart.engine.SmartCartEngine;
import com.example.smartcart.model.MenuSnapshot;
import com.example.smartcart.model.Recommendation;
import com.example.smartcart.services.ScoreBreakdown;
import com.example.smartcart.storage.ArtifactStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "recommend", mixinStandardHelpOptions = true,
    description = "Recommend up to three add-ons for the given cart items (at most 3 are used).")
public class RecommendCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(RecommendCommand.class);

    @Mixin
    private SettingsOption settingsOption;

    @Option(names = "--artifact", defaultValue = "artifacts/artifacts.json", description = "Artifact JSON (default: ${DEFAULT-VALUE})")
    private Path artifact;

    @Option(names = "--explain", description = "Also print the score breakdown of the leading candidates")
    private boolean explain;

    @Parameters(arity = "1..*", paramLabel = "ITEM", description = "Cart item names")
    private List<String> items;

    @Override
    public Integer call() {
        try {
            MenuSnapshot snapshot = new ArtifactStorage().load(artifact);
            SmartCartEngine engine = new SmartCartEngine(settingsOption.load());
            List<Recommendation> recs = engine.recommend(snapshot, items);
            if (recs.isEmpty()) {
                System.out.println("No recommendations found. Try different items or rebuild the model.");
                return 0;
            }
            System.out.println("Top " + recs.size() + " recommendations:");
            for (Recommendation r : recs) System.out.println("  " + r);
            if (explain) {
                System.out.println("Score breakdown:");
                List<ScoreBreakdown> breakdown = engine.explain(snapshot, items);
                breakdown.stream().limit(10).forEach(b -> System.out.println("  " + b));
            }
            return 0;
        } catch (IOException | IllegalArgumentException ex) {
            log.error("Recommend failed: {}", ex.getMessage(), ex);
            return 1;
        }
    }
}
