package com.example.smartcart.cli;

import com.example.smartcart.model.Category;
import com.example.smartcart.model.MenuSnapshot;
import com.example.smartcart.model.RankedItem;
import com.example.smartcart.storage.ArtifactStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "explore", mixinStandardHelpOptions = true,
    description = "Item counts per category and the most ordered items of each category.")
public class ExploreCommand implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(ExploreCommand.class);

    @Option(names = "--artifact", defaultValue = "artifacts/artifacts.json", description = "Artifact JSON (default: ${DEFAULT-VALUE})")
    private Path artifact;

    @Option(names = "--top", defaultValue = "10", description = "Items to list per category (default: ${DEFAULT-VALUE})")
    private int top;

    @Override
    public Integer call() {
        try {
            MenuSnapshot snapshot = new ArtifactStorage().load(artifact);
            System.out.println(snapshot);
            for (Category c : Category.values()) {
                List<RankedItem> ranked = snapshot.catalog.topByCategory(c);
                System.out.printf("%n%s (%d items)%n", c.label(), ranked.size());
                ranked.stream().limit(Math.max(0, top)).forEach(r -> System.out.println("  " + r.item.name + " - " + r.frequency));
            }
            return 0;
        } catch (IOException ex) {
            log.error("Explore failed: {}", ex.getMessage(), ex);
            return 1;
        }
    }
}
