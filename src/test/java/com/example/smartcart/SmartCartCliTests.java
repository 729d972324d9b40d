package com.example.smartcart;

import com.example.smartcart.cli.SmartCartCli;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.*;

public class SmartCartCliTests {

    private static String resource(String name) throws Exception {
        return Paths.get(SmartCartCliTests.class.getResource("/sample-data/" + name).toURI()).toString();
    }

    private static int run(String... args) {
        return new CommandLine(new SmartCartCli()).execute(args);
    }

    @Test
    void build_recommend_and_evaluate_end_to_end(@TempDir Path dir) throws Exception {
        Path artifact = dir.resolve("artifacts.json");
        Path out = dir.resolve("out.csv");

        assertEquals(0, run("build", "--orders", resource("orders.csv"), "--out", artifact.toString(), "--parallelism", "2"));
        assertTrue(Files.exists(artifact));

        assertEquals(0, run("recommend", "--artifact", artifact.toString(), "--explain", "10 pc Grilled Wings"));
        assertEquals(0, run("explore", "--artifact", artifact.toString(), "--top", "2"));

        assertEquals(0, run("evaluate", "--artifact", artifact.toString(), "--test", resource("test.csv"),
                "--out", out.toString(), "--baseline"));
        assertEquals(5, Files.readAllLines(out).size());
    }

    @Test
    void invalid_settings_fail_with_exit_code_one(@TempDir Path dir) throws Exception {
        Path artifact = dir.resolve("artifacts.json");
        assertEquals(0, run("build", "--orders", resource("orders.csv"), "--out", artifact.toString()));

        Path negativeBias = dir.resolve("bias.json");
        Files.writeString(negativeBias, "{\"categoryBias\": -1.0}");
        assertEquals(1, run("recommend", "--artifact", artifact.toString(), "--settings", negativeBias.toString(), "Wings"));

        Path noWorkers = dir.resolve("workers.json");
        Files.writeString(noWorkers, "{\"parallelism\": 0}");
        assertEquals(1, run("evaluate", "--artifact", artifact.toString(), "--test", resource("test.csv"),
                "--out", dir.resolve("out.csv").toString(), "--settings", noWorkers.toString()));
    }

    @Test
    void failures_return_a_nonzero_exit_code(@TempDir Path dir) {
        assertEquals(1, run("build", "--orders", dir.resolve("missing.csv").toString(), "--out", dir.resolve("a.json").toString()));
        assertEquals(1, run("recommend", "--artifact", dir.resolve("missing.json").toString(), "Wings"));
        assertNotEquals(0, run("build"));
        assertNotEquals(0, run());
    }
}
