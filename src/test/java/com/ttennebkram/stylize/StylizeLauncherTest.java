package com.ttennebkram.stylize;

import com.ttennebkram.stylize.util.OpenCVLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StylizeLauncherTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeAll
    static void loadOpenCV() {
        OpenCVLoader.ensureLoaded();
    }

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    @Test
    void noArguments_isUsageError() {
        assertEquals(StylizeLauncher.EXIT_USAGE, run());
        assertTrue(stderr().contains("Missing command"));
    }

    @Test
    void unknownOption_isUsageError() {
        assertEquals(StylizeLauncher.EXIT_USAGE, run("process", "--bogus", "a.png", "b.png"));
    }

    @Test
    void help_exitsCleanly() {
        assertEquals(StylizeLauncher.EXIT_OK, run("--help"));
        assertTrue(stdout().contains("process"));
        assertTrue(stdout().contains("batch"));
    }

    @Test
    void process_writesOutputImage() {
        Path input = TestImages.writePortrait(tempDir.resolve("face.png"), 64, 80);
        Path output = tempDir.resolve("styled.png");

        int code = run("process", input.toString(), output.toString(), "-e", "crystallize", "-s", "5");

        assertEquals(StylizeLauncher.EXIT_OK, code, stderr());
        assertTrue(Files.isRegularFile(output));
        assertTrue(stdout().contains("Saved"));
    }

    @Test
    void process_debugWritesComparison() {
        Path input = TestImages.writePortrait(tempDir.resolve("face.png"), 48, 48);
        Path output = tempDir.resolve("styled.png");

        assertEquals(StylizeLauncher.EXIT_OK, run("process", input.toString(), output.toString(), "--debug"));

        assertTrue(Files.isRegularFile(tempDir.resolve("styled_comparison.png")));
        assertTrue(Files.isRegularFile(tempDir.resolve("styled_flow_field.png")));
    }

    @Test
    void process_missingInputFails() {
        int code = run("process", tempDir.resolve("none.png").toString(), tempDir.resolve("o.png").toString());

        assertEquals(StylizeLauncher.EXIT_FAILURE, code);
        assertTrue(stderr().startsWith("Error:"));
        assertFalse(Files.exists(tempDir.resolve("o.png")));
    }

    @Test
    void process_malformedConfigFails() throws Exception {
        Path input = TestImages.writePortrait(tempDir.resolve("face.png"), 32, 32);
        Path config = Files.writeString(tempDir.resolve("bad.json"), "{ not json");

        int code = run("process", input.toString(), tempDir.resolve("o.png").toString(), "-c", config.toString());

        assertEquals(StylizeLauncher.EXIT_FAILURE, code);
        assertTrue(stderr().contains("Error:"));
    }

    @Test
    void batch_processesDirectory() throws Exception {
        Path in = Files.createDirectories(tempDir.resolve("in"));
        TestImages.writePortrait(in.resolve("a.png"), 40, 40);
        TestImages.writePortrait(in.resolve("b.png"), 40, 40);
        Path outDir = tempDir.resolve("out");

        int code = run("batch", "-i", in.toString(), "-o", outDir.toString(), "-j", "2", "-v", "2", "-s", "10");

        assertEquals(StylizeLauncher.EXIT_OK, code, stderr());
        assertTrue(Files.isRegularFile(outDir.resolve("a_v1.png")));
        assertTrue(Files.isRegularFile(outDir.resolve("b_v2.png")));
        assertTrue(stdout().contains("[batch] Done: 4 saved, 0 failed"));
    }

    @Test
    void batch_undecodableImageFails() throws Exception {
        Path in = Files.createDirectories(tempDir.resolve("in"));
        TestImages.writePortrait(in.resolve("good.png"), 40, 40);
        Files.writeString(in.resolve("bad.png"), "garbage");

        int code = run("batch", "-i", in.toString(), "-o", tempDir.resolve("out").toString());

        assertEquals(StylizeLauncher.EXIT_FAILURE, code);
        assertTrue(Files.isRegularFile(tempDir.resolve("out/good.png")));
        assertTrue(stdout().contains("1 saved, 1 failed"));
    }

    @Test
    void batch_invalidParallelismIsUsageError() throws Exception {
        Path in = Files.createDirectories(tempDir.resolve("in"));

        int code = run("batch", "-i", in.toString(), "-o", tempDir.resolve("out").toString(), "-j", "0");

        assertEquals(StylizeLauncher.EXIT_USAGE, code);
    }

    private int run(String... args) {
        return StylizeLauncher.run(args,
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
