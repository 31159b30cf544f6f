package com.biomodel.generator.cli;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

class ConvertCommandTest {

    @TempDir
    Path tempDir;

    private static int execute(String... args) {
        return new CommandLine(new ConvertCommand()).execute(args);
    }

    @Test
    void testConvertWritesReport() throws Exception {
        Path modelFile = tempDir.resolve("toy.txt");
        Files.writeString(modelFile, """
                A binds B --> C | kf=1, kr=0.5 | A=10, B=5
                C is degraded
                @obs total_C = u[C]
                @sim tspan: [0, 60]
                """);
        Path markdownDir = tempDir.resolve("markdown");

        int exitCode = execute(modelFile.toString(), "--markdown-dir", markdownDir.toString());

        assertThat(exitCode).isEqualTo(0);
        assertThat(markdownDir.resolve("toy").resolve("rate_equation.md")).exists();
        assertThat(markdownDir.resolve("toy").resolve("differential_equation.md")).exists();
    }

    @Test
    void testRegisteredPhrase() throws Exception {
        Path modelFile = tempDir.resolve("custom.txt");
        Files.writeString(modelFile, "A breaks down\n");

        assertThat(execute(modelFile.toString(), "-r", "is_degraded=breaks down")).isEqualTo(0);
        assertThat(execute(modelFile.toString())).isEqualTo(1);
    }

    @Test
    void testInvalidModelFails() throws Exception {
        Path modelFile = tempDir.resolve("broken.txt");
        Files.writeString(modelFile, "A binds B\n");

        assertThat(execute(modelFile.toString())).isEqualTo(1);
    }

    @Test
    void testInvalidOptionsFail() {
        assertThat(execute(tempDir.resolve("missing.txt").toString())).isEqualTo(1);
    }

    @Test
    void testSkipReferenceCheck() throws Exception {
        Path modelFile = tempDir.resolve("refs.txt");
        Files.writeString(modelFile, """
                A is degraded
                @obs ghost = u[Z]
                """);

        assertThat(execute(modelFile.toString())).isEqualTo(1);
        assertThat(execute(modelFile.toString(), "--skip-reference-check")).isEqualTo(0);
    }
}
