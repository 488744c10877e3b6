package com.falba.cli;

import com.falba.config.FalbaProperties;
import com.falba.derive.Derivers;
import com.falba.enrich.Enrichers;
import com.falba.pipeline.CorpusReader;
import com.falba.pipeline.PipelineService;
import com.falba.query.QueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class QueryCommandTest {

    @TempDir
    Path dir;

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private QueryCommand command;

    @BeforeEach
    void setUp() {
        PipelineService pipeline = new PipelineService(Enrichers.standard(1, dir.resolve("scratch")), Derivers.standard());
        command = new QueryCommand(new FalbaProperties(), new CorpusReader(), pipeline, new QueryService(),
            new PrintStream(stdout, true, StandardCharsets.UTF_8));
    }

    private Path corpus() throws IOException {
        Path root = dir.resolve("results");
        Files.createDirectories(root.resolve("fio/r1"));
        Files.writeString(root.resolve("fio/r1/ansible.json"),
            "{\"ansible_facts\": {\"ansible_cmdline\": \"quiet mitigations=auto,nosmt\"}}");
        Files.createDirectories(root.resolve("fio/r2"));
        Files.writeString(root.resolve("fio/r2/ansible.json"),
            "{\"ansible_facts\": {\"ansible_cmdline\": \"quiet\"}}");
        return root;
    }

    private void run(String... args) {
        command.run(new DefaultApplicationArguments(args));
    }

    @Test
    @DisplayName("ab prints one testName/runId line per match")
    void ab_printsMatches() throws IOException {
        Path root = corpus();

        run("ab", "asi_on", "--result-db=" + root);

        assertEquals(0, command.getExitCode());
        assertEquals("fio/r1", stdout.toString(StandardCharsets.UTF_8).strip());
    }

    @Test
    void noMatches_isStillSuccess() throws IOException {
        Path root = corpus();

        run("ab", "test_name == \"nope\"", "--result-db=" + root);

        assertEquals(0, command.getExitCode());
        assertEquals("", stdout.toString(StandardCharsets.UTF_8));
    }

    @Test
    void unreadableRoot_exitsNonZero() {
        run("ab", "true", "--result-db=" + dir.resolve("missing"));
        assertEquals(QueryCommand.EXIT_CORPUS, command.getExitCode());
    }

    @Test
    void emptyRoot_exitsNonZero() throws IOException {
        Path root = Files.createDirectories(dir.resolve("empty"));
        run("ab", "true", "--result-db=" + root);
        assertEquals(QueryCommand.EXIT_CORPUS, command.getExitCode());
    }

    @Test
    void badArguments_exitWithUsageCode() {
        run("frobnicate", "x");
        assertEquals(QueryCommand.EXIT_USAGE, command.getExitCode());

        run("ab");
        assertEquals(QueryCommand.EXIT_USAGE, command.getExitCode());
    }

    @Test
    void noArguments_doNothing() {
        run();
        assertEquals(0, command.getExitCode());
        assertEquals(0, stdout.size());
    }
}
