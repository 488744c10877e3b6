package com.falba.pipeline;

import com.falba.model.Artifact;
import com.falba.model.Corpus;
import com.falba.model.Run;
import com.falba.model.RunKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads a result database laid out as {@code <root>/<testName>/<runId>/...}.
 * Every regular file below a run directory, at any depth, is one artifact.
 * Plain files directly under the root or a test directory are ignored, as are
 * directories whose name is blank.
 */
@Component
public class CorpusReader {

    private static final Logger log = LoggerFactory.getLogger(CorpusReader.class);

    /**
     * @throws CorpusReadException if the root, a test directory or a run directory cannot be listed
     */
    public Corpus read(Path root) {
        if (!Files.isDirectory(root)) {
            throw new CorpusReadException(root, "result database is not a directory");
        }
        Corpus corpus = new Corpus();
        for (Path testDir : subdirectories(root)) {
            String testName = testDir.getFileName().toString();
            if (testName.isBlank()) {
                log.warn("Skipping test directory with a blank name: {}", testDir);
                continue;
            }
            for (Path runDir : subdirectories(testDir)) {
                String runId = runDir.getFileName().toString();
                if (runId.isBlank()) {
                    log.warn("Skipping run directory with a blank name: {}", runDir);
                    continue;
                }
                corpus.add(readRun(new RunKey(testName, runId), runDir));
            }
        }
        log.info("Loaded {} runs from {}", corpus.size(), root);
        return corpus;
    }

    Run readRun(RunKey key, Path runDir) {
        Run run = new Run(key);
        try (Stream<Path> files = Files.walk(runDir)) {
            List<Path> regular = files.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
            for (Path file : regular) {
                try {
                    run.addArtifact(Artifact.of(file));
                } catch (IllegalArgumentException ex) {
                    log.warn("Artifact disappeared while loading {}: {}", key, ex.getMessage());
                }
            }
        } catch (IOException | UncheckedIOException ex) {
            throw new CorpusReadException(runDir, "failed to read run directory", ex);
        }
        return run;
    }

    private List<Path> subdirectories(Path dir) {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.filter(Files::isDirectory).sorted().collect(Collectors.toList());
        } catch (IOException ex) {
            throw new CorpusReadException(dir, "failed to list directory", ex);
        }
    }
}
