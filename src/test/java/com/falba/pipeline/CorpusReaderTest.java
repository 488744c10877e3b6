package com.falba.pipeline;

import com.falba.model.Corpus;
import com.falba.model.Run;
import com.falba.model.RunKey;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class CorpusReaderTest {

    @TempDir
    Path root;

    private final CorpusReader reader = new CorpusReader();

    @Test
    void testAndRunDirectories_becomeRunsWithAllNestedFiles() throws IOException {
        Files.createDirectories(root.resolve("fio/r1/sub"));
        Files.writeString(root.resolve("fio/r1/ansible.json"), "{}");
        Files.writeString(root.resolve("fio/r1/sub/trace.log"), "@x: 1\n");
        Files.createDirectories(root.resolve("compile-kernel/r1"));
        Files.writeString(root.resolve("stray-file"), "ignored");

        Corpus corpus = reader.read(root);

        assertEquals(2, corpus.size());
        Run fio = corpus.get(new RunKey("fio", "r1")).orElseThrow();
        assertEquals(2, fio.getArtifacts().size());
        assertTrue(corpus.get(new RunKey("compile-kernel", "r1")).orElseThrow().getArtifacts().isEmpty());
    }

    @Test
    void missingRoot_isFatal() {
        CorpusReadException ex = assertThrows(CorpusReadException.class,
            () -> reader.read(root.resolve("does-not-exist")));
        assertTrue(ex.getMessage().contains("does-not-exist"));
    }

    @Test
    void emptyRoot_givesEmptyCorpus() {
        assertTrue(reader.read(root).isEmpty());
    }

    @Test
    void blankDirectoryNames_areSkippedAndOtherRunsLoad() throws IOException {
        Files.createDirectories(root.resolve("fio/good"));
        Files.writeString(root.resolve("fio/good/x.txt"), "x");
        Files.createDirectories(root.resolve("fio").resolve(" "));
        Files.createDirectories(root.resolve(" ").resolve("r1"));

        Corpus corpus = reader.read(root);

        assertEquals(1, corpus.size());
        assertTrue(corpus.get(new RunKey("fio", "good")).isPresent());
    }
}
