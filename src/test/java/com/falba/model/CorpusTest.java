package com.falba.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CorpusTest {

    @Test
    void sameRunIdInTwoTests_areBothKept() {
        Corpus corpus = new Corpus();
        corpus.add(new Run("fio", "r1"));
        corpus.add(new Run("compile-kernel", "r1"));

        assertEquals(2, corpus.size());
        assertTrue(corpus.get(new RunKey("fio", "r1")).isPresent());
        assertTrue(corpus.get(new RunKey("compile-kernel", "r1")).isPresent());
    }

    @Test
    void sameKeyAddedTwice_laterRunWins() {
        Corpus corpus = new Corpus();
        corpus.add(new Run("fio", "r1"));
        Run later = corpus.add(new Run("fio", "r1"));

        assertEquals(1, corpus.size());
        assertSame(later, corpus.get(new RunKey("fio", "r1")).orElseThrow());
    }

    @Test
    void runs_iterateByTestThenRunId() {
        Corpus corpus = new Corpus();
        corpus.add(new Run("fio", "r2"));
        corpus.add(new Run("fio", "r1"));
        corpus.add(new Run("compile-kernel", "r9"));

        List<String> order = corpus.getRuns().stream().map(r -> r.getKey().toString()).toList();

        assertEquals(List.of("compile-kernel/r9", "fio/r1", "fio/r2"), order);
    }

    @Test
    void blankKeyParts_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> new RunKey("", "r1"));
        assertThrows(IllegalArgumentException.class, () -> new RunKey("fio", null));
    }
}
