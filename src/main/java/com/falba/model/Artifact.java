package com.falba.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Handle on one output file of a run. The file must exist when the handle
 * is created; its content is only read on demand.
 */
public final class Artifact {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path path;

    private Artifact(Path path) {
        this.path = path;
    }

    /**
     * @throws IllegalArgumentException if nothing exists at {@code path}
     */
    public static Artifact of(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("artifact path does not exist: " + path);
        }
        return new Artifact(path.toAbsolutePath().normalize());
    }

    public Path path() {
        return path;
    }

    /** Last path element, the key most enrichers dispatch on. */
    public String fileName() {
        Path name = path.getFileName();
        return name == null ? "" : name.toString();
    }

    public byte[] content() throws IOException {
        return Files.readAllBytes(path);
    }

    public InputStream openStream() throws IOException {
        return Files.newInputStream(path);
    }

    /**
     * Parses the file as JSON.
     *
     * @throws IOException if the file cannot be read or is not valid JSON
     */
    public JsonNode json() throws IOException {
        try (InputStream in = openStream()) {
            JsonNode root = MAPPER.readTree(in);
            if (root == null || root.isMissingNode()) {
                throw new IOException("empty JSON document: " + path);
            }
            return root;
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Artifact other && path.equals(other.path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return "Artifact(" + path + ")";
    }
}
