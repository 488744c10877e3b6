package com.falba.pipeline;

import java.nio.file.Path;

/**
 * The result database or one of its test or run directories could not be
 * read. Unlike artifact problems this aborts the whole load.
 */
public class CorpusReadException extends RuntimeException {

    public CorpusReadException(Path path, String message) {
        super(message + ": " + path);
    }

    public CorpusReadException(Path path, String message, Throwable cause) {
        super(message + ": " + path, cause);
    }
}
