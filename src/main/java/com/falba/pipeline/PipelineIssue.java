package com.falba.pipeline;

import com.falba.model.RunKey;

/**
 * One problem met while enriching or deriving.
 *
 * @param source  the artifact path, or the run itself for derivation issues
 * @param handler name of the enricher or deriver involved
 */
public record PipelineIssue(
    Severity severity,
    RunKey run,
    String source,
    String handler,
    String message
) {

    public enum Severity {
        /** Duplicate facts, unsafe archive entries, logs without metrics. */
        WARNING,
        /** Artifact or deriver level failure; that unit of work was abandoned. */
        ERROR
    }

    @Override
    public String toString() {
        return severity + " " + run + " [" + handler + "] " + source + ": " + message;
    }
}
