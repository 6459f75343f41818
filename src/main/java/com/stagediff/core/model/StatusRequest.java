package com.stagediff.core.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * What to report on.
 *
 * @param workDir   working copy root
 * @param reference reference name for the staged comparison, usually {@code HEAD}
 * @param pathspec  paths to restrict both comparisons to; empty means everything
 */
public record StatusRequest(
    Path workDir,
    String reference,
    List<String> pathspec
) {

    public StatusRequest {
        Objects.requireNonNull(workDir, "workDir");
        Objects.requireNonNull(reference, "reference");
        pathspec = pathspec == null ? List.of() : List.copyOf(pathspec);
    }
}
