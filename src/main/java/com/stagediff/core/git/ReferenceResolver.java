package com.stagediff.core.git;

import com.stagediff.core.model.Baseline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Resolves the baseline for the staged comparison.
 *
 * <p>A reference that does not name a commit (typically {@code HEAD} on an unborn
 * branch) falls back to the empty tree, so every staged path shows as added.
 */
public class ReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    private final GitCommandRunner runner;

    public ReferenceResolver(GitCommandRunner runner) {
        this.runner = runner;
    }

    public Baseline resolve(Path workDir, String reference) {
        GitResult result = runner.run(workDir, "rev-parse", "--verify", "--quiet", reference + "^{commit}");
        String id = result.stdout().strip();
        if (result.isSuccess() && !id.isEmpty()) {
            log.debug("Reference {} resolved to {}", reference, id);
            return new Baseline(id, reference);
        }
        log.debug("Reference {} does not resolve, comparing against the empty tree", reference);
        return Baseline.emptyTree(reference);
    }
}
