package com.stagediff.core.git;

import com.stagediff.core.model.Baseline;
import com.stagediff.core.model.FileStat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * {@link DiffEngine} backed by git's plumbing diff commands.
 *
 * <ul>
 *   <li>working copy vs staged: {@code git diff-files --numstat -z}</li>
 *   <li>staged vs baseline: {@code git diff-index --cached --numstat -z <baseline>}</li>
 * </ul>
 *
 * <p>Binary paths come back from numstat without line counts; they are sized
 * through {@link BinarySizeResolver} so a binary change never reads as unchanged.
 */
public class GitDiffEngine implements DiffEngine {

    private static final Logger log = LoggerFactory.getLogger(GitDiffEngine.class);

    private final GitCommandRunner runner;
    private final NumstatParser parser;
    private final BinarySizeResolver binarySizes;

    public GitDiffEngine(GitCommandRunner runner, NumstatParser parser, BinarySizeResolver binarySizes) {
        this.runner = runner;
        this.parser = parser;
        this.binarySizes = binarySizes;
    }

    @Override
    public List<FileStat> diffWorkingCopy(Path workDir, List<String> pathspec) {
        var args = new ArrayList<>(List.of("diff-files", "--numstat", "-z"));
        appendPathspec(args, pathspec);
        return withBinarySizes(workDir, runDiff(workDir, args), binarySizes::forWorkingCopy);
    }

    @Override
    public List<FileStat> diffStaged(Path workDir, Baseline baseline, List<String> pathspec) {
        var args = new ArrayList<>(List.of("diff-index", "--cached", "--numstat", "-z", baseline.id()));
        appendPathspec(args, pathspec);
        return withBinarySizes(workDir, runDiff(workDir, args),
                (topLevel, stat) -> binarySizes.forStaged(topLevel, baseline, stat));
    }

    private List<FileStat> runDiff(Path workDir, List<String> args) {
        GitResult result = runner.run(workDir, args);
        if (!result.isSuccess()) {
            log.warn("git {} exited with code {}", args.get(0), result.exitCode());
            throw new GitCommandException(
                    "git %s failed (exit code %d): %s".formatted(args.get(0), result.exitCode(), result.stderr().strip()));
        }
        var stats = parser.parse(result.stdout());
        log.debug("git {} reported {} changed paths", args.get(0), stats.size());
        return stats;
    }

    private List<FileStat> withBinarySizes(Path workDir, List<FileStat> stats,
                                           BiFunction<Path, FileStat, FileStat> sizer) {
        if (stats.stream().noneMatch(stat -> stat.binary())) {
            return stats;
        }
        Path topLevel = binarySizes.topLevel(workDir);
        var sized = new ArrayList<FileStat>(stats.size());
        for (FileStat stat : stats) {
            sized.add(stat.binary() ? sizer.apply(topLevel, stat) : stat);
        }
        return sized;
    }

    private static void appendPathspec(List<String> args, List<String> pathspec) {
        if (pathspec != null && !pathspec.isEmpty()) {
            args.add("--");
            args.addAll(pathspec);
        }
    }
}
