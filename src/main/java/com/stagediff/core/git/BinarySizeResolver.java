package com.stagediff.core.git;

import com.stagediff.core.model.Baseline;
import com.stagediff.core.model.FileStat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Fills in counts for binary paths, which numstat reports as {@code -\t-}.
 *
 * <p>As in git's own diffstat, a binary change counts the byte size of the new
 * side as added and the byte size of the old side as deleted. A side that does
 * not exist has size zero, and identical content on both sides gives 0/0.
 *
 * <p>All lookups run from the repository top level, since diff output paths
 * are relative to it.
 */
public class BinarySizeResolver {

    private static final Logger log = LoggerFactory.getLogger(BinarySizeResolver.class);

    /** Stage number of a merged index entry. */
    private static final String MERGED_STAGE = "0";

    private final GitCommandRunner runner;

    public BinarySizeResolver(GitCommandRunner runner) {
        this.runner = runner;
    }

    /**
     * A blob named by an index or tree entry.
     *
     * @param id   object id
     * @param size byte size, or -1 when it still has to be looked up
     */
    record BlobEntry(String id, long size) {}

    public Path topLevel(Path workDir) {
        GitResult result = checked(workDir, "rev-parse", "--show-toplevel");
        return Path.of(result.stdout().strip());
    }

    /**
     * Sizes a binary path reported by the working copy pass: working file vs index entry.
     */
    public FileStat forWorkingCopy(Path topLevel, FileStat stat) {
        Optional<BlobEntry> indexEntry = indexEntry(topLevel, stat.path());
        Path file = topLevel.resolve(stat.path());

        if (!Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) {
            return stat.withCounts(0, indexEntry.map(e -> blobSize(topLevel, e)).orElse(0L));
        }

        String workingId = checked(topLevel, "hash-object", "--", stat.path()).stdout().strip();
        if (indexEntry.isPresent() && indexEntry.get().id().equals(workingId)) {
            log.debug("Binary path {} matches its index entry", stat.path());
            return stat.withCounts(0, 0);
        }

        long workingSize;
        try {
            workingSize = Files.size(file);
        } catch (IOException e) {
            throw new GitCommandException("Cannot read size of " + file, e);
        }
        return stat.withCounts(workingSize, indexEntry.map(e -> blobSize(topLevel, e)).orElse(0L));
    }

    /**
     * Sizes a binary path reported by the staged pass: index entry vs baseline tree entry.
     */
    public FileStat forStaged(Path topLevel, Baseline baseline, FileStat stat) {
        Optional<BlobEntry> indexEntry = indexEntry(topLevel, stat.path());
        Optional<BlobEntry> treeEntry = baseline.isEmptyTree()
                ? Optional.empty()
                : treeEntry(topLevel, baseline.id(), stat.path());

        if (indexEntry.isPresent() && treeEntry.isPresent()
                && indexEntry.get().id().equals(treeEntry.get().id())) {
            return stat.withCounts(0, 0);
        }
        return stat.withCounts(
                indexEntry.map(e -> blobSize(topLevel, e)).orElse(0L),
                treeEntry.map(e -> blobSize(topLevel, e)).orElse(0L));
    }

    private Optional<BlobEntry> indexEntry(Path topLevel, String path) {
        GitResult result = checked(topLevel, "--literal-pathspecs", "ls-files", "--stage", "-z", "--", path);
        return parseIndexEntry(result.stdout(), path);
    }

    private Optional<BlobEntry> treeEntry(Path topLevel, String treeIsh, String path) {
        GitResult result = checked(topLevel, "--literal-pathspecs", "ls-tree", "-l", "-z", treeIsh, "--", path);
        return parseTreeEntry(result.stdout(), path);
    }

    private long blobSize(Path topLevel, BlobEntry entry) {
        if (entry.size() >= 0) {
            return entry.size();
        }
        String size = checked(topLevel, "cat-file", "-s", entry.id()).stdout().strip();
        try {
            return Long.parseLong(size);
        } catch (NumberFormatException e) {
            throw new GitCommandException("Unexpected size '%s' for object %s".formatted(size, entry.id()), e);
        }
    }

    /**
     * Picks the entry for {@code path} out of {@code ls-files --stage -z} output
     * ({@code <mode> <id> <stage>\t<path>\0}). A merged entry wins over conflict stages;
     * among conflict stages the last one listed is used.
     */
    static Optional<BlobEntry> parseIndexEntry(String output, String path) {
        BlobEntry found = null;
        for (String entry : output.split("\0")) {
            int tab = entry.indexOf('\t');
            if (tab < 0 || !entry.substring(tab + 1).equals(path)) {
                continue;
            }
            String[] fields = entry.substring(0, tab).split(" ");
            if (fields.length != 3) {
                continue;
            }
            found = new BlobEntry(fields[1], -1);
            if (MERGED_STAGE.equals(fields[2])) {
                break;
            }
        }
        return Optional.ofNullable(found);
    }

    /**
     * Picks the blob entry for {@code path} out of {@code ls-tree -l -z} output
     * ({@code <mode> blob <id> <padded size>\t<path>\0}).
     */
    static Optional<BlobEntry> parseTreeEntry(String output, String path) {
        for (String entry : output.split("\0")) {
            int tab = entry.indexOf('\t');
            if (tab < 0 || !entry.substring(tab + 1).equals(path)) {
                continue;
            }
            String[] fields = entry.substring(0, tab).trim().split("\\s+");
            if (fields.length != 4 || !"blob".equals(fields[1])) {
                continue;
            }
            try {
                return Optional.of(new BlobEntry(fields[2], Long.parseLong(fields[3])));
            } catch (NumberFormatException e) {
                return Optional.of(new BlobEntry(fields[2], -1));
            }
        }
        return Optional.empty();
    }

    private GitResult checked(Path dir, String... args) {
        GitResult result = runner.run(dir, args);
        if (!result.isSuccess()) {
            throw new GitCommandException("git %s failed (exit code %d): %s"
                    .formatted(String.join(" ", args), result.exitCode(), result.stderr().strip()));
        }
        return result;
    }
}
