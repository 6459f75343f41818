package com.stagediff.core.git;

import com.stagediff.core.model.FileStat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses {@code git diff --numstat -z} output into {@link FileStat}s, preserving order.
 *
 * <p>Entry shapes:
 * <pre>
 *   12\t3\tsrc/Foo.java\0            modified (or added/deleted) text file
 *   -\t-\timg/logo.png\0             binary file, no line counts
 *   4\t1\t\0old/Bar.java\0new/Bar.java\0   rename or copy; the new path is kept
 * </pre>
 */
public class NumstatParser {

    private static final Logger log = LoggerFactory.getLogger(NumstatParser.class);

    private static final String BINARY_COUNT = "-";

    public List<FileStat> parse(String numstatOutput) {
        if (numstatOutput == null || numstatOutput.isEmpty()) {
            return List.of();
        }

        var results = new ArrayList<FileStat>();
        String[] tokens = numstatOutput.split("\0", -1);
        int i = 0;
        while (i < tokens.length) {
            String head = tokens[i++];
            if (head.isEmpty()) {
                continue;
            }

            int firstTab = head.indexOf('\t');
            int secondTab = firstTab < 0 ? -1 : head.indexOf('\t', firstTab + 1);
            if (secondTab < 0) {
                log.debug("Skipping unparseable numstat entry: {}", head);
                continue;
            }

            String added = head.substring(0, firstTab);
            String deleted = head.substring(firstTab + 1, secondTab);
            String path = head.substring(secondTab + 1);
            if (path.isEmpty()) {
                // rename/copy: old path and new path follow as separate entries
                if (i + 1 >= tokens.length) {
                    log.debug("Truncated rename entry in numstat output: {}", head);
                    break;
                }
                i++;
                path = tokens[i++];
            }

            var stat = toFileStat(path, added, deleted);
            if (stat != null) {
                results.add(stat);
            }
        }
        return results;
    }

    private static FileStat toFileStat(String path, String added, String deleted) {
        if (BINARY_COUNT.equals(added) && BINARY_COUNT.equals(deleted)) {
            return FileStat.binary(path);
        }
        try {
            long a = Long.parseLong(added);
            long d = Long.parseLong(deleted);
            if (a < 0 || d < 0) {
                log.debug("Skipping numstat entry with negative counts for {}", path);
                return null;
            }
            return FileStat.text(path, a, d);
        } catch (NumberFormatException e) {
            log.debug("Skipping numstat entry with bad counts for {}: {}/{}", path, added, deleted);
            return null;
        }
    }
}
