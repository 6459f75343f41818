package com.stagediff.core.report;

import com.stagediff.core.collect.ChangeRecordStore;
import com.stagediff.core.model.ChangeRecord;
import com.stagediff.core.model.Delta;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Locale;

/**
 * Renders a {@link ChangeRecordStore} as a numbered, path-sorted table:
 *
 * <pre>
 *            staged     unstaged path
 *   1:    unchanged        +3/-1 a.txt
 *   2:        +0/-2      nothing b.txt
 * </pre>
 *
 * <p>An empty store renders as a single blank line. Cells are plain strings and
 * grow with their content; a count wider than the column widens that row
 * instead of being truncated.
 */
public class Reporter {

    static final String HEADER_INDENT = "      ";
    static final String COLUMNS = "%12s %12s %s";
    static final String ROW_NUMBER = " %2d: ";

    static final String STAGED_LABEL = "staged";
    static final String UNSTAGED_LABEL = "unstaged";
    static final String PATH_LABEL = "path";

    static final String NO_WORKING_CHANGE = "nothing";
    static final String NO_STAGED_CHANGE = "unchanged";

    /** Orders paths by their UTF-8 bytes, as git does. */
    static final Comparator<String> BYTEWISE = (a, b) -> Arrays.compareUnsigned(
            a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));

    private final ColorSettings colors;

    public Reporter(ColorSettings colors) {
        this.colors = colors;
    }

    public String render(ChangeRecordStore store) {
        var out = new StringBuilder();
        if (store.isEmpty()) {
            return out.append('\n').toString();
        }

        var records = new ArrayList<>(store.snapshot());
        records.sort(Comparator.comparing(ChangeRecord::path, BYTEWISE));

        out.append(HEADER_INDENT)
                .append(colors.paint(ColorSlot.HEADER,
                        String.format(Locale.ROOT, COLUMNS, STAGED_LABEL, UNSTAGED_LABEL, PATH_LABEL)))
                .append('\n');

        for (int i = 0; i < records.size(); i++) {
            ChangeRecord record = records.get(i);
            out.append(String.format(Locale.ROOT, ROW_NUMBER, i + 1))
                    .append(String.format(Locale.ROOT, COLUMNS,
                            cell(record.stagedDelta(), NO_STAGED_CHANGE),
                            cell(record.workingDelta(), NO_WORKING_CHANGE),
                            record.path()))
                    .append('\n');
        }
        return out.append('\n').toString();
    }

    public void print(ChangeRecordStore store, PrintStream out) {
        out.print(render(store));
        out.flush();
    }

    static String cell(Delta delta, String unchanged) {
        return delta.isChanged() ? delta.toString() : unchanged;
    }
}
