package com.stagediff.core.report;

import com.stagediff.core.collect.ChangeRecordStore;
import com.stagediff.core.model.Phase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReporterTest {

    private static final String HEADER = "            staged     unstaged path";

    private ChangeRecordStore store;
    private Reporter reporter;

    @BeforeEach
    void setUp() {
        store = new ChangeRecordStore();
        reporter = new Reporter(ColorSettings.plain());
    }

    private static List<String> rows(String report) {
        var rows = new ArrayList<String>();
        for (String line : report.split("\n")) {
            if (line.startsWith(" ") && line.contains(": ") && !line.equals(HEADER)) {
                rows.add(line);
            }
        }
        return rows;
    }

    // --- empty store ---

    @Test
    void emptyStoreRendersASingleBlankLine() {
        assertEquals("\n", reporter.render(store));
    }

    // --- table layout ---

    @Test
    void rendersWorkingAndStagedScenario() {
        store.upsert("a.txt", Phase.WORKING_COPY, 3, 1);
        store.upsert("b.txt", Phase.STAGED, 0, 2);

        String expected = HEADER + "\n"
                + "  1:    unchanged        +3/-1 a.txt\n"
                + "  2:        +0/-2      nothing b.txt\n"
                + "\n";
        assertEquals(expected, reporter.render(store));
    }

    @Test
    void pathChangedInBothPhasesShowsBothDeltas() {
        store.upsert("both.txt", Phase.WORKING_COPY, 2, 0);
        store.upsert("both.txt", Phase.STAGED, 10, 4);

        assertEquals(List.of("  1:       +10/-4        +2/-0 both.txt"), rows(reporter.render(store)));
    }

    @Test
    void zeroCountsRenderTheNoChangeSentinels() {
        store.upsert("stat-dirty.txt", Phase.WORKING_COPY, 0, 0);

        assertEquals(List.of("  1:    unchanged      nothing stat-dirty.txt"), rows(reporter.render(store)));
    }

    @Test
    void lastWriteWithinAPhaseIsWhatGetsRendered() {
        store.upsert("a.txt", Phase.WORKING_COPY, 3, 1);
        store.upsert("a.txt", Phase.WORKING_COPY, 8, 0);

        assertEquals(List.of("  1:    unchanged        +8/-0 a.txt"), rows(reporter.render(store)));
    }

    @Test
    void rowNumbersWidenPastNinetyNine() {
        for (int i = 0; i < 100; i++) {
            store.upsert("f%03d".formatted(i), Phase.STAGED, 1, 0);
        }

        var rows = rows(reporter.render(store));
        assertEquals(100, rows.size());
        assertTrue(rows.get(8).startsWith("  9: "));
        assertTrue(rows.get(99).startsWith(" 100: "));
    }

    // --- ordering ---

    @Test
    void rowsAreSortedByPathRegardlessOfInsertionOrder() {
        store.upsert("src/z.txt", Phase.WORKING_COPY, 1, 0);
        store.upsert("README", Phase.STAGED, 1, 0);
        store.upsert("src/a.txt", Phase.WORKING_COPY, 1, 0);
        store.upsert("lib.c", Phase.STAGED, 1, 0);

        var rows = rows(reporter.render(store));
        assertTrue(rows.get(0).endsWith(" README"));
        assertTrue(rows.get(1).endsWith(" lib.c"));
        assertTrue(rows.get(2).endsWith(" src/a.txt"));
        assertTrue(rows.get(3).endsWith(" src/z.txt"));
    }

    @Test
    void orderingIsByUtf8BytesNotUtf16Units() {
        // U+FFFD encodes as EF BF BD, U+1F600 as F0 9F 98 80; in UTF-16 the surrogate sorts first
        store.upsert("😀.txt", Phase.STAGED, 1, 0);
        store.upsert("�.txt", Phase.STAGED, 1, 0);

        var rows = rows(reporter.render(store));
        assertTrue(rows.get(0).endsWith("�.txt"));
        assertTrue(rows.get(1).endsWith("😀.txt"));
    }

    @Test
    void bytewiseComparatorPutsUppercaseFirst() {
        assertTrue(Reporter.BYTEWISE.compare("B", "a") < 0);
        assertTrue(Reporter.BYTEWISE.compare("a", "a/b") < 0);
        assertEquals(0, Reporter.BYTEWISE.compare("same", "same"));
    }

    // --- idempotence ---

    @Test
    void renderingTwiceIsByteIdentical() {
        store.upsert("a.txt", Phase.WORKING_COPY, 3, 1);
        store.upsert("b.txt", Phase.STAGED, 0, 2);

        assertEquals(reporter.render(store), reporter.render(store));
    }

    // --- wide cells ---

    @Test
    void countsWiderThanTheColumnWidenTheRowWithoutTruncation() {
        store.upsert("huge.bin", Phase.STAGED, Long.MAX_VALUE, Long.MAX_VALUE);

        String row = rows(reporter.render(store)).get(0);
        assertEquals("  1: +9223372036854775807/-9223372036854775807      nothing huge.bin", row);
    }

    // --- color ---

    @Test
    void colorDecoratesTheHeaderOnly() {
        store.upsert("a.txt", Phase.WORKING_COPY, 3, 1);
        var colored = new Reporter(ColorSettings.defaults().withMode(ColorMode.ALWAYS)).render(store);

        assertTrue(colored.contains("\u001B["));
        assertEquals(reporter.render(store), colored.replaceAll("\u001B\\[[0-9;]*m", ""));
    }

    @Test
    void printWritesTheRenderedReport() {
        store.upsert("a.txt", Phase.WORKING_COPY, 3, 1);
        var buffer = new ByteArrayOutputStream();

        reporter.print(store, new PrintStream(buffer, true, StandardCharsets.UTF_8));

        assertEquals(reporter.render(store), buffer.toString(StandardCharsets.UTF_8));
    }
}
