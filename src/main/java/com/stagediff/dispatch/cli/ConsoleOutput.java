package com.stagediff.dispatch.cli;

import com.stagediff.core.report.ColorSettings;
import com.stagediff.core.report.ColorSlot;

/**
 * Colored diagnostic output for the stagediff CLI. Report text goes to stdout
 * unchanged; everything here goes to stderr.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void fatal(ColorSettings colors, String message) {
        System.err.println(colors.paint(ColorSlot.ERROR, "fatal: " + message));
    }

    public static void hint(ColorSettings colors, String message) {
        System.err.println(colors.paint(ColorSlot.HELP, message));
    }
}
