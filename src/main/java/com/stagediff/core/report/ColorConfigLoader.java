package com.stagediff.core.report;

import com.stagediff.core.git.GitCommandRunner;
import com.stagediff.core.git.GitResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads {@code color.ui}, {@code color.interactive} and {@code color.interactive.<slot>}
 * from git configuration into {@link ColorSettings}.
 *
 * <p>{@code color.interactive} wins over {@code color.ui}; with neither set the mode is auto.
 * Unknown slots are ignored.
 */
public class ColorConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ColorConfigLoader.class);

    static final String KEY_PATTERN = "^color\\.(ui|interactive(\\..+)?)$";

    private static final String UI_KEY = "color.ui";
    private static final String INTERACTIVE_KEY = "color.interactive";
    private static final String SLOT_PREFIX = INTERACTIVE_KEY + ".";

    /** {@code git config --get-regexp} exits with 1 when no key matches. */
    private static final int NO_MATCHING_KEYS = 1;

    private final GitCommandRunner runner;
    private final GitColorParser colorParser;

    public ColorConfigLoader(GitCommandRunner runner, GitColorParser colorParser) {
        this.runner = runner;
        this.colorParser = colorParser;
    }

    /**
     * @throws ColorConfigException if git configuration cannot be read or a color setting is malformed
     */
    public ColorSettings load(Path workDir) {
        GitResult result = runner.run(workDir, "config", "-z", "--get-regexp", KEY_PATTERN);
        if (result.exitCode() == NO_MATCHING_KEYS) {
            return ColorSettings.defaults();
        }
        if (!result.isSuccess()) {
            throw new ColorConfigException("cannot read color configuration (exit code %d): %s"
                    .formatted(result.exitCode(), result.stderr().strip()));
        }
        return parse(result.stdout());
    }

    /**
     * Applies {@code git config -z} output: entries are {@code key\nvalue\0}, or
     * {@code key\0} for a key without a value. Later entries override earlier ones.
     */
    ColorSettings parse(String configOutput) {
        var settings = ColorSettings.defaults();
        ColorMode uiMode = null;
        ColorMode interactiveMode = null;

        for (String entry : configOutput.split("\0")) {
            if (entry.isEmpty()) {
                continue;
            }
            int newline = entry.indexOf('\n');
            String key = newline < 0 ? entry : entry.substring(0, newline);
            String value = newline < 0 ? null : entry.substring(newline + 1);

            if (key.equalsIgnoreCase(UI_KEY)) {
                uiMode = ColorMode.parse(key, value);
            } else if (key.equalsIgnoreCase(INTERACTIVE_KEY)) {
                interactiveMode = ColorMode.parse(key, value);
            } else if (key.regionMatches(true, 0, SLOT_PREFIX, 0, SLOT_PREFIX.length())) {
                Optional<ColorSlot> slot = ColorSlot.fromConfigName(key.substring(SLOT_PREFIX.length()));
                if (slot.isEmpty()) {
                    log.debug("Ignoring unknown color slot {}", key);
                    continue;
                }
                settings = settings.withStyle(slot.get(), colorParser.parse(key, value));
            }
        }

        ColorMode mode = interactiveMode != null ? interactiveMode
                : uiMode != null ? uiMode
                : ColorMode.AUTO;
        return settings.withMode(mode);
    }
}
