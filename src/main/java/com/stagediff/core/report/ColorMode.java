package com.stagediff.core.report;

import picocli.CommandLine.Help.Ansi;

import java.util.Locale;

/**
 * Whether color escapes are emitted, as set by {@code color.interactive} or {@code color.ui}.
 */
public enum ColorMode {
    ALWAYS(Ansi.ON),
    NEVER(Ansi.OFF),
    AUTO(Ansi.AUTO);

    private final Ansi ansi;

    ColorMode(Ansi ansi) {
        this.ansi = ansi;
    }

    public Ansi ansi() {
        return ansi;
    }

    /**
     * Parses a git colorbool value.
     *
     * <p>{@code always}, {@code never} and {@code auto} map directly. A plain git
     * boolean is also accepted: true means auto, false means never. A key with
     * no value at all means auto.
     *
     * @param key   config key, for the error message
     * @param value raw value, or null when the key has no value
     * @throws ColorConfigException if the value is neither a colorbool nor a boolean
     */
    public static ColorMode parse(String key, String value) {
        if (value == null) {
            return AUTO;
        }
        String v = value.trim().toLowerCase(Locale.ROOT);
        switch (v) {
            case "always":
                return ALWAYS;
            case "never":
                return NEVER;
            case "auto":
                return AUTO;
            case "true", "yes", "on":
                return AUTO;
            case "false", "no", "off", "":
                return NEVER;
            default:
                break;
        }
        try {
            return Long.parseLong(v) != 0 ? AUTO : NEVER;
        } catch (NumberFormatException e) {
            throw new ColorConfigException("bad boolean config value '%s' for '%s'".formatted(value, key));
        }
    }
}
