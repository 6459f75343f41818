package com.stagediff.core.report;

import java.util.Locale;
import java.util.Optional;

/**
 * Colorable elements, configured through {@code color.interactive.<slot>}.
 * Default styles are picocli markup style lists.
 */
public enum ColorSlot {
    PROMPT("prompt", "bold,fg(blue)"),
    HEADER("header", "bold"),
    HELP("help", "bold,fg(red)"),
    ERROR("error", "bold,fg(red)");

    private final String configName;
    private final String defaultStyle;

    ColorSlot(String configName, String defaultStyle) {
        this.configName = configName;
        this.defaultStyle = defaultStyle;
    }

    public String configName() {
        return configName;
    }

    public String defaultStyle() {
        return defaultStyle;
    }

    public static Optional<ColorSlot> fromConfigName(String name) {
        String n = name.toLowerCase(Locale.ROOT);
        for (ColorSlot slot : values()) {
            if (slot.configName.equals(n)) {
                return Optional.of(slot);
            }
        }
        return Optional.empty();
    }
}
