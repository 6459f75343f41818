package com.stagediff.core.report;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable color configuration: the color mode plus a picocli style list per slot.
 *
 * <p>An empty style list means the slot is printed without decoration.
 */
public final class ColorSettings {

    private final ColorMode mode;
    private final Map<ColorSlot, String> styles;

    private ColorSettings(ColorMode mode, Map<ColorSlot, String> styles) {
        this.mode = mode;
        this.styles = styles;
    }

    public static ColorSettings defaults() {
        var styles = new EnumMap<ColorSlot, String>(ColorSlot.class);
        for (ColorSlot slot : ColorSlot.values()) {
            styles.put(slot, slot.defaultStyle());
        }
        return new ColorSettings(ColorMode.AUTO, styles);
    }

    /** Settings that never emit escapes, whatever the terminal. */
    public static ColorSettings plain() {
        return defaults().withMode(ColorMode.NEVER);
    }

    public ColorSettings withMode(ColorMode newMode) {
        return new ColorSettings(Objects.requireNonNull(newMode), styles);
    }

    public ColorSettings withStyle(ColorSlot slot, String style) {
        var copy = new EnumMap<>(styles);
        copy.put(slot, style == null ? "" : style);
        return new ColorSettings(mode, copy);
    }

    public ColorMode mode() {
        return mode;
    }

    public String style(ColorSlot slot) {
        return styles.get(slot);
    }

    /**
     * Wraps {@code text} in the slot's style when color is enabled.
     * Text that itself looks like picocli markup is returned as is.
     */
    public String paint(ColorSlot slot, String text) {
        String style = styles.get(slot);
        if (style == null || style.isEmpty() || text.contains("@|") || text.contains("|@")) {
            return text;
        }
        return mode.ansi().string("@|" + style + " " + text + "|@");
    }
}
