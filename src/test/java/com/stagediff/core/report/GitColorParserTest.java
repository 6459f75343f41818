package com.stagediff.core.report;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GitColorParserTest {

    private static final String KEY = "color.interactive.header";

    private final GitColorParser parser = new GitColorParser();

    @Test
    void attributeAndForeground() {
        assertEquals("bold,fg(red)", parser.parse(KEY, "bold red"));
    }

    @Test
    void secondColorIsBackground() {
        assertEquals("underline,fg(yellow),bg(blue)", parser.parse(KEY, "yellow blue ul"));
    }

    @Test
    void brightColorsUseUpperPalette() {
        assertEquals("fg(9)", parser.parse(KEY, "brightred"));
        assertEquals("fg(15)", parser.parse(KEY, "brightwhite"));
    }

    @Test
    void paletteIndexAndRgb() {
        assertEquals("fg(208)", parser.parse(KEY, "208"));
        assertEquals("fg(5;2;0)", parser.parse(KEY, "#ff6600"));
    }

    @Test
    void normalTakesTheForegroundSlotWithoutStyle() {
        assertEquals("bg(green)", parser.parse(KEY, "normal green"));
        assertEquals("", parser.parse(KEY, "normal"));
        assertEquals("", parser.parse(KEY, "-1"));
    }

    @Test
    void negatedAttributesAreAcceptedAndIgnored() {
        assertEquals("fg(cyan)", parser.parse(KEY, "nobold no-ul cyan"));
    }

    @Test
    void caseInsensitive() {
        assertEquals("bold,fg(magenta)", parser.parse(KEY, "BOLD Magenta"));
    }

    @Test
    void dimMapsToFaint() {
        assertEquals("faint", parser.parse(KEY, "dim"));
    }

    @Test
    void unknownWordIsRejected() {
        var ex = assertThrows(ColorConfigException.class, () -> parser.parse(KEY, "bold sparkly"));
        assertTrue(ex.getMessage().contains("invalid color value"));
        assertTrue(ex.getMessage().contains(KEY));
    }

    @Test
    void threeColorsAreRejected() {
        assertThrows(ColorConfigException.class, () -> parser.parse(KEY, "red green blue"));
    }

    @Test
    void outOfRangeIndexIsRejected() {
        assertThrows(ColorConfigException.class, () -> parser.parse(KEY, "256"));
        assertThrows(ColorConfigException.class, () -> parser.parse(KEY, "#12345"));
    }

    @Test
    void missingValueIsRejected() {
        var ex = assertThrows(ColorConfigException.class, () -> parser.parse(KEY, null));
        assertTrue(ex.getMessage().contains("missing value"));
    }
}
