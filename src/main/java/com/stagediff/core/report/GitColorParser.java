package com.stagediff.core.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Translates a git color value (e.g. {@code "bold red"}, {@code "ul #ff8800 black"})
 * into a picocli markup style list (e.g. {@code "bold,fg(red)"}).
 *
 * <p>Grammar: whitespace-separated words; at most two colors, the first is the
 * foreground and the second the background. Colors are {@code normal},
 * {@code default}, the eight basic names, {@code bright<name>}, a palette index
 * {@code 0..255} (or {@code -1} for normal), or {@code #rrggbb}. Attributes are
 * {@code bold, dim, italic, ul, blink, reverse, strike}, optionally prefixed by
 * {@code no} or {@code no-}.
 */
public class GitColorParser {

    private static final Logger log = LoggerFactory.getLogger(GitColorParser.class);

    private static final List<String> BASIC_COLORS =
            List.of("black", "red", "green", "yellow", "blue", "magenta", "cyan", "white");

    private static final String NO_COLOR = "";

    /**
     * @param key   config key, for the error message
     * @param value raw config value
     * @return comma-separated picocli styles, possibly empty
     * @throws ColorConfigException if the value is not a valid git color
     */
    public String parse(String key, String value) {
        if (value == null) {
            throw new ColorConfigException("missing value for '%s'".formatted(key));
        }

        var attributes = new ArrayList<String>();
        String foreground = null;
        String background = null;

        for (String word : value.trim().split("\\s+")) {
            if (word.isEmpty()) {
                continue;
            }
            String w = word.toLowerCase(Locale.ROOT);

            String color = parseColor(w);
            if (color != null) {
                if (foreground == null) {
                    foreground = color;
                } else if (background == null) {
                    background = color;
                } else {
                    throw invalid(key, value);
                }
                continue;
            }

            if (!parseAttribute(w, attributes)) {
                throw invalid(key, value);
            }
        }

        var styles = new ArrayList<>(attributes);
        if (foreground != null && !foreground.isEmpty()) {
            styles.add("fg(" + foreground + ")");
        }
        if (background != null && !background.isEmpty()) {
            styles.add("bg(" + background + ")");
        }
        return String.join(",", styles);
    }

    /**
     * @return the picocli color argument, {@link #NO_COLOR} for normal/default, or null if not a color
     */
    private static String parseColor(String w) {
        if (w.equals("normal") || w.equals("default")) {
            return NO_COLOR;
        }
        if (BASIC_COLORS.contains(w)) {
            return w;
        }
        if (w.startsWith("bright") && BASIC_COLORS.contains(w.substring("bright".length()))) {
            return String.valueOf(8 + BASIC_COLORS.indexOf(w.substring("bright".length())));
        }
        if (w.startsWith("#")) {
            return parseRgb(w);
        }
        try {
            int index = Integer.parseInt(w);
            if (index == -1) {
                return NO_COLOR;
            }
            if (index >= 0 && index <= 255) {
                return String.valueOf(index);
            }
        } catch (NumberFormatException e) {
            // not a palette index
        }
        return null;
    }

    /** Maps {@code #rrggbb} onto the 6x6x6 cube of the 256-color palette. */
    private static String parseRgb(String w) {
        if (w.length() != 7) {
            return null;
        }
        try {
            int rgb = Integer.parseInt(w.substring(1), 16);
            int r = ((rgb >> 16) & 0xff) * 6 / 256;
            int g = ((rgb >> 8) & 0xff) * 6 / 256;
            int b = (rgb & 0xff) * 6 / 256;
            return r + ";" + g + ";" + b;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static boolean parseAttribute(String w, List<String> attributes) {
        boolean negated = false;
        String name = w;
        if (name.startsWith("no-")) {
            negated = true;
            name = name.substring(3);
        } else if (name.startsWith("no")) {
            negated = true;
            name = name.substring(2);
        }

        String style = switch (name) {
            case "bold" -> "bold";
            case "dim" -> "faint";
            case "italic" -> "italic";
            case "ul" -> "underline";
            case "blink" -> "blink";
            case "reverse" -> "reverse";
            case "strike" -> NO_COLOR;
            default -> null;
        };
        if (style == null) {
            return false;
        }
        if (negated || style.isEmpty()) {
            log.debug("Color attribute '{}' has no terminal style here, ignoring", w);
            return true;
        }
        if (!attributes.contains(style)) {
            attributes.add(style);
        }
        return true;
    }

    private static ColorConfigException invalid(String key, String value) {
        return new ColorConfigException("invalid color value '%s' for '%s'".formatted(value, key));
    }
}
