package com.stagediff.core.report;

/**
 * Thrown when a color setting in git configuration cannot be parsed.
 */
public class ColorConfigException extends RuntimeException {

    public ColorConfigException(String message) {
        super(message);
    }
}
