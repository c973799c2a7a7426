package org.truetranslation.sword.core.format;

import java.io.IOException;

/**
 * A module descriptor or source list that cannot be understood.
 */
public class ConfFormatException extends IOException {
    public ConfFormatException(String message) {
        super(message);
    }
}
