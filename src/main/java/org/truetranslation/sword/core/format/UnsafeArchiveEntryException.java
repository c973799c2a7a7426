package org.truetranslation.sword.core.format;

import java.io.IOException;

/**
 * An archive entry whose path would land outside the extraction root.
 */
public class UnsafeArchiveEntryException extends IOException {
    private final String entryName;

    public UnsafeArchiveEntryException(String entryName) {
        super("invalid file path in archive: " + entryName);
        this.entryName = entryName;
    }

    public String getEntryName() {
        return entryName;
    }
}
