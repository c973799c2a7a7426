package org.truetranslation.sword.core.model;

import java.util.Locale;

/**
 * Outcome of one module within a batch installation.
 */
public enum InstallStatus {
    /** Downloaded and extracted. */
    DONE,
    /** Already installed and the batch was asked to skip such modules. */
    SKIPPED,
    /** Every candidate package URL reported the file as absent. */
    UNAVAILABLE,
    /** Any other error. */
    FAILED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
