package org.truetranslation.sword.core.model;

/**
 * Result of checking one installed module against its descriptor.
 */
public class ModuleVerification {
    private final String moduleId;
    private final boolean installed;
    private final boolean dataExists;
    private final boolean sizeMatch;
    private final long expectedSize;
    private final long actualSize;
    private final String error;

    public ModuleVerification(String moduleId, boolean installed, boolean dataExists, boolean sizeMatch,
                              long expectedSize, long actualSize, String error) {
        this.moduleId = moduleId;
        this.installed = installed;
        this.dataExists = dataExists;
        this.sizeMatch = sizeMatch;
        this.expectedSize = expectedSize;
        this.actualSize = actualSize;
        this.error = error;
    }

    public static ModuleVerification notInstalled(String moduleId, String error) {
        return new ModuleVerification(moduleId, false, false, false, 0, 0, error);
    }

    public String getModuleId() { return moduleId; }

    /** The module's conf file is present in {@code mods.d}. */
    public boolean isInstalled() { return installed; }

    /** The data directory exists and is not empty. */
    public boolean isDataExists() { return dataExists; }

    public boolean isSizeMatch() { return sizeMatch; }
    public long getExpectedSize() { return expectedSize; }
    public long getActualSize() { return actualSize; }
    public String getError() { return error; }

    public boolean isValid() {
        return installed && dataExists && (expectedSize == 0 || sizeMatch);
    }
}
