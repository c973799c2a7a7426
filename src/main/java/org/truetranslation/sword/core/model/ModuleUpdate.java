package org.truetranslation.sword.core.model;

import java.util.Objects;

public class ModuleUpdate {
    private final ModuleInfo module;
    private final String installedVersion;
    private final String availableVersion;

    public ModuleUpdate(ModuleInfo module, String installedVersion, String availableVersion) {
        this.module = module;
        this.installedVersion = installedVersion;
        this.availableVersion = availableVersion;
    }

    /** The module as offered by the remote source. */
    public ModuleInfo getModule() { return module; }
    public String getInstalledVersion() { return installedVersion; }
    public String getAvailableVersion() { return availableVersion; }

    // Plain string comparison; "1.10" and "1.9" are simply different.
    public boolean hasUpdate() {
        return !Objects.equals(installedVersion, availableVersion);
    }
}
