package org.truetranslation.sword.core.model;

public class InstallResult {
    private final ModuleInfo module;
    private final Source source;
    private final InstallStatus status;
    private final Exception error;

    public InstallResult(ModuleInfo module, Source source, InstallStatus status, Exception error) {
        this.module = module;
        this.source = source;
        this.status = status;
        this.error = error;
    }

    public ModuleInfo getModule() { return module; }
    public Source getSource() { return source; }
    public InstallStatus getStatus() { return status; }

    /** The failure behind an UNAVAILABLE or FAILED status, otherwise {@code null}. */
    public Exception getError() { return error; }

    @Override
    public String toString() {
        return module.getId() + ": " + status.label() + (error != null ? " (" + error.getMessage() + ")" : "");
    }
}
