package org.truetranslation.sword.core;

import org.truetranslation.sword.core.model.InstallResult;

import java.util.function.Consumer;

public class BatchInstallOptions {
    public static final int DEFAULT_WORKERS = 4;

    private final int workers;
    private final boolean skipInstalled;
    private final Consumer<InstallResult> onResult;

    public BatchInstallOptions(int workers, boolean skipInstalled, Consumer<InstallResult> onResult) {
        this.workers = workers <= 0 ? DEFAULT_WORKERS : workers;
        this.skipInstalled = skipInstalled;
        this.onResult = onResult;
    }

    public static BatchInstallOptions defaults() {
        return new BatchInstallOptions(DEFAULT_WORKERS, false, null);
    }

    public int getWorkers() { return workers; }
    public boolean isSkipInstalled() { return skipInstalled; }

    /** Called on the worker thread once per module; may be {@code null}. */
    public Consumer<InstallResult> getOnResult() { return onResult; }
}
