package org.truetranslation.sword.core;

import java.io.IOException;

/**
 * No candidate URL for a module's package exists on the server. Unlike other
 * download failures, retrying later will not help.
 */
public class PackageNotAvailableException extends IOException {
    private final String moduleId;
    private final int urlCount;

    public PackageNotAvailableException(String moduleId, int urlCount, Throwable lastError) {
        super("package not available on server: " + moduleId + " (tried " + urlCount + " URLs)", lastError);
        this.moduleId = moduleId;
        this.urlCount = urlCount;
    }

    public String getModuleId() { return moduleId; }
    public int getUrlCount() { return urlCount; }
}
