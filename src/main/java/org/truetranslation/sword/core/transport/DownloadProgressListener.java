package org.truetranslation.sword.core.transport;

/**
 * Receives byte counts while a download is streaming.
 */
@FunctionalInterface
public interface DownloadProgressListener {

    /**
     * @param bytesRead  bytes received so far
     * @param totalBytes expected size, or -1 when the server did not say
     */
    void onProgress(long bytesRead, long totalBytes);
}
