package org.truetranslation.sword.core.transport;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

final class Transfers {

    static final int CHUNK_SIZE = 32 * 1024;

    private Transfers() {
    }

    /**
     * Copies the stream in fixed-size chunks, reporting the running total
     * after each chunk when a listener is given.
     */
    static long copy(InputStream in, OutputStream out, long totalBytes, DownloadProgressListener listener)
            throws IOException {
        byte[] buffer = new byte[CHUNK_SIZE];
        long transferred = 0;
        int read;
        while ((read = in.read(buffer)) != -1) {
            out.write(buffer, 0, read);
            transferred += read;
            if (listener != null) {
                listener.onProgress(transferred, totalBytes);
            }
        }
        return transferred;
    }
}
