package org.truetranslation.sword.core.transport;

import java.io.IOException;

/**
 * A negative FTP server reply. Code 550 means the file does not exist.
 */
public class FtpStatusException extends IOException {
    private final int replyCode;

    public FtpStatusException(int replyCode, String message) {
        super("FTP error " + replyCode + ": " + message);
        this.replyCode = replyCode;
    }

    public int getReplyCode() { return replyCode; }
}
