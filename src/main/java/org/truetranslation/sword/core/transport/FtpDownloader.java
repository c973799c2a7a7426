package org.truetranslation.sword.core.transport;

import org.apache.commons.net.ftp.FTP;
import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPReply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Supplier;

/**
 * Anonymous FTP retrieval on top of Apache Commons Net. Every call opens
 * its own control connection and closes it before returning.
 */
public class FtpDownloader {
    private static final Logger LOG = LoggerFactory.getLogger(FtpDownloader.class);

    static final String ANONYMOUS_USER = "anonymous";
    static final String ANONYMOUS_PASSWORD = "anonymous@";
    private static final int SIZE_REPLY = 213;

    private final ClientOptions options;
    private final Supplier<FTPClient> clientFactory;

    public FtpDownloader(ClientOptions options) {
        this(options, FTPClient::new);
    }

    public FtpDownloader(ClientOptions options, Supplier<FTPClient> clientFactory) {
        this.options = options;
        this.clientFactory = clientFactory;
    }

    public byte[] download(URI uri, DownloadProgressListener listener) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        retrieve(uri, out, listener);
        return out.toByteArray();
    }

    /**
     * Streams one remote file into {@code out}.
     *
     * @throws FtpStatusException on a negative server reply, 550 when the file is missing
     */
    public void retrieve(URI uri, OutputStream out, DownloadProgressListener listener) throws IOException {
        FTPClient ftp = clientFactory.get();
        try {
            open(ftp, uri);
            String path = uri.getPath();

            long size = -1;
            if (listener != null && ftp.sendCommand("SIZE", path) == SIZE_REPLY) {
                size = parseSize(ftp.getReplyString());
            }

            InputStream in = ftp.retrieveFileStream(path);
            if (in == null) {
                throw new FtpStatusException(ftp.getReplyCode(), replyText(ftp));
            }
            try (InputStream data = in) {
                long copied = Transfers.copy(data, out, size, listener);
                LOG.debug("Retrieved {} bytes from {}", copied, uri);
            }
            if (!ftp.completePendingCommand()) {
                throw new FtpStatusException(ftp.getReplyCode(), replyText(ftp));
            }
        } finally {
            close(ftp);
        }
    }

    /** Names in a remote directory, as returned by {@code NLST}. */
    public List<String> listNames(URI uri) throws IOException {
        FTPClient ftp = clientFactory.get();
        try {
            open(ftp, uri);
            String[] names = ftp.listNames(uri.getPath());
            if (names == null) {
                throw new FtpStatusException(ftp.getReplyCode(), replyText(ftp));
            }
            return new ArrayList<>(Arrays.asList(names));
        } finally {
            close(ftp);
        }
    }

    private void open(FTPClient ftp, URI uri) throws IOException {
        int timeoutMs = (int) options.getTimeout().toMillis();
        ftp.setConnectTimeout(timeoutMs);
        ftp.setDefaultTimeout(timeoutMs);
        ftp.setDataTimeout(options.getTimeout());

        int port = uri.getPort() > 0 ? uri.getPort() : FTP.DEFAULT_PORT;
        LOG.debug("Connecting to {}:{}", uri.getHost(), port);
        ftp.connect(uri.getHost(), port);
        if (!FTPReply.isPositiveCompletion(ftp.getReplyCode())) {
            throw new FtpStatusException(ftp.getReplyCode(), "connection refused by " + uri.getHost());
        }
        if (!ftp.login(ANONYMOUS_USER, ANONYMOUS_PASSWORD)) {
            throw new FtpStatusException(ftp.getReplyCode(), "anonymous login rejected");
        }
        ftp.enterLocalPassiveMode();
        if (!ftp.setFileType(FTP.BINARY_FILE_TYPE)) {
            throw new FtpStatusException(ftp.getReplyCode(), "cannot switch to binary mode");
        }
    }

    private void close(FTPClient ftp) {
        if (!ftp.isConnected()) {
            return;
        }
        try {
            ftp.logout();
        } catch (IOException e) {
            LOG.debug("FTP logout failed: {}", e.getMessage());
        }
        try {
            ftp.disconnect();
        } catch (IOException e) {
            LOG.debug("FTP disconnect failed: {}", e.getMessage());
        }
    }

    private static String replyText(FTPClient ftp) {
        String reply = ftp.getReplyString();
        return reply == null ? "no reply" : reply.trim();
    }

    static long parseSize(String reply) {
        if (reply == null) {
            return -1;
        }
        String text = reply.trim();
        if (text.length() > 4) {
            text = text.substring(4).trim();
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
