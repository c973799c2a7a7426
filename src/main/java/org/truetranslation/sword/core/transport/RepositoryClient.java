package org.truetranslation.sword.core.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Downloads files from SWORD repositories over HTTP, HTTPS or anonymous FTP.
 *
 * <p>Plain HTTP downloads are retried up to {@code maxRetries} extra times on
 * server errors and network failures, waiting {@code retryDelay} between
 * attempts. Client errors (4xx) fail at once. FTP downloads and downloads
 * with a progress listener are single attempts.
 *
 * <p>A client holds no per-request state and may be shared between threads.
 */
public class RepositoryClient {
    private static final Logger LOG = LoggerFactory.getLogger(RepositoryClient.class);

    private static final Pattern HREF = Pattern.compile("href=\"([^\"]+)\"");
    private static final int MAX_REDIRECTS = 5;

    private final ClientOptions options;
    private final FtpDownloader ftp;

    public RepositoryClient(ClientOptions options) {
        this(options, new FtpDownloader(options));
    }

    public RepositoryClient(ClientOptions options, FtpDownloader ftp) {
        this.options = Objects.requireNonNull(options, "options");
        this.ftp = Objects.requireNonNull(ftp, "ftp");
    }

    public ClientOptions getOptions() {
        return options;
    }

    public byte[] download(CancellationToken token, String url) throws IOException {
        URI uri = parseUrl(url);
        token.throwIfCancelled();
        if (isFtp(uri)) {
            return ftp.download(uri, null);
        }

        IOException lastError = null;
        for (int attempt = 0; attempt <= options.getMaxRetries(); attempt++) {
            if (attempt > 0) {
                LOG.debug("Retrying {} (attempt {}/{}) after: {}", url, attempt + 1,
                    options.getMaxRetries() + 1, lastError.getMessage());
                token.sleep(options.getRetryDelay());
            }
            token.throwIfCancelled();
            try {
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                httpGet(uri, out, null);
                return out.toByteArray();
            } catch (HttpStatusException e) {
                if (e.isClientError()) {
                    throw e;
                }
                lastError = e;
            } catch (IOException e) {
                lastError = e;
            }
        }
        throw lastError;
    }

    public byte[] downloadWithProgress(CancellationToken token, String url, DownloadProgressListener listener)
            throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        fetch(token, url, out, listener);
        return out.toByteArray();
    }

    /**
     * Streams {@code url} into {@code dest}. The body is written to a
     * {@code .tmp} sibling first and moved into place once complete.
     */
    public void downloadToFile(CancellationToken token, String url, Path dest, DownloadProgressListener listener)
            throws IOException {
        Path parent = dest.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Path temp = dest.resolveSibling(dest.getFileName() + ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(temp)) {
                fetch(token, url, out, listener);
            }
            Files.move(temp, dest, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Lists the entries of a remote directory: link targets of an HTTP index
     * page, or the {@code NLST} names of an FTP directory.
     */
    public List<String> listDirectory(CancellationToken token, String url) throws IOException {
        URI uri = parseUrl(url);
        token.throwIfCancelled();
        if (isFtp(uri)) {
            return ftp.listNames(uri);
        }

        String page = new String(download(token, url), StandardCharsets.UTF_8);
        List<String> entries = new ArrayList<>();
        Matcher m = HREF.matcher(page);
        while (m.find()) {
            String href = m.group(1);
            if (href.equals("../") || href.startsWith("/") || href.startsWith("http")) {
                continue;
            }
            entries.add(href);
        }
        return entries;
    }

    /**
     * Whether a failure means the remote file does not exist, as opposed to a
     * transient or server-side problem.
     */
    public static boolean isNotFoundError(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof HttpStatusException && ((HttpStatusException) t).getStatusCode() == 404) {
                return true;
            }
            if (t instanceof FtpStatusException && ((FtpStatusException) t).getReplyCode() == 550) {
                return true;
            }
            String message = t.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                if (lower.contains("404") || lower.contains("550") || lower.contains("not found")) {
                    return true;
                }
            }
        }
        return false;
    }

    private void fetch(CancellationToken token, String url, OutputStream out, DownloadProgressListener listener)
            throws IOException {
        URI uri = parseUrl(url);
        token.throwIfCancelled();
        if (isFtp(uri)) {
            ftp.retrieve(uri, out, listener);
        } else {
            httpGet(uri, out, listener);
        }
    }

    private void httpGet(URI uri, OutputStream out, DownloadProgressListener listener) throws IOException {
        HttpURLConnection conn = open(uri);
        try (InputStream in = conn.getInputStream()) {
            long copied = Transfers.copy(in, out, conn.getContentLengthLong(), listener);
            LOG.debug("Downloaded {} bytes from {}", copied, uri);
        } finally {
            conn.disconnect();
        }
    }

    // HttpURLConnection will not follow a redirect that switches between http and https.
    private HttpURLConnection open(URI uri) throws IOException {
        URI current = uri;
        for (int hop = 0; ; hop++) {
            HttpURLConnection conn = (HttpURLConnection) current.toURL().openConnection();
            conn.setRequestProperty("User-Agent", options.getUserAgent());
            conn.setConnectTimeout((int) options.getTimeout().toMillis());
            conn.setReadTimeout((int) options.getTimeout().toMillis());
            conn.setInstanceFollowRedirects(true);

            int code = conn.getResponseCode();
            if (isRedirect(code) && hop < MAX_REDIRECTS) {
                String location = conn.getHeaderField("Location");
                conn.disconnect();
                if (location == null) {
                    throw new HttpStatusException(code, code + " redirect without Location");
                }
                current = current.resolve(location);
                if (!isHttp(current)) {
                    throw new IOException("unsupported redirect from " + uri + " to " + current);
                }
                LOG.debug("Following redirect to {}", current);
                continue;
            }
            if (code >= 400) {
                String message = conn.getResponseMessage();
                conn.disconnect();
                throw new HttpStatusException(code, message == null ? String.valueOf(code) : code + " " + message);
            }
            return conn;
        }
    }

    private static boolean isRedirect(int code) {
        return code == 301 || code == 302 || code == 303 || code == 307 || code == 308;
    }

    private static boolean isHttp(URI uri) {
        return "http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme());
    }

    private static boolean isFtp(URI uri) {
        return "ftp".equalsIgnoreCase(uri.getScheme());
    }

    private static URI parseUrl(String url) throws IOException {
        if (url == null || url.isEmpty()) {
            throw new IOException("URL cannot be empty");
        }
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new IOException("invalid URL: " + url, e);
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https") && !scheme.equals("ftp")) {
            throw new IOException("unsupported URL scheme: " + url);
        }
        if (uri.getHost() == null) {
            throw new IOException("URL has no host: " + url);
        }
        return uri;
    }
}
