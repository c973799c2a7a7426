package org.truetranslation.sword.core.transport;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.truetranslation.sword.testutil.TestRepositoryServer;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RepositoryClientTest {

    private static final byte[] PAYLOAD = "module bytes".getBytes(StandardCharsets.UTF_8);

    private TestRepositoryServer server;
    private RepositoryClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = TestRepositoryServer.start();
        client = new RepositoryClient(new ClientOptions(Duration.ofSeconds(5), 3, Duration.ZERO, null));
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    void download_shouldReturnBody() throws IOException {
        server.serve("/file.zip", PAYLOAD);

        assertThat(client.download(CancellationToken.create(), server.url("/file.zip"))).isEqualTo(PAYLOAD);
    }

    @Test
    void download_shouldRetryServerErrorsUntilSuccess() throws IOException {
        server.serve("/file.zip", PAYLOAD);
        server.script("/file.zip", 503, 503, 200);

        byte[] data = client.download(CancellationToken.create(), server.url("/file.zip"));

        assertThat(data).isEqualTo(PAYLOAD);
        assertThat(server.hits("/file.zip")).isEqualTo(3);
    }

    @Test
    void download_shouldFollowRedirects() throws IOException {
        server.serve("/mirror/file.zip", PAYLOAD);
        server.redirect("/file.zip", "/mirror/file.zip");

        assertThat(client.download(CancellationToken.create(), server.url("/file.zip"))).isEqualTo(PAYLOAD);
    }

    @Test
    void download_shouldRejectRedirectToNonHttpScheme() {
        server.redirect("/file.zip", "ftp://127.0.0.1/pub/KJV.zip");

        assertThatThrownBy(() -> client.download(CancellationToken.create(), server.url("/file.zip")))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("unsupported redirect")
            .hasMessageContaining("ftp://127.0.0.1/pub/KJV.zip");
    }

    @Test
    void download_shouldNotRetryClientErrors() {
        assertThatThrownBy(() -> client.download(CancellationToken.create(), server.url("/missing.zip")))
            .isInstanceOfSatisfying(HttpStatusException.class, e -> assertThat(e.getStatusCode()).isEqualTo(404));

        assertThat(server.hits("/missing.zip")).isEqualTo(1);
    }

    @Test
    void download_shouldGiveUpAfterMaxRetries() {
        server.script("/flaky.zip", 500, 500, 500, 500, 500, 500);

        assertThatThrownBy(() -> client.download(CancellationToken.create(), server.url("/flaky.zip")))
            .isInstanceOfSatisfying(HttpStatusException.class, e -> assertThat(e.getStatusCode()).isEqualTo(500))
            .hasMessageStartingWith("HTTP error: 500");

        assertThat(server.hits("/flaky.zip")).isEqualTo(4);
    }

    @Test
    void download_shouldRejectUnsupportedUrlsWithoutContactingServer() {
        assertThatThrownBy(() -> client.download(CancellationToken.create(), ""))
            .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> client.download(CancellationToken.create(), "file:///etc/passwd"))
            .isInstanceOf(IOException.class).hasMessageContaining("unsupported");
    }

    @Test
    void download_shouldStopWaitingWhenCancelledDuringBackoff() {
        RepositoryClient slowRetry = new RepositoryClient(
            new ClientOptions(Duration.ofSeconds(5), 3, Duration.ofSeconds(30), null));
        server.script("/busy.zip", 503, 503, 503, 503);
        CancellationToken token = CancellationToken.create();
        ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
        scheduler.schedule(token::cancel, 300, TimeUnit.MILLISECONDS);

        long start = System.nanoTime();
        try {
            assertThatThrownBy(() -> slowRetry.download(token, server.url("/busy.zip")))
                .isInstanceOf(CancellationException.class);
        } finally {
            scheduler.shutdownNow();
        }

        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(10));
        assertThat(server.hits("/busy.zip")).isEqualTo(1);
    }

    @Test
    void download_shouldFailImmediatelyWithCancelledToken() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        server.serve("/file.zip", PAYLOAD);

        assertThatThrownBy(() -> client.download(token, server.url("/file.zip")))
            .isInstanceOf(CancellationException.class);
        assertThat(server.hits("/file.zip")).isZero();
    }

    @Test
    void downloadWithProgress_shouldReportRunningTotals() throws IOException {
        byte[] big = new byte[100 * 1024];
        server.serve("/big.zip", big);
        List<long[]> reports = new ArrayList<>();

        byte[] data = client.downloadWithProgress(CancellationToken.create(), server.url("/big.zip"),
            (read, total) -> reports.add(new long[] {read, total}));

        assertThat(data).hasSize(big.length);
        assertThat(reports).isNotEmpty();
        assertThat(reports.get(reports.size() - 1)).containsExactly(big.length, big.length);
    }

    @Test
    void downloadToFile_shouldCreateParentsAndLeaveNoTempFile(@TempDir Path dir) throws IOException {
        server.serve("/file.zip", PAYLOAD);
        Path dest = dir.resolve("cache/nested/file.zip");

        client.downloadToFile(CancellationToken.create(), server.url("/file.zip"), dest, null);

        assertThat(dest).hasBinaryContent(PAYLOAD);
        assertThat(dest.resolveSibling("file.zip.tmp")).doesNotExist();
    }

    @Test
    void downloadToFile_shouldNotCreateTargetOnFailure(@TempDir Path dir) {
        Path dest = dir.resolve("file.zip");

        assertThatThrownBy(() -> client.downloadToFile(CancellationToken.create(), server.url("/nope.zip"), dest, null))
            .isInstanceOf(HttpStatusException.class);
        assertThat(dest).doesNotExist();
        assertThat(dir.resolve("file.zip.tmp")).doesNotExist();
    }

    @Test
    void listDirectory_shouldDropParentAndAbsoluteLinks() throws IOException {
        String page = "<html><body>"
            + "<a href=\"../\">Parent</a>"
            + "<a href=\"/icons/\">icons</a>"
            + "<a href=\"https://elsewhere.example/\">x</a>"
            + "<a href=\"KJV.zip\">KJV.zip</a>"
            + "<a href=\"rawzip/\">rawzip/</a>"
            + "</body></html>";
        server.serve("/sword/", page.getBytes(StandardCharsets.UTF_8));

        assertThat(client.listDirectory(CancellationToken.create(), server.url("/sword/")))
            .containsExactly("KJV.zip", "rawzip/");
    }

    @Test
    void isNotFoundError_shouldRecognizeMissingFiles() {
        assertThat(RepositoryClient.isNotFoundError(new HttpStatusException(404, "404 Not Found"))).isTrue();
        assertThat(RepositoryClient.isNotFoundError(new FtpStatusException(550, "No such file"))).isTrue();
        assertThat(RepositoryClient.isNotFoundError(new IOException("wrapped",
            new HttpStatusException(404, "404 Not Found")))).isTrue();
        assertThat(RepositoryClient.isNotFoundError(new FileNotFoundException("file not found"))).isTrue();

        assertThat(RepositoryClient.isNotFoundError(new HttpStatusException(503, "503 Service Unavailable"))).isFalse();
        assertThat(RepositoryClient.isNotFoundError(new IOException("connection reset"))).isFalse();
        assertThat(RepositoryClient.isNotFoundError(null)).isFalse();
    }
}
