package org.truetranslation.sword.core.transport;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CancellationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CancellationTokenTest {

    @Test
    void cancel_shouldBeObservable() {
        CancellationToken token = CancellationToken.create();
        assertThat(token.isCancelled()).isFalse();
        assertThatCode(token::throwIfCancelled).doesNotThrowAnyException();

        token.cancel();

        assertThat(token.isCancelled()).isTrue();
        assertThatThrownBy(token::throwIfCancelled).isInstanceOf(CancellationException.class);
    }

    @Test
    void withTimeout_shouldCancelOnceDeadlinePasses() throws Exception {
        CancellationToken token = CancellationToken.withTimeout(Duration.ofMillis(50));

        Thread.sleep(120);

        assertThat(token.isCancelled()).isTrue();
    }

    @Test
    void sleep_shouldWaitTheFullDelayWhenNotCancelled() throws IOException {
        CancellationToken token = CancellationToken.create();
        long start = System.nanoTime();

        token.sleep(Duration.ofMillis(100));

        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(90));
    }

    @Test
    void sleep_shouldEndAtDeadline() {
        CancellationToken token = CancellationToken.withTimeout(Duration.ofMillis(100));
        long start = System.nanoTime();

        assertThatThrownBy(() -> token.sleep(Duration.ofSeconds(30))).isInstanceOf(CancellationException.class);
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
    }
}
