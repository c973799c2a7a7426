package org.truetranslation.sword.core.transport;

import java.time.Duration;

/**
 * Settings for {@link RepositoryClient}. Zero or blank values fall back to
 * the defaults.
 */
public final class ClientOptions {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(1);
    public static final String DEFAULT_USER_AGENT = "sword-cli-java/1.0";

    private final Duration timeout;
    private final int maxRetries;
    private final Duration retryDelay;
    private final String userAgent;

    public ClientOptions(Duration timeout, int maxRetries, Duration retryDelay, String userAgent) {
        this.timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? DEFAULT_TIMEOUT : timeout;
        this.maxRetries = Math.max(0, maxRetries);
        this.retryDelay = retryDelay == null || retryDelay.isNegative() ? DEFAULT_RETRY_DELAY : retryDelay;
        this.userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
    }

    public static ClientOptions defaults() {
        return new ClientOptions(DEFAULT_TIMEOUT, DEFAULT_MAX_RETRIES, DEFAULT_RETRY_DELAY, DEFAULT_USER_AGENT);
    }

    public Duration getTimeout() { return timeout; }
    public int getMaxRetries() { return maxRetries; }
    public Duration getRetryDelay() { return retryDelay; }
    public String getUserAgent() { return userAgent; }

    public ClientOptions withRetryDelay(Duration delay) {
        return new ClientOptions(timeout, maxRetries, delay, userAgent);
    }

    public ClientOptions withMaxRetries(int retries) {
        return new ClientOptions(timeout, retries, retryDelay, userAgent);
    }
}
