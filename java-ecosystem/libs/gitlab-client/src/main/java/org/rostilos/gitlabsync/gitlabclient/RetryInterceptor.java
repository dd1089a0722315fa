package org.rostilos.gitlabsync.gitlabclient;

import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;

/**
 * Retries calls that fail on the connection, are rate limited (429) or hit a server error (5xx),
 * with exponential backoff. A numeric Retry-After header takes precedence over the computed delay.
 */
public class RetryInterceptor implements Interceptor {

    private static final Logger log = LoggerFactory.getLogger(RetryInterceptor.class);

    private static final long INITIAL_BACKOFF_MILLIS = 500;
    private static final long MAX_BACKOFF_MILLIS = 30_000;

    private final int maxRetries;
    private final long initialBackoffMillis;

    public RetryInterceptor(int maxRetries) {
        this(maxRetries, INITIAL_BACKOFF_MILLIS);
    }

    RetryInterceptor(int maxRetries, long initialBackoffMillis) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.maxRetries = maxRetries;
        this.initialBackoffMillis = initialBackoffMillis;
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        Request request = chain.request();
        int attempt = 0;
        while (true) {
            Response response;
            try {
                response = chain.proceed(request);
            } catch (IOException e) {
                if (attempt >= maxRetries) {
                    throw e;
                }
                log.debug("{} {} failed: {}, retrying ({}/{})", request.method(), request.url(), e.getMessage(),
                        attempt + 1, maxRetries);
                sleep(backoff(attempt));
                attempt++;
                continue;
            }

            if (!isRetryable(response.code()) || attempt >= maxRetries) {
                return response;
            }

            long delay = retryAfterMillis(response);
            if (delay < 0) {
                delay = backoff(attempt);
            }
            log.debug("{} {} returned {}, retrying in {} ms ({}/{})", request.method(), request.url(),
                    response.code(), delay, attempt + 1, maxRetries);
            response.close();
            sleep(delay);
            attempt++;
        }
    }

    static boolean isRetryable(int code) {
        return code == 429 || code >= 500;
    }

    private long backoff(int attempt) {
        long delay = initialBackoffMillis << Math.min(attempt, 16);
        return Math.min(delay, MAX_BACKOFF_MILLIS);
    }

    private long retryAfterMillis(Response response) {
        String retryAfter = response.header("Retry-After");
        if (retryAfter == null || retryAfter.isBlank()) {
            return -1;
        }
        try {
            return Math.min(Long.parseLong(retryAfter.trim()) * 1000, MAX_BACKOFF_MILLIS);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private void sleep(long millis) throws IOException {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting to retry");
        }
    }
}
