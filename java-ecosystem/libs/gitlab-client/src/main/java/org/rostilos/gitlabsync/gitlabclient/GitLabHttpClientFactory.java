package org.rostilos.gitlabsync.gitlabclient;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Builds authorized OkHttp clients for a GitLab instance.
 */
@Component
public class GitLabHttpClientFactory {

    /**
     * Create an OkHttpClient that sends the given access token on every call and retries transient failures.
     *
     * @param accessToken personal, group or project access token; blank for anonymous access to public resources
     * @param timeout connect, read and write timeout
     * @param maxRetries number of retries after the first attempt
     * @return configured OkHttpClient
     */
    public OkHttpClient createClient(String accessToken, Duration timeout, int maxRetries) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive");
        }

        OkHttpClient.Builder builder = new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .retryOnConnectionFailure(false);
        if (accessToken != null && !accessToken.isBlank()) {
            builder.addInterceptor(chain -> {
                Request original = chain.request();
                Request authorized = original.newBuilder()
                        .header("Authorization", "Bearer " + accessToken)
                        .build();
                return chain.proceed(authorized);
            });
        }
        return builder
                .addInterceptor(new RetryInterceptor(maxRetries))
                .build();
    }

    /**
     * Create a client and wrap it into a {@link GitLabClient} for the given instance.
     */
    public GitLabClient createGitLabClient(String instanceUrl, String accessToken, Duration timeout, int maxRetries) {
        return new GitLabClient(createClient(accessToken, timeout, maxRetries), instanceUrl);
    }
}
