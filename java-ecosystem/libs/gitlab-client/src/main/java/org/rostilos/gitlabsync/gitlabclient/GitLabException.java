package org.rostilos.gitlabsync.gitlabclient;

/**
 * A non-2xx answer of the GitLab API. The client hands it to callers as the cause of an {@link java.io.IOException}.
 */
public class GitLabException extends RuntimeException {

    private final int statusCode;
    private final String responseBody;

    public GitLabException(String operation, int statusCode, String responseBody) {
        super(String.format("GitLab %s failed: %d - %s", operation, statusCode, responseBody));
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getResponseBody() {
        return responseBody;
    }

    public boolean isNotFound() {
        return statusCode == 404;
    }

    public boolean isConflict() {
        return statusCode == 409;
    }
}
