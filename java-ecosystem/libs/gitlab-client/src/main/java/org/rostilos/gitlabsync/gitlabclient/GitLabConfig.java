package org.rostilos.gitlabsync.gitlabclient;

/**
 * Configuration constants for GitLab API access.
 */
public final class GitLabConfig {

    public static final String API_PATH = "/api/v4";
    public static final String GRAPHQL_PATH = "/api/graphql";
    public static final int DEFAULT_PAGE_SIZE = 100;

    /** Access level GitLab assigns to group and project owners. */
    public static final int OWNER_ACCESS_LEVEL = 50;

    public static final int DEFAULT_TIMEOUT_SECONDS = 30;
    public static final int DEFAULT_MAX_RETRIES = 3;

    private GitLabConfig() {
        // Utility class
    }
}
