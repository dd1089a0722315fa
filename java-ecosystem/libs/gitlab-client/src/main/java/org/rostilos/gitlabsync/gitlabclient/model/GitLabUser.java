package org.rostilos.gitlabsync.gitlabclient.model;

/**
 * The user a GitLab access token authenticates as.
 */
public record GitLabUser(
        long id,
        String username,
        String name
) {}
