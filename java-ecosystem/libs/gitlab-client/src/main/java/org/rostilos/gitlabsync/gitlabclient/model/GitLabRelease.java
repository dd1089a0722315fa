package org.rostilos.gitlabsync.gitlabclient.model;

/**
 * A project release, identified by its tag.
 */
public record GitLabRelease(
        String name,
        String tagName,
        String description,

        /**
         * ISO-8601 timestamp, as GitLab reports it.
         */
        String releasedAt
) {}
