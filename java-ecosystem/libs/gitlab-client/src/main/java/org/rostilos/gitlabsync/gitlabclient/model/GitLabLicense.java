package org.rostilos.gitlabsync.gitlabclient.model;

/**
 * Subset of the instance license GitLab exposes through {@code GET /license}.
 */
public record GitLabLicense(
        /**
         * License plan, e.g. "premium" or "ultimate".
         */
        String plan,

        /**
         * Whether the license has expired.
         */
        boolean expired
) {}
