package org.rostilos.gitlabsync.gitlabclient.model;

/**
 * A GitLab group as returned by the groups API.
 */
public record GitLabGroup(
        long id,
        String name,
        String path,

        /**
         * Full path including every ancestor group, e.g. "parent/child".
         */
        String fullPath,

        String description,
        Visibility visibility,
        String defaultBranch,
        String avatarUrl,

        /**
         * Numeric id of the parent group, null for top-level groups.
         */
        Long parentId
) {
    public boolean hasAvatar() {
        return avatarUrl != null && !avatarUrl.isBlank();
    }
}
