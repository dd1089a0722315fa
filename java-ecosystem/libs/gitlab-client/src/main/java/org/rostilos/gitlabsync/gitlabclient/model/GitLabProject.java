package org.rostilos.gitlabsync.gitlabclient.model;

import java.util.List;

/**
 * A GitLab project as returned by the projects API.
 */
public record GitLabProject(
        long id,
        String name,
        String path,

        /**
         * Full path including the namespace, e.g. "group/subgroup/project".
         */
        String pathWithNamespace,

        String description,
        Visibility visibility,
        String defaultBranch,
        List<String> topics,
        String avatarUrl,

        /**
         * HTTP(S) clone URL of the repository.
         */
        String httpUrlToRepo,

        /**
         * Numeric id of the namespace (group or user) holding the project.
         */
        Long namespaceId,

        boolean archived,
        boolean mirror,
        boolean mirrorTriggerBuilds,
        boolean mirrorOverwritesDivergedBranches
) {
    public GitLabProject {
        topics = topics == null ? List.of() : List.copyOf(topics);
    }

    public boolean hasAvatar() {
        return avatarUrl != null && !avatarUrl.isBlank();
    }
}
