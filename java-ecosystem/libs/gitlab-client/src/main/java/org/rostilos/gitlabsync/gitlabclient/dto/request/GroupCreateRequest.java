package org.rostilos.gitlabsync.gitlabclient.dto.request;

import org.rostilos.gitlabsync.gitlabclient.model.Visibility;

/**
 * Body of {@code POST /groups}.
 */
public record GroupCreateRequest(
        String name,
        String path,
        String description,
        Visibility visibility,
        String defaultBranch,

        /**
         * Parent group id, null to create a top-level group.
         */
        Long parentId
) {}
