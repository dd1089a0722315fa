package org.rostilos.gitlabsync.gitlabclient.dto.request;

import org.rostilos.gitlabsync.gitlabclient.model.Visibility;

import java.util.List;

/**
 * Body of {@code POST /projects}.
 */
public record ProjectCreateRequest(
        String name,
        String path,
        String description,
        Visibility visibility,
        String defaultBranch,
        List<String> topics,

        /**
         * Id of the group the project is created in.
         */
        long namespaceId,

        /**
         * Whether the project is created as a pull mirror.
         */
        boolean mirror,

        boolean mirrorTriggerBuilds
) {
    public ProjectCreateRequest {
        topics = topics == null ? List.of() : List.copyOf(topics);
    }
}
