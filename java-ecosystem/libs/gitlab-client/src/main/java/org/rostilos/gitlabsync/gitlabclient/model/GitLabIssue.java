package org.rostilos.gitlabsync.gitlabclient.model;

import java.util.List;

/**
 * A project issue with the fields that are copied between instances.
 */
public record GitLabIssue(
        /**
         * Project-scoped issue number.
         */
        long iid,

        String title,
        String description,
        List<String> labels,
        boolean confidential,
        String dueDate,
        Integer weight,
        String issueType,
        String createdAt,

        /**
         * "opened" or "closed".
         */
        String state
) {
    public GitLabIssue {
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    public boolean isClosed() {
        return "closed".equals(state);
    }
}
