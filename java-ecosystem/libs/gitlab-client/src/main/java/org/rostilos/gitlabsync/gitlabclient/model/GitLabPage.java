package org.rostilos.gitlabsync.gitlabclient.model;

import java.util.List;

/**
 * One page of a paginated GitLab listing.
 */
public record GitLabPage<T>(
        /**
         * Items on this page.
         */
        List<T> items,

        /**
         * Current page number (1-based).
         */
        int currentPage,

        /**
         * Total number of pages; equals currentPage when GitLab does not report it and there is no next page.
         */
        int totalPages
) {
    public GitLabPage {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public boolean isLastPage() {
        return currentPage >= totalPages;
    }

    public int nextPage() {
        return currentPage + 1;
    }

    public static <T> GitLabPage<T> empty() {
        return new GitLabPage<>(List.of(), 1, 1);
    }
}
