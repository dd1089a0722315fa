package org.rostilos.gitlabsync.engine.fetch;

import org.rostilos.gitlabsync.gitlabclient.model.GitLabPage;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * One paginated listing call.
 */
@FunctionalInterface
interface PageFetcher<T> {

    GitLabPage<T> fetch(int page) throws IOException;

    /**
     * Walk every page from the first one until the current page reaches the total page count.
     * Items of the pages read before a failure have already been handed to the sink.
     */
    static <T> void forEachItem(PageFetcher<T> fetcher, Consumer<T> sink) throws IOException {
        int page = 1;
        while (true) {
            GitLabPage<T> result = fetcher.fetch(page);
            result.items().forEach(sink);
            if (result.isLastPage() || result.items().isEmpty()) {
                return;
            }
            page = result.nextPage();
        }
    }
}
