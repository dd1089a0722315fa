package org.rostilos.gitlabsync.engine.fetch;

import org.rostilos.gitlabsync.engine.error.MirrorException;
import org.rostilos.gitlabsync.engine.error.SyncErrors;
import org.rostilos.gitlabsync.engine.instance.GitLabInstance;
import org.rostilos.gitlabsync.engine.mapping.MirrorMapping;
import org.rostilos.gitlabsync.engine.mapping.PathFilters;
import org.rostilos.gitlabsync.engine.mapping.PathFilters.PathMatch;
import org.rostilos.gitlabsync.gitlabclient.model.GitLabGroup;
import org.rostilos.gitlabsync.gitlabclient.model.GitLabProject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.Consumer;

/**
 * Lists every group and every project of the instance, then keeps the ones the filters select.
 * Matching and storing runs as one unit per listed item on the worker pool.
 */
public class SmallInstanceFetcher extends AbstractInstanceFetcher {

    private static final Logger log = LoggerFactory.getLogger(SmallInstanceFetcher.class);

    private final Executor workers;

    public SmallInstanceFetcher(Executor workers) {
        this.workers = workers;
    }

    @Override
    public SyncErrors fetchGroups(GitLabInstance instance, PathFilters filters, MirrorMapping mapping) {
        List<GitLabGroup> listed = new ArrayList<>();
        SyncErrors listingErrors = listAll(instance, "groups", instance.getApi()::listGroups, listed);
        if (listingErrors.hasBlocking()) {
            return listingErrors;
        }
        SyncErrors matchErrors = fanOut(listed, group -> {
            PathMatch match = filters.matchGroup(instance.getRole(), group.fullPath());
            if (match.matched()) {
                storeGroup(instance, group, match, mapping);
            }
        });
        log.info("Fetched {} matching group(s) out of {} on {} instance", instance.groupsSnapshot().size(),
                listed.size(), roleName(instance));
        return listingErrors.and(matchErrors);
    }

    @Override
    public SyncErrors fetchProjects(GitLabInstance instance, PathFilters filters, MirrorMapping mapping) {
        List<GitLabProject> listed = new ArrayList<>();
        SyncErrors listingErrors = listAll(instance, "projects", instance.getApi()::listProjects, listed);
        if (listingErrors.hasBlocking()) {
            return listingErrors;
        }
        SyncErrors matchErrors = fanOut(listed, project -> {
            PathMatch match = filters.matchProject(instance.getRole(), project.pathWithNamespace());
            if (match.matched()) {
                storeProject(instance, project, match, mapping);
            }
        });
        log.info("Fetched {} matching project(s) out of {} on {} instance", instance.projectsSnapshot().size(),
                listed.size(), roleName(instance));
        return listingErrors.and(matchErrors);
    }

    /**
     * A listing that fails before returning anything is blocking. A listing that fails part way keeps
     * the items already read and reports a non-blocking error.
     */
    private <T> SyncErrors listAll(GitLabInstance instance, String what, PageFetcher<T> fetcher, List<T> target) {
        try {
            PageFetcher.forEachItem(fetcher, target::add);
            return SyncErrors.NONE;
        } catch (IOException | RuntimeException e) {
            String message = "Failed to list " + what + " on " + roleName(instance) + " instance " + instance.getUrl();
            if (target.isEmpty()) {
                return SyncErrors.of(MirrorException.blocking(message, e));
            }
            log.warn("{} after {} item(s), continuing with a partial list: {}", message, target.size(), e.getMessage());
            return SyncErrors.of(MirrorException.nonBlocking(message + " (partial list of " + target.size()
                    + " item(s) used)", e));
        }
    }

    private <T> SyncErrors fanOut(List<T> items, Consumer<T> unit) {
        LinkedBlockingQueue<Throwable> errors = new LinkedBlockingQueue<>();
        CompletableFuture<?>[] futures = items.stream()
                .map(item -> CompletableFuture.runAsync(() -> {
                    try {
                        unit.accept(item);
                    } catch (RuntimeException e) {
                        errors.add(e);
                    }
                }, workers))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(futures).join();
        return SyncErrors.drain(errors);
    }
}
