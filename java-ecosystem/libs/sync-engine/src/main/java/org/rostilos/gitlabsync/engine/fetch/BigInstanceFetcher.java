package org.rostilos.gitlabsync.engine.fetch;

import org.rostilos.gitlabsync.engine.error.MirrorException;
import org.rostilos.gitlabsync.engine.error.SyncErrors;
import org.rostilos.gitlabsync.engine.instance.GitLabInstance;
import org.rostilos.gitlabsync.engine.instance.GroupRef;
import org.rostilos.gitlabsync.engine.mapping.MappingPaths;
import org.rostilos.gitlabsync.engine.mapping.MirrorMapping;
import org.rostilos.gitlabsync.engine.mapping.PathFilters;
import org.rostilos.gitlabsync.gitlabclient.model.GitLabGroup;
import org.rostilos.gitlabsync.gitlabclient.model.GitLabProject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fetch strategy for instances too large to list in full.
 * <p>
 * Declared projects are fetched one by one. Declared groups are walked recursively: each visited group
 * spawns one unit for its projects and one unit per subgroup. A unit never waits for the units it spawns;
 * every unit is counted before it is submitted and uncounted when it ends, and the pass waits once for
 * the count to drop to zero. The count is unbounded, so any number of units may be queued at once.
 * <p>
 * On the destination the walk only descends below declared destination groups; project namespaces
 * are fetched alone.
 */
public class BigInstanceFetcher extends AbstractInstanceFetcher {

    private static final Logger log = LoggerFactory.getLogger(BigInstanceFetcher.class);

    private final Executor workers;

    public BigInstanceFetcher(Executor workers) {
        this.workers = workers;
    }

    @Override
    public SyncErrors fetchProjects(GitLabInstance instance, PathFilters filters, MirrorMapping mapping) {
        LinkedBlockingQueue<Throwable> errors = new LinkedBlockingQueue<>();
        CompletableFuture<?>[] futures = filters.projects(instance.getRole()).stream()
                .map(path -> CompletableFuture.runAsync(() -> {
                    try {
                        fetchProject(instance, path, filters, mapping);
                    } catch (RuntimeException e) {
                        errors.add(e);
                    }
                }, workers))
                .toArray(CompletableFuture[]::new);
        CompletableFuture.allOf(futures).join();
        return SyncErrors.drain(errors);
    }

    private void fetchProject(GitLabInstance instance, String path, PathFilters filters, MirrorMapping mapping) {
        GitLabProject project;
        try {
            project = instance.getApi().getProject(path);
        } catch (IOException e) {
            throw MirrorException.nonBlocking("Failed to retrieve project " + path + " from "
                    + roleName(instance) + " instance", e);
        }
        if (project == null) {
            if (instance.isSource()) {
                throw MirrorException.nonBlocking("project " + path + " not found on source instance");
            }
            log.debug("Project {} does not exist on destination instance yet", path);
            return;
        }
        storeProject(instance, project, filters.matchProject(instance.getRole(), path), mapping);
    }

    @Override
    public SyncErrors fetchGroups(GitLabInstance instance, PathFilters filters, MirrorMapping mapping) {
        Walk walk = new Walk(instance, filters, mapping);
        for (String root : roots(instance, filters)) {
            walk.spawn(() -> walk.visit(new GroupRef.ByPath(root)));
        }
        walk.awaitCompletion();
        log.info("Walked {} group(s) and {} project(s) on {} instance", instance.groupsSnapshot().size(),
                instance.projectsSnapshot().size(), roleName(instance));
        return SyncErrors.drain(walk.errors);
    }

    /**
     * Declared groups not already reached by walking one of their declared ancestors.
     */
    private Set<String> roots(GitLabInstance instance, PathFilters filters) {
        Set<String> groups = filters.groups(instance.getRole());
        Set<String> roots = new TreeSet<>();
        for (String path : groups) {
            boolean covered = false;
            String ancestor = MappingPaths.parentOf(path);
            while (!ancestor.isEmpty() && !covered) {
                covered = groups.contains(ancestor) && descends(instance, filters, ancestor);
                ancestor = MappingPaths.parentOf(ancestor);
            }
            if (!covered) {
                roots.add(path);
            }
        }
        return roots;
    }

    private static boolean descends(GitLabInstance instance, PathFilters filters, String path) {
        return instance.isSource() || filters.isUnderMappedDestinationGroup(path);
    }

    private final class Walk {
        private final GitLabInstance instance;
        private final PathFilters filters;
        private final MirrorMapping mapping;
        // starts at one for the coordinator, released in awaitCompletion
        private final AtomicLong outstanding = new AtomicLong(1);
        private final CompletableFuture<Void> completion = new CompletableFuture<>();
        private final LinkedBlockingQueue<Throwable> errors = new LinkedBlockingQueue<>();

        Walk(GitLabInstance instance, PathFilters filters, MirrorMapping mapping) {
            this.instance = instance;
            this.filters = filters;
            this.mapping = mapping;
        }

        void spawn(Runnable unit) {
            outstanding.incrementAndGet();
            try {
                workers.execute(() -> {
                    try {
                        unit.run();
                    } catch (RuntimeException e) {
                        errors.add(e);
                    } finally {
                        release();
                    }
                });
            } catch (RejectedExecutionException e) {
                errors.add(MirrorException.nonBlocking("Group walk unit rejected by the worker pool", e));
                release();
            }
        }

        void awaitCompletion() {
            release();
            completion.join();
        }

        private void release() {
            if (outstanding.decrementAndGet() == 0) {
                completion.complete(null);
            }
        }

        void visit(GroupRef ref) {
            GitLabGroup group = resolve(ref);
            if (group == null) {
                return;
            }
            storeGroup(instance, group, filters.matchGroup(instance.getRole(), group.fullPath()), mapping);
            if (!descends(instance, filters, group.fullPath())) {
                return;
            }
            spawn(() -> listProjects(group));
            spawn(() -> listSubgroups(group));
        }

        private GitLabGroup resolve(GroupRef ref) {
            if (ref instanceof GroupRef.Resolved resolved) {
                return resolved.group();
            }
            String idOrPath = ref instanceof GroupRef.ById byId
                    ? String.valueOf(byId.id())
                    : ((GroupRef.ByPath) ref).path();
            GitLabGroup group;
            try {
                group = instance.getApi().getGroup(idOrPath);
            } catch (IOException e) {
                throw MirrorException.nonBlocking("Failed to retrieve group " + ref.describe() + " from "
                        + roleName(instance) + " instance", e);
            }
            if (group == null) {
                if (instance.isSource()) {
                    throw MirrorException.nonBlocking("group " + ref.describe() + " not found on source instance");
                }
                log.debug("Group {} does not exist on destination instance yet", ref.describe());
            }
            return group;
        }

        private void listProjects(GitLabGroup group) {
            try {
                PageFetcher.forEachItem(page -> instance.getApi().listGroupProjects(group.id(), page), project ->
                        storeProject(instance, project,
                                filters.matchProject(instance.getRole(), project.pathWithNamespace()), mapping));
            } catch (IOException e) {
                throw MirrorException.nonBlocking("Failed to list projects of group " + group.fullPath() + " on "
                        + roleName(instance) + " instance", e);
            }
        }

        private void listSubgroups(GitLabGroup group) {
            try {
                PageFetcher.forEachItem(page -> instance.getApi().listSubgroups(group.id(), page),
                        subgroup -> spawn(() -> visit(new GroupRef.Resolved(subgroup))));
            } catch (IOException e) {
                throw MirrorException.nonBlocking("Failed to list subgroups of group " + group.fullPath() + " on "
                        + roleName(instance) + " instance", e);
            }
        }
    }
}
