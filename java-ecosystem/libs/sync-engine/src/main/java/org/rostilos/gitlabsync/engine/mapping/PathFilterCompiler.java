package org.rostilos.gitlabsync.engine.mapping;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Compiles the declared mapping into {@link PathFilters}. The group half and the project half are compiled
 * concurrently; the destination group set is the only one both halves write.
 */
public class PathFilterCompiler {

    private static final Logger log = LoggerFactory.getLogger(PathFilterCompiler.class);

    private final Executor executor;

    public PathFilterCompiler(Executor executor) {
        this.executor = executor;
    }

    public PathFilters compile(MirrorMapping mapping) {
        Set<String> sourceProjects = new HashSet<>();
        Set<String> sourceGroups = new HashSet<>();
        Set<String> destinationProjects = new HashSet<>();
        Set<String> destinationGroups = new HashSet<>();
        Set<String> destinationMappedGroups = new HashSet<>();
        ReentrantLock destinationGroupsLock = new ReentrantLock();

        Map<String, MirrorOptions> groups = mapping.groupsSnapshot();
        Map<String, MirrorOptions> projects = mapping.projectsSnapshot();

        CompletableFuture<Void> groupHalf = CompletableFuture.runAsync(() -> groups.forEach((source, options) -> {
            sourceGroups.add(source);
            destinationMappedGroups.add(options.destinationPath());
            destinationGroupsLock.lock();
            try {
                destinationGroups.add(options.destinationPath());
            } finally {
                destinationGroupsLock.unlock();
            }
        }), executor);

        CompletableFuture<Void> projectHalf = CompletableFuture.runAsync(() -> projects.forEach((source, options) -> {
            sourceProjects.add(source);
            destinationProjects.add(options.destinationPath());
            String namespace = MappingPaths.parentOf(options.destinationPath());
            if (!namespace.isEmpty()) {
                destinationGroupsLock.lock();
                try {
                    destinationGroups.add(namespace);
                } finally {
                    destinationGroupsLock.unlock();
                }
            }
        }), executor);

        CompletableFuture.allOf(groupHalf, projectHalf).join();

        PathFilters filters = new PathFilters(sourceProjects, sourceGroups, destinationProjects,
                destinationGroups, destinationMappedGroups);
        log.debug("Compiled path filters: {} source project(s), {} source group(s), {} destination group prefix(es)",
                sourceProjects.size(), sourceGroups.size(), destinationGroups.size());
        return filters;
    }
}
