package org.rostilos.gitlabsync.engine.fetch;

import org.rostilos.gitlabsync.engine.error.MirrorException;
import org.rostilos.gitlabsync.engine.error.SyncErrors;
import org.rostilos.gitlabsync.engine.instance.GitLabInstance;
import org.rostilos.gitlabsync.engine.mapping.MirrorMapping;
import org.rostilos.gitlabsync.engine.mapping.PathFilters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Fetches the source and the destination instance at the same time, each with its group pass and its
 * project pass running side by side, and joins the four passes once.
 */
public class FetchPipeline {

    private static final Logger log = LoggerFactory.getLogger(FetchPipeline.class);

    private final Executor coordinator;
    private final InstanceFetcher smallFetcher;
    private final InstanceFetcher bigFetcher;

    /**
     * @param coordinator runs the four passes; needs at least four threads since every pass blocks
     *                    until its units complete
     */
    public FetchPipeline(Executor coordinator, InstanceFetcher smallFetcher, InstanceFetcher bigFetcher) {
        this.coordinator = coordinator;
        this.smallFetcher = smallFetcher;
        this.bigFetcher = bigFetcher;
    }

    public SyncErrors fetch(GitLabInstance source, GitLabInstance destination, PathFilters filters,
                            MirrorMapping mapping) {
        InstanceFetcher sourceFetcher = fetcherFor(source);
        InstanceFetcher destinationFetcher = fetcherFor(destination);

        List<CompletableFuture<SyncErrors>> passes = List.of(
                pass(() -> sourceFetcher.fetchGroups(source, filters, mapping)),
                pass(() -> sourceFetcher.fetchProjects(source, filters, mapping)),
                pass(() -> destinationFetcher.fetchGroups(destination, filters, mapping)),
                pass(() -> destinationFetcher.fetchProjects(destination, filters, mapping))
        );

        SyncErrors errors = SyncErrors.NONE;
        for (CompletableFuture<SyncErrors> pass : passes) {
            errors = errors.and(pass.join());
        }
        log.info("Fetch complete: source {} group(s) / {} project(s), destination {} group(s) / {} project(s), "
                        + "mapping {} group(s) / {} project(s)",
                source.groupsSnapshot().size(), source.projectsSnapshot().size(),
                destination.groupsSnapshot().size(), destination.projectsSnapshot().size(),
                mapping.groupCount(), mapping.projectCount());
        return errors;
    }

    private InstanceFetcher fetcherFor(GitLabInstance instance) {
        return instance.isBig() ? bigFetcher : smallFetcher;
    }

    private CompletableFuture<SyncErrors> pass(Supplier<SyncErrors> body) {
        return CompletableFuture.supplyAsync(body, coordinator)
                .exceptionally(e -> {
                    Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                    return SyncErrors.of(cause instanceof MirrorException
                            ? cause
                            : MirrorException.blocking("Fetch pass failed unexpectedly", cause));
                });
    }
}
