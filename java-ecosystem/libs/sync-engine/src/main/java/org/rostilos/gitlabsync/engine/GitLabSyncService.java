package org.rostilos.gitlabsync.engine;

import org.rostilos.gitlabsync.engine.capability.MirrorCapabilityProber;
import org.rostilos.gitlabsync.engine.error.MirrorException;
import org.rostilos.gitlabsync.engine.error.SyncErrors;
import org.rostilos.gitlabsync.engine.fetch.BigInstanceFetcher;
import org.rostilos.gitlabsync.engine.fetch.FetchPipeline;
import org.rostilos.gitlabsync.engine.fetch.SmallInstanceFetcher;
import org.rostilos.gitlabsync.engine.instance.GitLabInstance;
import org.rostilos.gitlabsync.engine.instance.InstanceRole;
import org.rostilos.gitlabsync.engine.mapping.MirrorMapping;
import org.rostilos.gitlabsync.engine.mapping.PathFilterCompiler;
import org.rostilos.gitlabsync.engine.mapping.PathFilters;
import org.rostilos.gitlabsync.engine.mirror.GitMirrorEngine;
import org.rostilos.gitlabsync.engine.reconcile.AvatarCopier;
import org.rostilos.gitlabsync.engine.reconcile.GroupReconciler;
import org.rostilos.gitlabsync.engine.reconcile.IssueMirror;
import org.rostilos.gitlabsync.engine.reconcile.OwnershipClaimer;
import org.rostilos.gitlabsync.engine.reconcile.ProjectReconciler;
import org.rostilos.gitlabsync.engine.reconcile.ReconciliationPass;
import org.rostilos.gitlabsync.engine.reconcile.ReconciliationResult;
import org.rostilos.gitlabsync.engine.reconcile.ReleaseMirror;
import org.rostilos.gitlabsync.gitlabclient.GitLabApi;
import org.rostilos.gitlabsync.gittransport.GitTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a synchronization: connect both instances, probe the destination for pull mirroring, fetch both
 * hierarchies, then reconcile groups before projects.
 * <p>
 * Only a failure to connect, to probe or to list an instance in bulk stops the run early. Any other
 * failure is collected and the remaining work still runs.
 */
public class GitLabSyncService {

    private static final Logger log = LoggerFactory.getLogger(GitLabSyncService.class);

    private final SyncSettings settings;
    private final GitLabApi sourceApi;
    private final GitLabApi destinationApi;
    private final GitTransport gitTransport;

    public GitLabSyncService(SyncSettings settings, GitLabApi sourceApi, GitLabApi destinationApi,
                             GitTransport gitTransport) {
        this.settings = settings;
        this.sourceApi = sourceApi;
        this.destinationApi = destinationApi;
        this.gitTransport = gitTransport;
    }

    /**
     * @param mapping declared mapping; extended in place with the resources found below declared groups
     */
    public SyncReport run(MirrorMapping mapping) {
        try (WorkerPools pools = new WorkerPools(settings.concurrency())) {
            return run(mapping, pools);
        } catch (MirrorException e) {
            log.error("Synchronization aborted: {}", e.describe());
            return SyncReport.aborted(SyncErrors.of(e));
        } catch (RuntimeException e) {
            log.error("Synchronization aborted by an unexpected failure", e);
            return SyncReport.aborted(SyncErrors.of(MirrorException.blocking("Synchronization aborted: " + e, e)));
        }
    }

    private SyncReport run(MirrorMapping mapping, WorkerPools pools) {
        GitLabInstance source = GitLabInstance.connect(InstanceRole.SOURCE, settings.source(), sourceApi);
        GitLabInstance destination = GitLabInstance.connect(InstanceRole.DESTINATION, settings.destination(),
                destinationApi);

        boolean pullMirrorAvailable = new MirrorCapabilityProber(destinationApi)
                .isPullMirrorAvailable(settings.forcePremium(), settings.forceNonPremium());
        log.info("Repository content will be copied with {}", pullMirrorAvailable ? "pull mirrors" : "git push");

        PathFilters filters = new PathFilterCompiler(pools.workers()).compile(mapping);
        FetchPipeline pipeline = new FetchPipeline(pools.coordinator(),
                new SmallInstanceFetcher(pools.workers()), new BigInstanceFetcher(pools.workers()));
        SyncErrors fetchErrors = pipeline.fetch(source, destination, filters, mapping);
        if (fetchErrors.hasBlocking()) {
            log.error("Fetch failed, nothing was changed:{}{}", System.lineSeparator(), fetchErrors.render());
            return new SyncReport(List.of(), fetchErrors, pullMirrorAvailable, null);
        }

        ReleaseMirror releaseMirror = new ReleaseMirror();
        if (settings.dryRun()) {
            DryRunPlanner.PlanResult planned = new DryRunPlanner(releaseMirror).plan(source, destination, mapping);
            return new SyncReport(List.of(), fetchErrors.and(planned.errors()), pullMirrorAvailable, planned.plan());
        }

        OwnershipClaimer ownershipClaimer = new OwnershipClaimer();
        AvatarCopier avatarCopier = new AvatarCopier();
        ReconciliationPass groups = new GroupReconciler(ownershipClaimer, avatarCopier)
                .reconcile(source, destination, mapping);
        ReconciliationPass projects = new ProjectReconciler(pools.workers(), new GitMirrorEngine(gitTransport),
                ownershipClaimer, avatarCopier, new IssueMirror(), releaseMirror)
                .reconcile(source, destination, mapping, pullMirrorAvailable);

        List<ReconciliationResult> results = new ArrayList<>(groups.results());
        results.addAll(projects.results());
        SyncReport report = new SyncReport(results,
                SyncErrors.merge(fetchErrors, groups.errors(), projects.errors()), pullMirrorAvailable, null);
        log.info("Synchronization finished: {}", report.summary());
        return report;
    }
}
