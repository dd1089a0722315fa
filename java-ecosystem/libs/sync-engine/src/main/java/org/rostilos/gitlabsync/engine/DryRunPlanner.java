package org.rostilos.gitlabsync.engine;

import org.rostilos.gitlabsync.engine.error.MirrorException;
import org.rostilos.gitlabsync.engine.error.SyncErrors;
import org.rostilos.gitlabsync.engine.instance.GitLabInstance;
import org.rostilos.gitlabsync.engine.mapping.MirrorMapping;
import org.rostilos.gitlabsync.engine.mapping.MirrorOptions;
import org.rostilos.gitlabsync.engine.reconcile.ReconciliationResult.ResourceKind;
import org.rostilos.gitlabsync.engine.reconcile.ReleaseMirror;
import org.rostilos.gitlabsync.gitlabclient.model.GitLabProject;
import org.rostilos.gitlabsync.gitlabclient.model.GitLabRelease;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@link SyncPlan} of a dry run from the fetched caches and the completed mapping.
 * Only resources found on the source are planned.
 */
public class DryRunPlanner {

    private static final Logger log = LoggerFactory.getLogger(DryRunPlanner.class);

    private final ReleaseMirror releaseMirror;

    public DryRunPlanner(ReleaseMirror releaseMirror) {
        this.releaseMirror = releaseMirror;
    }

    public PlanResult plan(GitLabInstance source, GitLabInstance destination, MirrorMapping mapping) {
        List<SyncPlan.Entry> entries = new ArrayList<>();
        List<Throwable> errors = new ArrayList<>();

        mapping.groupsSnapshot().forEach((sourcePath, options) -> {
            if (source.getGroup(sourcePath) != null) {
                entries.add(new SyncPlan.Entry(ResourceKind.GROUP, sourcePath, options.destinationPath(),
                        action(destination.getGroup(options.destinationPath()) != null), List.of()));
            }
        });

        for (Map.Entry<String, MirrorOptions> entry : mapping.projectsSnapshot().entrySet()) {
            String sourcePath = entry.getKey();
            MirrorOptions options = entry.getValue();
            GitLabProject sourceProject = source.getProject(sourcePath);
            if (sourceProject == null) {
                continue;
            }
            GitLabProject destinationProject = destination.getProject(options.destinationPath());
            List<String> tags = List.of();
            if (options.mirrorReleases()) {
                try {
                    tags = releaseMirror.missingReleases(source, sourceProject, destination, destinationProject)
                            .stream().map(GitLabRelease::tagName).toList();
                } catch (RuntimeException e) {
                    errors.add(MirrorException.scopedTo("releases of project " + sourcePath, e));
                }
            }
            entries.add(new SyncPlan.Entry(ResourceKind.PROJECT, sourcePath, options.destinationPath(),
                    action(destinationProject != null), tags));
        }

        SyncPlan plan = new SyncPlan(entries);
        log.info("Dry run, planned {} change(s):", entries.size());
        plan.lines().forEach(line -> log.info("  {}", line));
        return new PlanResult(plan, SyncErrors.of(errors));
    }

    private static SyncPlan.Action action(boolean exists) {
        return exists ? SyncPlan.Action.UPDATE : SyncPlan.Action.CREATE;
    }

    public record PlanResult(SyncPlan plan, SyncErrors errors) {
    }
}
