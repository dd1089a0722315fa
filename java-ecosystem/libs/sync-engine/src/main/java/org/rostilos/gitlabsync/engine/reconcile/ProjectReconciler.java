package org.rostilos.gitlabsync.engine.reconcile;

import org.rostilos.gitlabsync.engine.error.MirrorException;
import org.rostilos.gitlabsync.engine.error.SyncErrors;
import org.rostilos.gitlabsync.engine.instance.GitLabInstance;
import org.rostilos.gitlabsync.engine.mapping.MappingPaths;
import org.rostilos.gitlabsync.engine.mapping.MirrorMapping;
import org.rostilos.gitlabsync.engine.mapping.MirrorOptions;
import org.rostilos.gitlabsync.engine.mirror.GitMirrorEngine;
import org.rostilos.gitlabsync.engine.mirror.GitMirrorEngine.GitMirrorResult;
import org.rostilos.gitlabsync.engine.reconcile.ReconciliationResult.ResourceKind;
import org.rostilos.gitlabsync.gitlabclient.dto.request.ProjectCreateRequest;
import org.rostilos.gitlabsync.gitlabclient.dto.request.ProjectUpdateRequest;
import org.rostilos.gitlabsync.gitlabclient.dto.request.PullMirrorRequest;
import org.rostilos.gitlabsync.gitlabclient.model.GitLabProject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Creates or updates every mapped project, one unit per project on the worker pool. Projects never
 * depend on each other; groups must have been reconciled first.
 * <p>
 * Within a unit the steps run in order: create when missing, repository content, attributes, avatar,
 * CI/CD catalog, issues, releases. A failing step is recorded and the following steps still run, except
 * releases, which need the mirrored tags.
 */
public class ProjectReconciler {

    private static final Logger log = LoggerFactory.getLogger(ProjectReconciler.class);

    private final Executor workers;
    private final GitMirrorEngine gitMirrorEngine;
    private final OwnershipClaimer ownershipClaimer;
    private final AvatarCopier avatarCopier;
    private final IssueMirror issueMirror;
    private final ReleaseMirror releaseMirror;

    public ProjectReconciler(Executor workers, GitMirrorEngine gitMirrorEngine, OwnershipClaimer ownershipClaimer,
                             AvatarCopier avatarCopier, IssueMirror issueMirror, ReleaseMirror releaseMirror) {
        this.workers = workers;
        this.gitMirrorEngine = gitMirrorEngine;
        this.ownershipClaimer = ownershipClaimer;
        this.avatarCopier = avatarCopier;
        this.issueMirror = issueMirror;
        this.releaseMirror = releaseMirror;
    }

    public ReconciliationPass reconcile(GitLabInstance source, GitLabInstance destination, MirrorMapping mapping,
                                        boolean pullMirrorAvailable) {
        LinkedBlockingQueue<Throwable> errors = new LinkedBlockingQueue<>();
        ConcurrentLinkedQueue<ReconciliationResult> results = new ConcurrentLinkedQueue<>();
        Map<String, MirrorOptions> entries = mapping.projectsSnapshot();

        List<CompletableFuture<Void>> units = new ArrayList<>();
        DestinationIndex.of(entries, mapping::isDeclaredProject, "project", errors)
                .forEach((destinationPath, sourcePath) -> units.add(CompletableFuture.runAsync(() -> {
                    Unit unit = new Unit(source, destination, sourcePath, entries.get(sourcePath), pullMirrorAvailable);
                    try {
                        results.add(unit.run());
                    } catch (RuntimeException e) {
                        MirrorException failure = MirrorException.scopedTo("project " + sourcePath, e);
                        log.error("Project {} -> {} failed: {}", sourcePath, destinationPath, failure.describe());
                        unit.errors.add(failure);
                        results.add(ReconciliationResult.failed(ResourceKind.PROJECT, sourcePath, destinationPath,
                                failure.describe()));
                    } finally {
                        errors.addAll(unit.errors);
                    }
                }, workers)));
        CompletableFuture.allOf(units.toArray(CompletableFuture[]::new)).join();

        List<ReconciliationResult> sorted = new ArrayList<>(results);
        sorted.sort(Comparator.comparing(ReconciliationResult::destinationPath));
        return new ReconciliationPass(sorted, SyncErrors.drain(errors));
    }

    /**
     * State of one project while it is being reconciled.
     */
    private final class Unit {
        private final GitLabInstance source;
        private final GitLabInstance destination;
        private final String sourcePath;
        private final MirrorOptions options;
        private final boolean pullMirror;
        private final List<Throwable> errors = new ArrayList<>();

        Unit(GitLabInstance source, GitLabInstance destination, String sourcePath, MirrorOptions options,
             boolean pullMirror) {
            this.source = source;
            this.destination = destination;
            this.sourcePath = sourcePath;
            this.options = options;
            this.pullMirror = pullMirror;
        }

        ReconciliationResult run() {
            String destinationPath = options.destinationPath();
            GitLabProject sourceProject = source.getProject(sourcePath);
            if (sourceProject == null) {
                throw MirrorException.nonBlocking("project " + sourcePath + " not found on source instance");
            }

            GitLabProject destinationProject = destination.getProject(destinationPath);
            boolean created = destinationProject == null;
            if (created) {
                destinationProject = create(sourceProject);
            }

            boolean contentMirrored = false;
            try {
                destinationProject = mirrorContent(sourceProject, destinationProject);
                contentMirrored = true;
            } catch (RuntimeException e) {
                record(e);
            }

            int patched = 0;
            try {
                patched = syncAttributes(sourceProject, destinationProject);
            } catch (RuntimeException e) {
                record(e);
            }

            GitLabProject target = destinationProject;
            step(() -> avatarCopier.copyProjectAvatar(source, sourceProject, destination, target));
            if (options.ciCdCatalog()) {
                step(() -> addToCatalog(target));
            }
            if (options.issues()) {
                step(() -> errors.addAll(issueMirror.mirror(source, sourceProject, destination, target)));
            }
            if (options.mirrorReleases()) {
                if (contentMirrored) {
                    step(() -> errors.addAll(releaseMirror.mirror(source, sourceProject, destination, target)));
                } else {
                    log.warn("Skipping releases of {}: repository content was not mirrored", destinationPath);
                }
            }

            return created
                    ? ReconciliationResult.created(ResourceKind.PROJECT, sourcePath, destinationPath)
                    : ReconciliationResult.existing(ResourceKind.PROJECT, sourcePath, destinationPath, patched);
        }

        private GitLabProject create(GitLabProject sourceProject) {
            String destinationPath = options.destinationPath();
            long namespaceId = destination.resolveParentId(destinationPath)
                    .orElseThrow(() -> MirrorException.nonBlocking("project " + destinationPath
                            + " must be located in a namespace"));
            ProjectCreateRequest request = new ProjectCreateRequest(
                    sourceProject.name(),
                    MappingPaths.baseName(destinationPath),
                    sourceProject.description(),
                    options.visibilityOr(sourceProject.visibility()),
                    sourceProject.defaultBranch(),
                    sourceProject.topics(),
                    namespaceId,
                    pullMirror,
                    options.mirrorTriggerBuilds()
            );
            GitLabProject created;
            try {
                created = destination.getApi().createProject(request);
            } catch (IOException e) {
                throw MirrorException.nonBlocking("Failed to create project " + destinationPath, e);
            }
            destination.putProject(created);
            log.info("Created project {} from {}", destinationPath, sourceProject.pathWithNamespace());
            ownershipClaimer.claimProject(destination, created);
            return created;
        }

        /**
         * @return the destination record, re-read when pushing may have changed its default branch
         */
        private GitLabProject mirrorContent(GitLabProject sourceProject, GitLabProject destinationProject) {
            if (pullMirror) {
                PullMirrorRequest request = new PullMirrorRequest(
                        sourceProject.httpUrlToRepo(),
                        source.getGitCredentials().username(),
                        source.getGitCredentials().token(),
                        true,
                        true,
                        true,
                        options.mirrorTriggerBuilds()
                );
                try {
                    destination.getApi().configurePullMirror(destinationProject.id(), request);
                } catch (IOException e) {
                    throw MirrorException.nonBlocking("Failed to configure pull mirror of "
                            + destinationProject.pathWithNamespace(), e);
                }
                log.debug("Pull mirror of {} configured from {}", destinationProject.pathWithNamespace(),
                        sourceProject.httpUrlToRepo());
                return withPullMirror(destinationProject);
            }

            GitMirrorResult result = gitMirrorEngine.mirror(sourceProject.httpUrlToRepo(), source.getGitCredentials(),
                    destinationProject.httpUrlToRepo(), destination.getGitCredentials());
            if (result.headWritten()) {
                return destinationProject;
            }
            // the default branch is then reconciled through the API
            return refresh(destinationProject);
        }

        /**
         * Destination record as the pull mirror configuration left it.
         */
        private GitLabProject withPullMirror(GitLabProject project) {
            GitLabProject mirrored = new GitLabProject(project.id(), project.name(), project.path(),
                    project.pathWithNamespace(), project.description(), project.visibility(), project.defaultBranch(),
                    project.topics(), project.avatarUrl(), project.httpUrlToRepo(), project.namespaceId(),
                    project.archived(), true, options.mirrorTriggerBuilds(), true);
            destination.putProject(mirrored);
            return mirrored;
        }

        private GitLabProject refresh(GitLabProject destinationProject) {
            try {
                GitLabProject current = destination.getApi().getProject(String.valueOf(destinationProject.id()));
                if (current == null) {
                    return destinationProject;
                }
                destination.putProject(current);
                return current;
            } catch (IOException e) {
                log.warn("Could not re-read project {} after push: {}", destinationProject.pathWithNamespace(),
                        e.getMessage());
                return destinationProject;
            }
        }

        private int syncAttributes(GitLabProject sourceProject, GitLabProject destinationProject) {
            ProjectUpdateRequest patch = AttributeDiff.project(sourceProject, destinationProject, options, pullMirror);
            if (patch.isEmpty()) {
                log.debug("Project {} attributes already in sync", destinationProject.pathWithNamespace());
                return 0;
            }
            try {
                GitLabProject updated = destination.getApi().updateProject(destinationProject.id(), patch);
                if (updated != null && updated.pathWithNamespace() != null) {
                    destination.putProject(updated);
                }
            } catch (IOException e) {
                throw MirrorException.nonBlocking("Failed to update project "
                        + destinationProject.pathWithNamespace(), e);
            }
            log.info("Updated {} attribute(s) of project {}", patch.changedFieldCount(),
                    destinationProject.pathWithNamespace());
            return patch.changedFieldCount();
        }

        private void addToCatalog(GitLabProject destinationProject) {
            try {
                destination.getApi().addToCatalog(destinationProject.pathWithNamespace());
            } catch (IOException e) {
                throw MirrorException.nonBlocking("Failed to add " + destinationProject.pathWithNamespace()
                        + " to the CI/CD catalog", e);
            }
            log.debug("Project {} registered in the CI/CD catalog", destinationProject.pathWithNamespace());
        }

        private void step(Runnable action) {
            try {
                action.run();
            } catch (RuntimeException e) {
                record(e);
            }
        }

        private void record(RuntimeException e) {
            MirrorException failure = MirrorException.scopedTo("project " + sourcePath, e);
            log.error("{}", failure.describe());
            errors.add(failure);
        }
    }
}
