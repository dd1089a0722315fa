package org.rostilos.gitlabsync.engine.reconcile;

import org.rostilos.gitlabsync.engine.error.MirrorException;
import org.rostilos.gitlabsync.engine.error.SyncErrors;
import org.rostilos.gitlabsync.engine.instance.GitLabInstance;
import org.rostilos.gitlabsync.engine.mapping.MappingPaths;
import org.rostilos.gitlabsync.engine.mapping.MirrorMapping;
import org.rostilos.gitlabsync.engine.mapping.MirrorOptions;
import org.rostilos.gitlabsync.engine.reconcile.ReconciliationResult.ResourceKind;
import org.rostilos.gitlabsync.gitlabclient.dto.request.GroupCreateRequest;
import org.rostilos.gitlabsync.gitlabclient.dto.request.GroupUpdateRequest;
import org.rostilos.gitlabsync.gitlabclient.model.GitLabGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Creates or updates the destination groups, one at a time, in ascending destination path order.
 * A parent path sorts before every path below it, so a parent is always handled, and cached with its
 * numeric id, before any of its subgroups.
 */
public class GroupReconciler {

    private static final Logger log = LoggerFactory.getLogger(GroupReconciler.class);

    private final OwnershipClaimer ownershipClaimer;
    private final AvatarCopier avatarCopier;

    public GroupReconciler(OwnershipClaimer ownershipClaimer, AvatarCopier avatarCopier) {
        this.ownershipClaimer = ownershipClaimer;
        this.avatarCopier = avatarCopier;
    }

    public ReconciliationPass reconcile(GitLabInstance source, GitLabInstance destination, MirrorMapping mapping) {
        List<Throwable> errors = new ArrayList<>();
        List<ReconciliationResult> results = new ArrayList<>();
        Map<String, MirrorOptions> entries = mapping.groupsSnapshot();

        SortedMap<String, String> index = DestinationIndex.of(entries, mapping::isDeclaredGroup, "group", errors);
        index.forEach((destinationPath, sourcePath) -> {
            try {
                results.add(reconcileGroup(source, destination, sourcePath, entries.get(sourcePath), errors));
            } catch (RuntimeException e) {
                MirrorException failure = MirrorException.scopedTo("group " + sourcePath, e);
                log.error("Group {} -> {} failed: {}", sourcePath, destinationPath, failure.describe());
                errors.add(failure);
                results.add(ReconciliationResult.failed(ResourceKind.GROUP, sourcePath, destinationPath,
                        failure.describe()));
            }
        });
        return new ReconciliationPass(results, SyncErrors.of(errors));
    }

    private ReconciliationResult reconcileGroup(GitLabInstance source, GitLabInstance destination, String sourcePath,
                                                MirrorOptions options, List<Throwable> errors) {
        String destinationPath = options.destinationPath();
        GitLabGroup sourceGroup = source.getGroup(sourcePath);
        if (sourceGroup == null) {
            throw MirrorException.nonBlocking("group " + sourcePath + " not found on source instance");
        }

        GitLabGroup existing = destination.getGroup(destinationPath);
        if (existing == null) {
            GitLabGroup created = create(destination, sourceGroup, options);
            copyAvatar(source, sourceGroup, destination, created, errors);
            return ReconciliationResult.created(ResourceKind.GROUP, sourcePath, destinationPath);
        }

        int patched = update(destination, sourceGroup, existing, options);
        copyAvatar(source, sourceGroup, destination, existing, errors);
        return ReconciliationResult.existing(ResourceKind.GROUP, sourcePath, destinationPath, patched);
    }

    private GitLabGroup create(GitLabInstance destination, GitLabGroup sourceGroup, MirrorOptions options) {
        String destinationPath = options.destinationPath();
        Long parentId = destination.resolveParentId(destinationPath).orElse(null);
        GroupCreateRequest request = new GroupCreateRequest(
                sourceGroup.name(),
                MappingPaths.baseName(destinationPath),
                sourceGroup.description(),
                options.visibilityOr(sourceGroup.visibility()),
                sourceGroup.defaultBranch(),
                parentId
        );
        GitLabGroup created;
        try {
            created = destination.getApi().createGroup(request);
        } catch (IOException e) {
            throw MirrorException.nonBlocking("Failed to create group " + destinationPath, e);
        }
        destination.putGroup(created);
        log.info("Created group {} from {}", destinationPath, sourceGroup.fullPath());
        ownershipClaimer.claimGroup(destination, created);
        return created;
    }

    private int update(GitLabInstance destination, GitLabGroup sourceGroup, GitLabGroup existing,
                       MirrorOptions options) {
        GroupUpdateRequest patch = AttributeDiff.group(sourceGroup, existing, options);
        if (patch.isEmpty()) {
            log.debug("Group {} attributes already in sync", existing.fullPath());
            return 0;
        }
        try {
            GitLabGroup updated = destination.getApi().updateGroup(existing.id(), patch);
            if (updated != null && updated.fullPath() != null) {
                destination.putGroup(updated);
            }
        } catch (IOException e) {
            throw MirrorException.nonBlocking("Failed to update group " + existing.fullPath(), e);
        }
        log.info("Updated {} attribute(s) of group {}", patch.changedFieldCount(), existing.fullPath());
        return patch.changedFieldCount();
    }

    private void copyAvatar(GitLabInstance source, GitLabGroup sourceGroup, GitLabInstance destination,
                            GitLabGroup destinationGroup, List<Throwable> errors) {
        try {
            avatarCopier.copyGroupAvatar(source, sourceGroup, destination, destinationGroup);
        } catch (RuntimeException e) {
            MirrorException failure = MirrorException.scopedTo("avatar of group " + sourceGroup.fullPath(), e);
            log.error("{}", failure.describe());
            errors.add(failure);
        }
    }
}
