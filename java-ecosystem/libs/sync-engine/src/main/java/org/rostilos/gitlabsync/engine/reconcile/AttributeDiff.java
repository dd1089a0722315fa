package org.rostilos.gitlabsync.engine.reconcile;

import org.rostilos.gitlabsync.engine.mapping.MirrorOptions;
import org.rostilos.gitlabsync.gitlabclient.dto.request.GroupUpdateRequest;
import org.rostilos.gitlabsync.gitlabclient.dto.request.ProjectUpdateRequest;
import org.rostilos.gitlabsync.gitlabclient.model.GitLabGroup;
import org.rostilos.gitlabsync.gitlabclient.model.GitLabProject;
import org.rostilos.gitlabsync.gitlabclient.model.Visibility;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Field by field comparison of a destination resource with its source. Only differing fields end up
 * in the update request, so an empty request means nothing to patch.
 */
public final class AttributeDiff {

    private AttributeDiff() {
        // Utility class
    }

    public static GroupUpdateRequest group(GitLabGroup source, GitLabGroup destination, MirrorOptions options) {
        Visibility visibility = options.visibilityOr(source.visibility());
        return new GroupUpdateRequest(
                differs(source.name(), destination.name()) ? source.name() : null,
                differs(source.description(), destination.description()) ? nullToEmpty(source.description()) : null,
                visibility != null && visibility != destination.visibility() ? visibility : null
        );
    }

    /**
     * @param pullMirror whether the destination pull-mirrors; the mirror flags are only compared then
     */
    public static ProjectUpdateRequest project(GitLabProject source, GitLabProject destination, MirrorOptions options,
                                               boolean pullMirror) {
        ProjectUpdateRequest.Builder patch = ProjectUpdateRequest.builder();
        if (differs(source.name(), destination.name())) {
            patch.name(source.name());
        }
        if (differs(source.description(), destination.description())) {
            patch.description(nullToEmpty(source.description()));
        }
        if (source.defaultBranch() != null && !source.defaultBranch().equals(destination.defaultBranch())) {
            patch.defaultBranch(source.defaultBranch());
        }
        if (!sameElements(source.topics(), destination.topics())) {
            patch.topics(source.topics());
        }
        Visibility visibility = options.visibilityOr(source.visibility());
        if (visibility != null && visibility != destination.visibility()) {
            patch.visibility(visibility);
        }
        if (pullMirror) {
            if (options.mirrorTriggerBuilds() != destination.mirrorTriggerBuilds()) {
                patch.mirrorTriggerBuilds(options.mirrorTriggerBuilds());
            }
            if (!destination.mirrorOverwritesDivergedBranches()) {
                patch.mirrorOverwritesDivergedBranches(true);
            }
            if (!destination.mirror()) {
                patch.mirror(true);
            }
        }
        return patch.build();
    }

    /**
     * Null and empty text are the same value for GitLab.
     */
    private static boolean differs(String source, String destination) {
        return !Objects.equals(nullToEmpty(source), nullToEmpty(destination));
    }

    private static boolean sameElements(List<String> left, List<String> right) {
        return new HashSet<>(left).equals(new HashSet<>(right));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
