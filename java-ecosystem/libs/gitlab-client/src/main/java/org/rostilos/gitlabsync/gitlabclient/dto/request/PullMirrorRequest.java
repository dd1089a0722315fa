package org.rostilos.gitlabsync.gitlabclient.dto.request;

/**
 * Body of {@code PUT /projects/:id/mirror/pull}.
 */
public record PullMirrorRequest(
        /**
         * Clone URL the destination pulls from.
         */
        String url,

        String authUser,
        String authPassword,
        boolean enabled,
        boolean onlyMirrorProtectedBranches,
        boolean mirrorOverwritesDivergedBranches,
        boolean mirrorTriggerBuilds
) {

    @Override
    public String toString() {
        return "PullMirrorRequest[url=" + url + ", authUser=" + authUser + ", enabled=" + enabled
                + ", onlyMirrorProtectedBranches=" + onlyMirrorProtectedBranches
                + ", mirrorOverwritesDivergedBranches=" + mirrorOverwritesDivergedBranches
                + ", mirrorTriggerBuilds=" + mirrorTriggerBuilds + "]";
    }
}
