package org.rostilos.gitlabsync.engine.mapping;

import org.rostilos.gitlabsync.gitlabclient.model.Visibility;

/**
 * Copy options of one mapping entry.
 *
 * @param destinationPath     full path the resource is copied to
 * @param ciCdCatalog         register the destination project as a CI/CD catalog resource
 * @param issues              copy issues
 * @param mirrorTriggerBuilds trigger pipelines when the destination mirror updates
 * @param visibility          visibility forced on the destination, null to copy the source visibility
 * @param mirrorReleases      copy releases
 */
public record MirrorOptions(
        String destinationPath,
        boolean ciCdCatalog,
        boolean issues,
        boolean mirrorTriggerBuilds,
        Visibility visibility,
        boolean mirrorReleases
) {

    public static MirrorOptions toDestination(String destinationPath) {
        return new MirrorOptions(destinationPath, false, false, false, null, false);
    }

    /**
     * Same options, other destination. Used when a descendant inherits its ancestor group's options.
     */
    public MirrorOptions withDestinationPath(String path) {
        return new MirrorOptions(path, ciCdCatalog, issues, mirrorTriggerBuilds, visibility, mirrorReleases);
    }

    /**
     * @return the forced visibility, or the given source visibility when none is forced
     */
    public Visibility visibilityOr(Visibility sourceVisibility) {
        return visibility != null ? visibility : sourceVisibility;
    }
}
