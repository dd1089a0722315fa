package org.rostilos.gitlabsync.engine.mapping;

import org.rostilos.gitlabsync.engine.instance.InstanceRole;

import java.util.Set;

/**
 * Lookup sets compiled from the declared mapping entries.
 *
 * @param sourceProjects              declared source project paths
 * @param sourceGroups                declared source group paths
 * @param destinationProjects         declared destination project paths
 * @param destinationGroups           declared destination group paths plus the parent namespace of every
 *                                    declared destination project
 * @param destinationMappedGroups     declared destination group paths only
 */
public record PathFilters(
        Set<String> sourceProjects,
        Set<String> sourceGroups,
        Set<String> destinationProjects,
        Set<String> destinationGroups,
        Set<String> destinationMappedGroups
) {

    public PathFilters {
        sourceProjects = Set.copyOf(sourceProjects);
        sourceGroups = Set.copyOf(sourceGroups);
        destinationProjects = Set.copyOf(destinationProjects);
        destinationGroups = Set.copyOf(destinationGroups);
        destinationMappedGroups = Set.copyOf(destinationMappedGroups);
    }

    public Set<String> projects(InstanceRole role) {
        return role == InstanceRole.SOURCE ? sourceProjects : destinationProjects;
    }

    public Set<String> groups(InstanceRole role) {
        return role == InstanceRole.SOURCE ? sourceGroups : destinationGroups;
    }

    /**
     * Decide whether a project discovered on an instance is relevant.
     * A declared project is an exact match; otherwise the deepest declared group containing it is its origin.
     */
    public PathMatch matchProject(InstanceRole role, String path) {
        if (projects(role).contains(path)) {
            return PathMatch.exact();
        }
        return matchUnderGroup(groups(role), path);
    }

    public PathMatch matchGroup(InstanceRole role, String path) {
        return matchUnderGroup(groups(role), path);
    }

    /**
     * @return true when the path lies at or below a group declared as a destination
     */
    public boolean isUnderMappedDestinationGroup(String path) {
        return deepestAncestor(destinationMappedGroups, path) != null;
    }

    private static PathMatch matchUnderGroup(Set<String> groups, String path) {
        String origin = deepestAncestor(groups, path);
        if (origin == null) {
            return PathMatch.none();
        }
        return origin.equals(path) ? PathMatch.exact() : PathMatch.under(origin);
    }

    private static String deepestAncestor(Set<String> groups, String path) {
        String candidate = path;
        while (!candidate.isEmpty()) {
            if (groups.contains(candidate)) {
                return candidate;
            }
            candidate = MappingPaths.parentOf(candidate);
        }
        return null;
    }

    /**
     * Result of matching a discovered path.
     *
     * @param kind        how the path matched
     * @param originGroup the declared group the path was found under, only set for {@link Kind#UNDER_GROUP}
     */
    public record PathMatch(Kind kind, String originGroup) {

        public enum Kind {
            EXACT,
            UNDER_GROUP,
            NONE
        }

        static PathMatch exact() {
            return new PathMatch(Kind.EXACT, null);
        }

        static PathMatch under(String originGroup) {
            return new PathMatch(Kind.UNDER_GROUP, originGroup);
        }

        static PathMatch none() {
            return new PathMatch(Kind.NONE, null);
        }

        public boolean matched() {
            return kind != Kind.NONE;
        }
    }
}
