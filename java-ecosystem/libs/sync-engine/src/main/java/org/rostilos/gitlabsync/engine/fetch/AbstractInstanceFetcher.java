package org.rostilos.gitlabsync.engine.fetch;

import org.rostilos.gitlabsync.engine.error.MirrorException;
import org.rostilos.gitlabsync.engine.instance.GitLabInstance;
import org.rostilos.gitlabsync.engine.mapping.MappingPaths;
import org.rostilos.gitlabsync.engine.mapping.MirrorMapping;
import org.rostilos.gitlabsync.engine.mapping.MirrorOptions;
import org.rostilos.gitlabsync.engine.mapping.PathFilters.PathMatch;
import org.rostilos.gitlabsync.gitlabclient.model.GitLabGroup;
import org.rostilos.gitlabsync.gitlabclient.model.GitLabProject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Storing and mapping derivation shared by both fetch strategies.
 */
abstract class AbstractInstanceFetcher implements InstanceFetcher {

    private static final Logger log = LoggerFactory.getLogger(AbstractInstanceFetcher.class);

    protected void storeGroup(GitLabInstance instance, GitLabGroup group, PathMatch match, MirrorMapping mapping) {
        instance.putGroup(group);
        if (instance.isSource() && match.kind() == PathMatch.Kind.UNDER_GROUP) {
            MirrorOptions derived = derive(group.fullPath(), match.originGroup(), mapping);
            if (mapping.addGroupIfAbsent(group.fullPath(), derived)) {
                log.debug("Group {} will be copied to {} (below {})",
                        group.fullPath(), derived.destinationPath(), match.originGroup());
            }
        }
    }

    protected void storeProject(GitLabInstance instance, GitLabProject project, PathMatch match,
                                MirrorMapping mapping) {
        instance.putProject(project);
        if (instance.isSource() && match.kind() == PathMatch.Kind.UNDER_GROUP) {
            MirrorOptions derived = derive(project.pathWithNamespace(), match.originGroup(), mapping);
            if (mapping.addProjectIfAbsent(project.pathWithNamespace(), derived)) {
                log.debug("Project {} will be copied to {} (below {})",
                        project.pathWithNamespace(), derived.destinationPath(), match.originGroup());
            }
        }
    }

    /**
     * Destination of a resource found below a declared group: the group's destination joined with the
     * resource's path relative to the group. Every other option is inherited.
     */
    private MirrorOptions derive(String path, String originGroup, MirrorMapping mapping) {
        MirrorOptions originOptions = mapping.getGroup(originGroup);
        if (originOptions == null) {
            throw MirrorException.nonBlocking("group " + originGroup + " not found in mirror mapping (required for "
                    + path + ")");
        }
        String destination = MappingPaths.join(originOptions.destinationPath(),
                MappingPaths.relativize(originGroup, path));
        return originOptions.withDestinationPath(destination);
    }

    protected static String roleName(GitLabInstance instance) {
        return instance.isSource() ? "source" : "destination";
    }
}
