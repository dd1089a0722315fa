package org.rostilos.gitlabsync.engine.fetch;

import org.rostilos.gitlabsync.engine.error.SyncErrors;
import org.rostilos.gitlabsync.engine.instance.GitLabInstance;
import org.rostilos.gitlabsync.engine.mapping.MirrorMapping;
import org.rostilos.gitlabsync.engine.mapping.PathFilters;

/**
 * Populates an instance cache with the groups and projects selected by the path filters.
 * On a source instance every resource found below a declared group also gets a derived mapping entry.
 * <p>
 * The two passes may run at the same time for the same instance.
 */
public interface InstanceFetcher {

    /**
     * @return the errors of the pass; a blocking error means the pass produced nothing usable
     */
    SyncErrors fetchGroups(GitLabInstance instance, PathFilters filters, MirrorMapping mapping);

    SyncErrors fetchProjects(GitLabInstance instance, PathFilters filters, MirrorMapping mapping);
}
