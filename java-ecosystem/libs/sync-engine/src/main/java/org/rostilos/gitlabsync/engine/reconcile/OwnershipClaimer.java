package org.rostilos.gitlabsync.engine.reconcile;

import org.rostilos.gitlabsync.engine.instance.GitLabInstance;
import org.rostilos.gitlabsync.gitlabclient.GitLabConfig;
import org.rostilos.gitlabsync.gitlabclient.model.GitLabGroup;
import org.rostilos.gitlabsync.gitlabclient.model.GitLabProject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Makes the synchronizing user owner of what it just created. A failure is only logged.
 */
public class OwnershipClaimer {

    private static final Logger log = LoggerFactory.getLogger(OwnershipClaimer.class);

    public void claimGroup(GitLabInstance destination, GitLabGroup group) {
        try {
            destination.getApi().addGroupMember(group.id(), destination.getUserId(), GitLabConfig.OWNER_ACCESS_LEVEL);
            log.debug("Claimed ownership of group {}", group.fullPath());
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to claim ownership of group {}: {}", group.fullPath(), e.getMessage());
        }
    }

    public void claimProject(GitLabInstance destination, GitLabProject project) {
        try {
            destination.getApi().addProjectMember(project.id(), destination.getUserId(),
                    GitLabConfig.OWNER_ACCESS_LEVEL);
            log.debug("Claimed ownership of project {}", project.pathWithNamespace());
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to claim ownership of project {}: {}", project.pathWithNamespace(), e.getMessage());
        }
    }
}
