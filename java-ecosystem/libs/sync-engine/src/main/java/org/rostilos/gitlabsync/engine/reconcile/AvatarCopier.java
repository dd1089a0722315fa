package org.rostilos.gitlabsync.engine.reconcile;

import org.rostilos.gitlabsync.engine.error.MirrorException;
import org.rostilos.gitlabsync.engine.instance.GitLabInstance;
import org.rostilos.gitlabsync.gitlabclient.model.GitLabGroup;
import org.rostilos.gitlabsync.gitlabclient.model.GitLabProject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;

/**
 * Copies the source avatar to a destination resource that has none. An avatar already present on the
 * destination is never replaced.
 */
public class AvatarCopier {

    private static final Logger log = LoggerFactory.getLogger(AvatarCopier.class);

    private final Clock clock;

    public AvatarCopier() {
        this(Clock.systemUTC());
    }

    AvatarCopier(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return true when an avatar was uploaded
     */
    public boolean copyGroupAvatar(GitLabInstance source, GitLabGroup sourceGroup,
                                   GitLabInstance destination, GitLabGroup destinationGroup) {
        if (destinationGroup.hasAvatar() || !sourceGroup.hasAvatar()) {
            return false;
        }
        try {
            byte[] avatar = source.getApi().downloadGroupAvatar(sourceGroup.id());
            destination.getApi().uploadGroupAvatar(destinationGroup.id(), avatar, filename());
        } catch (IOException e) {
            throw MirrorException.nonBlocking("Failed to copy avatar of group " + sourceGroup.fullPath(), e);
        }
        log.debug("Copied avatar of group {} to {}", sourceGroup.fullPath(), destinationGroup.fullPath());
        return true;
    }

    public boolean copyProjectAvatar(GitLabInstance source, GitLabProject sourceProject,
                                     GitLabInstance destination, GitLabProject destinationProject) {
        if (destinationProject.hasAvatar() || !sourceProject.hasAvatar()) {
            return false;
        }
        try {
            byte[] avatar = source.getApi().downloadProjectAvatar(sourceProject.id());
            destination.getApi().uploadProjectAvatar(destinationProject.id(), avatar, filename());
        } catch (IOException e) {
            throw MirrorException.nonBlocking("Failed to copy avatar of project "
                    + sourceProject.pathWithNamespace(), e);
        }
        log.debug("Copied avatar of project {} to {}", sourceProject.pathWithNamespace(),
                destinationProject.pathWithNamespace());
        return true;
    }

    private String filename() {
        return "avatar-" + clock.instant().getEpochSecond() + ".png";
    }
}
