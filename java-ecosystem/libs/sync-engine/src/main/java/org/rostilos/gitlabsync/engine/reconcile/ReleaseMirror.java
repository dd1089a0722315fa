package org.rostilos.gitlabsync.engine.reconcile;

import org.rostilos.gitlabsync.engine.error.MirrorException;
import org.rostilos.gitlabsync.engine.instance.GitLabInstance;
import org.rostilos.gitlabsync.gitlabclient.model.GitLabProject;
import org.rostilos.gitlabsync.gitlabclient.model.GitLabRelease;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Copies releases, matched by tag name. Must run once the repository content is on the destination,
 * since a release needs its tag.
 */
public class ReleaseMirror {

    private static final Logger log = LoggerFactory.getLogger(ReleaseMirror.class);

    /**
     * Source releases whose tag has no release on the destination yet. Read only.
     */
    public List<GitLabRelease> missingReleases(GitLabInstance source, GitLabProject sourceProject,
                                               GitLabInstance destination, GitLabProject destinationProject) {
        try {
            Set<String> existingTags = new HashSet<>();
            if (destinationProject != null) {
                destination.getApi().listReleases(destinationProject.id())
                        .forEach(release -> existingTags.add(release.tagName()));
            }
            List<GitLabRelease> missing = new ArrayList<>();
            for (GitLabRelease release : source.getApi().listReleases(sourceProject.id())) {
                if (existingTags.add(release.tagName())) {
                    missing.add(release);
                }
            }
            return missing;
        } catch (IOException e) {
            throw MirrorException.nonBlocking("Failed to list releases of " + sourceProject.pathWithNamespace(), e);
        }
    }

    /**
     * @return one error per release that could not be created
     */
    public List<Throwable> mirror(GitLabInstance source, GitLabProject sourceProject,
                                  GitLabInstance destination, GitLabProject destinationProject) {
        List<Throwable> errors = new ArrayList<>();
        int created = 0;
        for (GitLabRelease release : missingReleases(source, sourceProject, destination, destinationProject)) {
            try {
                destination.getApi().createRelease(destinationProject.id(), release);
                created++;
            } catch (IOException e) {
                errors.add(MirrorException.nonBlocking("Failed to create release " + release.tagName() + " in "
                        + destinationProject.pathWithNamespace(), e));
            }
        }
        if (created > 0) {
            log.info("Copied {} release(s) from {} to {}", created, sourceProject.pathWithNamespace(),
                    destinationProject.pathWithNamespace());
        }
        return errors;
    }
}
