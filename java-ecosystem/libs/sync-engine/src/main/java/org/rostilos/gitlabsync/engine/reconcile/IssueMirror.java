package org.rostilos.gitlabsync.engine.reconcile;

import org.rostilos.gitlabsync.engine.error.MirrorException;
import org.rostilos.gitlabsync.engine.instance.GitLabInstance;
import org.rostilos.gitlabsync.gitlabclient.model.GitLabIssue;
import org.rostilos.gitlabsync.gitlabclient.model.GitLabProject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Copies the issues of a project. Issues are matched by title: a source issue whose title already exists
 * on the destination is not copied again, but the destination issue is closed when the source one is
 * closed and the destination one is still open.
 */
public class IssueMirror {

    private static final Logger log = LoggerFactory.getLogger(IssueMirror.class);

    /**
     * @return one error per issue that could not be copied or closed, empty when all went through
     * @throws MirrorException when the issues of either side cannot be listed
     */
    public List<Throwable> mirror(GitLabInstance source, GitLabProject sourceProject,
                                  GitLabInstance destination, GitLabProject destinationProject) {
        List<GitLabIssue> sourceIssues;
        Map<String, GitLabIssue> existingByTitle = new HashMap<>();
        try {
            sourceIssues = source.getApi().listIssues(sourceProject.id());
            for (GitLabIssue issue : destination.getApi().listIssues(destinationProject.id())) {
                existingByTitle.putIfAbsent(issue.title(), issue);
            }
        } catch (IOException e) {
            throw MirrorException.nonBlocking("Failed to list issues of " + sourceProject.pathWithNamespace()
                    + " or " + destinationProject.pathWithNamespace(), e);
        }

        List<Throwable> errors = new ArrayList<>();
        Set<String> seenTitles = new HashSet<>();
        int created = 0;
        int closed = 0;
        for (GitLabIssue issue : sourceIssues) {
            if (!seenTitles.add(issue.title())) {
                continue;
            }
            GitLabIssue existing = existingByTitle.get(issue.title());
            if (existing != null) {
                if (issue.isClosed() && !existing.isClosed()) {
                    closed += close(destination, destinationProject, existing, errors);
                }
                continue;
            }
            GitLabIssue copy;
            try {
                copy = destination.getApi().createIssue(destinationProject.id(), issue);
            } catch (IOException e) {
                errors.add(MirrorException.nonBlocking("Failed to copy issue '" + issue.title() + "' to "
                        + destinationProject.pathWithNamespace(), e));
                continue;
            }
            created++;
            if (issue.isClosed()) {
                closed += close(destination, destinationProject, copy, errors);
            }
        }
        if (created > 0 || closed > 0) {
            log.info("Copied {} and closed {} issue(s) from {} to {}", created, closed,
                    sourceProject.pathWithNamespace(), destinationProject.pathWithNamespace());
        }
        return errors;
    }

    private int close(GitLabInstance destination, GitLabProject destinationProject, GitLabIssue issue,
                      List<Throwable> errors) {
        try {
            destination.getApi().closeIssue(destinationProject.id(), issue.iid());
            return 1;
        } catch (IOException e) {
            errors.add(MirrorException.nonBlocking("Failed to close issue '" + issue.title() + "' of "
                    + destinationProject.pathWithNamespace(), e));
            return 0;
        }
    }
}
