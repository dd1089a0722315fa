package org.rostilos.gitlabsync.engine.instance;

import org.rostilos.gitlabsync.engine.error.MirrorException;
import org.rostilos.gitlabsync.engine.mapping.MappingPaths;
import org.rostilos.gitlabsync.gitlabclient.GitLabApi;
import org.rostilos.gitlabsync.gitlabclient.model.GitLabGroup;
import org.rostilos.gitlabsync.gitlabclient.model.GitLabProject;
import org.rostilos.gitlabsync.gitlabclient.model.GitLabUser;
import org.rostilos.gitlabsync.gittransport.GitCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * One connected GitLab instance of a run and the groups and projects discovered on it, keyed by full path.
 * Both caches are filled concurrently by the fetch pipeline and updated by the reconcilers.
 */
public class GitLabInstance {

    private static final Logger log = LoggerFactory.getLogger(GitLabInstance.class);

    private final InstanceRole role;
    private final InstanceSettings settings;
    private final GitLabApi api;
    private final GitLabUser user;
    private final GitCredentials gitCredentials;

    private final Map<String, GitLabGroup> groups = new HashMap<>();
    private final Map<String, GitLabProject> projects = new HashMap<>();
    private final ReentrantReadWriteLock groupsLock = new ReentrantReadWriteLock();
    private final ReentrantReadWriteLock projectsLock = new ReentrantReadWriteLock();

    public GitLabInstance(InstanceRole role, InstanceSettings settings, GitLabApi api, GitLabUser user) {
        this.role = role;
        this.settings = settings;
        this.api = api;
        this.user = user;
        this.gitCredentials = settings.isAnonymous()
                ? GitCredentials.anonymous()
                : GitCredentials.ofToken(settings.token());
    }

    /**
     * Authenticate against the instance. An instance without token is used anonymously, which only
     * works for reading public resources.
     *
     * @throws MirrorException (blocking) when the current user cannot be resolved
     */
    public static GitLabInstance connect(InstanceRole role, InstanceSettings settings, GitLabApi api) {
        if (settings.isAnonymous()) {
            log.info("Using {} instance {} anonymously", describe(role), settings.url());
            return new GitLabInstance(role, settings, api, null);
        }
        GitLabUser user;
        try {
            user = api.getCurrentUser();
        } catch (IOException | RuntimeException e) {
            throw MirrorException.blocking("Failed to connect to " + describe(role) + " instance "
                    + settings.url(), e);
        }
        log.info("Connected to {} instance {} as {}", describe(role), settings.url(), user.username());
        return new GitLabInstance(role, settings, api, user);
    }

    public InstanceRole getRole() {
        return role;
    }

    public InstanceScale getScale() {
        return settings.scale();
    }

    public boolean isSource() {
        return role == InstanceRole.SOURCE;
    }

    public boolean isBig() {
        return settings.scale() == InstanceScale.BIG;
    }

    public String getUrl() {
        return settings.url();
    }

    public GitLabApi getApi() {
        return api;
    }

    /**
     * @throws IllegalStateException for an anonymous instance
     */
    public long getUserId() {
        if (user == null) {
            throw new IllegalStateException(describe(role) + " instance " + settings.url() + " has no user");
        }
        return user.id();
    }

    public GitCredentials getGitCredentials() {
        return gitCredentials;
    }

    public void putGroup(GitLabGroup group) {
        groupsLock.writeLock().lock();
        try {
            groups.put(group.fullPath(), group);
        } finally {
            groupsLock.writeLock().unlock();
        }
    }

    /**
     * @return the cached group, or null if it was not discovered
     */
    public GitLabGroup getGroup(String path) {
        groupsLock.readLock().lock();
        try {
            return groups.get(path);
        } finally {
            groupsLock.readLock().unlock();
        }
    }

    public void putProject(GitLabProject project) {
        projectsLock.writeLock().lock();
        try {
            projects.put(project.pathWithNamespace(), project);
        } finally {
            projectsLock.writeLock().unlock();
        }
    }

    /**
     * @return the cached project, or null if it was not discovered
     */
    public GitLabProject getProject(String path) {
        projectsLock.readLock().lock();
        try {
            return projects.get(path);
        } finally {
            projectsLock.readLock().unlock();
        }
    }

    public Map<String, GitLabGroup> groupsSnapshot() {
        groupsLock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new TreeMap<>(groups));
        } finally {
            groupsLock.readLock().unlock();
        }
    }

    public Map<String, GitLabProject> projectsSnapshot() {
        projectsLock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new TreeMap<>(projects));
        } finally {
            projectsLock.readLock().unlock();
        }
    }

    /**
     * Numeric id of the group that must hold the resource at {@code path}.
     * The parent is looked up in the cache first. A destination instance also asks the API once, because
     * ancestors above the declared destinations are never fetched; a group found that way is cached.
     *
     * @return empty for a top-level path
     * @throws MirrorException (non-blocking) when the parent group does not exist
     */
    public Optional<Long> resolveParentId(String path) {
        String parentPath = MappingPaths.parentOf(path);
        if (parentPath.isEmpty()) {
            return Optional.empty();
        }
        GitLabGroup parent = getGroup(parentPath);
        if (parent == null && role == InstanceRole.DESTINATION) {
            parent = lookUpGroup(parentPath);
        }
        if (parent == null) {
            throw MirrorException.nonBlocking("parent group not found for path " + path);
        }
        return Optional.of(parent.id());
    }

    private GitLabGroup lookUpGroup(String path) {
        try {
            GitLabGroup group = api.getGroup(path);
            if (group != null) {
                log.debug("Resolved group {} on {} instance outside of the fetched set", path, describe(role));
                putGroup(group);
            }
            return group;
        } catch (IOException e) {
            throw MirrorException.nonBlocking("Failed to look up group " + path + " on " + describe(role)
                    + " instance", e);
        }
    }

    private static String describe(InstanceRole role) {
        return role == InstanceRole.SOURCE ? "source" : "destination";
    }

    @Override
    public String toString() {
        return describe(role) + " " + settings.url();
    }
}
