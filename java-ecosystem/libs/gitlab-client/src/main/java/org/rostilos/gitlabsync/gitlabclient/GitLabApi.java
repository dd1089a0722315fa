package org.rostilos.gitlabsync.gitlabclient;

import org.rostilos.gitlabsync.gitlabclient.dto.request.GroupCreateRequest;
import org.rostilos.gitlabsync.gitlabclient.dto.request.GroupUpdateRequest;
import org.rostilos.gitlabsync.gitlabclient.dto.request.ProjectCreateRequest;
import org.rostilos.gitlabsync.gitlabclient.dto.request.ProjectUpdateRequest;
import org.rostilos.gitlabsync.gitlabclient.dto.request.PullMirrorRequest;
import org.rostilos.gitlabsync.gitlabclient.model.*;

import java.io.IOException;
import java.util.List;

/**
 * Operations the synchronization engine needs from one GitLab instance.
 * All paginated listings are page-number based and report the total page count.
 */
public interface GitLabApi {

    /**
     * Get the user the configured token authenticates as.
     * @return the current user
     */
    GitLabUser getCurrentUser() throws IOException;

    /**
     * List every group visible to the token.
     * @param page page number (1-based)
     */
    GitLabPage<GitLabGroup> listGroups(int page) throws IOException;

    /**
     * List the direct subgroups of a group.
     * @param groupId numeric group id
     * @param page page number (1-based)
     */
    GitLabPage<GitLabGroup> listSubgroups(long groupId, int page) throws IOException;

    /**
     * List the projects held directly by a group.
     * @param groupId numeric group id
     * @param page page number (1-based)
     */
    GitLabPage<GitLabProject> listGroupProjects(long groupId, int page) throws IOException;

    /**
     * List every non-archived project visible to the token.
     * @param page page number (1-based)
     */
    GitLabPage<GitLabProject> listProjects(int page) throws IOException;

    /**
     * Get a group by numeric id or full path.
     * @return the group, or null if it does not exist
     */
    GitLabGroup getGroup(String idOrPath) throws IOException;

    /**
     * Get a project by numeric id or full path.
     * @return the project, or null if it does not exist
     */
    GitLabProject getProject(String idOrPath) throws IOException;

    GitLabGroup createGroup(GroupCreateRequest request) throws IOException;

    GitLabProject createProject(ProjectCreateRequest request) throws IOException;

    GitLabGroup updateGroup(long groupId, GroupUpdateRequest request) throws IOException;

    GitLabProject updateProject(long projectId, ProjectUpdateRequest request) throws IOException;

    byte[] downloadGroupAvatar(long groupId) throws IOException;

    void uploadGroupAvatar(long groupId, byte[] avatar, String filename) throws IOException;

    byte[] downloadProjectAvatar(long projectId) throws IOException;

    void uploadProjectAvatar(long projectId, byte[] avatar, String filename) throws IOException;

    /**
     * Configure the native pull mirror of a project (GitLab 17.6+).
     */
    void configurePullMirror(long projectId, PullMirrorRequest request) throws IOException;

    /**
     * Get the GitLab version string, e.g. "17.6.1-ee".
     */
    String getPlatformVersion() throws IOException;

    GitLabLicense getLicense() throws IOException;

    /**
     * List every release of a project, all pages included.
     */
    List<GitLabRelease> listReleases(long projectId) throws IOException;

    void createRelease(long projectId, GitLabRelease release) throws IOException;

    /**
     * List every issue of a project, all pages included.
     */
    List<GitLabIssue> listIssues(long projectId) throws IOException;

    /**
     * Create an issue.
     * @return the created issue, carrying the destination iid
     */
    GitLabIssue createIssue(long projectId, GitLabIssue issue) throws IOException;

    void closeIssue(long projectId, long issueIid) throws IOException;

    /**
     * Add a user to a group. An existing membership is not an error.
     */
    void addGroupMember(long groupId, long userId, int accessLevel) throws IOException;

    /**
     * Add a user to a project. An existing membership is not an error.
     */
    void addProjectMember(long projectId, long userId, int accessLevel) throws IOException;

    /**
     * Register a project as a CI/CD catalog resource.
     * @param projectPath full path of the project
     */
    void addToCatalog(String projectPath) throws IOException;
}
