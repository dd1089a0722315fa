package org.rostilos.gitlabsync.gitlabclient;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.*;
import org.rostilos.gitlabsync.gitlabclient.dto.request.GroupCreateRequest;
import org.rostilos.gitlabsync.gitlabclient.dto.request.GroupUpdateRequest;
import org.rostilos.gitlabsync.gitlabclient.dto.request.ProjectCreateRequest;
import org.rostilos.gitlabsync.gitlabclient.dto.request.ProjectUpdateRequest;
import org.rostilos.gitlabsync.gitlabclient.dto.request.PullMirrorRequest;
import org.rostilos.gitlabsync.gitlabclient.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * GitLabApi implementation over the REST v4 API and the GraphQL endpoint.
 * Authentication is expected to be applied by the supplied OkHttpClient.
 */
public class GitLabClient implements GitLabApi {

    private static final Logger log = LoggerFactory.getLogger(GitLabClient.class);

    private static final int DEFAULT_PAGE_SIZE = GitLabConfig.DEFAULT_PAGE_SIZE;
    private static final MediaType JSON_MEDIA_TYPE = MediaType.parse("application/json");
    private static final MediaType PNG_MEDIA_TYPE = MediaType.parse("image/png");

    private static final String ACCEPT_HEADER = "Accept";
    private static final String GITLAB_ACCEPT_HEADER = "application/json";

    private static final String CATALOG_MUTATION =
            "mutation { catalogResourcesCreate(input: { projectPath: \"%s\" }) { errors } }";

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiUrl;
    private final String graphqlUrl;

    public GitLabClient(OkHttpClient httpClient, String instanceUrl) {
        if (instanceUrl == null || instanceUrl.isBlank()) {
            throw new IllegalArgumentException("GitLab instance URL cannot be null or empty");
        }
        String base = instanceUrl.endsWith("/") ? instanceUrl.substring(0, instanceUrl.length() - 1) : instanceUrl;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper();
        this.apiUrl = base + GitLabConfig.API_PATH;
        this.graphqlUrl = base + GitLabConfig.GRAPHQL_PATH;
    }

    @Override
    public GitLabUser getCurrentUser() throws IOException {
        Request request = createGetRequest(apiUrl + "/user");
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw createException("get current user", response);
            }
            return parseUser(objectMapper.readTree(response.body().string()));
        }
    }

    @Override
    public GitLabPage<GitLabGroup> listGroups(int page) throws IOException {
        String url = apiUrl + "/groups?all_available=true&per_page=" + DEFAULT_PAGE_SIZE + "&page=" + page;
        return fetchPage(url, page, "list groups", this::parseGroup);
    }

    @Override
    public GitLabPage<GitLabGroup> listSubgroups(long groupId, int page) throws IOException {
        String url = apiUrl + "/groups/" + groupId + "/subgroups?all_available=true&per_page=" + DEFAULT_PAGE_SIZE
                + "&page=" + page;
        return fetchPage(url, page, "list subgroups", this::parseGroup);
    }

    @Override
    public GitLabPage<GitLabProject> listGroupProjects(long groupId, int page) throws IOException {
        String url = apiUrl + "/groups/" + groupId + "/projects?archived=false&per_page=" + DEFAULT_PAGE_SIZE
                + "&page=" + page;
        return fetchPage(url, page, "list group projects", this::parseProject);
    }

    @Override
    public GitLabPage<GitLabProject> listProjects(int page) throws IOException {
        String url = apiUrl + "/projects?archived=false&include_hidden=false&include_pending_delete=false&per_page="
                + DEFAULT_PAGE_SIZE + "&page=" + page;
        return fetchPage(url, page, "list projects", this::parseProject);
    }

    @Override
    public GitLabGroup getGroup(String idOrPath) throws IOException {
        Request request = createGetRequest(apiUrl + "/groups/" + encode(idOrPath) + "?with_projects=false");
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                GitLabException failure = toGitLabException("get group", response);
                if (failure.isNotFound()) {
                    log.debug("Group {} not found", idOrPath);
                    return null;
                }
                throw wrap(failure);
            }
            return parseGroup(objectMapper.readTree(response.body().string()));
        }
    }

    @Override
    public GitLabProject getProject(String idOrPath) throws IOException {
        Request request = createGetRequest(apiUrl + "/projects/" + encode(idOrPath));
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                GitLabException failure = toGitLabException("get project", response);
                if (failure.isNotFound()) {
                    log.debug("Project {} not found", idOrPath);
                    return null;
                }
                throw wrap(failure);
            }
            return parseProject(objectMapper.readTree(response.body().string()));
        }
    }

    @Override
    public GitLabGroup createGroup(GroupCreateRequest group) throws IOException {
        Map<String, Object> payload = new HashMap<>();
        payload.put("name", group.name());
        payload.put("path", group.path());
        putIfNotNull(payload, "description", group.description());
        putIfNotNull(payload, "visibility", group.visibility() != null ? group.visibility().apiValue() : null);
        putIfNotNull(payload, "default_branch", group.defaultBranch());
        putIfNotNull(payload, "parent_id", group.parentId());

        Request request = createPostRequest(apiUrl + "/groups", objectMapper.writeValueAsString(payload));
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw createException("create group", response);
            }
            return parseGroup(objectMapper.readTree(response.body().string()));
        }
    }

    @Override
    public GitLabProject createProject(ProjectCreateRequest project) throws IOException {
        Map<String, Object> payload = new HashMap<>();
        payload.put("name", project.name());
        payload.put("path", project.path());
        payload.put("namespace_id", project.namespaceId());
        putIfNotNull(payload, "description", project.description());
        putIfNotNull(payload, "visibility", project.visibility() != null ? project.visibility().apiValue() : null);
        putIfNotNull(payload, "default_branch", project.defaultBranch());
        if (!project.topics().isEmpty()) {
            payload.put("topics", project.topics());
        }
        payload.put("mirror", project.mirror());
        payload.put("mirror_trigger_builds", project.mirrorTriggerBuilds());

        Request request = createPostRequest(apiUrl + "/projects", objectMapper.writeValueAsString(payload));
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw createException("create project", response);
            }
            return parseProject(objectMapper.readTree(response.body().string()));
        }
    }

    @Override
    public GitLabGroup updateGroup(long groupId, GroupUpdateRequest update) throws IOException {
        Request request = createPutRequest(apiUrl + "/groups/" + groupId,
                objectMapper.writeValueAsString(update.toPayload()));
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw createException("update group", response);
            }
            return parseGroup(objectMapper.readTree(response.body().string()));
        }
    }

    @Override
    public GitLabProject updateProject(long projectId, ProjectUpdateRequest update) throws IOException {
        Request request = createPutRequest(apiUrl + "/projects/" + projectId,
                objectMapper.writeValueAsString(update.toPayload()));
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw createException("update project", response);
            }
            return parseProject(objectMapper.readTree(response.body().string()));
        }
    }

    @Override
    public byte[] downloadGroupAvatar(long groupId) throws IOException {
        return download(apiUrl + "/groups/" + groupId + "/avatar", "download group avatar");
    }

    @Override
    public void uploadGroupAvatar(long groupId, byte[] avatar, String filename) throws IOException {
        upload(apiUrl + "/groups/" + groupId, avatar, filename, "upload group avatar");
    }

    @Override
    public byte[] downloadProjectAvatar(long projectId) throws IOException {
        return download(apiUrl + "/projects/" + projectId + "/avatar", "download project avatar");
    }

    @Override
    public void uploadProjectAvatar(long projectId, byte[] avatar, String filename) throws IOException {
        upload(apiUrl + "/projects/" + projectId, avatar, filename, "upload project avatar");
    }

    @Override
    public void configurePullMirror(long projectId, PullMirrorRequest mirror) throws IOException {
        Map<String, Object> payload = new HashMap<>();
        payload.put("url", mirror.url());
        putIfNotNull(payload, "auth_user", mirror.authUser());
        putIfNotNull(payload, "auth_password", mirror.authPassword());
        payload.put("enabled", mirror.enabled());
        payload.put("only_mirror_protected_branches", mirror.onlyMirrorProtectedBranches());
        payload.put("mirror_overwrites_diverged_branches", mirror.mirrorOverwritesDivergedBranches());
        payload.put("mirror_trigger_builds", mirror.mirrorTriggerBuilds());

        Request request = createPutRequest(apiUrl + "/projects/" + projectId + "/mirror/pull",
                objectMapper.writeValueAsString(payload));
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw createException("configure pull mirror", response);
            }
        }
    }

    @Override
    public String getPlatformVersion() throws IOException {
        Request request = createGetRequest(apiUrl + "/metadata");
        try (Response response = httpClient.newCall(request).execute()) {
            if (response.isSuccessful()) {
                return getTextOrNull(objectMapper.readTree(response.body().string()), "version");
            }
            GitLabException failure = toGitLabException("get metadata", response);
            if (!failure.isNotFound()) {
                throw wrap(failure);
            }
        }

        // Instances older than 15.2 only expose /version
        Request fallback = createGetRequest(apiUrl + "/version");
        try (Response response = httpClient.newCall(fallback).execute()) {
            if (!response.isSuccessful()) {
                throw createException("get version", response);
            }
            return getTextOrNull(objectMapper.readTree(response.body().string()), "version");
        }
    }

    @Override
    public GitLabLicense getLicense() throws IOException {
        Request request = createGetRequest(apiUrl + "/license");
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw createException("get license", response);
            }
            JsonNode root = objectMapper.readTree(response.body().string());
            if (root == null || root.isNull()) {
                return new GitLabLicense(null, false);
            }
            return new GitLabLicense(getTextOrNull(root, "plan"), root.path("expired").asBoolean(false));
        }
    }

    @Override
    public List<GitLabRelease> listReleases(long projectId) throws IOException {
        return fetchAllPages(page -> apiUrl + "/projects/" + projectId + "/releases?per_page=" + DEFAULT_PAGE_SIZE
                + "&page=" + page, "list releases", this::parseRelease);
    }

    @Override
    public void createRelease(long projectId, GitLabRelease release) throws IOException {
        Map<String, Object> payload = new HashMap<>();
        payload.put("tag_name", release.tagName());
        putIfNotNull(payload, "name", release.name());
        putIfNotNull(payload, "description", release.description());
        putIfNotNull(payload, "released_at", release.releasedAt());

        Request request = createPostRequest(apiUrl + "/projects/" + projectId + "/releases",
                objectMapper.writeValueAsString(payload));
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw createException("create release", response);
            }
        }
    }

    @Override
    public List<GitLabIssue> listIssues(long projectId) throws IOException {
        return fetchAllPages(page -> apiUrl + "/projects/" + projectId + "/issues?scope=all&per_page="
                + DEFAULT_PAGE_SIZE + "&page=" + page, "list issues", this::parseIssue);
    }

    @Override
    public GitLabIssue createIssue(long projectId, GitLabIssue issue) throws IOException {
        Map<String, Object> payload = new HashMap<>();
        payload.put("title", issue.title());
        putIfNotNull(payload, "description", issue.description());
        if (!issue.labels().isEmpty()) {
            payload.put("labels", String.join(",", issue.labels()));
        }
        payload.put("confidential", issue.confidential());
        putIfNotNull(payload, "due_date", issue.dueDate());
        putIfNotNull(payload, "weight", issue.weight());
        putIfNotNull(payload, "issue_type", issue.issueType());
        putIfNotNull(payload, "created_at", issue.createdAt());

        Request request = createPostRequest(apiUrl + "/projects/" + projectId + "/issues",
                objectMapper.writeValueAsString(payload));
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw createException("create issue", response);
            }
            return parseIssue(objectMapper.readTree(response.body().string()));
        }
    }

    @Override
    public void closeIssue(long projectId, long issueIid) throws IOException {
        Map<String, Object> payload = Map.of("state_event", "close");
        Request request = createPutRequest(apiUrl + "/projects/" + projectId + "/issues/" + issueIid,
                objectMapper.writeValueAsString(payload));
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw createException("close issue", response);
            }
        }
    }

    @Override
    public void addGroupMember(long groupId, long userId, int accessLevel) throws IOException {
        addMember(apiUrl + "/groups/" + groupId + "/members", userId, accessLevel, "add group member");
    }

    @Override
    public void addProjectMember(long projectId, long userId, int accessLevel) throws IOException {
        addMember(apiUrl + "/projects/" + projectId + "/members", userId, accessLevel, "add project member");
    }

    @Override
    public void addToCatalog(String projectPath) throws IOException {
        String escapedPath = projectPath.replace("\\", "\\\\").replace("\"", "\\\"");
        Map<String, Object> payload = Map.of("query", String.format(CATALOG_MUTATION, escapedPath));

        Request request = createPostRequest(graphqlUrl, objectMapper.writeValueAsString(payload));
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw createException("add to CI/CD catalog", response);
            }
            String body = response.body().string();
            JsonNode root = objectMapper.readTree(body);

            JsonNode topLevelErrors = root.path("errors");
            JsonNode mutationErrors = root.path("data").path("catalogResourcesCreate").path("errors");
            if (hasElements(topLevelErrors) || hasElements(mutationErrors)) {
                throw wrap(new GitLabException("add to CI/CD catalog", response.code(), body));
            }
        }
    }

    private void addMember(String url, long userId, int accessLevel, String operation) throws IOException {
        Map<String, Object> payload = new HashMap<>();
        payload.put("user_id", userId);
        payload.put("access_level", accessLevel);

        Request request = createPostRequest(url, objectMapper.writeValueAsString(payload));
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                GitLabException failure = toGitLabException(operation, response);
                if (failure.isConflict()) {
                    log.debug("User {} is already a member ({})", userId, url);
                    return;
                }
                throw wrap(failure);
            }
        }
    }

    private byte[] download(String url, String operation) throws IOException {
        Request request = createGetRequest(url);
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw createException(operation, response);
            }
            return response.body().bytes();
        }
    }

    private void upload(String url, byte[] avatar, String filename, String operation) throws IOException {
        RequestBody body = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("avatar", filename, RequestBody.create(avatar, PNG_MEDIA_TYPE))
                .build();
        Request request = new Request.Builder()
                .url(url)
                .header(ACCEPT_HEADER, GITLAB_ACCEPT_HEADER)
                .put(body)
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw createException(operation, response);
            }
        }
    }

    private <T> GitLabPage<T> fetchPage(String url, int requestedPage, String operation,
                                        Function<JsonNode, T> parser) throws IOException {
        Request request = createGetRequest(url);
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw createException(operation, response);
            }

            JsonNode root = objectMapper.readTree(response.body().string());
            List<T> items = new ArrayList<>();
            if (root != null && root.isArray()) {
                for (JsonNode node : root) {
                    items.add(parser.apply(node));
                }
            }

            int currentPage = parseIntHeader(response, "X-Page", requestedPage);
            // GitLab omits X-Total-Pages on very large collections
            String nextPage = response.header("X-Next-Page");
            boolean hasNext = nextPage != null && !nextPage.isBlank();
            int totalPages = parseIntHeader(response, "X-Total-Pages", hasNext ? currentPage + 1 : currentPage);

            return new GitLabPage<>(items, currentPage, totalPages);
        }
    }

    private <T> List<T> fetchAllPages(Function<Integer, String> urlForPage, String operation,
                                      Function<JsonNode, T> parser) throws IOException {
        List<T> all = new ArrayList<>();
        int page = 1;
        while (true) {
            GitLabPage<T> current = fetchPage(urlForPage.apply(page), page, operation, parser);
            all.addAll(current.items());
            if (current.isLastPage()) {
                break;
            }
            page = current.nextPage();
        }
        return all;
    }

    private int parseIntHeader(Response response, String header, int fallback) {
        String value = response.header(header);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed {} header: {}", header, value);
            return fallback;
        }
    }

    private GitLabUser parseUser(JsonNode node) {
        return new GitLabUser(
                node.get("id").asLong(),
                getTextOrNull(node, "username"),
                getTextOrNull(node, "name")
        );
    }

    private GitLabGroup parseGroup(JsonNode node) {
        Long parentId = node.has("parent_id") && !node.get("parent_id").isNull()
                ? node.get("parent_id").asLong()
                : null;
        return new GitLabGroup(
                node.get("id").asLong(),
                getTextOrNull(node, "name"),
                getTextOrNull(node, "path"),
                getTextOrNull(node, "full_path"),
                getTextOrNull(node, "description"),
                Visibility.fromApiValue(getTextOrNull(node, "visibility")),
                getTextOrNull(node, "default_branch"),
                getTextOrNull(node, "avatar_url"),
                parentId
        );
    }

    private GitLabProject parseProject(JsonNode node) {
        Long namespaceId = null;
        JsonNode namespace = node.get("namespace");
        if (namespace != null && namespace.has("id")) {
            namespaceId = namespace.get("id").asLong();
        }
        return new GitLabProject(
                node.get("id").asLong(),
                getTextOrNull(node, "name"),
                getTextOrNull(node, "path"),
                getTextOrNull(node, "path_with_namespace"),
                getTextOrNull(node, "description"),
                Visibility.fromApiValue(getTextOrNull(node, "visibility")),
                getTextOrNull(node, "default_branch"),
                parseStringArray(node.get("topics")),
                getTextOrNull(node, "avatar_url"),
                getTextOrNull(node, "http_url_to_repo"),
                namespaceId,
                node.path("archived").asBoolean(false),
                node.path("mirror").asBoolean(false),
                node.path("mirror_trigger_builds").asBoolean(false),
                node.path("mirror_overwrites_diverged_branches").asBoolean(false)
        );
    }

    private GitLabRelease parseRelease(JsonNode node) {
        return new GitLabRelease(
                getTextOrNull(node, "name"),
                getTextOrNull(node, "tag_name"),
                getTextOrNull(node, "description"),
                getTextOrNull(node, "released_at")
        );
    }

    private GitLabIssue parseIssue(JsonNode node) {
        Integer weight = node.has("weight") && !node.get("weight").isNull() ? node.get("weight").asInt() : null;
        return new GitLabIssue(
                node.path("iid").asLong(),
                getTextOrNull(node, "title"),
                getTextOrNull(node, "description"),
                parseStringArray(node.get("labels")),
                node.path("confidential").asBoolean(false),
                getTextOrNull(node, "due_date"),
                weight,
                getTextOrNull(node, "issue_type"),
                getTextOrNull(node, "created_at"),
                getTextOrNull(node, "state")
        );
    }

    private List<String> parseStringArray(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            for (JsonNode value : node) {
                values.add(value.asText());
            }
        }
        return values;
    }

    private boolean hasElements(JsonNode node) {
        return node != null && node.isArray() && !node.isEmpty();
    }

    private String getTextOrNull(JsonNode node, String field) {
        return node.has(field) && !node.get(field).isNull() ? node.get(field).asText() : null;
    }

    private void putIfNotNull(Map<String, Object> payload, String key, Object value) {
        if (value != null) {
            payload.put(key, value);
        }
    }

    private String encode(String idOrPath) {
        return URLEncoder.encode(idOrPath, StandardCharsets.UTF_8);
    }

    private IOException createException(String operation, Response response) throws IOException {
        return wrap(toGitLabException(operation, response));
    }

    private GitLabException toGitLabException(String operation, Response response) throws IOException {
        String body = response.body() != null ? response.body().string() : "";
        return new GitLabException(operation, response.code(), body);
    }

    private static IOException wrap(GitLabException failure) {
        return new IOException(failure.getMessage(), failure);
    }

    private Request createPostRequest(String url, String jsonBody) {
        return new Request.Builder()
                .url(url)
                .header(ACCEPT_HEADER, GITLAB_ACCEPT_HEADER)
                .post(RequestBody.create(jsonBody, JSON_MEDIA_TYPE))
                .build();
    }

    private Request createPutRequest(String url, String jsonBody) {
        return new Request.Builder()
                .url(url)
                .header(ACCEPT_HEADER, GITLAB_ACCEPT_HEADER)
                .put(RequestBody.create(jsonBody, JSON_MEDIA_TYPE))
                .build();
    }

    private Request createGetRequest(String url) {
        return new Request.Builder()
                .url(url)
                .header(ACCEPT_HEADER, GITLAB_ACCEPT_HEADER)
                .get()
                .build();
    }
}
