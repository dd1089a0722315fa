package org.rostilos.gitlabsync.gitlabclient;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.rostilos.gitlabsync.gitlabclient.dto.request.ProjectCreateRequest;
import org.rostilos.gitlabsync.gitlabclient.dto.request.ProjectUpdateRequest;
import org.rostilos.gitlabsync.gitlabclient.dto.request.PullMirrorRequest;
import org.rostilos.gitlabsync.gitlabclient.model.*;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("GitLabClient against a stubbed GitLab")
class GitLabClientWireMockTest {

    private static final String TOKEN = "glpat-test";

    private WireMockServer server;
    private GitLabClient client;

    @BeforeEach
    void setUp() {
        server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();
        client = new GitLabHttpClientFactory().createGitLabClient(server.baseUrl(), TOKEN, Duration.ofSeconds(5), 2);
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Nested
    @DisplayName("pagination")
    class Pagination {

        @Test
        @DisplayName("should read current and total pages from headers")
        void shouldReadPageHeaders() throws IOException {
            server.stubFor(get(urlPathEqualTo("/api/v4/groups"))
                    .withQueryParam("page", equalTo("1"))
                    .withQueryParam("all_available", equalTo("true"))
                    .willReturn(aResponse()
                            .withStatus(200)
                            .withHeader("Content-Type", "application/json")
                            .withHeader("X-Page", "1")
                            .withHeader("X-Total-Pages", "2")
                            .withBody("""
                                [{"id": 1, "name": "Group", "path": "group", "full_path": "group", "visibility": "private"}]
                                """)));

            GitLabPage<GitLabGroup> page = client.listGroups(1);

            assertThat(page.items()).extracting(GitLabGroup::fullPath).containsExactly("group");
            assertThat(page.currentPage()).isEqualTo(1);
            assertThat(page.totalPages()).isEqualTo(2);
            assertThat(page.isLastPage()).isFalse();
        }

        @Test
        @DisplayName("should fall back to X-Next-Page when total pages are not reported")
        void shouldFallBackToNextPage() throws IOException {
            server.stubFor(get(urlPathEqualTo("/api/v4/projects"))
                    .willReturn(aResponse()
                            .withStatus(200)
                            .withHeader("Content-Type", "application/json")
                            .withHeader("X-Page", "3")
                            .withHeader("X-Next-Page", "")
                            .withBody("[]")));

            GitLabPage<GitLabProject> page = client.listProjects(3);

            assertThat(page.items()).isEmpty();
            assertThat(page.isLastPage()).isTrue();
        }

        @Test
        @DisplayName("should collect every page of releases")
        void shouldCollectAllReleasePages() throws IOException {
            server.stubFor(get(urlPathEqualTo("/api/v4/projects/5/releases"))
                    .withQueryParam("page", equalTo("1"))
                    .willReturn(aResponse()
                            .withStatus(200)
                            .withHeader("X-Page", "1")
                            .withHeader("X-Total-Pages", "2")
                            .withBody("""
                                [{"name": "v1", "tag_name": "v1.0.0", "description": "first", "released_at": "2024-01-01T00:00:00Z"}]
                                """)));
            server.stubFor(get(urlPathEqualTo("/api/v4/projects/5/releases"))
                    .withQueryParam("page", equalTo("2"))
                    .willReturn(aResponse()
                            .withStatus(200)
                            .withHeader("X-Page", "2")
                            .withHeader("X-Total-Pages", "2")
                            .withBody("""
                                [{"name": "v2", "tag_name": "v2.0.0", "description": null, "released_at": null}]
                                """)));

            List<GitLabRelease> releases = client.listReleases(5);

            assertThat(releases).extracting(GitLabRelease::tagName).containsExactly("v1.0.0", "v2.0.0");
        }
    }

    @Test
    @DisplayName("should send the bearer token on every call")
    void shouldSendBearerToken() throws IOException {
        server.stubFor(get(urlPathEqualTo("/api/v4/user"))
                .willReturn(okJson("""
                    {"id": 99, "username": "sync-bot", "name": "Sync Bot"}
                    """)));

        GitLabUser user = client.getCurrentUser();

        assertThat(user.id()).isEqualTo(99);
        server.verify(getRequestedFor(urlPathEqualTo("/api/v4/user"))
                .withHeader("Authorization", equalTo("Bearer " + TOKEN)));
    }

    @Test
    @DisplayName("should create a project in the given namespace")
    void shouldCreateProject() throws IOException {
        server.stubFor(post(urlPathEqualTo("/api/v4/projects"))
                .willReturn(aResponse()
                        .withStatus(201)
                        .withHeader("Content-Type", "application/json")
                        .withBody("""
                            {"id": 11, "name": "p", "path": "p", "path_with_namespace": "g2/p", "visibility": "public",
                             "namespace": {"id": 3}}
                            """)));

        GitLabProject created = client.createProject(new ProjectCreateRequest(
                "p", "p", "description", Visibility.PUBLIC, "main", List.of("a"), 3, true, false));

        assertThat(created.pathWithNamespace()).isEqualTo("g2/p");
        server.verify(postRequestedFor(urlPathEqualTo("/api/v4/projects"))
                .withRequestBody(matchingJsonPath("$.namespace_id", equalTo("3")))
                .withRequestBody(matchingJsonPath("$.visibility", equalTo("public")))
                .withRequestBody(matchingJsonPath("$.mirror", equalTo("true")))
                .withRequestBody(matchingJsonPath("$.default_branch", equalTo("main"))));
    }

    @Test
    @DisplayName("should only send changed project fields")
    void shouldSendPartialProjectUpdate() throws IOException {
        server.stubFor(put(urlPathEqualTo("/api/v4/projects/11"))
                .willReturn(okJson("""
                    {"id": 11, "name": "renamed", "path": "p", "path_with_namespace": "g2/p"}
                    """)));

        client.updateProject(11, ProjectUpdateRequest.builder().name("renamed").build());

        server.verify(putRequestedFor(urlPathEqualTo("/api/v4/projects/11"))
                .withRequestBody(equalToJson("{\"name\": \"renamed\"}")));
    }

    @Test
    @DisplayName("should configure the pull mirror with credentials")
    void shouldConfigurePullMirror() throws IOException {
        server.stubFor(put(urlPathEqualTo("/api/v4/projects/11/mirror/pull")).willReturn(okJson("{}")));

        client.configurePullMirror(11, new PullMirrorRequest(
                "https://source.example.com/g/p.git", "git", "secret", true, true, true, false));

        server.verify(putRequestedFor(urlPathEqualTo("/api/v4/projects/11/mirror/pull"))
                .withRequestBody(matchingJsonPath("$.url", equalTo("https://source.example.com/g/p.git")))
                .withRequestBody(matchingJsonPath("$.auth_password", equalTo("secret")))
                .withRequestBody(matchingJsonPath("$.only_mirror_protected_branches", equalTo("true")))
                .withRequestBody(matchingJsonPath("$.mirror_overwrites_diverged_branches", equalTo("true")))
                .withRequestBody(matchingJsonPath("$.mirror_trigger_builds", equalTo("false"))));
    }

    @Test
    @DisplayName("should upload the avatar as multipart form data")
    void shouldUploadAvatar() throws IOException {
        server.stubFor(put(urlPathEqualTo("/api/v4/groups/7")).willReturn(okJson("{\"id\": 7}")));

        client.uploadGroupAvatar(7, new byte[]{1, 2, 3}, "avatar-1.png");

        server.verify(putRequestedFor(urlPathEqualTo("/api/v4/groups/7"))
                .withAnyRequestBodyPart(aMultipart().withName("avatar")));
    }

    @Test
    @DisplayName("should treat an existing membership as success")
    void shouldIgnoreExistingMembership() {
        server.stubFor(post(urlPathEqualTo("/api/v4/groups/7/members"))
                .willReturn(aResponse().withStatus(409).withBody("{\"message\":\"Member already exists\"}")));

        assertThatCode(() -> client.addGroupMember(7, 99, GitLabConfig.OWNER_ACCESS_LEVEL))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("should read the version from /version when /metadata is missing")
    void shouldFallBackToVersionEndpoint() throws IOException {
        server.stubFor(get(urlPathEqualTo("/api/v4/metadata")).willReturn(aResponse().withStatus(404)));
        server.stubFor(get(urlPathEqualTo("/api/v4/version"))
                .willReturn(okJson("{\"version\": \"15.1.0-ee\", \"revision\": \"abc\"}")));

        assertThat(client.getPlatformVersion()).isEqualTo("15.1.0-ee");
    }

    @Test
    @DisplayName("should fail catalog registration when GraphQL reports errors")
    void shouldFailOnGraphQlErrors() {
        server.stubFor(post(urlPathEqualTo("/api/graphql"))
                .willReturn(okJson("""
                    {"data": {"catalogResourcesCreate": {"errors": ["Project must have a description"]}}}
                    """)));

        assertThatThrownBy(() -> client.addToCatalog("g2/p"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Project must have a description");

        server.verify(postRequestedFor(urlPathEqualTo("/api/graphql"))
                .withRequestBody(containing("catalogResourcesCreate"))
                .withRequestBody(containing("g2/p")));
    }

    @Test
    @DisplayName("should retry a server error and return the recovered response")
    void shouldRetryServerErrors() throws IOException {
        server.stubFor(get(urlPathEqualTo("/api/v4/license"))
                .inScenario("flaky")
                .whenScenarioStateIs(Scenario.STARTED)
                .willReturn(aResponse().withStatus(503))
                .willSetStateTo("recovered"));
        server.stubFor(get(urlPathEqualTo("/api/v4/license"))
                .inScenario("flaky")
                .whenScenarioStateIs("recovered")
                .willReturn(okJson("{\"plan\": \"premium\", \"expired\": false}")));

        GitLabLicense license = client.getLicense();

        assertThat(license.plan()).isEqualTo("premium");
        assertThat(license.expired()).isFalse();
        server.verify(2, getRequestedFor(urlPathEqualTo("/api/v4/license")));
    }
}
