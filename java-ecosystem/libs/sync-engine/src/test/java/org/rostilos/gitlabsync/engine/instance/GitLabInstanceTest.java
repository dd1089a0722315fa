package org.rostilos.gitlabsync.engine.instance;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.rostilos.gitlabsync.engine.error.MirrorException;
import org.rostilos.gitlabsync.gitlabclient.GitLabApi;
import org.rostilos.gitlabsync.gitlabclient.model.GitLabGroup;
import org.rostilos.gitlabsync.gitlabclient.model.GitLabUser;
import org.rostilos.gitlabsync.gitlabclient.model.Visibility;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GitLabInstanceTest {

    private static final InstanceSettings SETTINGS =
            new InstanceSettings("https://gitlab.example.com", "token", InstanceScale.SMALL);

    @Mock
    private GitLabApi api;

    @Test
    @DisplayName("should resolve the authenticated user when connecting")
    void shouldConnect() throws IOException {
        when(api.getCurrentUser()).thenReturn(new GitLabUser(42, "bot", "Bot"));

        GitLabInstance instance = GitLabInstance.connect(InstanceRole.SOURCE, SETTINGS, api);

        assertThat(instance.getUserId()).isEqualTo(42);
        assertThat(instance.isSource()).isTrue();
        assertThat(instance.getGitCredentials().token()).isEqualTo("token");
    }

    @Test
    @DisplayName("should fail the run when the user cannot be resolved")
    void shouldFailToConnect() throws IOException {
        when(api.getCurrentUser()).thenThrow(new IOException("401 Unauthorized"));

        assertThatThrownBy(() -> GitLabInstance.connect(InstanceRole.DESTINATION, SETTINGS, api))
                .isInstanceOfSatisfying(MirrorException.class, e -> assertThat(e.isBlocking()).isTrue());
    }

    @Test
    @DisplayName("should read a public source without token or user lookup")
    void shouldConnectAnonymously() {
        InstanceSettings anonymous = new InstanceSettings("https://gitlab.example.com", "", InstanceScale.SMALL);

        GitLabInstance instance = GitLabInstance.connect(InstanceRole.SOURCE, anonymous, api);

        assertThat(instance.getGitCredentials().isAnonymous()).isTrue();
        assertThatThrownBy(instance::getUserId).isInstanceOf(IllegalStateException.class);
        verifyNoInteractions(api);
    }

    @Test
    @DisplayName("should resolve no parent for a top-level path")
    void shouldResolveTopLevel() {
        GitLabInstance instance = instance(InstanceRole.DESTINATION);

        assertThat(instance.resolveParentId("top")).isEmpty();
        verifyNoInteractions(api);
    }

    @Test
    @DisplayName("should resolve the parent from the cache")
    void shouldResolveCachedParent() {
        GitLabInstance instance = instance(InstanceRole.DESTINATION);
        instance.putGroup(group(7, "a/b"));

        assertThat(instance.resolveParentId("a/b/c")).contains(7L);
        verifyNoInteractions(api);
    }

    @Test
    @DisplayName("should look up a destination parent that was not fetched and cache it")
    void shouldLookUpMissingDestinationParent() throws IOException {
        GitLabInstance instance = instance(InstanceRole.DESTINATION);
        when(api.getGroup("mirror")).thenReturn(group(3, "mirror"));

        assertThat(instance.resolveParentId("mirror/team")).contains(3L);
        assertThat(instance.getGroup("mirror")).isNotNull();
        verify(api).getGroup("mirror");
    }

    @Test
    @DisplayName("should fail when the parent group does not exist")
    void shouldFailOnMissingParent() throws IOException {
        GitLabInstance instance = instance(InstanceRole.DESTINATION);
        when(api.getGroup("missing")).thenReturn(null);

        assertThatThrownBy(() -> instance.resolveParentId("missing/p"))
                .isInstanceOfSatisfying(MirrorException.class, e -> assertThat(e.isBlocking()).isFalse())
                .hasMessageContaining("parent group not found for path missing/p");
    }

    @Test
    @DisplayName("should not query the source instance for parents")
    void shouldNotLookUpSourceParents() {
        GitLabInstance instance = instance(InstanceRole.SOURCE);

        assertThatThrownBy(() -> instance.resolveParentId("missing/p")).isInstanceOf(MirrorException.class);
        verifyNoInteractions(api);
    }

    private GitLabInstance instance(InstanceRole role) {
        return new GitLabInstance(role, SETTINGS, api, new GitLabUser(1, "bot", "Bot"));
    }

    static GitLabGroup group(long id, String fullPath) {
        String name = fullPath.substring(fullPath.lastIndexOf('/') + 1);
        return new GitLabGroup(id, name, name, fullPath, null, Visibility.PRIVATE, null, null, null);
    }
}
