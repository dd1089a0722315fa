package org.rostilos.gitlabsync.gitlabclient.dto.request;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.rostilos.gitlabsync.gitlabclient.model.Visibility;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ProjectUpdateRequest")
class ProjectUpdateRequestTest {

    @Test
    @DisplayName("should be empty when nothing was set")
    void shouldBeEmptyWhenNothingSet() {
        ProjectUpdateRequest update = ProjectUpdateRequest.builder().build();

        assertThat(update.isEmpty()).isTrue();
        assertThat(update.toPayload()).isEmpty();
    }

    @Test
    @DisplayName("should map set fields to GitLab attribute names")
    void shouldMapFieldsToAttributeNames() {
        ProjectUpdateRequest update = ProjectUpdateRequest.builder()
                .defaultBranch("main")
                .topics(List.of("a", "b"))
                .visibility(Visibility.PRIVATE)
                .mirrorOverwritesDivergedBranches(true)
                .build();

        assertThat(update.changedFieldCount()).isEqualTo(4);
        assertThat(update.toPayload())
                .containsEntry("default_branch", "main")
                .containsEntry("topics", List.of("a", "b"))
                .containsEntry("visibility", "private")
                .containsEntry("mirror_overwrites_diverged_branches", true)
                .doesNotContainKey("name");
    }

    @Test
    @DisplayName("should keep an explicit empty description")
    void shouldKeepEmptyDescription() {
        GroupUpdateRequest update = new GroupUpdateRequest(null, "", null);

        assertThat(update.isEmpty()).isFalse();
        assertThat(update.toPayload()).containsEntry("description", "");
    }
}
