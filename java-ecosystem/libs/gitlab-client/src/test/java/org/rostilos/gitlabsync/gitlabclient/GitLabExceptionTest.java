package org.rostilos.gitlabsync.gitlabclient;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("GitLabException")
class GitLabExceptionTest {

    @Test
    @DisplayName("should format message with operation, status code and response")
    void shouldFormatMessageWithApiErrorDetails() {
        GitLabException exception = new GitLabException("create group", 400, "{\"message\":\"path taken\"}");

        assertThat(exception.getMessage()).isEqualTo("GitLab create group failed: 400 - {\"message\":\"path taken\"}");
        assertThat(exception.getStatusCode()).isEqualTo(400);
        assertThat(exception.getResponseBody()).contains("path taken");
    }

    @Test
    @DisplayName("should report not found and conflict")
    void shouldClassifyStatusCodes() {
        assertThat(new GitLabException("get group", 404, "").isNotFound()).isTrue();
        assertThat(new GitLabException("add member", 409, "").isConflict()).isTrue();
        assertThat(new GitLabException("get group", 500, "").isNotFound()).isFalse();
    }
}
