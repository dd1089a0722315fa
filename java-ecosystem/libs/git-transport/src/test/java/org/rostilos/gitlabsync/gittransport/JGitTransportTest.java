package org.rostilos.gitlabsync.gittransport;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.Ref;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JGitTransport")
class JGitTransportTest {

    @TempDir
    Path tempDir;

    private Path sourceDir;
    private Path destinationDir;
    private Path scratchDir;
    private JGitTransport transport;

    @BeforeEach
    void setUp() throws Exception {
        sourceDir = tempDir.resolve("source");
        destinationDir = tempDir.resolve("destination.git");
        scratchDir = tempDir.resolve("scratch");

        try (Git source = Git.init().setDirectory(sourceDir.toFile()).setInitialBranch("main").call()) {
            Files.writeString(sourceDir.resolve("README.md"), "hello");
            source.add().addFilepattern("README.md").call();
            source.commit().setMessage("initial").setAuthor("Test", "test@example.com")
                    .setCommitter("Test", "test@example.com").call();
            source.tag().setName("v1.0.0").call();

            source.checkout().setCreateBranch(true).setName("feature").call();
            Files.writeString(sourceDir.resolve("feature.txt"), "feature");
            source.add().addFilepattern("feature.txt").call();
            source.commit().setMessage("feature").setAuthor("Test", "test@example.com")
                    .setCommitter("Test", "test@example.com").call();
            source.checkout().setName("main").call();
        }

        Git.init().setBare(true).setDirectory(destinationDir.toFile()).setInitialBranch("trunk").call().close();

        transport = new JGitTransport(scratchDir);
    }

    @Test
    @DisplayName("should copy every branch and tag and repair the destination HEAD")
    void shouldMirrorAllRefs() throws Exception {
        String destinationUrl = destinationDir.toUri().toString();

        try (MirrorRepository mirror = transport.mirrorClone(sourceDir.toUri().toString(), GitCredentials.anonymous())) {
            assertThat(mirror.getDirectory()).startsWith(scratchDir);

            transport.addRemote(mirror, "destination", destinationUrl);
            transport.forcePushAllRefs(mirror, "destination", GitCredentials.anonymous());

            String head = transport.readSymbolicHead(mirror);
            assertThat(head).isEqualTo("refs/heads/main");
            assertThat(transport.writeSymbolicHead(destinationUrl, head)).isTrue();
        }

        try (Git destination = Git.open(destinationDir.toFile())) {
            assertThat(destination.getRepository().exactRef("refs/heads/main")).isNotNull();
            assertThat(destination.getRepository().exactRef("refs/heads/feature")).isNotNull();
            assertThat(destination.getRepository().exactRef("refs/tags/v1.0.0")).isNotNull();

            Ref head = destination.getRepository().exactRef(Constants.HEAD);
            assertThat(head.isSymbolic()).isTrue();
            assertThat(head.getTarget().getName()).isEqualTo("refs/heads/main");
        }
    }

    @Test
    @DisplayName("should delete the scratch clone on close")
    void shouldDeleteScratchDirectoryOnClose() throws Exception {
        Path directory;
        try (MirrorRepository mirror = transport.mirrorClone(sourceDir.toUri().toString(), GitCredentials.anonymous())) {
            directory = mirror.getDirectory();
            assertThat(directory).exists();
        }
        assertThat(directory).doesNotExist();
    }

    @Test
    @DisplayName("should wrap clone failures into IOException and leave no scratch directory")
    void shouldWrapCloneFailure() throws IOException {
        String missing = tempDir.resolve("does-not-exist").toUri().toString();

        assertThatThrownBy(() -> transport.mirrorClone(missing, GitCredentials.anonymous()))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Failed to clone source repository");

        try (var entries = Files.list(scratchDir)) {
            assertThat(entries).isEmpty();
        }
    }

    @Test
    @DisplayName("should not touch HEAD of a remote destination")
    void shouldSkipRemoteDestination() throws IOException {
        assertThat(transport.writeSymbolicHead("https://gitlab.example.com/g/p.git", "refs/heads/main")).isFalse();
    }

    @Test
    @DisplayName("should mask the token and default the user")
    void shouldMaskToken() {
        GitCredentials credentials = new GitCredentials(" ", "secret");

        assertThat(credentials.username()).isEqualTo(GitCredentials.DEFAULT_GIT_USER);
        assertThat(credentials.toString()).doesNotContain("secret");
        assertThat(credentials.toCredentialsProvider()).isNotNull();
        assertThat(GitCredentials.anonymous().toCredentialsProvider()).isNull();
    }
}
