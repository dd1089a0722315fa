package org.rostilos.gitlabsync.engine.mirror;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.lib.Constants;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.rostilos.gitlabsync.engine.error.MirrorException;
import org.rostilos.gitlabsync.engine.mirror.GitMirrorEngine.GitMirrorResult;
import org.rostilos.gitlabsync.gittransport.GitCredentials;
import org.rostilos.gitlabsync.gittransport.GitTransport;
import org.rostilos.gitlabsync.gittransport.JGitTransport;
import org.rostilos.gitlabsync.gittransport.MirrorRepository;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GitMirrorEngineTest {

    private static final GitCredentials SOURCE = GitCredentials.ofToken("source-token");
    private static final GitCredentials DESTINATION = GitCredentials.ofToken("destination-token");

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("step order")
    class StepOrder {

        @Mock
        private GitTransport transport;

        @Test
        void shouldCloneAddRemotePushThenSetHead() throws IOException {
            MirrorRepository repository = mock(MirrorRepository.class);
            when(transport.mirrorClone("https://s/g/p.git", SOURCE)).thenReturn(repository);
            when(transport.readSymbolicHead(repository)).thenReturn("refs/heads/main");
            when(transport.writeSymbolicHead("https://d/g2/p.git", "refs/heads/main")).thenReturn(false);

            GitMirrorResult result = new GitMirrorEngine(transport)
                    .mirror("https://s/g/p.git", SOURCE, "https://d/g2/p.git", DESTINATION);

            assertThat(result).isEqualTo(new GitMirrorResult("refs/heads/main", false));
            InOrder order = inOrder(transport, repository);
            order.verify(transport).mirrorClone("https://s/g/p.git", SOURCE);
            order.verify(transport).addRemote(repository, GitMirrorEngine.DESTINATION_REMOTE, "https://d/g2/p.git");
            order.verify(transport).forcePushAllRefs(repository, GitMirrorEngine.DESTINATION_REMOTE, DESTINATION);
            order.verify(transport).readSymbolicHead(repository);
            order.verify(repository).close();
        }

        @Test
        @DisplayName("should report the failing step and still drop the scratch clone")
        void shouldReportFailingStep() throws IOException {
            MirrorRepository repository = mock(MirrorRepository.class);
            when(transport.mirrorClone(anyString(), any())).thenReturn(repository);
            doThrow(new IOException("rejected")).when(transport).forcePushAllRefs(any(), anyString(), any());

            GitMirrorEngine engine = new GitMirrorEngine(transport);

            assertThatThrownBy(() -> engine.mirror("https://s/g/p.git", SOURCE, "https://d/g2/p.git", DESTINATION))
                    .isInstanceOf(MirrorException.class)
                    .hasMessage("Git mirror of https://s/g/p.git failed at push")
                    .satisfies(e -> assertThat(((MirrorException) e).isBlocking()).isFalse());
            verify(repository).close();
            verify(transport, never()).readSymbolicHead(any());
        }

        @Test
        void shouldNotWriteHeadWhenSourceHasNone() throws IOException {
            MirrorRepository repository = mock(MirrorRepository.class);
            when(transport.mirrorClone(anyString(), any())).thenReturn(repository);

            GitMirrorResult result = new GitMirrorEngine(transport)
                    .mirror("https://s/g/p.git", SOURCE, "https://d/g2/p.git", DESTINATION);

            assertThat(result.head()).isNull();
            assertThat(result.headWritten()).isFalse();
            verify(transport, never()).writeSymbolicHead(anyString(), anyString());
        }
    }

    @Test
    @DisplayName("should mirror a local repository end to end")
    void shouldMirrorLocalRepository(@TempDir Path tempDir) throws Exception {
        Path sourceDir = tempDir.resolve("source");
        Path destinationDir = tempDir.resolve("destination.git");
        try (Git source = Git.init().setDirectory(sourceDir.toFile()).setInitialBranch("develop").call()) {
            Files.writeString(sourceDir.resolve("README.md"), "hello");
            source.add().addFilepattern("README.md").call();
            source.commit().setMessage("initial").setAuthor("Test", "test@example.com")
                    .setCommitter("Test", "test@example.com").call();
            source.tag().setName("v1.0.0").call();
        }
        Git.init().setBare(true).setDirectory(destinationDir.toFile()).setInitialBranch("main").call().close();

        GitMirrorResult result = new GitMirrorEngine(new JGitTransport(tempDir.resolve("scratch")))
                .mirror(sourceDir.toUri().toString(), GitCredentials.anonymous(),
                        destinationDir.toUri().toString(), GitCredentials.anonymous());

        assertThat(result.headWritten()).isTrue();
        try (Git destination = Git.open(destinationDir.toFile())) {
            assertThat(destination.getRepository().exactRef("refs/tags/v1.0.0")).isNotNull();
            assertThat(destination.getRepository().exactRef(Constants.HEAD).getTarget().getName())
                    .isEqualTo("refs/heads/develop");
        }
        try (var leftovers = Files.list(tempDir.resolve("scratch"))) {
            assertThat(leftovers).isEmpty();
        }
    }
}
