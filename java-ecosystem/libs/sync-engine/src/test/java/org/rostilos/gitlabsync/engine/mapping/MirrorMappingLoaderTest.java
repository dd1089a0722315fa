package org.rostilos.gitlabsync.engine.mapping;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.rostilos.gitlabsync.gitlabclient.model.Visibility;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MirrorMappingLoaderTest {

    private final MirrorMappingLoader loader = new MirrorMappingLoader();

    @Test
    @DisplayName("should read projects and groups with their options")
    void shouldReadMapping(@TempDir Path directory) throws IOException {
        Path file = directory.resolve("mapping.json");
        Files.writeString(file, """
                {
                  "projects": {
                    "g/p": {"destination_path": "g2/p", "visibility": "public", "issues": true,
                            "mirror_releases": true, "ci_cd_catalog": true}
                  },
                  "groups": {
                    "team": {"destination_path": "mirror/team", "mirror_trigger_builds": true}
                  }
                }
                """);

        MirrorMapping mapping = loader.load(file);

        MirrorOptions project = mapping.getProject("g/p");
        assertThat(project.destinationPath()).isEqualTo("g2/p");
        assertThat(project.visibility()).isEqualTo(Visibility.PUBLIC);
        assertThat(project.issues()).isTrue();
        assertThat(project.mirrorReleases()).isTrue();
        assertThat(project.ciCdCatalog()).isTrue();
        assertThat(project.mirrorTriggerBuilds()).isFalse();

        MirrorOptions group = mapping.getGroup("team");
        assertThat(group.destinationPath()).isEqualTo("mirror/team");
        assertThat(group.mirrorTriggerBuilds()).isTrue();
        assertThat(group.visibility()).isNull();
    }

    @Test
    @DisplayName("should accept mirror_issues as an alias of issues")
    void shouldAcceptIssuesAlias() {
        MirrorMapping mapping = loader.parse("""
                {"projects": {"g/p": {"destination_path": "g2/p", "mirror_issues": true}}}
                """);

        assertThat(mapping.getProject("g/p").issues()).isTrue();
    }

    @Test
    @DisplayName("should replace an invalid visibility with public without failing")
    void shouldDefaultInvalidVisibilityToPublic() {
        MirrorMapping mapping = loader.parse("""
                {"groups": {"g": {"destination_path": "g", "visibility": "secret"}}}
                """);

        assertThat(mapping.getGroup("g").visibility()).isEqualTo(Visibility.PUBLIC);
    }

    @Test
    @DisplayName("should report every problem of the file at once")
    void shouldReportAllProblems() {
        String json = """
                {
                  "projects": {
                    "/g/p": {"destination_path": "g2/p"},
                    "g/q": {"destination_path": "q"},
                    "g/r": {"destination_path": "g2/other"},
                    "h/p": {"destination_path": "g2/p"}
                  },
                  "groups": {
                    "team": {"destination_path": ""}
                  }
                }
                """;

        assertThatThrownBy(() -> loader.parse(json))
                .isInstanceOfSatisfying(MirrorMappingException.class, e -> assertThat(e.getProblems())
                        .anyMatch(p -> p.contains("must not start or end with /") && p.contains("/g/p"))
                        .anyMatch(p -> p.contains("must be in a namespace") && p.contains("q"))
                        .anyMatch(p -> p.contains("same base name") && p.contains("g/r"))
                        .anyMatch(p -> p.contains("duplicate destination path g2/p"))
                        .anyMatch(p -> p.contains("empty") && p.contains("team")));
    }

    @Test
    @DisplayName("should reject a mapping without any entry")
    void shouldRejectEmptyMapping() {
        assertThatThrownBy(() -> loader.parse("{}"))
                .isInstanceOf(MirrorMappingException.class)
                .hasMessageContaining("no projects or groups");
    }

    @Test
    @DisplayName("should reject malformed JSON and missing files")
    void shouldRejectUnreadableInput(@TempDir Path directory) {
        assertThatThrownBy(() -> loader.parse("{\"projects\": "))
                .isInstanceOf(MirrorMappingException.class)
                .hasMessageContaining("not valid JSON");
        assertThatThrownBy(() -> loader.load(directory.resolve("missing.json")))
                .isInstanceOf(MirrorMappingException.class)
                .hasMessageContaining("Cannot read mirror mapping");
    }
}
