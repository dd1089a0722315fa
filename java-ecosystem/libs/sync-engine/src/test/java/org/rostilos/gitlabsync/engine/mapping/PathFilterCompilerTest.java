package org.rostilos.gitlabsync.engine.mapping;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.rostilos.gitlabsync.engine.instance.InstanceRole;
import org.rostilos.gitlabsync.engine.mapping.PathFilters.PathMatch;

import java.util.Map;
import java.util.concurrent.ForkJoinPool;

import static org.assertj.core.api.Assertions.assertThat;

class PathFilterCompilerTest {

    private final PathFilterCompiler compiler = new PathFilterCompiler(ForkJoinPool.commonPool());

    private final MirrorMapping mapping = new MirrorMapping(
            Map.of("g/p", MirrorOptions.toDestination("g2/sub/p"),
                    "top/q", MirrorOptions.toDestination("other/q")),
            Map.of("g1", MirrorOptions.toDestination("d1"),
                    "g1/deep", MirrorOptions.toDestination("x/deep")));

    @Test
    @DisplayName("should build source and destination sets")
    void shouldCompileSets() {
        PathFilters filters = compiler.compile(mapping);

        assertThat(filters.sourceProjects()).containsExactlyInAnyOrder("g/p", "top/q");
        assertThat(filters.sourceGroups()).containsExactlyInAnyOrder("g1", "g1/deep");
        assertThat(filters.destinationProjects()).containsExactlyInAnyOrder("g2/sub/p", "other/q");
        assertThat(filters.destinationMappedGroups()).containsExactlyInAnyOrder("d1", "x/deep");
    }

    @Test
    @DisplayName("should add every project namespace to the destination groups")
    void shouldSeedProjectNamespaces() {
        PathFilters filters = compiler.compile(mapping);

        assertThat(filters.destinationGroups()).containsExactlyInAnyOrder("d1", "x/deep", "g2/sub", "other");
    }

    @Test
    @DisplayName("should match discovered paths against the deepest declared group")
    void shouldMatchDeepestGroup() {
        PathFilters filters = compiler.compile(mapping);

        assertThat(filters.matchProject(InstanceRole.SOURCE, "g/p").kind()).isEqualTo(PathMatch.Kind.EXACT);
        assertThat(filters.matchProject(InstanceRole.SOURCE, "g1/sub/proj").originGroup()).isEqualTo("g1");
        assertThat(filters.matchProject(InstanceRole.SOURCE, "g1/deep/proj").originGroup()).isEqualTo("g1/deep");
        assertThat(filters.matchGroup(InstanceRole.SOURCE, "g1").kind()).isEqualTo(PathMatch.Kind.EXACT);
        assertThat(filters.matchGroup(InstanceRole.SOURCE, "g10").matched()).isFalse();
        assertThat(filters.matchProject(InstanceRole.DESTINATION, "d1/a/b").originGroup()).isEqualTo("d1");
    }
}
