package org.rostilos.gitlabsync.engine.mapping;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class MirrorMappingTest {

    @Test
    @DisplayName("should add a derived entry exactly once under concurrent discovery")
    void shouldAddOnceConcurrently() {
        MirrorMapping mapping = new MirrorMapping();
        AtomicInteger added = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<CompletableFuture<Void>> futures = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                String destination = "d1/sub-" + i;
                futures.add(CompletableFuture.runAsync(() -> {
                    if (mapping.addGroupIfAbsent("g1/sub", MirrorOptions.toDestination(destination))) {
                        added.incrementAndGet();
                    }
                }, executor));
            }
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new)).join();
        } finally {
            executor.shutdown();
        }

        assertThat(added).hasValue(1);
        assertThat(mapping.groupCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("should return sorted snapshots")
    void shouldSnapshotSorted() {
        MirrorMapping mapping = new MirrorMapping();
        mapping.addProject("b/p", MirrorOptions.toDestination("x/p"));
        mapping.addProject("a/p", MirrorOptions.toDestination("y/p"));

        assertThat(mapping.projectsSnapshot().keySet()).containsExactly("a/p", "b/p");
    }

    @Test
    @DisplayName("should tell declared entries from derived ones")
    void shouldTrackDeclaredEntries() {
        MirrorMapping mapping = new MirrorMapping(Map.of(), Map.of("g1", MirrorOptions.toDestination("d1")));
        mapping.addGroupIfAbsent("g1/sub", MirrorOptions.toDestination("d1/sub"));
        mapping.addProject("solo/p", MirrorOptions.toDestination("x/p"));

        assertThat(mapping.isDeclaredGroup("g1")).isTrue();
        assertThat(mapping.isDeclaredGroup("g1/sub")).isFalse();
        assertThat(mapping.isDeclaredProject("solo/p")).isTrue();
        assertThat(mapping.isDeclaredProject("g1")).isFalse();
    }
}
