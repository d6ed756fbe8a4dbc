package com.wavesmith.core.scheduler;

import com.wavesmith.core.graph.ArtifactGraph;
import com.wavesmith.core.graph.ArtifactSpec;
import com.wavesmith.core.model.ModelTier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ModelTierSelectorTest {

    private final ArtifactGraph graph = ArtifactGraph.of(List.of(
            ArtifactSpec.of("a", "A"),
            ArtifactSpec.of("b", "B"),
            ArtifactSpec.of("c", "C"),
            ArtifactSpec.of("pair", "two deps", "a", "b"),
            ArtifactSpec.of("hub", "three deps", "a", "b", "c")
    ));

    @Test
    @DisplayName("leaves run on the small tier")
    void leavesAreSmall() {
        assertEquals(ModelTier.SMALL, ModelTierSelector.select(graph.get("a"), graph));
    }

    @Test
    @DisplayName("fan-in up to two runs on the medium tier")
    void lowFanInIsMedium() {
        assertEquals(ModelTier.MEDIUM, ModelTierSelector.select(graph.get("pair"), graph));
    }

    @Test
    @DisplayName("wider fan-in runs on the large tier")
    void highFanInIsLarge() {
        assertEquals(ModelTier.LARGE, ModelTierSelector.select(graph.get("hub"), graph));
    }

    @Test
    @DisplayName("distribution counts every tier")
    void distribution() {
        var counts = ModelTierSelector.distribution(graph);
        assertEquals(3, counts.get(ModelTier.SMALL));
        assertEquals(1, counts.get(ModelTier.MEDIUM));
        assertEquals(1, counts.get(ModelTier.LARGE));
    }
}
