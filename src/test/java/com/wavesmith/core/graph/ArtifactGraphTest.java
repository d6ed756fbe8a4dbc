package com.wavesmith.core.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ArtifactGraph}.
 */
class ArtifactGraphTest {

    /** schema <- model <- api, the canonical three-layer graph. */
    private static ArtifactGraph threeLayer() {
        return ArtifactGraph.of(List.of(
                ArtifactSpec.of("schema", "Database schema"),
                ArtifactSpec.of("model", "Domain model", "schema"),
                ArtifactSpec.of("api", "REST api", "model")
        ));
    }

    private static final int CHAIN_LENGTH = 20_000;

    private static String node(int i) {
        return "n" + i;
    }

    // -- Construction -----------------------------------------------------------

    @Nested
    @DisplayName("construction")
    class Construction {

        @Test
        @DisplayName("rejects duplicate ids")
        void rejectsDuplicateIds() {
            var graph = new ArtifactGraph();
            graph.add(ArtifactSpec.of("a", "first"));

            var e = assertThrows(DuplicateArtifactException.class, () -> graph.add(ArtifactSpec.of("a", "second")));
            assertEquals("a", e.getArtifactId());
            assertEquals("first", graph.get("a").description());
        }

        @Test
        @DisplayName("rejects a self-loop at spec construction")
        void rejectsSelfLoop() {
            var e = assertThrows(CyclicDependencyException.class, () -> ArtifactSpec.of("a", "self", "a"));
            assertEquals(List.of("a", "a"), e.getCycle());
        }

        @Test
        @DisplayName("rejects an add that closes a cycle and leaves the graph unchanged")
        void rejectsCycleAtomically() {
            var graph = new ArtifactGraph();
            graph.add(ArtifactSpec.of("a", "A", "b"));

            var e = assertThrows(CyclicDependencyException.class, () -> graph.add(ArtifactSpec.of("b", "B", "a")));

            assertEquals(List.of("b", "a", "b"), e.getCycle());
            assertTrue(e.getMessage().contains("b -> a -> b"));
            assertEquals(1, graph.size());
            assertFalse(graph.contains("b"));
        }

        @Test
        @DisplayName("addAll rolls back the whole batch on failure")
        void addAllRollsBack() {
            var graph = new ArtifactGraph();
            graph.add(ArtifactSpec.of("root", "root"));

            assertThrows(DuplicateArtifactException.class, () -> graph.addAll(List.of(
                    ArtifactSpec.of("x", "X", "root"),
                    ArtifactSpec.of("y", "Y", "x"),
                    ArtifactSpec.of("root", "duplicate")
            )));

            assertEquals(List.of("root"), graph.ids());
            assertTrue(graph.dependents("root").isEmpty());
        }

        @Test
        @DisplayName("allows forward references but rejects them when frozen")
        void danglingReferenceRejectedAtFreeze() {
            var graph = new ArtifactGraph();
            graph.add(ArtifactSpec.of("api", "api", "model"));

            var e = assertThrows(MissingDependencyException.class, graph::freeze);
            assertEquals("api", e.getArtifactId());
            assertEquals(Set.of("model"), e.getMissingIds());
            assertFalse(graph.isFrozen());

            graph.add(ArtifactSpec.of("model", "model"));
            assertSame(graph, graph.freeze());
            assertTrue(graph.isFrozen());
        }

        @Test
        @DisplayName("rejects add after freeze")
        void rejectsAddAfterFreeze() {
            var graph = threeLayer().freeze();
            assertThrows(IllegalStateException.class, () -> graph.add(ArtifactSpec.of("docs", "docs")));
        }

        @Test
        @DisplayName("get throws for unknown ids, find returns empty")
        void lookup() {
            var graph = threeLayer();
            assertThrows(ArtifactNotFoundException.class, () -> graph.get("nope"));
            assertTrue(graph.find("nope").isEmpty());
            assertEquals("model", graph.find("model").orElseThrow().id());
        }
    }

    // -- Waves ------------------------------------------------------------------

    @Nested
    @DisplayName("executionWaves")
    class Waves {

        @Test
        @DisplayName("schema/model/api yields three single-node waves")
        void threeLayerWaves() {
            assertEquals(List.of(Set.of("schema"), Set.of("model"), Set.of("api")), threeLayer().executionWaves());
        }

        @Test
        @DisplayName("waves partition the nodes and respect every edge")
        void wavesPartitionNodes() {
            var graph = ArtifactGraph.of(List.of(
                    ArtifactSpec.of("a", "A"),
                    ArtifactSpec.of("b", "B"),
                    ArtifactSpec.of("c", "C", "a"),
                    ArtifactSpec.of("d", "D", "a", "b"),
                    ArtifactSpec.of("e", "E", "c", "d"),
                    ArtifactSpec.of("f", "F", "b")
            ));

            List<Set<String>> waves = graph.executionWaves();

            Set<String> seen = new HashSet<>();
            for (Set<String> wave : waves) {
                for (String id : wave) {
                    assertTrue(seen.add(id), id + " appears in more than one wave");
                }
            }
            assertEquals(new HashSet<>(graph.ids()), seen);

            for (int i = 0; i < waves.size(); i++) {
                for (String id : waves.get(i)) {
                    for (String req : graph.get(id).requires()) {
                        int reqWave = waveOf(waves, req);
                        assertTrue(reqWave < i, req + " must run before " + id);
                    }
                }
            }
            assertEquals(List.of(Set.of("a", "b"), Set.of("c", "d", "f"), Set.of("e")), waves);
        }

        @Test
        @DisplayName("treats satisfied artifacts as available")
        void satisfiedArtifacts() {
            var waves = threeLayer().executionWaves(Set.of("schema", "model"));
            assertEquals(List.of(Set.of("api")), waves);
        }

        @Test
        @DisplayName("empty graph has no waves")
        void emptyGraph() {
            assertTrue(new ArtifactGraph().executionWaves().isEmpty());
        }

        @Test
        @DisplayName("topological order lists dependencies first")
        void topologicalOrder() {
            assertEquals(List.of("schema", "model", "api"), threeLayer().topologicalOrder());
        }

        private int waveOf(List<Set<String>> waves, String id) {
            for (int i = 0; i < waves.size(); i++) {
                if (waves.get(i).contains(id)) {
                    return i;
                }
            }
            return -1;
        }
    }

    // -- Structure --------------------------------------------------------------

    @Nested
    @DisplayName("structure queries")
    class Structure {

        @Test
        @DisplayName("depth, fan-in and fan-out")
        void depthAndFan() {
            var graph = threeLayer();
            assertEquals(0, graph.depth("schema"));
            assertEquals(1, graph.depth("model"));
            assertEquals(2, graph.depth("api"));
            assertEquals(2, graph.maxDepth());
            assertEquals(1, graph.fanIn("model"));
            assertEquals(1, graph.fanOut("schema"));
            assertEquals(0, graph.fanOut("api"));
        }

        @Test
        @DisplayName("leaves, roots and transitive dependents")
        void leavesRootsDependents() {
            var graph = threeLayer();
            assertEquals(List.of("schema"), graph.leaves());
            assertEquals(List.of("api"), graph.roots());
            assertEquals(Set.of("model", "api"), graph.transitiveDependents("schema"));
            assertEquals(Set.of("model"), graph.dependents("schema"));
        }

        @Test
        @DisplayName("subgraph is closed over dependencies")
        void subgraph() {
            var graph = ArtifactGraph.of(List.of(
                    ArtifactSpec.of("schema", "schema"),
                    ArtifactSpec.of("model", "model", "schema"),
                    ArtifactSpec.of("api", "api", "model"),
                    ArtifactSpec.of("docs", "docs")
            ));
            var sub = graph.subgraph(List.of("model"));
            assertEquals(List.of("schema", "model"), sub.ids());
            assertFalse(sub.isFrozen());
        }

        @Test
        @DisplayName("validate reports nothing for a sound graph and lists dangling references")
        void validate() {
            assertTrue(threeLayer().validate().isEmpty());

            var graph = new ArtifactGraph();
            graph.add(ArtifactSpec.of("api", "api", "model"));
            List<String> errors = graph.validate();
            assertEquals(1, errors.size());
            assertTrue(errors.get(0).contains("model"));
        }

        @Test
        @DisplayName("mermaid output draws every edge")
        void mermaid() {
            String mermaid = threeLayer().toMermaid();
            assertTrue(mermaid.startsWith("graph TD"));
            assertTrue(mermaid.contains("schema --> model"));
            assertTrue(mermaid.contains("model --> api"));
        }

        @Test
        @DisplayName("interface definitions are leaves or contract-like domain types")
        void interfaceDefinitions() {
            var protocol = new ArtifactSpec("p", "proto", "", null, Set.of("x"), "protocol", Map.of());
            var service = new ArtifactSpec("s", "svc", "", null, Set.of("x"), "service", Map.of());
            assertTrue(protocol.isInterfaceDefinition());
            assertFalse(service.isInterfaceDefinition());
            assertTrue(ArtifactSpec.of("leaf", "leaf").isInterfaceDefinition());
        }
    }

    // -- Extension --------------------------------------------------------------

    @Nested
    @DisplayName("proposeExtension")
    class Extension {

        @Test
        @DisplayName("accepts a valid batch on a frozen graph")
        void acceptsValidBatch() {
            var graph = threeLayer().freeze();

            var result = graph.proposeExtension(List.of(
                    ArtifactSpec.of("tests", "api tests", "api"),
                    ArtifactSpec.of("report", "test report", "tests")
            ));

            assertTrue(result.accepted());
            assertEquals(List.of("tests", "report"), result.artifactIds());
            assertEquals(5, graph.size());
            assertEquals(Set.of("tests"), graph.executionWaves(Set.of("schema", "model", "api")).get(0));
        }

        @Test
        @DisplayName("rejects duplicates, unknown requirements and size overflow without changing the graph")
        void rejectsInvalidBatches() {
            var graph = threeLayer().freeze();

            assertFalse(graph.proposeExtension(List.of(ArtifactSpec.of("api", "again"))).accepted());
            assertFalse(graph.proposeExtension(List.of(ArtifactSpec.of("x", "x", "ghost"))).accepted());
            var tooBig = graph.proposeExtension(List.of(ArtifactSpec.of("x", "x")), 3);
            assertFalse(tooBig.accepted());
            assertTrue(tooBig.reason().contains("limit 3"));

            assertEquals(3, graph.size());
        }

        @Test
        @DisplayName("rejects a cycle inside the batch")
        void rejectsCycleInBatch() {
            var graph = threeLayer().freeze();

            var result = graph.proposeExtension(List.of(
                    ArtifactSpec.of("x", "x", "y"),
                    ArtifactSpec.of("y", "y", "x")
            ));

            assertFalse(result.accepted());
            assertTrue(result.reason().startsWith("Cyclic dependency detected"));
            assertFalse(graph.contains("x"));
        }
    }

    // -- Deep graphs ------------------------------------------------------------

    @Nested
    @DisplayName("deep graphs")
    class DeepGraphs {

        @Test
        @DisplayName("a long chain added one spec at a time builds, schedules and measures depth")
        void longChain() {
            var graph = new ArtifactGraph();
            graph.add(ArtifactSpec.of(node(0), "start"));
            for (int i = 1; i < CHAIN_LENGTH; i++) {
                graph.add(ArtifactSpec.of(node(i), "step " + i, node(i - 1)));
            }

            assertEquals(CHAIN_LENGTH, graph.size());
            assertEquals(CHAIN_LENGTH - 1, graph.depth(node(CHAIN_LENGTH - 1)));
            assertEquals(CHAIN_LENGTH - 1, graph.maxDepth());
            assertEquals(CHAIN_LENGTH, graph.freeze().executionWaves().size());
        }

        @Test
        @DisplayName("a cycle closed at the end of a long chain is detected")
        void cycleThroughLongChain() {
            var graph = new ArtifactGraph();
            graph.add(ArtifactSpec.of(node(0), "start", node(CHAIN_LENGTH - 1)));
            for (int i = 1; i < CHAIN_LENGTH - 1; i++) {
                graph.add(ArtifactSpec.of(node(i), "step " + i, node(i - 1)));
            }

            var e = assertThrows(CyclicDependencyException.class, () -> graph.add(
                    ArtifactSpec.of(node(CHAIN_LENGTH - 1), "closing", node(CHAIN_LENGTH - 2))));

            List<String> cycle = e.getCycle();
            assertEquals(CHAIN_LENGTH + 1, cycle.size());
            assertEquals(node(CHAIN_LENGTH - 1), cycle.get(0));
            assertEquals(node(CHAIN_LENGTH - 2), cycle.get(1));
            assertEquals(node(CHAIN_LENGTH - 1), cycle.get(cycle.size() - 1));
            assertFalse(graph.contains(node(CHAIN_LENGTH - 1)));
        }
    }
}
