package work.lcod.config.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static work.lcod.config.support.ConfigTestSupport.chain;
import static work.lcod.config.support.ConfigTestSupport.graph;
import static work.lcod.config.support.ConfigTestSupport.map;

import org.junit.jupiter.api.Test;
import work.lcod.config.error.MaxDepthExceededException;

class DepthGuardTest {
    @Test
    void computesLongestChainPerNode() {
        var graph = graph(map(
            "a", 1,
            "b", "{{ values.a }}",
            "c", "{{ values.b }}{{ values.a }}",
            "d", "{{ values.nowhere }}"
        ));

        var depths = DepthGuard.check(graph, 10);

        assertEquals(1, depths.get(LeafPath.parse("b")));
        assertEquals(2, depths.get(LeafPath.parse("c")));
        assertEquals(1, depths.get(LeafPath.parse("d")));
    }

    @Test
    void acceptsChainAtTheLimit() {
        var depths = DepthGuard.check(graph(chain(10)), 10);

        assertEquals(10, depths.get(LeafPath.parse("l10")));
    }

    @Test
    void rejectsChainOverTheLimit() {
        var graph = graph(chain(11));

        var ex = assertThrows(MaxDepthExceededException.class, () -> DepthGuard.check(graph, 10));

        assertEquals(LeafPath.parse("l11"), ex.path());
        assertEquals(11, ex.depth());
        assertEquals(10, ex.maxDepth());
        assertEquals("max_depth_exceeded", ex.code());
    }

    @Test
    void honoursConfiguredMaximum() {
        var graph = graph(chain(3));

        assertThrows(MaxDepthExceededException.class, () -> DepthGuard.check(graph, 2));
        assertEquals(3, DepthGuard.check(graph, 3).get(LeafPath.parse("l3")));
    }
}
