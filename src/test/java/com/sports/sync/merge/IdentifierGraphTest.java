package com.sports.sync.merge;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IdentifierGraph Tests")
class IdentifierGraphTest {

    private IdentifierGraph graph;

    @BeforeEach
    void setUp() {
        graph = new IdentifierGraph();
    }

    private static RecordRef ref(int provider, int index) {
        return new RecordRef(provider, index);
    }

    private static IdentityLink link(RecordRef left, RecordRef right) {
        return new IdentityLink(left, right, "test", 1.0, 1);
    }

    @Test
    @DisplayName("Links are transitive across providers")
    void transitiveLinks() {
        assertTrue(graph.link(link(ref(0, 0), ref(1, 0))));
        assertTrue(graph.link(link(ref(1, 0), ref(2, 3))));

        assertEquals(List.of(List.of(ref(0, 0), ref(1, 0), ref(2, 3))), graph.clusters());
        assertEquals(2, graph.getAcceptedLinks().size());
    }

    @Test
    @DisplayName("A link putting two records of one provider together is rejected")
    void rejectsProviderConflict() {
        graph.link(link(ref(0, 0), ref(1, 0)));
        graph.link(link(ref(1, 1), ref(2, 0)));

        // would join (1,0) and (1,1)
        assertFalse(graph.link(link(ref(0, 0), ref(2, 0))));

        assertEquals(1, graph.getRejectedLinks().size());
        assertEquals(List.of(
                List.of(ref(0, 0), ref(1, 0)),
                List.of(ref(1, 1), ref(2, 0))), graph.clusters());
    }

    @Test
    @DisplayName("Relinking records already in one cluster is accepted without change")
    void relinkSameCluster() {
        graph.link(link(ref(0, 0), ref(1, 0)));
        graph.link(link(ref(1, 0), ref(2, 0)));

        assertTrue(graph.link(link(ref(0, 0), ref(2, 0))));
        assertEquals(1, graph.clusters().size());
    }

    @Test
    @DisplayName("Unlinked records form singleton clusters ordered by provider then index")
    void singletonOrdering() {
        graph.add(ref(1, 0));
        graph.add(ref(0, 1));
        graph.add(ref(0, 0));
        graph.link(link(ref(0, 1), ref(1, 1)));

        assertEquals(List.of(
                List.of(ref(0, 0)),
                List.of(ref(0, 1), ref(1, 1)),
                List.of(ref(1, 0))), graph.clusters());
        assertTrue(graph.isLinked(ref(1, 1)));
        assertFalse(graph.isLinked(ref(0, 0)));
        assertFalse(graph.isLinked(ref(5, 5)));
    }

    @Test
    @DisplayName("Links must join two different providers")
    void sameProviderLinkRejected() {
        assertThrows(IllegalArgumentException.class, () -> link(ref(0, 0), ref(0, 1)));
    }

    @Test
    @DisplayName("Record references order by provider, then index")
    void recordRefOrdering() {
        assertTrue(ref(0, 9).compareTo(ref(1, 0)) < 0);
        assertTrue(ref(1, 2).compareTo(ref(1, 1)) > 0);
        assertThrows(IllegalArgumentException.class, () -> ref(-1, 0));
    }
}
