package com.graphol.index.model;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Diagram item ownership and change notifications.
 */
class DiagramTest {

    private final Diagram diagram = new Diagram("d1");

    @Test
    void testAddAndRemoveNotifyListeners() {
        List<String> events = new ArrayList<>();
        diagram.addListener(new DiagramListener() {
            @Override
            public void itemAdded(Diagram d, DiagramItem item) {
                events.add("+" + item.getId());
            }

            @Override
            public void itemRemoved(Diagram d, DiagramItem item) {
                events.add("-" + item.getId());
            }
        });
        NodeItem node = concept("n1", "Person");

        assertThat(diagram.addItem(node)).isTrue();
        assertThat(diagram.addItem(node)).isFalse();
        assertThat(diagram.removeItem(node)).isTrue();
        assertThat(diagram.removeItem(node)).isFalse();

        assertThat(events).containsExactly("+n1", "-n1");
    }

    @Test
    void testRejectsItemOfAnotherDiagram() {
        NodeItem foreign = NodeItem.builder().id("n1").diagramId("d2").type(ItemType.CONCEPT_NODE).text("A").build();

        assertThatThrownBy(() -> diagram.addItem(foreign))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("d2");
    }

    @Test
    void testItemsKeepInsertionOrder() {
        diagram.addItem(concept("n2", "B"));
        diagram.addItem(concept("n1", "A"));

        assertThat(diagram.getItems()).extracting(DiagramItem::getId).containsExactly("n2", "n1");
        assertThat(diagram.getItem("n1")).isPresent();
        assertThat(diagram.getItem("n3")).isEmpty();
        assertThat(diagram.size()).isEqualTo(2);
    }

    @Test
    void testItemValidation() {
        assertThatThrownBy(() -> NodeItem.builder().id("n1").diagramId("d1").type(ItemType.INCLUSION_EDGE).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> EdgeItem.builder().id("e1").diagramId("d1").type(ItemType.CONCEPT_NODE).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> NodeItem.builder().id(" ").diagramId("d1").type(ItemType.CONCEPT_NODE).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testPredicateKeyNormalisesName() {
        NodeItem node = NodeItem.builder().id("n1").diagramId("d1").type(ItemType.ROLE_NODE).text("has parent").build();

        assertThat(PredicateKey.of(node)).isEqualTo(new PredicateKey(ItemType.ROLE_NODE, "has_parent"));
        assertThat(PredicateKey.of(ItemType.ROLE_NODE, "has_parent")).isEqualTo(PredicateKey.of(node));
    }

    private NodeItem concept(String id, String text) {
        return NodeItem.builder().id(id).diagramId("d1").type(ItemType.CONCEPT_NODE).text(text).build();
    }

    @Test
    void testCopyAsMovesItemsToNewDiagram() {
        diagram.addItem(concept("n1", "A"));
        diagram.addItem(EdgeItem.builder().id("e0").diagramId("d1").type(ItemType.INCLUSION_EDGE)
                .sourceId("n1").targetId("n1").build());

        Diagram copy = diagram.copyAs("d1_1");

        assertThat(copy.getName()).isEqualTo("d1_1");
        assertThat(copy.getItems()).extracting(DiagramItem::getDiagramId).containsOnly("d1_1");
        assertThat(copy.getItems()).extracting(DiagramItem::getId).containsExactly("n1", "e0");
        assertThat(copy.getItem("n1")).get().extracting(DiagramItem::getText).isEqualTo("A");
        assertThat(diagram.getItems()).extracting(DiagramItem::getDiagramId).containsOnly("d1");
    }
}
