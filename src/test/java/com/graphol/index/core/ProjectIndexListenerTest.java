package com.graphol.index.core;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.graphol.index.model.Diagram;
import com.graphol.index.model.DiagramItem;
import com.graphol.index.model.ItemType;
import com.graphol.index.model.NodeItem;
import com.graphol.index.model.meta.RoleMetaData;

import static com.graphol.index.core.ProjectIndexTest.node;
import static org.assertj.core.api.Assertions.*;

/**
 * Order and timing of ProjectIndex notifications.
 */
class ProjectIndexListenerTest {

    private ProjectIndex index;
    private List<String> events;

    @BeforeEach
    void setUp() {
        index = new ProjectIndex();
        events = new ArrayList<>();
        index.addListener(new RecordingListener());
    }

    @Test
    void testDiagramAddedBeforeItsItems() {
        Diagram d1 = new Diagram("d1");
        d1.addItem(node(d1, "n0", ItemType.CONCEPT_NODE, "A"));
        d1.addItem(node(d1, "n1", ItemType.ROLE_NODE, "r"));

        index.addDiagram(d1);

        assertThat(events).containsExactly("diagramAdded d1", "itemAdded d1/n0", "itemAdded d1/n1", "updated");
    }

    @Test
    void testItemsRemovedBeforeDiagram() {
        Diagram d1 = new Diagram("d1");
        d1.addItem(node(d1, "n0", ItemType.CONCEPT_NODE, "A"));
        d1.addItem(node(d1, "n1", ItemType.ROLE_NODE, "r"));
        index.addDiagram(d1);
        events.clear();

        index.removeDiagram(d1);

        assertThat(events).containsExactly("itemRemoved d1/n0", "itemRemoved d1/n1", "diagramRemoved d1", "updated");
    }

    @Test
    void testIndexAlreadyUpdatedInsideCallback() {
        Diagram d1 = new Diagram("d1");
        index.addDiagram(d1);
        NodeItem person = node(d1, "n0", ItemType.CONCEPT_NODE, "Person");
        List<Boolean> seen = new ArrayList<>();
        index.addListener(new ProjectIndexListener() {
            @Override
            public void itemAdded(Diagram diagram, DiagramItem item) {
                seen.add(index.item(diagram, item.getId()).isPresent());
                seen.add(index.predicates(ItemType.CONCEPT_NODE, "Person", diagram).contains(item));
            }

            @Override
            public void itemRemoved(Diagram diagram, DiagramItem item) {
                seen.add(index.item(diagram, item.getId()).isPresent());
            }
        });

        index.addItem(d1, person);
        index.removeItem(d1, person);

        assertThat(seen).containsExactly(true, true, false);
    }

    @Test
    void testNoNotificationWithoutChange() {
        Diagram d1 = new Diagram("d1");
        NodeItem n0 = node(d1, "n0", ItemType.CONCEPT_NODE, "A");
        index.addDiagram(d1);
        index.addItem(d1, n0);
        events.clear();

        index.addDiagram(d1);
        index.addItem(d1, n0);
        index.removeItem(d1, node(d1, "n9", ItemType.CONCEPT_NODE, "B"));
        index.removeMeta(ItemType.ROLE_NODE, "r");

        assertThat(events).isEmpty();
    }

    @Test
    void testMetaNotificationsUseNormalisedName() {
        index.addMeta(ItemType.ROLE_NODE, "works for", new RoleMetaData("works for"));
        index.removeMeta(ItemType.ROLE_NODE, "works for");

        assertThat(events).containsExactly(
                "metaAdded ROLE_NODE works_for", "updated",
                "metaRemoved ROLE_NODE works_for", "updated");
    }

    @Test
    void testClearAndRemovedListener() {
        Diagram d1 = new Diagram("d1");
        index.addDiagram(d1);
        events.clear();

        index.clear();
        assertThat(events).containsExactly("cleared", "updated");

        ProjectIndex other = new ProjectIndex();
        RecordingListener listener = new RecordingListener();
        other.addListener(listener);
        other.removeListener(listener);
        other.addDiagram(new Diagram("d2"));
        assertThat(events).containsExactly("cleared", "updated");
    }

    private class RecordingListener implements ProjectIndexListener {

        @Override
        public void diagramAdded(Diagram diagram) {
            events.add("diagramAdded " + diagram.getName());
        }

        @Override
        public void diagramRemoved(Diagram diagram) {
            events.add("diagramRemoved " + diagram.getName());
        }

        @Override
        public void itemAdded(Diagram diagram, DiagramItem item) {
            events.add("itemAdded " + diagram.getName() + "/" + item.getId());
        }

        @Override
        public void itemRemoved(Diagram diagram, DiagramItem item) {
            events.add("itemRemoved " + diagram.getName() + "/" + item.getId());
        }

        @Override
        public void metaAdded(ItemType type, String name) {
            events.add("metaAdded " + type + " " + name);
        }

        @Override
        public void metaRemoved(ItemType type, String name) {
            events.add("metaRemoved " + type + " " + name);
        }

        @Override
        public void cleared() {
            events.add("cleared");
        }

        @Override
        public void updated() {
            events.add("updated");
        }
    }
}
