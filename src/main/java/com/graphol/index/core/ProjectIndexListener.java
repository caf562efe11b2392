package com.graphol.index.core;

import com.graphol.index.model.Diagram;
import com.graphol.index.model.DiagramItem;
import com.graphol.index.model.ItemType;

/**
 * Receives the change notifications of a {@link ProjectIndex}.
 *
 * Callbacks run synchronously on the mutating thread, after the index has
 * been updated. All methods default to no-ops.
 */
public interface ProjectIndexListener {

    default void diagramAdded(Diagram diagram) {
    }

    default void diagramRemoved(Diagram diagram) {
    }

    default void itemAdded(Diagram diagram, DiagramItem item) {
    }

    default void itemRemoved(Diagram diagram, DiagramItem item) {
    }

    default void metaAdded(ItemType type, String name) {
    }

    default void metaRemoved(ItemType type, String name) {
    }

    default void cleared() {
    }

    /**
     * Fired once per mutating call that changed the index, after the specific notifications.
     */
    default void updated() {
    }
}
