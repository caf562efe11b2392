package com.graphol.index.model;

/**
 * Receives the item changes of a {@link Diagram}.
 */
public interface DiagramListener {

    void itemAdded(Diagram diagram, DiagramItem item);

    void itemRemoved(Diagram diagram, DiagramItem item);
}
