package com.graphol.index.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Base class for all the items (nodes and edges) of a diagram.
 *
 * Id, owning diagram and type never change while the item is indexed;
 * renaming a predicate is modelled as removing the node and adding a new one.
 * Equality covers exactly those three attributes.
 */
@Getter
@ToString
@EqualsAndHashCode
public abstract class DiagramItem {

    protected final String id;
    protected final String diagramId;
    protected final ItemType type;

    protected DiagramItem(String id, String diagramId, ItemType type) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Item id is required");
        }
        if (diagramId == null || diagramId.isBlank()) {
            throw new IllegalArgumentException("Diagram id is required for item " + id);
        }
        if (type == null) {
            throw new IllegalArgumentException("Item type is required for item " + id);
        }
        this.id = id;
        this.diagramId = diagramId;
        this.type = type;
    }

    public boolean isNode() {
        return type.isNode();
    }

    public boolean isEdge() {
        return type.isEdge();
    }

    public boolean isPredicate() {
        return type.isPredicate();
    }

    /**
     * Label of the item; the predicate name for predicate nodes.
     */
    public abstract String getText();

    /**
     * Same item, owned by another diagram.
     */
    public abstract DiagramItem withDiagramId(String diagramId);
}
