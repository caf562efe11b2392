package com.graphol.index.model;

import lombok.Builder;
import lombok.ToString;

/**
 * A node of a diagram. Predicate nodes carry the predicate name as text.
 */
@ToString(callSuper = true)
public class NodeItem extends DiagramItem {

    private final String text;

    @Builder
    public NodeItem(String id, String diagramId, ItemType type, String text) {
        super(id, diagramId, type);
        if (!type.isNode()) {
            throw new IllegalArgumentException("Not a node type: " + type);
        }
        this.text = text != null ? text : "";
    }

    @Override
    public String getText() {
        return text;
    }

    @Override
    public NodeItem withDiagramId(String diagramId) {
        return new NodeItem(id, diagramId, type, text);
    }
}
