package com.graphol.index.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * An edge of a diagram, connecting two nodes of the same diagram.
 */
@Getter
@ToString(callSuper = true)
public class EdgeItem extends DiagramItem {

    private final String sourceId;
    private final String targetId;

    @Builder
    public EdgeItem(String id, String diagramId, ItemType type, String sourceId, String targetId) {
        super(id, diagramId, type);
        if (!type.isEdge()) {
            throw new IllegalArgumentException("Not an edge type: " + type);
        }
        this.sourceId = sourceId;
        this.targetId = targetId;
    }

    @Override
    public String getText() {
        return "";
    }

    @Override
    public EdgeItem withDiagramId(String diagramId) {
        return new EdgeItem(id, diagramId, type, sourceId, targetId);
    }
}
