package com.graphol.index.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * One canvas of a Graphol project: a named collection of nodes and edges.
 *
 * The diagram owns its items; listeners (typically the owning project) are
 * told about every add and remove.
 */
@ToString(onlyExplicitlyIncluded = true)
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Diagram {

    private static final Logger log = LoggerFactory.getLogger(Diagram.class);

    @Getter
    @ToString.Include
    @EqualsAndHashCode.Include
    private final String name;

    private final Map<String, DiagramItem> items = new LinkedHashMap<>();
    private final List<DiagramListener> listeners = new CopyOnWriteArrayList<>();

    public Diagram(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Diagram name is required");
        }
        this.name = name;
    }

    public void addListener(DiagramListener listener) {
        if (listener != null && !listeners.contains(listener)) {
            listeners.add(listener);
        }
    }

    public void removeListener(DiagramListener listener) {
        listeners.remove(listener);
    }

    /**
     * Adds a node or edge to this diagram.
     *
     * @return false if an item with the same id is already present
     * @throws IllegalArgumentException if the item belongs to another diagram or is neither node nor edge
     */
    public boolean addItem(DiagramItem item) {
        checkOwnership(item);
        if (!item.isNode() && !item.isEdge()) {
            throw new IllegalArgumentException("Only nodes and edges can be added to a diagram: " + item);
        }
        if (items.putIfAbsent(item.getId(), item) != null) {
            log.debug("Item {} already present in diagram {}", item.getId(), name);
            return false;
        }
        for (DiagramListener listener : listeners) {
            listener.itemAdded(this, item);
        }
        return true;
    }

    /**
     * Removes an item from this diagram.
     *
     * @return false if the item was not present
     */
    public boolean removeItem(DiagramItem item) {
        checkOwnership(item);
        if (!items.remove(item.getId(), item)) {
            return false;
        }
        for (DiagramListener listener : listeners) {
            listener.itemRemoved(this, item);
        }
        return true;
    }

    public Optional<DiagramItem> getItem(String id) {
        return Optional.ofNullable(items.get(id));
    }

    /**
     * Snapshot of the items currently in this diagram, in insertion order.
     */
    public List<DiagramItem> getItems() {
        return new ArrayList<>(items.values());
    }

    public int size() {
        return items.size();
    }

    /**
     * Copies this diagram under another name, moving every item to the new diagram.
     * Listeners are not copied.
     */
    public Diagram copyAs(String name) {
        Diagram copy = new Diagram(name);
        for (DiagramItem item : items.values()) {
            copy.items.put(item.getId(), item.withDiagramId(name));
        }
        return copy;
    }

    private void checkOwnership(DiagramItem item) {
        if (item == null) {
            throw new IllegalArgumentException("Item is required");
        }
        if (!name.equals(item.getDiagramId())) {
            throw new IllegalArgumentException(
                    "Item " + item.getId() + " belongs to diagram " + item.getDiagramId() + ", not " + name);
        }
    }
}
