package com.graphol.index.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.graphol.index.core.exception.IndexContractException;
import com.graphol.index.model.Diagram;
import com.graphol.index.model.DiagramItem;
import com.graphol.index.model.ItemType;
import com.graphol.index.model.PredicateKey;
import com.graphol.index.model.meta.MetaDataFactory;
import com.graphol.index.model.meta.PredicateMetaData;
import com.graphol.index.util.NestedMapUtil;
import com.graphol.index.util.OwlTextUtil;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * In-memory index of a Graphol project.
 *
 * Keeps five synchronized views over the items of every diagram (all items,
 * items by type, nodes, edges and predicate occurrences by predicate key) and
 * the metadata attached to predicates. The only mutators are
 * {@link #addItem}/{@link #removeItem} (plus their diagram-wide and metadata
 * counterparts); every query returns a snapshot and never throws for unknown
 * keys.
 *
 * <p>Nested containers are created on demand and dropped as soon as they
 * become empty, so no query ever iterates a stale bucket.
 *
 * <p>Not thread-safe: mutate and query from a single thread, or serialize
 * access externally.
 */
@Getter(AccessLevel.PACKAGE)
public class ProjectIndex {

    private static final Logger log = LoggerFactory.getLogger(ProjectIndex.class);

    private final Map<String, Diagram> diagrams = new LinkedHashMap<>();
    private final Map<String, Map<String, DiagramItem>> items = new LinkedHashMap<>();
    private final Map<String, Map<ItemType, Set<DiagramItem>>> types = new LinkedHashMap<>();
    private final Map<String, Map<String, DiagramItem>> nodes = new LinkedHashMap<>();
    private final Map<String, Map<String, DiagramItem>> edges = new LinkedHashMap<>();
    private final Map<ItemType, Map<String, PredicateEntry>> predicates = new LinkedHashMap<>();

    @Getter(AccessLevel.NONE)
    private final List<ProjectIndexListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(ProjectIndexListener listener) {
        if (listener != null && !listeners.contains(listener)) {
            listeners.add(listener);
        }
    }

    public void removeListener(ProjectIndexListener listener) {
        listeners.remove(listener);
    }

    // -------------------------------------------------------------------------
    // Mutators
    // -------------------------------------------------------------------------

    /**
     * Registers a diagram and indexes every item it currently holds.
     * The diagram notification is fired before any item notification.
     *
     * @return false if a diagram with the same name is already registered
     */
    public boolean addDiagram(Diagram diagram) {
        requireDiagram(diagram);
        if (diagrams.putIfAbsent(diagram.getName(), diagram) != null) {
            log.debug("Diagram {} already indexed", diagram.getName());
            return false;
        }
        log.debug("Indexed diagram {}", diagram.getName());
        fire(l -> l.diagramAdded(diagram));
        for (DiagramItem item : diagram.getItems()) {
            indexItem(diagram, item);
        }
        fire(ProjectIndexListener::updated);
        return true;
    }

    /**
     * Removes every indexed item of the diagram, then the diagram itself.
     * The diagram notification is fired after all item notifications.
     *
     * @return false if the diagram is not registered
     */
    public boolean removeDiagram(Diagram diagram) {
        requireDiagram(diagram);
        if (!diagrams.containsKey(diagram.getName())) {
            return false;
        }
        for (DiagramItem item : items(diagram)) {
            unindexItem(diagram, item);
        }
        diagrams.remove(diagram.getName());
        log.debug("Removed diagram {} from index", diagram.getName());
        fire(l -> l.diagramRemoved(diagram));
        fire(ProjectIndexListener::updated);
        return true;
    }

    /**
     * Indexes an item of the given diagram.
     *
     * @return false if an item with the same id is already indexed in that diagram
     * @throws IndexContractException if the item belongs to another diagram
     */
    public boolean addItem(Diagram diagram, DiagramItem item) {
        boolean added = indexItem(diagram, item);
        if (added) {
            fire(ProjectIndexListener::updated);
        }
        return added;
    }

    /**
     * Removes an item of the given diagram from the index.
     *
     * @return false if the item is not indexed
     * @throws IndexContractException if the item belongs to another diagram
     */
    public boolean removeItem(Diagram diagram, DiagramItem item) {
        boolean removed = unindexItem(diagram, item);
        if (removed) {
            fire(ProjectIndexListener::updated);
        }
        return removed;
    }

    /**
     * Stores a copy of the metadata of a predicate, replacing any previous value.
     * The predicate does not need to have any node occurrence.
     */
    public boolean addMeta(ItemType type, String name, PredicateMetaData meta) {
        requireType(type);
        if (meta == null) {
            throw contractViolation("Metadata is required for predicate " + type + " '" + name + "'");
        }
        PredicateKey key = PredicateKey.of(type, name);
        predicates.computeIfAbsent(type, k -> new LinkedHashMap<>())
                .computeIfAbsent(key.getName(), k -> new PredicateEntry())
                .setMeta(meta.copy());
        log.debug("Stored metadata for {} '{}'", type, key.getName());
        fire(l -> l.metaAdded(type, key.getName()));
        fire(ProjectIndexListener::updated);
        return true;
    }

    /**
     * Drops the metadata of a predicate, leaving its node occurrences untouched.
     *
     * @return false if no metadata was stored
     */
    public boolean removeMeta(ItemType type, String name) {
        requireType(type);
        PredicateKey key = PredicateKey.of(type, name);
        PredicateEntry entry = predicateEntry(key);
        if (entry == null || !entry.hasMeta()) {
            return false;
        }
        entry.setMeta(null);
        pruneIfDisposable(key, entry);
        log.debug("Removed metadata for {} '{}'", type, key.getName());
        fire(l -> l.metaRemoved(type, key.getName()));
        fire(ProjectIndexListener::updated);
        return true;
    }

    /**
     * Drops every diagram, item and metadata entry.
     *
     * @return false if the index was already empty
     */
    public boolean clear() {
        if (diagrams.isEmpty() && items.isEmpty() && predicates.isEmpty()) {
            return false;
        }
        diagrams.clear();
        items.clear();
        types.clear();
        nodes.clear();
        edges.clear();
        predicates.clear();
        log.debug("Cleared project index");
        fire(ProjectIndexListener::cleared);
        fire(ProjectIndexListener::updated);
        return true;
    }

    // -------------------------------------------------------------------------
    // Lookups
    // -------------------------------------------------------------------------

    public Optional<Diagram> diagram(String name) {
        return Optional.ofNullable(name == null ? null : diagrams.get(name));
    }

    public Set<Diagram> diagrams() {
        return new LinkedHashSet<>(diagrams.values());
    }

    public Optional<DiagramItem> item(Diagram diagram, String id) {
        return lookup(items, diagram, id);
    }

    public Optional<DiagramItem> node(Diagram diagram, String id) {
        return lookup(nodes, diagram, id);
    }

    public Optional<DiagramItem> edge(Diagram diagram, String id) {
        return lookup(edges, diagram, id);
    }

    public Set<DiagramItem> items() {
        return collect(items, null);
    }

    /**
     * Items of the given diagram, or of the whole project when diagram is null.
     */
    public Set<DiagramItem> items(Diagram diagram) {
        return collect(items, diagram);
    }

    public Set<DiagramItem> nodes() {
        return collect(nodes, null);
    }

    public Set<DiagramItem> nodes(Diagram diagram) {
        return collect(nodes, diagram);
    }

    public Set<DiagramItem> edges() {
        return collect(edges, null);
    }

    public Set<DiagramItem> edges(Diagram diagram) {
        return collect(edges, diagram);
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    // -------------------------------------------------------------------------
    // Counting
    // -------------------------------------------------------------------------

    public int count() {
        return count(null, null, null);
    }

    public int count(Diagram diagram) {
        return count(null, null, diagram);
    }

    public int itemCount(ItemType type) {
        return count(type, null, null);
    }

    public int itemCount(ItemType type, Diagram diagram) {
        return count(type, null, diagram);
    }

    public int predicateCount(ItemType type) {
        return count(null, type, null);
    }

    public int predicateCount(ItemType type, Diagram diagram) {
        return count(null, type, diagram);
    }

    /**
     * Counts items of type {@code item}, or distinct predicate names of type
     * {@code predicate}, or all items when both are null; restricted to
     * {@code diagram} when it is not null.
     *
     * @throws IndexContractException if both {@code item} and {@code predicate} are given
     */
    public int count(ItemType item, ItemType predicate, Diagram diagram) {
        if (item != null && predicate != null) {
            throw contractViolation("count() accepts either an item type or a predicate type, not both");
        }
        if (item != null) {
            if (diagram == null) {
                return types.values().stream()
                        .map(byType -> byType.get(item))
                        .filter(bucket -> bucket != null)
                        .mapToInt(Set::size)
                        .sum();
            }
            Set<DiagramItem> bucket = types.getOrDefault(diagram.getName(), Map.of()).get(item);
            return bucket != null ? bucket.size() : 0;
        }
        if (predicate != null) {
            Map<String, PredicateEntry> byName = predicates.getOrDefault(predicate, Map.of());
            return (int) byName.values().stream()
                    .filter(entry -> diagram == null ? entry.hasNodes() : entry.getNodes().containsKey(diagram.getName()))
                    .count();
        }
        if (diagram == null) {
            return items.values().stream().mapToInt(Map::size).sum();
        }
        return items.getOrDefault(diagram.getName(), Map.of()).size();
    }

    // -------------------------------------------------------------------------
    // Predicates and metadata
    // -------------------------------------------------------------------------

    public Set<DiagramItem> predicates() {
        return predicates(null, null, null);
    }

    /**
     * Predicate node occurrences matching the given filters. Every null
     * argument widens the match to all types, names or diagrams respectively.
     */
    public Set<DiagramItem> predicates(ItemType type, String name, Diagram diagram) {
        Set<DiagramItem> collection = new LinkedHashSet<>();
        Collection<Map<String, PredicateEntry>> byType = type == null
                ? predicates.values()
                : Optional.ofNullable(predicates.get(type)).map(List::of).orElse(List.of());
        String owlName = name == null ? null : OwlTextUtil.toOwlText(name);
        for (Map<String, PredicateEntry> byName : byType) {
            Collection<PredicateEntry> entries = owlName == null
                    ? byName.values()
                    : Optional.ofNullable(byName.get(owlName)).map(List::of).orElse(List.of());
            for (PredicateEntry entry : entries) {
                if (diagram == null) {
                    entry.getNodes().values().forEach(collection::addAll);
                } else {
                    collection.addAll(entry.getNodes().getOrDefault(diagram.getName(), Set.of()));
                }
            }
        }
        return collection;
    }

    /**
     * Names of the predicates of the given type that have at least one occurrence.
     */
    public SortedSet<String> predicateNames(ItemType type) {
        SortedSet<String> names = new TreeSet<>();
        predicates.getOrDefault(type, Map.of()).forEach((name, entry) -> {
            if (entry.hasNodes()) {
                names.add(name);
            }
        });
        return names;
    }

    /**
     * Copy of the stored metadata of a predicate, or a fresh empty container of the right kind.
     * Changes to the returned value reach the index only through {@link #addMeta}.
     */
    public PredicateMetaData meta(ItemType type, String name) {
        requireType(type);
        PredicateKey key = PredicateKey.of(type, name);
        PredicateEntry entry = predicateEntry(key);
        if (entry != null && entry.hasMeta()) {
            return entry.getMeta().copy();
        }
        return MetaDataFactory.create(type, key.getName());
    }

    public boolean hasMeta(ItemType type, String name) {
        if (type == null) {
            return false;
        }
        PredicateEntry entry = predicateEntry(PredicateKey.of(type, name));
        return entry != null && entry.hasMeta();
    }

    /**
     * Keys of all predicates with stored metadata, optionally restricted to the given types.
     */
    public List<PredicateKey> metas(ItemType... types) {
        Set<ItemType> filter = types == null ? Set.of() : Arrays.stream(types)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        List<PredicateKey> keys = new ArrayList<>();
        predicates.forEach((type, byName) -> {
            if (filter.isEmpty() || filter.contains(type)) {
                byName.forEach((name, entry) -> {
                    if (entry.hasMeta()) {
                        keys.add(new PredicateKey(type, name));
                    }
                });
            }
        });
        return keys;
    }

    public IndexStatistics statistics() {
        return IndexStatistics.builder()
                .diagramCount(diagrams.size())
                .itemCount(count())
                .nodeCount(nodes.values().stream().mapToInt(Map::size).sum())
                .edgeCount(edges.values().stream().mapToInt(Map::size).sum())
                .predicateCount((int) predicates.values().stream()
                        .flatMap(byName -> byName.values().stream())
                        .filter(PredicateEntry::hasNodes)
                        .count())
                .metaCount(metas().size())
                .build();
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private boolean indexItem(Diagram diagram, DiagramItem item) {
        checkContract(diagram, item);
        String diagramId = diagram.getName();
        if (!NestedMapUtil.putIfAbsent(items, diagramId, item.getId(), item)) {
            log.debug("Item {} already indexed in diagram {}", item.getId(), diagramId);
            return false;
        }
        NestedMapUtil.addToNestedBucket(types, diagramId, item.getType(), item);
        if (item.isNode()) {
            NestedMapUtil.putIfAbsent(nodes, diagramId, item.getId(), item);
            if (item.isPredicate()) {
                PredicateKey key = PredicateKey.of(item);
                PredicateEntry entry = predicates.computeIfAbsent(key.getType(), k -> new LinkedHashMap<>())
                        .computeIfAbsent(key.getName(), k -> new PredicateEntry());
                NestedMapUtil.addToBucket(entry.getNodes(), diagramId, item);
            }
        }
        if (item.isEdge()) {
            NestedMapUtil.putIfAbsent(edges, diagramId, item.getId(), item);
        }
        log.debug("Indexed {} {} in diagram {}", item.getType().getRealName(), item.getId(), diagramId);
        fire(l -> l.itemAdded(diagram, item));
        return true;
    }

    private boolean unindexItem(Diagram diagram, DiagramItem item) {
        checkContract(diagram, item);
        String diagramId = diagram.getName();
        DiagramItem indexed = NestedMapUtil.removeAndPrune(items, diagramId, item.getId());
        if (indexed == null) {
            return false;
        }
        NestedMapUtil.removeFromNestedBucket(types, diagramId, indexed.getType(), indexed);
        if (indexed.isNode()) {
            NestedMapUtil.removeAndPrune(nodes, diagramId, indexed.getId());
            if (indexed.isPredicate()) {
                PredicateKey key = PredicateKey.of(indexed);
                PredicateEntry entry = predicateEntry(key);
                if (entry != null) {
                    NestedMapUtil.removeFromBucket(entry.getNodes(), diagramId, indexed);
                    pruneIfDisposable(key, entry);
                }
            }
        }
        if (indexed.isEdge()) {
            NestedMapUtil.removeAndPrune(edges, diagramId, indexed.getId());
        }
        log.debug("Removed {} {} from diagram {}", indexed.getType().getRealName(), indexed.getId(), diagramId);
        fire(l -> l.itemRemoved(diagram, indexed));
        return true;
    }

    private PredicateEntry predicateEntry(PredicateKey key) {
        Map<String, PredicateEntry> byName = predicates.get(key.getType());
        return byName != null ? byName.get(key.getName()) : null;
    }

    private void pruneIfDisposable(PredicateKey key, PredicateEntry entry) {
        if (!entry.isDisposable()) {
            return;
        }
        Map<String, PredicateEntry> byName = predicates.get(key.getType());
        if (byName != null) {
            byName.remove(key.getName());
            if (byName.isEmpty()) {
                predicates.remove(key.getType());
            }
        }
    }

    private static <V> Optional<V> lookup(Map<String, Map<String, V>> map, Diagram diagram, String id) {
        if (diagram == null || id == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(map.getOrDefault(diagram.getName(), Map.of()).get(id));
    }

    private static Set<DiagramItem> collect(Map<String, Map<String, DiagramItem>> map, Diagram diagram) {
        if (diagram != null) {
            return new LinkedHashSet<>(map.getOrDefault(diagram.getName(), Map.of()).values());
        }
        Set<DiagramItem> collection = new LinkedHashSet<>();
        map.values().forEach(bucket -> collection.addAll(bucket.values()));
        return collection;
    }

    private void fire(Consumer<ProjectIndexListener> notification) {
        for (ProjectIndexListener listener : listeners) {
            notification.accept(listener);
        }
    }

    private void checkContract(Diagram diagram, DiagramItem item) {
        requireDiagram(diagram);
        if (item == null) {
            throw contractViolation("Item is required");
        }
        if (!diagram.getName().equals(item.getDiagramId())) {
            throw contractViolation("Item " + item.getId() + " belongs to diagram " + item.getDiagramId()
                    + " but was passed with diagram " + diagram.getName());
        }
    }

    private static void requireDiagram(Diagram diagram) {
        if (diagram == null) {
            throw contractViolation("Diagram is required");
        }
    }

    private static void requireType(ItemType type) {
        if (type == null) {
            throw contractViolation("Predicate type is required");
        }
    }

    private static IndexContractException contractViolation(String message) {
        log.warn("Project index contract violation: {}", message);
        return new IndexContractException(message);
    }
}
