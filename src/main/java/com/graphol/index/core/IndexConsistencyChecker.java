package com.graphol.index.core;

import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.graphol.index.model.DiagramItem;
import com.graphol.index.model.PredicateKey;

/**
 * Verifies the structural invariants of a {@link ProjectIndex}: every item is
 * reachable from exactly the views its kind requires, and no empty nested
 * container is left behind.
 */
public class IndexConsistencyChecker {

    private static final Logger log = LoggerFactory.getLogger(IndexConsistencyChecker.class);

    public IndexDiagnostics check(ProjectIndex index) {
        IndexDiagnostics diagnostics = new IndexDiagnostics();

        checkItems(index, diagnostics);
        checkTypes(index, diagnostics);
        checkView(index.getNodes(), index, "node", diagnostics);
        checkView(index.getEdges(), index, "edge", diagnostics);
        checkPredicates(index, diagnostics);

        for (String diagramId : index.getItems().keySet()) {
            if (!index.getDiagrams().containsKey(diagramId)) {
                diagnostics.addWarning("Items indexed for unregistered diagram " + diagramId);
            }
        }

        if (diagnostics.hasErrors()) {
            log.warn("Project index has {} consistency error(s)", diagnostics.getErrors().size());
        }
        return diagnostics;
    }

    private void checkItems(ProjectIndex index, IndexDiagnostics diagnostics) {
        index.getItems().forEach((diagramId, byId) -> {
            if (byId.isEmpty()) {
                diagnostics.addError("Empty item bucket for diagram " + diagramId);
            }
            byId.forEach((id, item) -> {
                if (!id.equals(item.getId()) || !diagramId.equals(item.getDiagramId())) {
                    diagnostics.addError("Item " + item.getId() + " indexed under wrong key " + diagramId + "/" + id);
                }
                Set<DiagramItem> typed = index.getTypes().getOrDefault(diagramId, Map.of()).get(item.getType());
                if (typed == null || !typed.contains(item)) {
                    diagnostics.addError("Item " + id + " of diagram " + diagramId + " missing from type view");
                }
                checkMembership(index.getNodes(), diagramId, item, item.isNode(), "node", diagnostics);
                checkMembership(index.getEdges(), diagramId, item, item.isEdge(), "edge", diagnostics);
                if (item.isPredicate()) {
                    PredicateKey key = PredicateKey.of(item);
                    PredicateEntry entry = index.getPredicates().getOrDefault(key.getType(), Map.of()).get(key.getName());
                    Set<DiagramItem> occurrences = entry == null ? null : entry.getNodes().get(diagramId);
                    if (occurrences == null || !occurrences.contains(item)) {
                        diagnostics.addError("Predicate node " + id + " of diagram " + diagramId
                                + " missing from predicate " + key.getType() + " '" + key.getName() + "'");
                    }
                }
            });
        });
    }

    private void checkMembership(Map<String, Map<String, DiagramItem>> view, String diagramId, DiagramItem item,
                                 boolean expected, String viewName, IndexDiagnostics diagnostics) {
        boolean present = view.getOrDefault(diagramId, Map.of()).containsKey(item.getId());
        if (expected && !present) {
            diagnostics.addError("Item " + item.getId() + " of diagram " + diagramId + " missing from " + viewName + " view");
        } else if (!expected && present) {
            diagnostics.addError("Item " + item.getId() + " of diagram " + diagramId + " wrongly in " + viewName + " view");
        }
    }

    private void checkTypes(ProjectIndex index, IndexDiagnostics diagnostics) {
        index.getTypes().forEach((diagramId, byType) -> {
            if (byType.isEmpty()) {
                diagnostics.addError("Empty type map for diagram " + diagramId);
            }
            byType.forEach((type, bucket) -> {
                if (bucket.isEmpty()) {
                    diagnostics.addError("Empty " + type + " bucket for diagram " + diagramId);
                }
                for (DiagramItem item : bucket) {
                    if (item.getType() != type || !isIndexed(index, diagramId, item)) {
                        diagnostics.addError("Stale item " + item.getId() + " in " + type + " bucket of diagram " + diagramId);
                    }
                }
            });
        });
    }

    private void checkView(Map<String, Map<String, DiagramItem>> view, ProjectIndex index, String viewName,
                           IndexDiagnostics diagnostics) {
        view.forEach((diagramId, byId) -> {
            if (byId.isEmpty()) {
                diagnostics.addError("Empty " + viewName + " bucket for diagram " + diagramId);
            }
            byId.values().forEach(item -> {
                if (!isIndexed(index, diagramId, item)) {
                    diagnostics.addError("Stale " + viewName + " " + item.getId() + " in diagram " + diagramId);
                }
            });
        });
    }

    private void checkPredicates(ProjectIndex index, IndexDiagnostics diagnostics) {
        index.getPredicates().forEach((type, byName) -> {
            if (byName.isEmpty()) {
                diagnostics.addError("Empty predicate map for " + type);
            }
            byName.forEach((name, entry) -> {
                if (entry.isDisposable()) {
                    diagnostics.addError("Predicate " + type + " '" + name + "' has neither occurrences nor metadata");
                }
                entry.getNodes().forEach((diagramId, occurrences) -> {
                    if (occurrences.isEmpty()) {
                        diagnostics.addError("Empty occurrence set for " + type + " '" + name + "' in diagram " + diagramId);
                    }
                    for (DiagramItem item : occurrences) {
                        if (!PredicateKey.of(item).equals(new PredicateKey(type, name)) || !isIndexed(index, diagramId, item)) {
                            diagnostics.addError("Stale occurrence " + item.getId() + " of " + type + " '" + name + "'");
                        }
                    }
                });
            });
        });
    }

    private static boolean isIndexed(ProjectIndex index, String diagramId, DiagramItem item) {
        return item.equals(index.getItems().getOrDefault(diagramId, Map.of()).get(item.getId()));
    }
}
