package com.graphol.index.project;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.graphol.index.core.IndexConsistencyChecker;
import com.graphol.index.core.IndexDiagnostics;
import com.graphol.index.core.ProjectIndex;
import com.graphol.index.core.ProjectIndexListener;
import com.graphol.index.model.Diagram;
import com.graphol.index.model.DiagramItem;
import com.graphol.index.model.DiagramListener;
import com.graphol.index.model.EdgeItem;
import com.graphol.index.model.ItemType;
import com.graphol.index.model.NodeItem;
import com.graphol.index.model.meta.PredicateMetaData;
import com.graphol.index.project.merge.MetaConflict;
import com.graphol.index.project.merge.ProjectMerger;
import com.graphol.index.project.output.ProjectSummaryPrinter;
import com.graphol.index.project.validation.ProjectConfigValidator;
import com.graphol.index.util.IdGenerator;

import lombok.Getter;

/**
 * A Graphol project: its configuration, its diagrams and the index over them.
 *
 * Once a diagram is added, every item later added to or removed from it is
 * forwarded to the index, so the index always mirrors the diagrams.
 */
public class Project implements DiagramListener {

    private static final Logger log = LoggerFactory.getLogger(Project.class);

    public static final String NODE_PREFIX = "n";
    public static final String EDGE_PREFIX = "e";

    @Getter
    private final ProjectConfig config;

    @Getter
    private final ProjectIndex index = new ProjectIndex();

    private final IdGenerator idGenerator = new IdGenerator();
    private final IndexConsistencyChecker checker = new IndexConsistencyChecker();
    private final ProjectSummaryPrinter printer = new ProjectSummaryPrinter();

    public Project(ProjectConfig config) {
        this.config = new ProjectConfigValidator().validate(config);
    }

    public void addListener(ProjectIndexListener listener) {
        index.addListener(listener);
    }

    public void removeListener(ProjectIndexListener listener) {
        index.removeListener(listener);
    }

    /**
     * Adds a diagram with all its items and starts following its changes.
     *
     * @return false if a diagram with the same name is already part of the project
     */
    public boolean addDiagram(Diagram diagram) {
        if (index.diagram(diagram.getName()).isPresent()) {
            log.warn("Diagram {} already part of project {}", diagram.getName(), config.getName());
            return false;
        }
        index.addDiagram(diagram);
        diagram.addListener(this);
        diagram.getItems().forEach(item -> idGenerator.tryUpdate(item.getId()));
        log.info("Added diagram {} ({} items) to project {}", diagram.getName(), diagram.size(), config.getName());
        return true;
    }

    /**
     * Removes a diagram with all its items and stops following its changes.
     */
    public boolean removeDiagram(Diagram diagram) {
        Optional<Diagram> registered = index.diagram(diagram.getName());
        if (registered.isEmpty()) {
            return false;
        }
        registered.get().removeListener(this);
        index.removeDiagram(registered.get());
        log.info("Removed diagram {} from project {}", diagram.getName(), config.getName());
        return true;
    }

    public Optional<Diagram> diagram(String name) {
        return index.diagram(name);
    }

    public Set<Diagram> diagrams() {
        return index.diagrams();
    }

    /**
     * Creates a node with a generated id and adds it to the diagram.
     */
    public NodeItem createNode(Diagram diagram, ItemType type, String text) {
        NodeItem node = NodeItem.builder()
                .id(idGenerator.next(NODE_PREFIX))
                .diagramId(diagram.getName())
                .type(type)
                .text(text)
                .build();
        diagram.addItem(node);
        return node;
    }

    /**
     * Creates an edge with a generated id between two nodes and adds it to the diagram.
     */
    public EdgeItem createEdge(Diagram diagram, ItemType type, DiagramItem source, DiagramItem target) {
        EdgeItem edge = EdgeItem.builder()
                .id(idGenerator.next(EDGE_PREFIX))
                .diagramId(diagram.getName())
                .type(type)
                .sourceId(source.getId())
                .targetId(target.getId())
                .build();
        diagram.addItem(edge);
        return edge;
    }

    public PredicateMetaData meta(ItemType type, String name) {
        return index.meta(type, name);
    }

    public void setMeta(ItemType type, String name, PredicateMetaData meta) {
        index.addMeta(type, name, meta);
    }

    public void unsetMeta(ItemType type, String name) {
        index.removeMeta(type, name);
    }

    /**
     * Imports every diagram and the predicate metadata of another project.
     *
     * The other project loses its diagrams; a diagram whose name is taken
     * here is imported under the first free name {@code name_1}, {@code name_2}, ...
     *
     * @return the metadata conflicts left unresolved, the current value being kept
     */
    public List<MetaConflict> merge(Project other) {
        if (other == null || other == this) {
            throw new IllegalArgumentException("A distinct project is required for merging");
        }
        return new ProjectMerger(this, other).merge();
    }

    @Override
    public void itemAdded(Diagram diagram, DiagramItem item) {
        index.addItem(diagram, item);
        idGenerator.tryUpdate(item.getId());
    }

    @Override
    public void itemRemoved(Diagram diagram, DiagramItem item) {
        index.removeItem(diagram, item);
    }

    public IndexDiagnostics verify() {
        IndexDiagnostics diagnostics = checker.check(index);
        printer.printDiagnostics(diagnostics);
        return diagnostics;
    }

    public void logSummary() {
        printer.printSummary(config, index.statistics());
    }
}
