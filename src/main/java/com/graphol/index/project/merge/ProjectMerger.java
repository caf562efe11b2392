package com.graphol.index.project.merge;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.graphol.index.model.Diagram;
import com.graphol.index.model.ItemType;
import com.graphol.index.model.PredicateKey;
import com.graphol.index.model.meta.PredicateMetaData;
import com.graphol.index.project.Project;

/**
 * Imports the content of one project into another.
 *
 * Rules:
 * - Metadata of a predicate with no occurrence in the target is copied over.
 * - Metadata of a predicate used in the target is left as is; a differing
 *   imported value is reported as a {@link MetaConflict}.
 * - Diagrams move from the source to the target, renamed {@code name_1},
 *   {@code name_2}, ... when their name is taken.
 *
 * Metadata is compared against the target as it was before any diagram moved.
 */
public class ProjectMerger {

    private static final Logger log = LoggerFactory.getLogger(ProjectMerger.class);

    private final Project project;
    private final Project other;

    public ProjectMerger(Project project, Project other) {
        this.project = project;
        this.other = other;
    }

    public List<MetaConflict> merge() {
        log.info("Importing project {} into {}", other.getConfig().getName(), project.getConfig().getName());
        List<MetaConflict> conflicts = mergeMeta();
        int diagrams = mergeDiagrams();
        log.info("Imported {} diagram(s), {} metadata conflict(s) kept current value", diagrams, conflicts.size());
        return conflicts;
    }

    private List<MetaConflict> mergeMeta() {
        List<MetaConflict> conflicts = new ArrayList<>();
        for (PredicateKey key : other.getIndex().metas()) {
            ItemType type = key.getType();
            String name = key.getName();
            PredicateMetaData importing = other.meta(type, name);
            if (project.getIndex().predicates(type, name, null).isEmpty()) {
                project.setMeta(type, name, importing);
                continue;
            }
            PredicateMetaData current = project.meta(type, name);
            if (!current.equals(importing)) {
                log.debug("Metadata conflict on {} '{}'", type, name);
                conflicts.add(new MetaConflict(type, name, current, importing));
            }
        }
        return conflicts;
    }

    private int mergeDiagrams() {
        int count = 0;
        for (Diagram diagram : other.diagrams()) {
            String name = freeName(diagram.getName());
            other.removeDiagram(diagram);
            Diagram imported = name.equals(diagram.getName()) ? diagram : diagram.copyAs(name);
            if (imported != diagram) {
                log.info("Diagram {} imported as {}", diagram.getName(), name);
            }
            project.addDiagram(imported);
            count++;
        }
        return count;
    }

    private String freeName(String name) {
        String candidate = name;
        int occurrence = 1;
        while (project.diagram(candidate).isPresent()) {
            candidate = name + "_" + occurrence;
            occurrence++;
        }
        return candidate;
    }
}
