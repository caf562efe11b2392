package com.graphol.index.project.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.graphol.index.core.IndexDiagnostics;
import com.graphol.index.core.IndexStatistics;
import com.graphol.index.project.ProjectConfig;

/**
 * Responsible only for logging project summaries.
 * No validation, no mutation.
 */
public class ProjectSummaryPrinter {

    private static final Logger log = LoggerFactory.getLogger(ProjectSummaryPrinter.class);

    public void printSummary(ProjectConfig config, IndexStatistics stats) {
        log.info("=================================================");
        log.info("Project: {} (version {})", config.getName(), config.getVersion());
        log.info("=================================================");
        log.info("IRI: {}", orNone(config.getIri()));
        log.info("Prefix: {}", orNone(config.getPrefix()));
        log.info("Profile: {}", config.getProfile());
        log.info("");
        log.info("Diagrams: {}", stats.getDiagramCount());
        log.info("Items: {}", stats.getItemCount());
        log.info("  Nodes: {}", stats.getNodeCount());
        log.info("  Edges: {}", stats.getEdgeCount());
        log.info("Predicates: {}", stats.getPredicateCount());
        log.info("Predicates with metadata: {}", stats.getMetaCount());
        log.info("=================================================");
    }

    public void printDiagnostics(IndexDiagnostics diagnostics) {
        if (!diagnostics.hasErrors() && diagnostics.getWarnings().isEmpty()) {
            log.info("Project index is consistent");
            return;
        }
        diagnostics.getErrors().forEach(error -> log.error("Index error: {}", error));
        diagnostics.getWarnings().forEach(warning -> log.warn("Index warning: {}", warning));
    }

    private static String orNone(String value) {
        return value == null || value.isBlank() ? "None" : value;
    }
}
