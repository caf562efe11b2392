package com.graphol.index.project;

import lombok.Builder;
import lombok.Data;

/**
 * Descriptive settings of a Graphol project.
 */
@Data
@Builder
public class ProjectConfig {

    private String name;

    @Builder.Default
    private String iri = "";

    @Builder.Default
    private String prefix = "";

    /**
     * OWL 2 profile the ontology targets: "OWL 2", "OWL 2 QL" or "OWL 2 RL".
     */
    @Builder.Default
    private String profile = "OWL 2";

    @Builder.Default
    private String version = "1.0";
}
