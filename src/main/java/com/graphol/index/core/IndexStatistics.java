package com.graphol.index.core;

import lombok.Builder;
import lombok.Value;

/**
 * Aggregated sizes of a project index.
 */
@Value
@Builder
public class IndexStatistics {

    int diagramCount;
    int itemCount;
    int nodeCount;
    int edgeCount;
    int predicateCount;
    int metaCount;
}
