package com.graphol.index.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.graphol.index.model.DiagramItem;
import com.graphol.index.model.meta.PredicateMetaData;

import lombok.Getter;
import lombok.Setter;

/**
 * Everything the index knows about one predicate: its node occurrences per diagram
 * and its optional metadata.
 */
@Getter
class PredicateEntry {

    private final Map<String, Set<DiagramItem>> nodes = new LinkedHashMap<>();

    @Setter
    private PredicateMetaData meta;

    boolean hasNodes() {
        return !nodes.isEmpty();
    }

    boolean hasMeta() {
        return meta != null;
    }

    /**
     * An entry with neither occurrences nor metadata must not stay in the index.
     */
    boolean isDisposable() {
        return !hasNodes() && !hasMeta();
    }
}
