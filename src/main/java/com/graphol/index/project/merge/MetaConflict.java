package com.graphol.index.project.merge;

import com.graphol.index.model.ItemType;
import com.graphol.index.model.meta.PredicateMetaData;

import lombok.Value;

/**
 * A predicate used in both projects of a merge, whose metadata differs.
 */
@Value
public class MetaConflict {

    ItemType type;
    String name;
    PredicateMetaData current;
    PredicateMetaData importing;
}
