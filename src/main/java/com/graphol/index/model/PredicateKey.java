package com.graphol.index.model;

import com.graphol.index.util.OwlTextUtil;

import lombok.NonNull;
import lombok.Value;

/**
 * Identity of a predicate across the whole project: its type plus its OWL name.
 * Node occurrences in different diagrams sharing a key denote the same predicate.
 */
@Value
public class PredicateKey {

    @NonNull
    ItemType type;

    @NonNull
    String name;

    /**
     * Builds a key, normalising the name to OWL text.
     */
    public static PredicateKey of(ItemType type, String name) {
        return new PredicateKey(type, OwlTextUtil.toOwlText(name));
    }

    /**
     * Key of a predicate node.
     */
    public static PredicateKey of(DiagramItem item) {
        return of(item.getType(), item.getText());
    }
}
