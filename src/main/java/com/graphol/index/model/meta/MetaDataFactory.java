package com.graphol.index.model.meta;

import com.graphol.index.model.ItemType;

/**
 * Builds empty metadata containers of the right kind for a predicate type.
 */
public class MetaDataFactory {

    private MetaDataFactory() {
        // Utility class
    }

    public static PredicateMetaData create(ItemType type, String predicate) {
        return switch (type) {
            case ROLE_NODE -> new RoleMetaData(predicate);
            case ATTRIBUTE_NODE -> new AttributeMetaData(predicate);
            default -> new PredicateMetaData(type, predicate);
        };
    }
}
