package com.graphol.index.model;

import java.util.Locale;

/**
 * All the elements that can appear in a Graphol diagram.
 */
public enum ItemType {

    // Predicates
    CONCEPT_NODE(Category.PREDICATE),
    ATTRIBUTE_NODE(Category.PREDICATE),
    ROLE_NODE(Category.PREDICATE),
    VALUE_DOMAIN_NODE(Category.PREDICATE),
    INDIVIDUAL_NODE(Category.PREDICATE),

    // Constructors
    DOMAIN_RESTRICTION_NODE(Category.CONSTRUCTOR),
    RANGE_RESTRICTION_NODE(Category.CONSTRUCTOR),
    UNION_NODE(Category.CONSTRUCTOR),
    ENUMERATION_NODE(Category.CONSTRUCTOR),
    COMPLEMENT_NODE(Category.CONSTRUCTOR),
    ROLE_CHAIN_NODE(Category.CONSTRUCTOR),
    INTERSECTION_NODE(Category.CONSTRUCTOR),
    ROLE_INVERSE_NODE(Category.CONSTRUCTOR),
    DATATYPE_RESTRICTION_NODE(Category.CONSTRUCTOR),
    DISJOINT_UNION_NODE(Category.CONSTRUCTOR),
    PROPERTY_ASSERTION_NODE(Category.CONSTRUCTOR),
    FACET_NODE(Category.CONSTRUCTOR),
    LITERAL_NODE(Category.CONSTRUCTOR),
    HAS_KEY_NODE(Category.CONSTRUCTOR),

    // Edges
    INCLUSION_EDGE(Category.EDGE),
    EQUIVALENCE_EDGE(Category.EDGE),
    INPUT_EDGE(Category.EDGE),
    MEMBERSHIP_EDGE(Category.EDGE),
    SAME_EDGE(Category.EDGE),
    DIFFERENT_EDGE(Category.EDGE),

    // Extra
    LABEL(Category.OTHER),
    UNDEFINED(Category.OTHER);

    private enum Category {
        PREDICATE,
        CONSTRUCTOR,
        EDGE,
        OTHER
    }

    private final Category category;

    ItemType(Category category) {
        this.category = category;
    }

    public boolean isNode() {
        return category == Category.PREDICATE || category == Category.CONSTRUCTOR;
    }

    public boolean isEdge() {
        return category == Category.EDGE;
    }

    /**
     * True for node kinds denoting an OWL predicate (class, property, datatype, individual).
     */
    public boolean isPredicate() {
        return category == Category.PREDICATE;
    }

    /**
     * Readable name, i.e. "attribute node", "inclusion edge".
     */
    public String getRealName() {
        return name().replace('_', ' ').toLowerCase(Locale.ROOT);
    }

    /**
     * Short name, i.e. "attribute", "inclusion".
     */
    public String getShortName() {
        String realName = getRealName();
        if (realName.endsWith(" node")) {
            return realName.substring(0, realName.length() - " node".length());
        }
        if (realName.endsWith(" edge")) {
            return realName.substring(0, realName.length() - " edge".length());
        }
        return realName;
    }
}
