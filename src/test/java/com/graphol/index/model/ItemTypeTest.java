package com.graphol.index.model;

import java.util.Arrays;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ItemType classification and naming.
 */
class ItemTypeTest {

    @Test
    void testNodeAndEdgeAreMutuallyExclusive() {
        Arrays.stream(ItemType.values())
                .forEach(type -> assertThat(type.isNode() && type.isEdge()).as(type.name()).isFalse());
    }

    @Test
    void testPredicatesAreNodes() {
        assertThat(ItemType.values())
                .filteredOn(ItemType::isPredicate)
                .containsExactly(ItemType.CONCEPT_NODE, ItemType.ATTRIBUTE_NODE, ItemType.ROLE_NODE,
                        ItemType.VALUE_DOMAIN_NODE, ItemType.INDIVIDUAL_NODE)
                .allMatch(ItemType::isNode);
    }

    @Test
    void testExtraTypesAreNeitherNodeNorEdge() {
        assertThat(ItemType.LABEL.isNode()).isFalse();
        assertThat(ItemType.LABEL.isEdge()).isFalse();
        assertThat(ItemType.UNDEFINED.isNode()).isFalse();
    }

    @Test
    void testNames() {
        assertThat(ItemType.ATTRIBUTE_NODE.getRealName()).isEqualTo("attribute node");
        assertThat(ItemType.ATTRIBUTE_NODE.getShortName()).isEqualTo("attribute");
        assertThat(ItemType.INCLUSION_EDGE.getShortName()).isEqualTo("inclusion");
        assertThat(ItemType.LABEL.getShortName()).isEqualTo("label");
    }
}
