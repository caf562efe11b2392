package com.graphol.index.model.meta;

import org.junit.jupiter.api.Test;

import com.graphol.index.model.ItemType;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for predicate metadata kinds, equality and copies.
 */
class MetaDataTest {

    @Test
    void testFactoryPicksKindByType() {
        assertThat(MetaDataFactory.create(ItemType.ROLE_NODE, "worksFor")).isInstanceOf(RoleMetaData.class);
        assertThat(MetaDataFactory.create(ItemType.ATTRIBUTE_NODE, "age")).isInstanceOf(AttributeMetaData.class);
        assertThat(MetaDataFactory.create(ItemType.CONCEPT_NODE, "Person"))
                .isExactlyInstanceOf(PredicateMetaData.class)
                .extracting(PredicateMetaData::getType)
                .isEqualTo(ItemType.CONCEPT_NODE);
    }

    @Test
    void testDefaultsHaveNoCharacteristics() {
        RoleMetaData role = (RoleMetaData) MetaDataFactory.create(ItemType.ROLE_NODE, "worksFor");

        assertThat(role.isFunctional()).isFalse();
        assertThat(role.isTransitive()).isFalse();
        assertThat(role.isSymmetric()).isFalse();
        assertThat(role.getDescription()).isEmpty();
        assertThat(role.getUrl()).isEmpty();
        assertThat(role.getPredicate()).isEqualTo("worksFor");
    }

    @Test
    void testTextFieldsAreStripped() {
        PredicateMetaData meta = new PredicateMetaData(ItemType.CONCEPT_NODE, " Person ");
        meta.setDescription("  A human being. ");
        meta.setUrl(" http://example.com/Person\n");

        assertThat(meta.getPredicate()).isEqualTo("Person");
        assertThat(meta.getDescription()).isEqualTo("A human being.");
        assertThat(meta.getUrl()).isEqualTo("http://example.com/Person");
    }

    @Test
    void testEqualityIsStructuralPerKind() {
        RoleMetaData a = new RoleMetaData("worksFor");
        RoleMetaData b = new RoleMetaData("worksFor");
        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);

        b.setTransitive(true);
        assertThat(a).isNotEqualTo(b);

        AttributeMetaData attribute = new AttributeMetaData("worksFor");
        PredicateMetaData plain = new PredicateMetaData(ItemType.ROLE_NODE, "worksFor");
        assertThat(plain).isNotEqualTo(a);
        assertThat(a).isNotEqualTo(plain);
        assertThat(attribute).isNotEqualTo(a);
    }

    @Test
    void testCopyIsIndependent() {
        AttributeMetaData original = new AttributeMetaData("age");
        original.setFunctional(true);
        original.setDescription("Age in years");

        AttributeMetaData copy = original.copy();
        assertThat(copy).isEqualTo(original).isNotSameAs(original);

        copy.setFunctional(false);
        assertThat(original.isFunctional()).isTrue();
    }

    @Test
    void testRoleCopyKeepsAllCharacteristics() {
        RoleMetaData original = new RoleMetaData("hasAncestor");
        original.setTransitive(true);
        original.setIrreflexive(true);
        original.setAsymmetric(true);
        original.setUrl("http://example.com/hasAncestor");

        assertThat(original.copy()).isEqualTo(original);
    }

    @Test
    void testEmptiness() {
        PredicateMetaData plain = MetaDataFactory.create(ItemType.CONCEPT_NODE, "Person");
        assertThat(plain.isEmpty()).isTrue();

        plain.setDescription("described");
        assertThat(plain.isEmpty()).isFalse();

        assertThat(new RoleMetaData("r").isEmpty()).isFalse();
        assertThat(new AttributeMetaData("a").isEmpty()).isFalse();
    }
}
