package com.graphol.index.model.meta;

import com.graphol.index.model.ItemType;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Metadata of a role (OWL object property) with its logical characteristics.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class RoleMetaData extends PredicateMetaData {

    private boolean asymmetric;
    private boolean functional;
    private boolean inverseFunctional;
    private boolean irreflexive;
    private boolean reflexive;
    private boolean symmetric;
    private boolean transitive;

    public RoleMetaData(String predicate) {
        super(ItemType.ROLE_NODE, predicate);
    }

    @Override
    public boolean isEmpty() {
        return false;
    }

    @Override
    public RoleMetaData copy() {
        RoleMetaData meta = new RoleMetaData(getPredicate());
        copySharedInto(meta);
        meta.setAsymmetric(asymmetric);
        meta.setFunctional(functional);
        meta.setInverseFunctional(inverseFunctional);
        meta.setIrreflexive(irreflexive);
        meta.setReflexive(reflexive);
        meta.setSymmetric(symmetric);
        meta.setTransitive(transitive);
        return meta;
    }
}
