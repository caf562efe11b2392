package com.graphol.index.model.meta;

import com.graphol.index.model.ItemType;

import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Metadata of an attribute (OWL data property).
 */
@Data
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class AttributeMetaData extends PredicateMetaData {

    private boolean functional;

    public AttributeMetaData(String predicate) {
        super(ItemType.ATTRIBUTE_NODE, predicate);
    }

    /**
     * Attribute metadata always carries its characteristics, so it is never empty.
     */
    @Override
    public boolean isEmpty() {
        return false;
    }

    @Override
    public AttributeMetaData copy() {
        AttributeMetaData meta = new AttributeMetaData(getPredicate());
        copySharedInto(meta);
        meta.setFunctional(functional);
        return meta;
    }
}
