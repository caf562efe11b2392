package com.graphol.index.model.meta;

import com.graphol.index.model.ItemType;

import lombok.Data;

/**
 * Descriptive metadata attached to a predicate (not to a single node occurrence).
 *
 * Subclasses add the logical characteristics of attributes and roles. Equality
 * is structural and kind-sensitive: a plain instance never equals an
 * attribute or role instance, even with identical shared fields.
 */
@Data
public class PredicateMetaData {

    private final ItemType type;
    private String predicate;
    private String description = "";
    private String url = "";

    public PredicateMetaData(ItemType type, String predicate) {
        this.type = type;
        this.predicate = predicate != null ? predicate.strip() : "";
    }

    public void setPredicate(String predicate) {
        this.predicate = predicate != null ? predicate.strip() : "";
    }

    public void setDescription(String description) {
        this.description = description != null ? description.strip() : "";
    }

    public void setUrl(String url) {
        this.url = url != null ? url.strip() : "";
    }

    /**
     * True when nothing worth storing has been set.
     */
    public boolean isEmpty() {
        return description.isEmpty() && url.isEmpty();
    }

    /**
     * Returns an independent copy of this metadata.
     */
    public PredicateMetaData copy() {
        PredicateMetaData meta = new PredicateMetaData(type, predicate);
        copySharedInto(meta);
        return meta;
    }

    protected void copySharedInto(PredicateMetaData meta) {
        meta.setDescription(description);
        meta.setUrl(url);
    }
}
