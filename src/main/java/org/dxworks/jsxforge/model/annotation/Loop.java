package org.dxworks.jsxforge.model.annotation;

import java.util.Objects;

public final class Loop implements Annotation {
    public final String item;
    public final String collection;
    public final String key;
    public final String index;

    public Loop(String item, String collection) {
        this(item, collection, null, null);
    }

    public Loop(String item, String collection, String key, String index) {
        this.item = Objects.requireNonNull(item, "item");
        this.collection = Objects.requireNonNull(collection, "collection");
        this.key = key;
        this.index = index;
    }

    @Override
    public AnnotationKind kind() {
        return AnnotationKind.LOOP;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Loop other
                && item.equals(other.item)
                && collection.equals(other.collection)
                && Objects.equals(key, other.key)
                && Objects.equals(index, other.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(item, collection, key, index);
    }

    @Override
    public String toString() {
        return "Loop{item=" + item + ", collection=" + collection + ", key=" + key + ", index=" + index + "}";
    }
}
