package io.scopebind.core.model;

/** The entity collections held by the binding store. */
public enum StoreCollection {
    VARIABLES("variables"),
    RESOURCES("resources"),
    PROPS("props");

    private final String collectionName;

    StoreCollection(String collectionName) {
        this.collectionName = collectionName;
    }

    /** Wire name of the collection, as reported to the persistence collaborator. */
    public String collectionName() {
        return collectionName;
    }
}
