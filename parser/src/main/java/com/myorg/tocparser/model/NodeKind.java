package com.myorg.tocparser.model;

/**
 * Kind of an outline entry. The JSON name is what the interchange document writes in {@code type}.
 */
public enum NodeKind {
    CHAPTER("chapter"),
    ITEM("item"),
    OTHER("other");

    private final String jsonName;

    NodeKind(String jsonName) {
        this.jsonName = jsonName;
    }

    public String jsonName() {
        return jsonName;
    }
}
