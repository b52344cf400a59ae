package com.vidnyan.heuristic.domain.feature;

/**
 * Top-level namespaces of a feature map, one per extraction collaborator.
 */
public enum FeatureNamespace {
    HTML("html"),
    IMAGE("image");

    private final String key;

    FeatureNamespace(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
