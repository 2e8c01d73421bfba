package com.circuitsync.core.model;

/**
 * Connectivity markers found in documents, with their element names.
 */
public enum AnnotationKind {
    LOCAL_LABEL("label"),
    HIERARCHICAL_LABEL("hierarchical_label"),
    GLOBAL_LABEL("global_label"),
    SHEET_PIN("pin");

    private final String element;

    AnnotationKind(String element) {
        this.element = element;
    }

    /**
     * @return the element head used in documents
     */
    public String element() {
        return element;
    }
}
