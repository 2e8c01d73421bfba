package com.circuitsync.core.model;

import java.util.Objects;

/**
 * A connectivity marker read from a document.
 *
 * @param kind marker kind
 * @param text net or port name carried by the marker
 * @param position anchor point
 */
public record Annotation(AnnotationKind kind, String text, Position position) {
    public Annotation {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(position, "position must not be null");
    }
}
