package org.pragmatica.scss.tree;

/**
 * What an identifier refers to, for tooling that resolves symbols.
 */
public enum ReferenceType {
    MIXIN,
    FUNCTION,
    KEYFRAME,
    MODULE,
    FORWARD,
    PROPERTY
}
