package com.composum.platform.remap;

/**
 * The two fields of a node that carry a serialized layout. Both use the same serialization.
 */
public enum LayoutFieldKind {

    /** The layout shared across all versions and languages of a node, unless a version overrides it. */
    SHARED,

    /** The per-version override of the layout. */
    FINAL

}
