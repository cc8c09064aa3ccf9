package com.composum.platform.remap;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * A handle for one language / version variant of an entry in the content repository. The {@link #getId()} is
 * stable and independent of the {@link #getPath()} - a copy of a node has the same relative path below the copy's
 * root, but a new identifier.
 */
public interface ContentNode {

    /** The repository wide unique identifier of the node - the same for all its language / version variants. */
    @Nonnull
    String getId();

    /** The full path of the node, e.g. /content/site/home. */
    @Nonnull
    String getPath();

    /** The language of this variant of the node; null if the repository has no such notion for the node. */
    @Nullable
    String getLanguage();

    /** The version of this variant of the node; null if the repository has no such notion for the node. */
    @Nullable
    String getVersion();

}
