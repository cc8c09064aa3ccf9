package com.composum.platform.remap;

import javax.annotation.Nonnull;

/**
 * Receives the notification that a content subtree was copied - the only trigger for the layout reference
 * remapping. Whatever copies content (a servlet, a workflow step, an event handler) calls this after the copy
 * was completed and persisted.
 */
public interface SubtreeCopyListener {

    /**
     * Called after {originalRoot} was copied to {newRoot}.
     *
     * @param originalRoot the root of the copied subtree
     * @param newRoot      the root of the copy; its subtree is expected to mirror the subtree of {originalRoot}
     * @throws NullPointerException if one of the roots is missing
     */
    void onSubtreeCopied(@Nonnull ContentNode originalRoot, @Nonnull ContentNode newRoot);

}
