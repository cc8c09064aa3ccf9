package com.composum.platform.remap.impl;

import com.composum.platform.remap.ContentNode;
import com.composum.platform.remap.ContentRepository;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Finds the node of a copy that corresponds to a node of the original tree: the node at the same path relative
 * to the root of the copy.
 */
public class PathCorrelator {

    @Nonnull
    protected final ContentRepository repository;

    public PathCorrelator(@Nonnull ContentRepository repository) {
        this.repository = Objects.requireNonNull(repository);
    }

    /**
     * Determines the node below {newRoot} at the same relative path as {node} below {originalRoot}, in the same
     * language and version as {node}. The {originalRoot} itself corresponds to {newRoot}.
     *
     * @return the corresponding node, or null if {node} is not in the original tree or there is no such node in
     * the copy, e.g. since the copy is incomplete
     */
    @Nullable
    public ContentNode findCorresponding(@Nonnull ContentNode node, @Nonnull ContentNode originalRoot,
                                         @Nonnull ContentNode newRoot) {
        String path = node.getPath();
        String rootPath = originalRoot.getPath();
        if (!path.equals(rootPath) && !repository.isDescendantOf(node, originalRoot)) {
            return null;
        }
        String relativePath = path.substring(rootPath.length());
        String newPath = newRoot.getPath() + relativePath;
        return repository.resolveByPath(newPath, node.getLanguage(), node.getVersion());
    }

}
