package com.composum.platform.remap.impl;

import com.composum.platform.remap.ContentNode;
import com.composum.platform.remap.ContentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Visits the original tree of a {@link RemapTask} depth first, each node before its children, and lets the
 * {@link LayoutRewriter} update the copy of each node.
 */
public class SubtreeWalker {

    private static final Logger LOG = LoggerFactory.getLogger(SubtreeWalker.class);

    @Nonnull
    protected final ContentRepository repository;

    @Nonnull
    protected final LayoutRewriter rewriter;

    public SubtreeWalker(@Nonnull ContentRepository repository, @Nonnull LayoutRewriter rewriter) {
        this.repository = Objects.requireNonNull(repository);
        this.rewriter = Objects.requireNonNull(rewriter);
    }

    public void walk(@Nonnull RemapTask task) {
        walk(task, task.getOriginalRoot());
    }

    protected void walk(@Nonnull RemapTask task, @Nonnull ContentNode node) {
        if (task.isAborted()) {
            LOG.info("Aborted before {}", node.getPath());
            return;
        }
        task.countVisitedNode();
        rewriter.rewriteNodeLayouts(task, node);
        for (ContentNode child : repository.getChildren(node)) {
            walk(task, child);
            if (task.isAborted()) {
                break;
            }
        }
    }

}
