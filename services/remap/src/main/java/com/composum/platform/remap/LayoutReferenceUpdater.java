package com.composum.platform.remap;

import com.composum.platform.remap.impl.LayoutRewriter;
import com.composum.platform.remap.impl.PathCorrelator;
import com.composum.platform.remap.impl.RemapTask;
import com.composum.platform.remap.impl.SubtreeWalker;
import com.composum.platform.remap.layout.LayoutFormat;
import com.composum.platform.remap.logging.MessageContainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Updates the datasource references in the shared and final layouts of a copied tree. Each node of the copy that
 * references a descendant of its original is changed to reference the corresponding descendant of the copy, so
 * that the copy doesn't share content with the original. References to anything else are left untouched.
 * <p>
 * Problems with single nodes or references don't stop the update - they are reported as warnings in the
 * {@link RemapTask#getMessages()}.
 */
public class LayoutReferenceUpdater implements SubtreeCopyListener {

    private static final Logger LOG = LoggerFactory.getLogger(LayoutReferenceUpdater.class);

    @Nonnull
    protected final SubtreeWalker walker;

    public LayoutReferenceUpdater(@Nonnull ContentRepository repository, @Nonnull LayoutFormat layoutFormat) {
        Objects.requireNonNull(repository, "repository");
        Objects.requireNonNull(layoutFormat, "layoutFormat");
        PathCorrelator correlator = new PathCorrelator(repository);
        this.walker = new SubtreeWalker(repository, new LayoutRewriter(repository, correlator, layoutFormat));
    }

    @Override
    public void onSubtreeCopied(@Nonnull ContentNode originalRoot, @Nonnull ContentNode newRoot) {
        Objects.requireNonNull(originalRoot, "No original root in parameters");
        Objects.requireNonNull(newRoot, "No new root in parameters");
        updateReferences(new RemapTask(originalRoot, newRoot, new MessageContainer(LOG)));
    }

    /**
     * Runs the update for the task's root pair. Use this instead of {@link #onSubtreeCopied(ContentNode, ContentNode)}
     * to get at the warnings or to be able to {@link RemapTask#abort()} the update.
     *
     * @return the task, for convenience
     */
    @Nonnull
    public RemapTask updateReferences(@Nonnull RemapTask task) {
        Objects.requireNonNull(task, "task");
        LOG.info("Updating layout references {} -> {}", task.getOriginalRoot().getPath(), task.getNewRoot().getPath());
        walker.walk(task);
        LOG.info("Finished {} with {} warnings", task, task.getMessages().getMessages().size());
        return task;
    }

}
