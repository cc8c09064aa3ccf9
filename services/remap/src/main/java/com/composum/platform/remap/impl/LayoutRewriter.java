package com.composum.platform.remap.impl;

import com.composum.platform.remap.ContentAccessException;
import com.composum.platform.remap.ContentNode;
import com.composum.platform.remap.ContentRepository;
import com.composum.platform.remap.LayoutFieldKind;
import com.composum.platform.remap.layout.LayoutDefinition;
import com.composum.platform.remap.layout.LayoutFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Rewrites the datasource references in the shared and final layouts of the copy of a node: references to
 * descendants of the node are changed to the corresponding descendants of the copy.
 */
public class LayoutRewriter {

    private static final Logger LOG = LoggerFactory.getLogger(LayoutRewriter.class);

    @Nonnull
    protected final ContentRepository repository;

    @Nonnull
    protected final PathCorrelator correlator;

    @Nonnull
    protected final LayoutFormat layoutFormat;

    public LayoutRewriter(@Nonnull ContentRepository repository, @Nonnull PathCorrelator correlator,
                          @Nonnull LayoutFormat layoutFormat) {
        this.repository = Objects.requireNonNull(repository);
        this.correlator = Objects.requireNonNull(correlator);
        this.layoutFormat = Objects.requireNonNull(layoutFormat);
    }

    /**
     * Updates the layouts of the copy of {node} for all its languages and versions. The shared layout is written
     * only once per node, the final layout once per version.
     *
     * @param task the running remapping
     * @param node a node of the original tree
     */
    public void rewriteNodeLayouts(@Nonnull RemapTask task, @Nonnull ContentNode node) {
        if (!repository.hasFieldValue(node, LayoutFieldKind.SHARED) || repository.getLanguages(node).isEmpty()) {
            return;
        }
        ContentNode newNode = correlator.findCorresponding(node, task.getOriginalRoot(), task.getNewRoot());
        if (newNode == null) {
            task.warn(node, "Unable to find corresponding node for copied node {} - root {}.",
                    node.getPath(), task.getOriginalRoot().getPath());
            return;
        }
        for (String language : repository.getLanguages(node)) {
            for (ContentNode version : repository.getVersions(node, language)) {
                if (task.markSharedLayoutRewritten(node.getId())) {
                    rewriteField(task, node, version, newNode, LayoutFieldKind.SHARED);
                }
                rewriteField(task, node, version, newNode, LayoutFieldKind.FINAL);
            }
        }
    }

    /**
     * Rewrites one layout field of one version of the node into the corresponding version of its copy.
     *
     * @param node    the processed node of the original tree - only references to its descendants are changed
     * @param version the language / version variant of {node} whose field is read
     * @param newNode the copy of {node}
     */
    protected void rewriteField(@Nonnull RemapTask task, @Nonnull ContentNode node, @Nonnull ContentNode version,
                                @Nonnull ContentNode newNode, @Nonnull LayoutFieldKind kind) {
        String raw = repository.readField(version, kind);
        LayoutDefinition layout = layoutFormat.parse(raw);
        if (raw == null || layout == null || layout.isEmpty()) {
            return;
        }
        for (String datasource : layout.getDatasources()) {
            ContentNode datasourceNode = repository.resolveById(datasource);
            if (datasourceNode == null) {
                task.warn(node, "Could not find datasource node {} while copying node {}", datasource, version.getId());
                continue;
            }
            if (!repository.isDescendantOf(datasourceNode, node)) {
                LOG.debug("Keeping reference to {} outside of {}", datasourceNode.getPath(), node.getPath());
                continue;
            }
            ContentNode correspondingNode = correlator.findCorresponding(datasourceNode, node, newNode);
            if (correspondingNode == null) {
                task.warn(node, "Could not find datasource target node {} while copying node {}", datasource, version.getId());
                continue;
            }
            String replaced = layoutFormat.replaceReference(raw, datasource, correspondingNode.getId());
            if (replaced.equals(raw) && !datasource.equals(correspondingNode.getId())) {
                task.warn(node, "Could not replace datasource {} by {} in the layout of node {}",
                        datasource, correspondingNode.getId(), version.getId());
            }
            raw = replaced;
        }
        ContentNode target = repository.resolveById(newNode.getId(), version.getLanguage(), version.getVersion());
        if (target == null) {
            task.warn(node, "Could not find version {} / {} of copied node {}",
                    version.getLanguage(), version.getVersion(), newNode.getPath());
            return;
        }
        if (!raw.equals(repository.readField(target, kind))) {
            try (ContentRepository.FieldEdit edit = repository.edit(target)) {
                edit.set(kind, raw);
                edit.commit();
                task.countChangedField();
                LOG.debug("Updated {} layout of {} ({} / {})", kind, target.getPath(), target.getLanguage(), target.getVersion());
            } catch (ContentAccessException e) {
                task.warn(node, e, "Could not save {} layout of {}", kind, target.getPath());
            }
        }
    }

}
