package com.composum.platform.remap.impl;

import com.composum.platform.remap.ContentAccessException;
import com.composum.platform.remap.ContentNode;
import com.composum.platform.remap.logging.Message;
import com.composum.platform.remap.logging.MessageContainer;

import javax.annotation.Nonnull;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * The state of one remapping run after a copy: the root pair, the nodes whose shared layout was already rewritten,
 * the collected warnings and some statistics. Lives only for one traversal and is not thread safe - except for
 * {@link #abort()}, which can be called from any thread.
 */
public class RemapTask {

    @Nonnull
    protected final ContentNode originalRoot;

    @Nonnull
    protected final ContentNode newRoot;

    @Nonnull
    protected final MessageContainer messages;

    /** Ids of the nodes whose shared layout was already rewritten - it is shared by all versions of a node. */
    protected final Set<String> sharedLayoutRewritten = new HashSet<>();

    protected volatile boolean aborted;

    protected int visitedNodes;

    protected int changedFields;

    /**
     * @param originalRoot the root of the copied subtree
     * @param newRoot      the root of the copy
     * @param messages     the sink for the warnings about skipped nodes and references
     * @throws NullPointerException if one of the parameters is missing
     */
    public RemapTask(@Nonnull ContentNode originalRoot, @Nonnull ContentNode newRoot, @Nonnull MessageContainer messages) {
        this.originalRoot = Objects.requireNonNull(originalRoot, "OriginalRoot cannot be null");
        this.newRoot = Objects.requireNonNull(newRoot, "NewRoot cannot be null");
        this.messages = Objects.requireNonNull(messages, "messages");
    }

    @Nonnull
    public ContentNode getOriginalRoot() {
        return originalRoot;
    }

    @Nonnull
    public ContentNode getNewRoot() {
        return newRoot;
    }

    @Nonnull
    public MessageContainer getMessages() {
        return messages;
    }

    /**
     * Records that the shared layout of the node is being rewritten.
     *
     * @return true if that's the first time for this node, false if it was already rewritten before
     */
    public boolean markSharedLayoutRewritten(@Nonnull String nodeId) {
        return sharedLayoutRewritten.add(nodeId);
    }

    /** Requests that the traversal stops before the next node. Nodes already processed stay changed. */
    public void abort() {
        aborted = true;
    }

    public boolean isAborted() {
        return aborted;
    }

    /** Adds a warning about the given node to the {@link #getMessages()}. */
    public void warn(@Nonnull ContentNode node, @Nonnull String text, Object... arguments) {
        messages.add(Message.warn(text, arguments).setContext(node.getPath()));
    }

    /** Adds a warning about a failed repository access, with the failure's message as detail. */
    public void warn(@Nonnull ContentNode node, @Nonnull ContentAccessException cause, @Nonnull String text, Object... arguments) {
        messages.add(Message.warn(text, arguments).setContext(node.getPath())
                .addDetail(cause.getMessageObject()), cause);
    }

    protected void countVisitedNode() {
        visitedNodes++;
    }

    protected void countChangedField() {
        changedFields++;
    }

    /** The number of nodes of the original tree that were visited. */
    public int getVisitedNodes() {
        return visitedNodes;
    }

    /** The number of field edits committed into the copy. */
    public int getChangedFields() {
        return changedFields;
    }

    @Override
    public String toString() {
        return "RemapTask{" + originalRoot.getPath() + " -> " + newRoot.getPath()
                + ", visited=" + visitedNodes + ", changed=" + changedFields
                + (aborted ? ", aborted" : "") + "}";
    }

}
