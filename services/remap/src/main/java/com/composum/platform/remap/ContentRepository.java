package com.composum.platform.remap;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Set;

/**
 * The operations the layout reference remapping needs from a hierarchical content repository. Lookups never
 * throw: a node that cannot be found or read yields null. Only the commit of a {@link FieldEdit} reports failures.
 */
public interface ContentRepository {

    /** The direct children of the node, in the repository's order, without any filtering. */
    @Nonnull
    List<ContentNode> getChildren(@Nonnull ContentNode node);

    /**
     * True if {node} is a strict descendant of {ancestor} - a node is not its own descendant.
     */
    boolean isDescendantOf(@Nonnull ContentNode node, @Nonnull ContentNode ancestor);

    /**
     * Resolves the node at the given path in the given language and version.
     *
     * @param language the language; null for the repository's default
     * @param version  the version; null for the repository's default (usually the latest)
     * @return the node variant or null if there is none
     */
    @Nullable
    ContentNode resolveByPath(@Nonnull String path, @Nullable String language, @Nullable String version);

    /**
     * Resolves a node by its identifier, as used in cross tree references, in the repository's default language
     * and version.
     */
    @Nullable
    ContentNode resolveById(@Nonnull String id);

    /**
     * Resolves a specific language / version variant of the node with the given identifier.
     *
     * @return the variant or null if the node or that variant of it does not exist
     */
    @Nullable
    ContentNode resolveById(@Nonnull String id, @Nullable String language, @Nullable String version);

    /** The languages the node exists in. */
    @Nonnull
    Set<String> getLanguages(@Nonnull ContentNode node);

    /** All versions of the node in the given language, as variants of the node, oldest first. */
    @Nonnull
    List<ContentNode> getVersions(@Nonnull ContentNode node, @Nonnull String language);

    /**
     * Checks whether the field has a value at any level - stored at the node variant itself or inherited, e.g.
     * from a fallback language or standard values.
     */
    boolean hasFieldValue(@Nonnull ContentNode node, @Nonnull LayoutFieldKind kind);

    /** The raw value stored at the node variant itself, without any inheritance. */
    @Nullable
    String readField(@Nonnull ContentNode node, @Nonnull LayoutFieldKind kind);

    /** Begins a scoped edit of the layout fields of the given node variant. */
    @Nonnull
    FieldEdit edit(@Nonnull ContentNode node);

    /**
     * A scoped edit of a node variant: values are {@link #set(LayoutFieldKind, String)} and become durable with
     * {@link #commit()}. Closing an edit that was not committed reverts it.
     */
    interface FieldEdit extends AutoCloseable {

        /** Records a new value for the field; null removes the value. */
        void set(@Nonnull LayoutFieldKind kind, @Nullable String value);

        /** Persists all recorded values at once. */
        void commit() throws ContentAccessException;

        /** Reverts everything that was not committed. */
        @Override
        void close();
    }

}
