package com.composum.platform.remap.sling;

import com.composum.platform.remap.logging.MessageContainer;
import org.apache.sling.api.resource.Resource;

import javax.annotation.Nonnull;

/**
 * Updates the layout datasource references of a resource tree that was copied in the JCR, so that the copy
 * references its own copies of the datasources instead of the original ones.
 */
public interface SlingLayoutReferenceService {

    /**
     * Is to be called after {originalRoot} was copied to {newRoot} and the copy was committed. The changes are
     * committed field by field with the resource resolver of {newRoot}. If a commit fails, that resolver is
     * reverted, which discards all its pending changes - not only those of this update. So the resolver should not
     * have uncommitted changes when calling this.
     *
     * @param originalRoot the root of the copied tree
     * @param newRoot      the root of the copy, read and written with its resource resolver
     * @return the warnings about everything that couldn't be updated - empty if everything went fine
     * @throws NullPointerException if one of the roots is missing
     */
    @Nonnull
    MessageContainer onSubtreeCopied(@Nonnull Resource originalRoot, @Nonnull Resource newRoot);

}
