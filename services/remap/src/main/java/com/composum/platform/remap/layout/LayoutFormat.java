package com.composum.platform.remap.layout;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The serialization of layout field values.
 */
public interface LayoutFormat {

    /**
     * Parses a raw layout field value.
     *
     * @return the layout, or null if the value is blank or cannot be parsed
     */
    @Nullable
    LayoutDefinition parse(@Nullable String raw);

    /**
     * Replaces the datasource reference {oldReference} by {newReference} in the raw serialized layout. Only the
     * values of datasource attributes are changed; everything else is kept character by character, even if
     * {oldReference} occurs there.
     *
     * @return the changed value, or {raw} itself if there was nothing to replace
     */
    @NotNull
    String replaceReference(@NotNull String raw, @NotNull String oldReference, @NotNull String newReference);

}
