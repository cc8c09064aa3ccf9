package com.composum.platform.remap.layout;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * One rendering assigned to a device of a layout, optionally with a datasource - the reference to the node that
 * provides the rendering's content.
 */
public class RenderingDefinition {

    @Nullable
    private final String id;

    @Nullable
    private final String datasource;

    @Nullable
    private final String placeholder;

    @Nullable
    private final String uniqueId;

    public RenderingDefinition(@Nullable String id, @Nullable String datasource,
                               @Nullable String placeholder, @Nullable String uniqueId) {
        this.id = StringUtils.trimToNull(id);
        this.datasource = StringUtils.isNotBlank(datasource) ? datasource : null;
        this.placeholder = StringUtils.trimToNull(placeholder);
        this.uniqueId = StringUtils.trimToNull(uniqueId);
    }

    /** The identifier of the rendering item. */
    @Nullable
    public String getId() {
        return id;
    }

    /** The datasource reference exactly as it is written in the layout, or null if the rendering has none. */
    @Nullable
    public String getDatasource() {
        return datasource;
    }

    public boolean hasDatasource() {
        return datasource != null;
    }

    @Nullable
    public String getPlaceholder() {
        return placeholder;
    }

    /** The identifier of this assignment of the rendering within the layout. */
    @Nullable
    public String getUniqueId() {
        return uniqueId;
    }

    @Override
    @NotNull
    public String toString() {
        return "Rendering{" + id + (datasource != null ? ", ds=" + datasource : "") + "}";
    }

}
