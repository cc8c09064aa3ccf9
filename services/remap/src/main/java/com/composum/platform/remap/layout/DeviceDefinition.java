package com.composum.platform.remap.layout;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.List;

/**
 * The renderings a layout assigns for one device.
 */
public class DeviceDefinition {

    @Nullable
    private final String id;

    @Nullable
    private final String layout;

    @NotNull
    private final List<RenderingDefinition> renderings;

    public DeviceDefinition(@Nullable String id, @Nullable String layout, @NotNull List<RenderingDefinition> renderings) {
        this.id = id;
        this.layout = layout;
        this.renderings = Collections.unmodifiableList(renderings);
    }

    @Nullable
    public String getId() {
        return id;
    }

    /** The identifier of the page layout used for the device. */
    @Nullable
    public String getLayout() {
        return layout;
    }

    @NotNull
    public List<RenderingDefinition> getRenderings() {
        return renderings;
    }

    @Override
    @NotNull
    public String toString() {
        return "Device{" + id + ", " + renderings + "}";
    }

}
