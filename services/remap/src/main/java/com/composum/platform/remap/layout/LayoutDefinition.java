package com.composum.platform.remap.layout;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The parsed form of a layout field value: the rendering assignments per device.
 */
public class LayoutDefinition {

    @NotNull
    private final List<DeviceDefinition> devices;

    public LayoutDefinition(@NotNull List<DeviceDefinition> devices) {
        this.devices = Collections.unmodifiableList(devices);
    }

    @NotNull
    public List<DeviceDefinition> getDevices() {
        return devices;
    }

    /** True if there is no device with any rendering. */
    public boolean isEmpty() {
        return devices.stream().allMatch(device -> device.getRenderings().isEmpty());
    }

    /** All distinct datasource references of all renderings of all devices, in document order. */
    @NotNull
    public Set<String> getDatasources() {
        Set<String> result = new LinkedHashSet<>();
        for (DeviceDefinition device : devices) {
            for (RenderingDefinition rendering : device.getRenderings()) {
                if (rendering.hasDatasource()) {
                    result.add(rendering.getDatasource());
                }
            }
        }
        return result;
    }

    @Override
    @NotNull
    public String toString() {
        return "Layout" + devices;
    }

}
