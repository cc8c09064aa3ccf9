package com.composum.platform.remap.sling;

import com.composum.platform.remap.ContentNode;
import org.apache.sling.api.resource.Resource;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * A language variant of a resource, as seen by the {@link SlingContentRepository}.
 */
public class SlingContentNode implements ContentNode {

    @Nonnull
    protected final Resource resource;

    @Nonnull
    protected final String id;

    @Nullable
    protected final String language;

    @Nullable
    protected final String version;

    public SlingContentNode(@Nonnull Resource resource, @Nonnull String id,
                            @Nullable String language, @Nullable String version) {
        this.resource = Objects.requireNonNull(resource);
        this.id = Objects.requireNonNull(id);
        this.language = language;
        this.version = version;
    }

    @Nonnull
    public Resource getResource() {
        return resource;
    }

    @Nonnull
    @Override
    public String getId() {
        return id;
    }

    @Nonnull
    @Override
    public String getPath() {
        return resource.getPath();
    }

    @Nullable
    @Override
    public String getLanguage() {
        return language;
    }

    @Nullable
    @Override
    public String getVersion() {
        return version;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) { return true; }
        if (o == null || getClass() != o.getClass()) { return false; }
        SlingContentNode that = (SlingContentNode) o;
        return getPath().equals(that.getPath()) &&
                Objects.equals(language, that.language) &&
                Objects.equals(version, that.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getPath(), language, version);
    }

    @Override
    public String toString() {
        return "SlingContentNode{" + getPath() + ", " + language + "}";
    }

}
