package com.composum.platform.remap.sling;

import com.composum.platform.remap.ContentAccessException;
import com.composum.platform.remap.ContentNode;
import com.composum.platform.remap.ContentRepository;
import com.composum.platform.remap.LayoutFieldKind;
import com.composum.platform.remap.logging.Message;
import org.apache.commons.collections4.IteratorUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.jackrabbit.JcrConstants;
import org.apache.sling.api.resource.ModifiableValueMap;
import org.apache.sling.api.resource.PersistenceException;
import org.apache.sling.api.resource.Resource;
import org.apache.sling.api.resource.ResourceResolver;
import org.apache.sling.api.resource.ResourceUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.jcr.ItemNotFoundException;
import javax.jcr.Node;
import javax.jcr.RepositoryException;
import javax.jcr.Session;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link ContentRepository} on the resources of a {@link ResourceResolver}.
 * <ul>
 * <li>The shared layout is a property of the resource.</li>
 * <li>The final layout is a property of the resource for the default language, and of the resource
 * {i18nFolder}/{language} below it for other languages. The languages of a resource are the default language
 * and the languages that have such a subresource. The i18n folder is not a child node in the sense of the
 * repository.</li>
 * <li>The identifier is the jcr:uuid of the resource, else the JCR identifier, else the path.</li>
 * <li>Only the working copy can be modified, so that's the only version ({@link #CURRENT_VERSION}).</li>
 * </ul>
 */
public class SlingContentRepository implements ContentRepository {

    private static final Logger LOG = LoggerFactory.getLogger(SlingContentRepository.class);

    public static final String DEFAULT_SHARED_LAYOUT_PROPERTY = "layout";
    public static final String DEFAULT_FINAL_LAYOUT_PROPERTY = "finalLayout";
    public static final String DEFAULT_I18N_FOLDER = "i18n";
    public static final String DEFAULT_LANGUAGE = "en";

    /** The version name of the working copy. */
    public static final String CURRENT_VERSION = "current";

    @Nonnull
    protected final ResourceResolver resolver;

    @Nonnull
    protected final String sharedLayoutProperty;

    @Nonnull
    protected final String finalLayoutProperty;

    @Nonnull
    protected final String i18nFolder;

    @Nonnull
    protected final String defaultLanguage;

    public SlingContentRepository(@Nonnull ResourceResolver resolver) {
        this(resolver, null, null, null, null);
    }

    public SlingContentRepository(@Nonnull ResourceResolver resolver, @Nonnull LayoutReferenceConfiguration config) {
        this(resolver, config.sharedLayoutProperty(), config.finalLayoutProperty(), config.i18nFolder(),
                config.defaultLanguage());
    }

    public SlingContentRepository(@Nonnull ResourceResolver resolver, @Nullable String sharedLayoutProperty,
                                  @Nullable String finalLayoutProperty, @Nullable String i18nFolder,
                                  @Nullable String defaultLanguage) {
        this.resolver = Objects.requireNonNull(resolver);
        this.sharedLayoutProperty = StringUtils.defaultIfBlank(sharedLayoutProperty, DEFAULT_SHARED_LAYOUT_PROPERTY);
        this.finalLayoutProperty = StringUtils.defaultIfBlank(finalLayoutProperty, DEFAULT_FINAL_LAYOUT_PROPERTY);
        this.i18nFolder = StringUtils.defaultIfBlank(i18nFolder, DEFAULT_I18N_FOLDER);
        this.defaultLanguage = StringUtils.defaultIfBlank(defaultLanguage, DEFAULT_LANGUAGE);
    }

    /** The node for the default language of a resource. */
    @Nonnull
    public SlingContentNode wrap(@Nonnull Resource resource) {
        return wrap(resource, defaultLanguage);
    }

    @Nonnull
    protected SlingContentNode wrap(@Nonnull Resource resource, @Nullable String language) {
        return new SlingContentNode(resource, determineId(resource),
                language != null ? language : defaultLanguage, CURRENT_VERSION);
    }

    @Nonnull
    protected String determineId(@Nonnull Resource resource) {
        String uuid = resource.getValueMap().get(JcrConstants.JCR_UUID, String.class);
        if (StringUtils.isNotBlank(uuid)) {
            return uuid;
        }
        Node node = resource.adaptTo(Node.class);
        if (node != null) {
            try {
                return node.getIdentifier();
            } catch (RepositoryException e) {
                LOG.debug("No identifier for {}: {}", resource.getPath(), e.toString());
            }
        }
        return resource.getPath();
    }

    @Nonnull
    protected Resource resource(@Nonnull ContentNode node) {
        if (node instanceof SlingContentNode) {
            return ((SlingContentNode) node).getResource();
        }
        Resource resource = resolver.getResource(node.getPath());
        if (resource == null) {
            throw new IllegalArgumentException("Resource not available: " + node.getPath());
        }
        return resource;
    }

    @Nonnull
    @Override
    public List<ContentNode> getChildren(@Nonnull ContentNode node) {
        return IteratorUtils.toList(resource(node).listChildren()).stream()
                .filter(child -> !i18nFolder.equals(child.getName()))
                .map(child -> wrap(child, node.getLanguage()))
                .collect(Collectors.toList());
    }

    @Override
    public boolean isDescendantOf(@Nonnull ContentNode node, @Nonnull ContentNode ancestor) {
        String ancestorPath = StringUtils.removeEnd(ancestor.getPath(), "/") + "/";
        return node.getPath().startsWith(ancestorPath) && node.getPath().length() > ancestorPath.length();
    }

    @Nullable
    @Override
    public ContentNode resolveByPath(@Nonnull String path, @Nullable String language, @Nullable String version) {
        if (version != null && !CURRENT_VERSION.equals(version)) {
            return null;
        }
        Resource resource = resolver.getResource(path);
        return resource != null ? wrap(resource, language) : null;
    }

    @Nullable
    @Override
    public ContentNode resolveById(@Nonnull String id) {
        return resolveById(id, null, null);
    }

    @Nullable
    @Override
    public ContentNode resolveById(@Nonnull String id, @Nullable String language, @Nullable String version) {
        if (StringUtils.isBlank(id) || (version != null && !CURRENT_VERSION.equals(version))) {
            return null;
        }
        if (id.startsWith("/")) {
            return resolveByPath(id, language, version);
        }
        Session session = resolver.adaptTo(Session.class);
        if (session == null) {
            LOG.debug("No JCR session to resolve {}", id);
            return null;
        }
        try {
            Node node = session.getNodeByIdentifier(id);
            return resolveByPath(node.getPath(), language, version);
        } catch (ItemNotFoundException e) {
            return null;
        } catch (RepositoryException | IllegalArgumentException e) {
            // Oak rejects identifiers that are not UUIDs with an IllegalArgumentException
            LOG.debug("Could not resolve {}: {}", id, e.toString());
            return null;
        }
    }

    @Nonnull
    @Override
    public Set<String> getLanguages(@Nonnull ContentNode node) {
        Set<String> languages = new LinkedHashSet<>();
        languages.add(defaultLanguage);
        Resource i18n = resource(node).getChild(i18nFolder);
        if (i18n != null) {
            for (Resource languageResource : i18n.getChildren()) {
                languages.add(languageResource.getName());
            }
        }
        return languages;
    }

    @Nonnull
    @Override
    public List<ContentNode> getVersions(@Nonnull ContentNode node, @Nonnull String language) {
        if (!getLanguages(node).contains(language)) {
            return Collections.emptyList();
        }
        return Collections.singletonList(wrap(resource(node), language));
    }

    @Override
    public boolean hasFieldValue(@Nonnull ContentNode node, @Nonnull LayoutFieldKind kind) {
        if (StringUtils.isNotBlank(readField(node, kind))) {
            return true;
        }
        return kind == LayoutFieldKind.FINAL && !isDefaultLanguage(node.getLanguage())
                && StringUtils.isNotBlank(resource(node).getValueMap().get(finalLayoutProperty, String.class));
    }

    @Nullable
    @Override
    public String readField(@Nonnull ContentNode node, @Nonnull LayoutFieldKind kind) {
        Resource holder = fieldHolder(resource(node), node.getLanguage(), kind);
        return holder != null ? holder.getValueMap().get(propertyName(kind), String.class) : null;
    }

    @Nonnull
    @Override
    public FieldEdit edit(@Nonnull ContentNode node) {
        return new SlingFieldEdit(resource(node), node.getLanguage());
    }

    protected boolean isDefaultLanguage(@Nullable String language) {
        return language == null || defaultLanguage.equals(language);
    }

    @Nonnull
    protected String propertyName(@Nonnull LayoutFieldKind kind) {
        return kind == LayoutFieldKind.SHARED ? sharedLayoutProperty : finalLayoutProperty;
    }

    /** The resource storing the field - null if that's a language resource that doesn't exist yet. */
    @Nullable
    protected Resource fieldHolder(@Nonnull Resource resource, @Nullable String language, @Nonnull LayoutFieldKind kind) {
        if (kind == LayoutFieldKind.SHARED || isDefaultLanguage(language)) {
            return resource;
        }
        return resource.getChild(i18nFolder + "/" + language);
    }

    protected class SlingFieldEdit implements FieldEdit {

        @Nonnull
        protected final Resource resource;

        @Nullable
        protected final String language;

        protected final Map<LayoutFieldKind, String> values = new EnumMap<>(LayoutFieldKind.class);

        protected boolean changed;

        protected boolean committed;

        protected SlingFieldEdit(@Nonnull Resource resource, @Nullable String language) {
            this.resource = resource;
            this.language = language;
        }

        @Override
        public void set(@Nonnull LayoutFieldKind kind, @Nullable String value) {
            values.put(kind, value);
        }

        @Override
        public void commit() throws ContentAccessException {
            try {
                for (Map.Entry<LayoutFieldKind, String> entry : values.entrySet()) {
                    Resource holder = fieldHolder(resource, language, entry.getKey());
                    if (holder == null) {
                        holder = ResourceUtil.getOrCreateResource(resolver,
                                resource.getPath() + "/" + i18nFolder + "/" + language,
                                Collections.<String, Object>singletonMap(JcrConstants.JCR_PRIMARYTYPE, JcrConstants.NT_UNSTRUCTURED),
                                JcrConstants.NT_UNSTRUCTURED, false);
                    }
                    ModifiableValueMap properties = holder.adaptTo(ModifiableValueMap.class);
                    if (properties == null) {
                        throw new ContentAccessException(Message.error("Not modifiable: {}", holder.getPath()), null);
                    }
                    changed = true;
                    if (entry.getValue() != null) {
                        properties.put(propertyName(entry.getKey()), entry.getValue());
                    } else {
                        properties.remove(propertyName(entry.getKey()));
                    }
                }
                resolver.commit();
                committed = true;
            } catch (PersistenceException | RuntimeException e) {
                throw new ContentAccessException(Message.error("Could not save layout of {}", resource.getPath()), e);
            }
        }

        /** Reverting discards all pending changes of the resolver, not only those of this edit. */
        @Override
        public void close() {
            if (changed && !committed) {
                LOG.info("Reverting uncommitted changes of {}", resource.getPath());
                resolver.revert();
            }
        }
    }

}
