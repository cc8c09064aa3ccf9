package com.composum.platform.remap.sling;

import org.osgi.service.metatype.annotations.AttributeDefinition;
import org.osgi.service.metatype.annotations.ObjectClassDefinition;

/**
 * Configuration of the layout reference update after copies in the JCR.
 */
@ObjectClassDefinition(
        name = "Composum Platform Layout Reference Updater",
        description = "Rewrites the datasource references in the layouts of copied content to point into the copy"
)
public @interface LayoutReferenceConfiguration {

    @AttributeDefinition(
            description = "the general on/off switch for this service"
    )
    boolean enabled() default true;

    @AttributeDefinition(
            name = "Shared layout property",
            description = "the property containing the layout shared by all languages"
    )
    String sharedLayoutProperty() default SlingContentRepository.DEFAULT_SHARED_LAYOUT_PROPERTY;

    @AttributeDefinition(
            name = "Final layout property",
            description = "the property containing the language specific layout"
    )
    String finalLayoutProperty() default SlingContentRepository.DEFAULT_FINAL_LAYOUT_PROPERTY;

    @AttributeDefinition(
            name = "I18N folder",
            description = "the name of the subresource containing one subresource per language with the translated properties"
    )
    String i18nFolder() default SlingContentRepository.DEFAULT_I18N_FOLDER;

    @AttributeDefinition(
            name = "Default language",
            description = "the language of the properties stored directly at the resource"
    )
    String defaultLanguage() default SlingContentRepository.DEFAULT_LANGUAGE;

    @AttributeDefinition(
            name = "Datasource attributes",
            description = "the attributes of renderings in the layout XML which contain datasource references"
    )
    String[] datasourceAttributes() default {"ds", "s:ds"};

}
