package com.composum.platform.remap.sling;

import com.composum.platform.remap.LayoutReferenceUpdater;
import com.composum.platform.remap.impl.RemapTask;
import com.composum.platform.remap.layout.XmlLayoutFormat;
import com.composum.platform.remap.logging.Message;
import com.composum.platform.remap.logging.MessageContainer;
import org.apache.sling.api.resource.Resource;
import org.osgi.framework.Constants;
import org.osgi.service.component.annotations.Activate;
import org.osgi.service.component.annotations.Component;
import org.osgi.service.component.annotations.Deactivate;
import org.osgi.service.component.annotations.Modified;
import org.osgi.service.metatype.annotations.Designate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.Objects;

@Component(
        service = {SlingLayoutReferenceService.class},
        property = {
                Constants.SERVICE_DESCRIPTION + "=Composum Platform Layout Reference Updater"
        }
)
@Designate(ocd = LayoutReferenceConfiguration.class)
public class SlingLayoutReferenceServiceImpl implements SlingLayoutReferenceService {

    private static final Logger LOG = LoggerFactory.getLogger(SlingLayoutReferenceServiceImpl.class);

    protected volatile LayoutReferenceConfiguration config;

    @Activate
    @Modified
    protected void activate(LayoutReferenceConfiguration config) {
        LOG.info("activate: enabled={}, datasource attributes {}", config.enabled(),
                Arrays.asList(config.datasourceAttributes()));
        this.config = config;
    }

    @Deactivate
    protected void deactivate() {
        LOG.info("deactivate");
        this.config = null;
    }

    @Nonnull
    @Override
    public MessageContainer onSubtreeCopied(@Nonnull Resource originalRoot, @Nonnull Resource newRoot) {
        Objects.requireNonNull(originalRoot, "No original root in parameters");
        Objects.requireNonNull(newRoot, "No new root in parameters");
        MessageContainer messages = new MessageContainer(LOG);
        LayoutReferenceConfiguration config = this.config;
        if (config == null || !config.enabled()) {
            messages.add(Message.debug("Layout reference update is disabled"));
            return messages;
        }
        SlingContentRepository repository = new SlingContentRepository(newRoot.getResourceResolver(), config);
        LayoutReferenceUpdater updater = new LayoutReferenceUpdater(repository,
                new XmlLayoutFormat(Arrays.asList(config.datasourceAttributes())));
        updater.updateReferences(new RemapTask(repository.wrap(originalRoot), repository.wrap(newRoot), messages));
        return messages;
    }

}
