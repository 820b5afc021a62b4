package com.radarsync.infrastructure.config;

import com.radarsync.application.port.ConfigProvider;
import com.radarsync.core.batch.BatchLimits;
import com.radarsync.core.batch.OperationKind;
import com.radarsync.core.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link ConfigProvider} backed by {@link RadarProperties}.
 * Values are validated once at startup.
 */
@Component
public class PropertiesConfigProvider implements ConfigProvider {

    private static final Logger log = LoggerFactory.getLogger(PropertiesConfigProvider.class);

    private final RadarProperties properties;

    public PropertiesConfigProvider(RadarProperties properties) {
        this.properties = properties;
        validate();
    }

    private void validate() {
        String stock = properties.getCollections().getStock();
        if (stock == null || stock.isBlank()) {
            throw new ConfigurationException("radar.collections.stock must be set");
        }
        int chunkSize = properties.getSync().getWriteChunkSize();
        if (!BatchLimits.isValid(OperationKind.PLAYLIST_ITEM_WRITE, chunkSize)) {
            throw new ConfigurationException("radar.sync.write-chunk-size must be between 1 and "
                    + BatchLimits.limitFor(OperationKind.PLAYLIST_ITEM_WRITE) + ", was " + chunkSize);
        }
        if (!properties.getSync().getDescriptionTemplate().contains("%s")) {
            throw new ConfigurationException("radar.sync.description-template must contain %s for the date");
        }
        log.debug("Using stock collection {} and write chunk size {}", stock, chunkSize);
    }

    @Override
    public String stockCollectionId() {
        return properties.getCollections().getStock();
    }

    @Override
    public String defaultReferenceCollectionId() {
        return properties.getCollections().getReference();
    }

    @Override
    public String defaultTargetCollectionId() {
        return properties.getCollections().getTarget();
    }

    @Override
    public int writeChunkSize() {
        return properties.getSync().getWriteChunkSize();
    }

    @Override
    public String descriptionTemplate() {
        return properties.getSync().getDescriptionTemplate();
    }

    @Override
    public boolean wipeReferenceByDefault() {
        return properties.getSync().isWipeReference();
    }
}
