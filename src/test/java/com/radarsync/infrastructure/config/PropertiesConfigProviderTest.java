package com.radarsync.infrastructure.config;

import com.radarsync.core.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PropertiesConfigProviderTest {

    private static RadarProperties properties(String stock, int chunkSize) {
        RadarProperties properties = new RadarProperties();
        properties.getCollections().setStock(stock);
        properties.getCollections().setReference("intake");
        properties.getCollections().setTarget("albums");
        properties.getSync().setWriteChunkSize(chunkSize);
        return properties;
    }

    @Test
    void exposesConfiguredValues() {
        PropertiesConfigProvider provider = new PropertiesConfigProvider(properties("stock", 50));

        assertThat(provider.stockCollectionId()).isEqualTo("stock");
        assertThat(provider.defaultReferenceCollectionId()).isEqualTo("intake");
        assertThat(provider.defaultTargetCollectionId()).isEqualTo("albums");
        assertThat(provider.writeChunkSize()).isEqualTo(50);
        assertThat(provider.descriptionTemplate()).contains("%s");
        assertThat(provider.wipeReferenceByDefault()).isTrue();
    }

    @Test
    void missingStockIdFailsAtStartup() {
        assertThatThrownBy(() -> new PropertiesConfigProvider(properties(" ", 100)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("radar.collections.stock");
    }

    @Test
    void chunkSizeAboveWriteLimitFails() {
        assertThatThrownBy(() -> new PropertiesConfigProvider(properties("stock", 101)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("between 1 and 100");
    }

    @Test
    void zeroChunkSizeFails() {
        assertThatThrownBy(() -> new PropertiesConfigProvider(properties("stock", 0)))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void templateWithoutDatePlaceholderFails() {
        RadarProperties properties = properties("stock", 100);
        properties.getSync().setDescriptionTemplate("No date here");

        assertThatThrownBy(() -> new PropertiesConfigProvider(properties))
                .isInstanceOf(ConfigurationException.class);
    }
}
