package com.radarsync.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Radar sync configuration properties.
 */
@Component
@ConfigurationProperties(prefix = "radar")
public class RadarProperties {

    @NestedConfigurationProperty
    private Collections collections = new Collections();

    @NestedConfigurationProperty
    private Sync sync = new Sync();

    @NestedConfigurationProperty
    private Catalog catalog = new Catalog();

    public Collections getCollections() { return collections; }
    public void setCollections(Collections collections) { this.collections = collections; }

    public Sync getSync() { return sync; }
    public void setSync(Sync sync) { this.sync = sync; }

    public Catalog getCatalog() { return catalog; }
    public void setCatalog(Catalog catalog) { this.catalog = catalog; }

    public static class Collections {
        private String stock;
        private String reference;
        private String target;

        public String getStock() { return stock; }
        public void setStock(String stock) { this.stock = stock; }

        public String getReference() { return reference; }
        public void setReference(String reference) { this.reference = reference; }

        public String getTarget() { return target; }
        public void setTarget(String target) { this.target = target; }
    }

    public static class Sync {
        private int writeChunkSize = 100;
        private String descriptionTemplate =
                "Release Radar playlist with songs from albums included. Updated on %s.";
        private boolean wipeReference = true;

        public int getWriteChunkSize() { return writeChunkSize; }
        public void setWriteChunkSize(int writeChunkSize) { this.writeChunkSize = writeChunkSize; }

        public String getDescriptionTemplate() { return descriptionTemplate; }
        public void setDescriptionTemplate(String descriptionTemplate) { this.descriptionTemplate = descriptionTemplate; }

        public boolean isWipeReference() { return wipeReference; }
        public void setWipeReference(boolean wipeReference) { this.wipeReference = wipeReference; }
    }

    public static class Catalog {
        private String baseUrl = "https://api.spotify.com/v1";
        private String accessToken;
        private String market = "US";
        private Duration connectTimeout = Duration.ofSeconds(10);

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getAccessToken() { return accessToken; }
        public void setAccessToken(String accessToken) { this.accessToken = accessToken; }

        public String getMarket() { return market; }
        public void setMarket(String market) { this.market = market; }

        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
    }
}
