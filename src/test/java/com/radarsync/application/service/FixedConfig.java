package com.radarsync.application.service;

import com.radarsync.application.port.ConfigProvider;

/**
 * In-memory configuration for service tests.
 */
record FixedConfig(String stockCollectionId, int writeChunkSize) implements ConfigProvider {

    static final String STOCK = "stock";

    static FixedConfig withChunkSize(int writeChunkSize) {
        return new FixedConfig(STOCK, writeChunkSize);
    }

    @Override
    public String defaultReferenceCollectionId() {
        return "ref";
    }

    @Override
    public String defaultTargetCollectionId() {
        return "target";
    }

    @Override
    public String descriptionTemplate() {
        return "Full albums. Updated on %s.";
    }

    @Override
    public boolean wipeReferenceByDefault() {
        return true;
    }
}
