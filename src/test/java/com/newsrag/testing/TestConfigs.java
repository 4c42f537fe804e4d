package com.newsrag.testing;

import java.nio.file.Path;
import java.util.List;

import com.newsrag.runtime.EngineConfig;

public final class TestConfigs {
    private TestConfigs() {
    }

    public static EngineConfig hashing(Path persistenceRoot, String... taxonomy) {
        EngineConfig config = new EngineConfig();
        config.getEmbedding().setStrategy(EngineConfig.EmbeddingStrategy.HASHING);
        config.getEmbedding().setDimension(64);
        config.getSynthesis().setApiKey("test-key");
        config.getPersistence().setRoot(persistenceRoot.toString());
        if (taxonomy.length > 0) {
            config.getRetrieval().setTaxonomy(List.of(taxonomy));
        }
        return config;
    }
}
