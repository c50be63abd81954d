package com.mcpgateway.registry.search.config;

import java.nio.file.Path;

/** Настройки поиска для тестов с файловым бэкендом во временном каталоге */
public final class SearchSettingsFixtures {

    private SearchSettingsFixtures() {
    }

    public static SearchProperties properties(Path dataPath, int dimension) {
        SearchProperties properties = new SearchProperties();
        properties.getEmbedding().setDimension(dimension);
        properties.getIndex().setDataPath(dataPath.toString());
        properties.getIndex().setInitialCapacity(64);
        return properties;
    }

    public static SearchSettings settings(Path dataPath, int dimension) {
        return properties(dataPath, dimension).toSettings();
    }
}
