package com.mcpgateway.registry.search.indexing;

import java.util.Optional;

/**
 * Источник актуального признака доступности сущности.
 * Пустой Optional означает, что состояние неизвестно и используется флаг из индекса.
 */
public interface EntityStatusProvider {

    Optional<Boolean> enabledState(String path);
}
