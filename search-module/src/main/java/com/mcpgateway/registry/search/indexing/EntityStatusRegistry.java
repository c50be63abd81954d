package com.mcpgateway.registry.search.indexing;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Состояние доступности сущностей в памяти. Обновляется индексатором
 * при индексации, переключении и удалении.
 */
@Component
public class EntityStatusRegistry implements EntityStatusProvider {

    private final Map<String, Boolean> states = new ConcurrentHashMap<>();

    @Override
    public Optional<Boolean> enabledState(String path) {
        return Optional.ofNullable(states.get(path));
    }

    public void setEnabled(String path, boolean enabled) {
        states.put(path, enabled);
    }

    public void forget(String path) {
        states.remove(path);
    }
}
