package com.mcpgateway.registry.common.model;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Фильтр запроса к индексу по типам сущностей. Пустой набор означает все типы.
 */
public record IndexFilter(Set<EntityType> types) {

    public IndexFilter {
        types = types == null || types.isEmpty()
                ? Set.copyOf(EnumSet.allOf(EntityType.class))
                : Set.copyOf(types);
    }

    public static IndexFilter all() {
        return new IndexFilter(null);
    }

    public static IndexFilter of(Collection<EntityType> types) {
        return new IndexFilter(types == null || types.isEmpty() ? null : EnumSet.copyOf(types));
    }

    public boolean accepts(EmbeddingRecord record) {
        return types.contains(record.entityType());
    }

    public boolean acceptsAll() {
        return types.size() == EntityType.values().length;
    }
}
